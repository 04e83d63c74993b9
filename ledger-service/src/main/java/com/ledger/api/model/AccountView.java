package com.ledger.api.model;

import com.ledger.core.account.AccountFacade;

public record AccountView(
    String accountId,
    String venue,
    String currency,
    MoneyView balance,
    MoneyView freeBalance,
    MoneyView lockedBalance,
    MoneyView orderMargin,
    MoneyView positionMargin
) {

    public static AccountView of(AccountFacade account) {
        return new AccountView(
            account.id().toString(),
            account.venue().name(),
            account.currency().code(),
            MoneyView.of(account.balance()),
            MoneyView.of(account.freeBalance()),
            MoneyView.of(account.lockedBalance()),
            MoneyView.of(account.orderMargin()),
            MoneyView.of(account.positionMargin())
        );
    }
}
