package com.ledger.core.event;

import com.ledger.core.identifier.AccountId;
import com.ledger.core.identifier.EventId;
import com.ledger.core.model.Currency;
import com.ledger.core.model.CurrencyMismatchException;
import com.ledger.core.model.Money;

import java.time.Instant;
import java.util.Objects;

/**
 * Authoritative balance snapshot for one account, published by the upstream ledger.
 *
 * @param marginUsed      balance locked as margin (orders plus positions)
 * @param marginAvailable free balance
 * @param orderMargin     part of {@code marginUsed} reserved for working orders
 */
public record AccountState(
    AccountId accountId,
    Currency currency,
    Money balance,
    Money marginUsed,
    Money marginAvailable,
    Money orderMargin,
    EventId eventId,
    Instant timestamp
) implements LedgerEvent {

    public AccountState {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(balance, "balance");
        Objects.requireNonNull(marginUsed, "marginUsed");
        Objects.requireNonNull(marginAvailable, "marginAvailable");
        Objects.requireNonNull(orderMargin, "orderMargin");
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
        requireCurrency(currency, balance);
        requireCurrency(currency, marginUsed);
        requireCurrency(currency, marginAvailable);
        requireCurrency(currency, orderMargin);
        if (marginUsed.isNegative() || orderMargin.isNegative()) {
            throw new IllegalArgumentException("Margin cannot be negative for " + accountId);
        }
        if (orderMargin.compareTo(marginUsed) > 0) {
            throw new IllegalArgumentException(
                "Order margin " + orderMargin + " exceeds margin used " + marginUsed + " for " + accountId);
        }
    }

    /**
     * State without an order-margin breakdown: all used margin is attributed to positions.
     */
    public AccountState(AccountId accountId,
                        Currency currency,
                        Money balance,
                        Money marginUsed,
                        Money marginAvailable,
                        EventId eventId,
                        Instant timestamp) {
        this(accountId, currency, balance, marginUsed, marginAvailable, Money.zero(currency), eventId, timestamp);
    }

    @Override
    public LedgerEventKind kind() {
        return LedgerEventKind.ACCOUNT_STATE;
    }

    private static void requireCurrency(Currency expected, Money money) {
        if (!expected.equals(money.currency())) {
            throw new CurrencyMismatchException(expected, money.currency());
        }
    }
}
