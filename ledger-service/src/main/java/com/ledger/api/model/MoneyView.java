package com.ledger.api.model;

import com.ledger.core.model.Money;

import java.util.Optional;

/**
 * JSON view of a monetary value that may be unavailable.
 * Amounts are rendered as plain decimal strings to keep their scale.
 */
public record MoneyView(
    boolean available,
    String amount,
    String currency
) {

    public static MoneyView of(Money money) {
        return new MoneyView(true, money.amount().toPlainString(), money.currency().code());
    }

    /**
     * Unavailable value: no quote or no exchange rate to produce it.
     */
    public static MoneyView unavailable(String currency) {
        return new MoneyView(false, null, currency);
    }

    public static MoneyView of(Optional<Money> money, String currency) {
        return money.map(MoneyView::of).orElseGet(() -> unavailable(currency));
    }
}
