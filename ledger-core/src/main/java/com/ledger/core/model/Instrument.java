package com.ledger.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A tradable symbol and the currency pair its prices are expressed in.
 */
public record Instrument(Symbol symbol, Currency baseCurrency, Currency quoteCurrency) {
    public Instrument {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(baseCurrency, "baseCurrency");
        Objects.requireNonNull(quoteCurrency, "quoteCurrency");
    }

    /**
     * The pair usable for exchange-rate lookups, empty when base and quote coincide.
     */
    public Optional<CurrencyPair> currencyPair() {
        if (baseCurrency.equals(quoteCurrency)) {
            return Optional.empty();
        }
        return Optional.of(new CurrencyPair(baseCurrency, quoteCurrency));
    }
}
