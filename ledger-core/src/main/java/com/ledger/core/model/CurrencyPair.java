package com.ledger.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Ordered (base, quote) currency pair: a price in this pair is quote units per base unit.
 */
public record CurrencyPair(Currency base, Currency quote) {
    public CurrencyPair {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(quote, "quote");
        if (base.equals(quote)) {
            throw new IllegalArgumentException("Currency pair needs two distinct currencies: " + base);
        }
    }

    public CurrencyPair inverse() {
        return new CurrencyPair(quote, base);
    }

    /**
     * Resolve a pair from an instrument code such as {@code AUDUSD} or {@code ETH/XBT}.
     * Both halves must be known to the registry.
     */
    public static Optional<CurrencyPair> parse(String code, CurrencyRegistry currencies) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase();
        int slash = normalized.indexOf('/');
        if (slash > 0) {
            return pairOf(normalized.substring(0, slash), normalized.substring(slash + 1), currencies);
        }
        if (normalized.length() == 6) {
            return pairOf(normalized.substring(0, 3), normalized.substring(3), currencies);
        }
        return Optional.empty();
    }

    private static Optional<CurrencyPair> pairOf(String base, String quote, CurrencyRegistry currencies) {
        var baseCcy = currencies.find(base);
        var quoteCcy = currencies.find(quote);
        if (baseCcy.isEmpty() || quoteCcy.isEmpty() || baseCcy.get().equals(quoteCcy.get())) {
            return Optional.empty();
        }
        return Optional.of(new CurrencyPair(baseCcy.get(), quoteCcy.get()));
    }

    @Override
    public String toString() {
        return base.code() + "/" + quote.code();
    }
}
