package com.ledger.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit per-currency precision table.
 *
 * Starts from {@link Currencies#defaults()}; configuration may add currencies or
 * override the precision of a default one. Immutable once built.
 */
public final class CurrencyRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CurrencyRegistry.class);

    private final Map<String, Currency> byCode;

    private CurrencyRegistry(Map<String, Currency> byCode) {
        this.byCode = Collections.unmodifiableMap(byCode);
    }

    public static CurrencyRegistry defaults() {
        return withOverrides(Map.of());
    }

    /**
     * Build a registry from the defaults plus {@code precisionByCode} entries.
     */
    public static CurrencyRegistry withOverrides(Map<String, Integer> precisionByCode) {
        var table = new LinkedHashMap<String, Currency>();
        for (Currency currency : Currencies.defaults()) {
            table.put(currency.code(), currency);
        }
        precisionByCode.forEach((code, precision) -> {
            var currency = new Currency(code, precision);
            var previous = table.put(currency.code(), currency);
            if (previous != null && previous.precision() != precision) {
                logger.info("Currency {} precision overridden: {} -> {}", currency.code(), previous.precision(), precision);
            }
        });
        return new CurrencyRegistry(table);
    }

    public Optional<Currency> find(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byCode.get(code.trim().toUpperCase()));
    }

    /**
     * @throws IllegalArgumentException if the code is not in the precision table
     */
    public Currency get(String code) {
        return find(code).orElseThrow(() ->
            new IllegalArgumentException("Unknown currency (no precision configured): " + code));
    }

    public Collection<Currency> all() {
        return byCode.values();
    }
}
