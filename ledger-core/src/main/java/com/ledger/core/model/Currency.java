package com.ledger.core.model;

import java.util.Objects;

/**
 * A currency code together with the number of fractional digits amounts in it carry.
 * Precision comes from the configured precision table, see {@link CurrencyRegistry}.
 *
 * Identity is the code alone: a precision override does not make a second currency,
 * so pairs, rates and money built from differently configured instances still meet.
 */
public record Currency(String code, int precision) {
    public Currency {
        Objects.requireNonNull(code, "code");
        if (code.isBlank()) {
            throw new IllegalArgumentException("Currency code is blank");
        }
        if (precision < 0 || precision > 16) {
            throw new IllegalArgumentException("Currency precision out of range [0, 16]: " + precision);
        }
        code = code.trim().toUpperCase();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Currency)) return false;
        return code.equals(((Currency) o).code);
    }

    @Override
    public int hashCode() {
        return code.hashCode();
    }

    @Override
    public String toString() {
        return code;
    }
}
