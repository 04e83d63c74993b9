package com.ledger.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Strictly positive decimal price. Prices are compared, differenced and scaled by a
 * {@link Quantity}, but never added to one.
 */
public record Price(BigDecimal value) implements Comparable<Price> {
    public Price {
        Objects.requireNonNull(value, "value");
        if (value.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive: " + value.toPlainString());
        }
    }

    public static Price of(String value) {
        return new Price(new BigDecimal(value));
    }

    public int precision() {
        return Math.max(value.scale(), 0);
    }

    public BigDecimal subtract(Price other) {
        return value.subtract(other.value);
    }

    public BigDecimal multiply(Quantity quantity) {
        return value.multiply(quantity.value());
    }

    @Override
    public int compareTo(Price other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Price other)) return false;
        return value.compareTo(other.value) == 0;
    }

    @Override
    public int hashCode() {
        return value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}
