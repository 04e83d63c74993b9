package com.ledger.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Non-negative decimal magnitude. Precision is the scale the value was created with.
 */
public record Quantity(BigDecimal value) implements Comparable<Quantity> {
    public Quantity {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + value.toPlainString());
        }
    }

    public static Quantity of(String value) {
        return new Quantity(new BigDecimal(value));
    }

    public static Quantity of(long value) {
        return new Quantity(BigDecimal.valueOf(value));
    }

    public static Quantity zero() {
        return new Quantity(BigDecimal.ZERO);
    }

    public int precision() {
        return Math.max(value.scale(), 0);
    }

    public Quantity add(Quantity other) {
        return new Quantity(value.add(other.value));
    }

    /**
     * @throws IllegalArgumentException if {@code other} is larger than this quantity
     */
    public Quantity subtract(Quantity other) {
        if (other.compareTo(this) > 0) {
            throw new IllegalArgumentException(
                "Cannot subtract " + other + " from " + this + ": result would be negative");
        }
        return new Quantity(value.subtract(other.value));
    }

    public Quantity min(Quantity other) {
        return compareTo(other) <= 0 ? this : other;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    @Override
    public int compareTo(Quantity other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Quantity other)) return false;
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
