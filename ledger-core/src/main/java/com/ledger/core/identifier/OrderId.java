package com.ledger.core.identifier;

import java.util.Objects;

public record OrderId(String value) {
    public OrderId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("OrderId is blank");
    }

    @Override
    public String toString() {
        return value;
    }
}
