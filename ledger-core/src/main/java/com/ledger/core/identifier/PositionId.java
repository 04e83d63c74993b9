package com.ledger.core.identifier;

import java.util.Objects;

public record PositionId(String value) {
    public PositionId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("PositionId is blank");
    }

    @Override
    public String toString() {
        return value;
    }
}
