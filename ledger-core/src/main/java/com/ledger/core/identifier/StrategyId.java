package com.ledger.core.identifier;

import java.util.Objects;

public record StrategyId(String value) {
    public StrategyId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("StrategyId is blank");
    }

    @Override
    public String toString() {
        return value;
    }
}
