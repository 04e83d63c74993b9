package com.ledger.core.model;

import java.util.Objects;

public record Venue(String name) {
    public Venue {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("Venue name is blank");
        name = name.trim().toUpperCase();
    }

    @Override
    public String toString() {
        return name;
    }
}
