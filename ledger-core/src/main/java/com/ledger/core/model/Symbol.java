package com.ledger.core.model;

import java.util.Objects;

/**
 * Instrument code bound to a venue. Join key between quotes, positions and accounts.
 */
public record Symbol(String code, Venue venue) {
    public Symbol {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(venue, "venue");
        if (code.isBlank()) throw new IllegalArgumentException("Symbol code is blank");
        code = code.trim().toUpperCase();
    }

    /**
     * Parse the {@code CODE.VENUE} form, e.g. {@code AUDUSD.FXCM}.
     */
    public static Symbol parse(String value) {
        Objects.requireNonNull(value, "value");
        int dot = value.lastIndexOf('.');
        if (dot <= 0 || dot == value.length() - 1) {
            throw new IllegalArgumentException("Symbol must be CODE.VENUE: " + value);
        }
        return new Symbol(value.substring(0, dot), new Venue(value.substring(dot + 1)));
    }

    @Override
    public String toString() {
        return code + "." + venue.name();
    }
}
