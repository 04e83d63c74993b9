package com.ledger.core.model;

/**
 * Thrown when two monetary values in different currencies are combined.
 * Always a programming error on the caller's side.
 */
public class CurrencyMismatchException extends IllegalArgumentException {

    public CurrencyMismatchException(Currency expected, Currency actual) {
        super("Currency mismatch: expected " + expected + " but was " + actual);
    }
}
