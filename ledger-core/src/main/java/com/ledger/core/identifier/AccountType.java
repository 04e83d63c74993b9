package com.ledger.core.identifier;

public enum AccountType {
    SIMULATED,
    DEMO,
    REAL
}
