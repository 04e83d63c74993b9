package com.ledger.core.event;

public enum LedgerEventKind {
    ACCOUNT_STATE,
    POSITION,
    QUOTE
}
