package com.ledger.core.model;

public enum OrderSide {
    BUY,
    SELL
}
