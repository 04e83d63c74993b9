package com.ledger.core.model;

public enum PriceType {
    BID,
    ASK,
    MID
}
