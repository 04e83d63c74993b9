package com.ledger.core.event;

public enum PositionEventType {
    OPENED,
    MODIFIED,
    CLOSED
}
