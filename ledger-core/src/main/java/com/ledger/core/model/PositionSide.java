package com.ledger.core.model;

public enum PositionSide {
    FLAT,
    LONG,
    SHORT;

    /**
     * Side a position takes when opened by a fill on {@code side}.
     */
    public static PositionSide opening(OrderSide side) {
        return switch (side) {
            case BUY -> LONG;
            case SELL -> SHORT;
        };
    }
}
