package com.ledger.core.event;

import com.ledger.core.identifier.EventId;
import com.ledger.core.position.PositionSnapshot;

import java.time.Instant;
import java.util.Objects;

public record PositionClosed(PositionSnapshot position, EventId eventId, Instant timestamp) implements PositionEvent {
    public PositionClosed {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static PositionClosed of(PositionSnapshot position) {
        return new PositionClosed(position, EventId.random(), position.lastUpdated());
    }

    @Override
    public PositionEventType type() {
        return PositionEventType.CLOSED;
    }
}
