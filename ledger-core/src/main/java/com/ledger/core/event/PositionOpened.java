package com.ledger.core.event;

import com.ledger.core.identifier.EventId;
import com.ledger.core.position.PositionSnapshot;

import java.time.Instant;
import java.util.Objects;

public record PositionOpened(PositionSnapshot position, EventId eventId, Instant timestamp) implements PositionEvent {
    public PositionOpened {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static PositionOpened of(PositionSnapshot position) {
        return new PositionOpened(position, EventId.random(), position.lastUpdated());
    }

    @Override
    public PositionEventType type() {
        return PositionEventType.OPENED;
    }
}
