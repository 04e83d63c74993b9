package com.ledger.core.event;

import com.ledger.core.identifier.EventId;
import com.ledger.core.position.PositionSnapshot;

import java.time.Instant;
import java.util.Objects;

public record PositionModified(PositionSnapshot position, EventId eventId, Instant timestamp) implements PositionEvent {
    public PositionModified {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static PositionModified of(PositionSnapshot position) {
        return new PositionModified(position, EventId.random(), position.lastUpdated());
    }

    @Override
    public PositionEventType type() {
        return PositionEventType.MODIFIED;
    }
}
