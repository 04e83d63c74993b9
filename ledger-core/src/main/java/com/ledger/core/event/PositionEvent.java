package com.ledger.core.event;

import com.ledger.core.identifier.EventId;
import com.ledger.core.position.PositionSnapshot;

/**
 * Position lifecycle notification. Each carries the full position state, never a diff.
 */
public sealed interface PositionEvent extends LedgerEvent permits PositionOpened, PositionModified, PositionClosed {

    PositionSnapshot position();

    EventId eventId();

    PositionEventType type();

    @Override
    default LedgerEventKind kind() {
        return LedgerEventKind.POSITION;
    }
}
