package com.ledger.core.position;

import com.ledger.core.identifier.PositionId;

/**
 * A fill was applied to a position it does not belong to, or to a position that is
 * already closed. Signals a programming error upstream, not a data condition.
 */
public class InvalidFillException extends IllegalArgumentException {

    public InvalidFillException(PositionId positionId, String reason) {
        super("Invalid fill for position " + positionId + ": " + reason);
    }
}
