package com.ledger.api.model;

import com.ledger.core.position.PositionSnapshot;

import java.math.BigDecimal;
import java.time.Instant;

public record PositionView(
    String positionId,
    String symbol,
    String side,
    String quantity,
    String averageEntryPrice,
    MoneyView realizedPnl,
    int fillCount,
    Instant openedTime,
    Instant lastUpdated
) {

    public static PositionView of(PositionSnapshot position) {
        return new PositionView(
            position.id().value(),
            position.symbol().toString(),
            position.side().name(),
            position.quantity().toString(),
            position.averageEntryPrice().map(BigDecimal::toPlainString).orElse(null),
            MoneyView.of(position.realizedPnl()),
            position.fillCount(),
            position.openedTime(),
            position.lastUpdated()
        );
    }
}
