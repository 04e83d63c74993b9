package com.ledger.core.event;

import com.ledger.core.identifier.EventId;
import com.ledger.core.identifier.OrderId;
import com.ledger.core.identifier.PositionId;
import com.ledger.core.identifier.StrategyId;
import com.ledger.core.model.Currency;
import com.ledger.core.model.Money;
import com.ledger.core.model.OrderSide;
import com.ledger.core.model.Price;
import com.ledger.core.model.Quantity;
import com.ledger.core.model.Symbol;

import java.time.Instant;
import java.util.Objects;

/**
 * Execution report for an order. Consumed by {@link com.ledger.core.position.Position}.
 */
public record OrderFilled(
    OrderId orderId,
    PositionId positionId,
    StrategyId strategyId,
    Symbol symbol,
    OrderSide side,
    Quantity quantity,
    Price price,
    Currency baseCurrency,
    Currency quoteCurrency,
    Money commission,
    EventId eventId,
    Instant timestamp
) {
    public OrderFilled {
        Objects.requireNonNull(orderId, "orderId");
        Objects.requireNonNull(positionId, "positionId");
        Objects.requireNonNull(strategyId, "strategyId");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(quantity, "quantity");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(baseCurrency, "baseCurrency");
        Objects.requireNonNull(quoteCurrency, "quoteCurrency");
        Objects.requireNonNull(commission, "commission");
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
        if (quantity.isZero()) {
            throw new IllegalArgumentException("Fill quantity must be positive for order " + orderId);
        }
        if (commission.isNegative()) {
            throw new IllegalArgumentException("Commission cannot be negative for order " + orderId);
        }
    }
}
