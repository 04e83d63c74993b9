package com.ledger.core.position;

import com.ledger.core.event.OrderFilled;
import com.ledger.core.event.QuoteTick;
import com.ledger.core.identifier.EventId;
import com.ledger.core.identifier.OrderId;
import com.ledger.core.identifier.PositionId;
import com.ledger.core.identifier.StrategyId;
import com.ledger.core.model.Currency;
import com.ledger.core.model.Money;
import com.ledger.core.model.PositionSide;
import com.ledger.core.model.Price;
import com.ledger.core.model.Quantity;
import com.ledger.core.model.Symbol;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Net exposure on one symbol under one position id.
 *
 * State machine over {FLAT, LONG, SHORT}:
 * - the first fill opens LONG (buy) or SHORT (sell);
 * - a same-direction fill adds quantity and re-averages the entry price;
 * - an opposite fill reduces quantity and realizes PnL on the reduced part; matching the
 *   open quantity exactly goes FLAT, overshooting flips side with the residual opened at
 *   the fill price;
 * - FLAT is terminal for the id, further fills are rejected.
 *
 * Not thread-safe; owned by a single event-processing context.
 */
public final class Position {
    static final int AVG_PRICE_SCALE = 16;

    private final PositionId id;
    private final StrategyId strategyId;
    private final Symbol symbol;
    private final Currency baseCurrency;
    private final Currency quoteCurrency;
    private final PositionSide entrySide;
    private final Instant openedTime;

    private PositionSide side;
    private Quantity quantity;
    private Quantity peakQuantity;
    private BigDecimal avgEntryPrice;
    private Quantity exitedQuantity = Quantity.zero();
    private BigDecimal exitNotional = BigDecimal.ZERO;
    private Money realizedPnl;
    private final Map<Currency, Money> commissions = new LinkedHashMap<>();
    private final List<OrderId> orderIds = new ArrayList<>();
    private int fillCount;
    private Instant closedTime;
    private Instant lastUpdated;
    private EventId lastEventId;

    /**
     * Open a position from its first fill.
     */
    public Position(OrderFilled fill) {
        Objects.requireNonNull(fill, "fill");
        this.id = fill.positionId();
        this.strategyId = fill.strategyId();
        this.symbol = fill.symbol();
        this.baseCurrency = fill.baseCurrency();
        this.quoteCurrency = fill.quoteCurrency();
        this.entrySide = PositionSide.opening(fill.side());
        this.openedTime = fill.timestamp();

        this.side = entrySide;
        this.quantity = fill.quantity();
        this.peakQuantity = fill.quantity();
        this.avgEntryPrice = fill.price().value();
        this.realizedPnl = Money.zero(quoteCurrency);
        recordFill(fill);
    }

    /**
     * Apply a subsequent fill on this position id.
     *
     * @throws InvalidFillException if the fill belongs to another position, symbol or
     *                              currency pair, or the position is already closed
     */
    public void apply(OrderFilled fill) {
        Objects.requireNonNull(fill, "fill");
        validate(fill);

        PositionSide fillDirection = PositionSide.opening(fill.side());
        if (fillDirection == side) {
            increase(fill.quantity(), fill.price());
        } else {
            reduce(fill.quantity(), fill.price(), fill.timestamp());
        }
        recordFill(fill);
    }

    private void validate(OrderFilled fill) {
        if (!fill.positionId().equals(id)) {
            throw new InvalidFillException(id, "fill is for position " + fill.positionId());
        }
        if (!fill.symbol().equals(symbol)) {
            throw new InvalidFillException(id, "symbol " + fill.symbol() + " does not match " + symbol);
        }
        if (!fill.baseCurrency().equals(baseCurrency) || !fill.quoteCurrency().equals(quoteCurrency)) {
            throw new InvalidFillException(id, "currencies " + fill.baseCurrency() + "/" + fill.quoteCurrency()
                + " do not match " + baseCurrency + "/" + quoteCurrency);
        }
        if (isClosed()) {
            throw new InvalidFillException(id, "position is closed; a new position id is required to reopen");
        }
    }

    private void increase(Quantity fillQuantity, Price fillPrice) {
        Quantity total = quantity.add(fillQuantity);
        BigDecimal weighted = avgEntryPrice.multiply(quantity.value()).add(fillPrice.multiply(fillQuantity));
        avgEntryPrice = weighted.divide(total.value(), AVG_PRICE_SCALE, RoundingMode.HALF_UP);
        quantity = total;
        if (quantity.compareTo(peakQuantity) > 0) {
            peakQuantity = quantity;
        }
    }

    private void reduce(Quantity fillQuantity, Price fillPrice, Instant timestamp) {
        Quantity closing = fillQuantity.min(quantity);
        realizedPnl = realizedPnl.add(pnlOn(closing, fillPrice));
        exitedQuantity = exitedQuantity.add(closing);
        exitNotional = exitNotional.add(fillPrice.multiply(closing));

        int cmp = fillQuantity.compareTo(quantity);
        if (cmp < 0) {
            quantity = quantity.subtract(fillQuantity);
        } else if (cmp == 0) {
            quantity = Quantity.zero();
            side = PositionSide.FLAT;
            avgEntryPrice = null;
            closedTime = timestamp;
        } else {
            // Overshoot: the residual opens on the other side at the fill price.
            quantity = fillQuantity.subtract(quantity);
            side = side == PositionSide.LONG ? PositionSide.SHORT : PositionSide.LONG;
            avgEntryPrice = fillPrice.value();
            if (quantity.compareTo(peakQuantity) > 0) {
                peakQuantity = quantity;
            }
        }
    }

    private Money pnlOn(Quantity closing, Price exitPrice) {
        BigDecimal points = side == PositionSide.LONG
            ? exitPrice.value().subtract(avgEntryPrice)
            : avgEntryPrice.subtract(exitPrice.value());
        return Money.of(points.multiply(closing.value()), quoteCurrency);
    }

    private void recordFill(OrderFilled fill) {
        commissions.merge(fill.commission().currency(), fill.commission(), Money::add);
        if (!orderIds.contains(fill.orderId())) {
            orderIds.add(fill.orderId());
        }
        fillCount++;
        lastUpdated = fill.timestamp();
        lastEventId = fill.eventId();
    }

    public PositionId id() { return id; }
    public StrategyId strategyId() { return strategyId; }
    public Symbol symbol() { return symbol; }
    public Currency baseCurrency() { return baseCurrency; }
    public Currency quoteCurrency() { return quoteCurrency; }
    public PositionSide entrySide() { return entrySide; }
    public PositionSide side() { return side; }
    public Quantity quantity() { return quantity; }
    public Quantity peakQuantity() { return peakQuantity; }
    public Money realizedPnl() { return realizedPnl; }
    public int fillCount() { return fillCount; }
    public Instant openedTime() { return openedTime; }
    public Instant lastUpdated() { return lastUpdated; }
    public EventId lastEventId() { return lastEventId; }

    public Optional<BigDecimal> averageEntryPrice() {
        return Optional.ofNullable(avgEntryPrice);
    }

    public Optional<BigDecimal> averageExitPrice() {
        return Optional.ofNullable(averageExit());
    }

    public Optional<Instant> closedTime() {
        return Optional.ofNullable(closedTime);
    }

    public Map<Currency, Money> commissions() {
        return Collections.unmodifiableMap(commissions);
    }

    public List<OrderId> orderIds() {
        return Collections.unmodifiableList(orderIds);
    }

    public boolean isOpen() {
        return side != PositionSide.FLAT;
    }

    public boolean isClosed() {
        return side == PositionSide.FLAT;
    }

    public Money unrealizedPnl(Price mark) {
        return snapshot().unrealizedPnl(mark);
    }

    public Money unrealizedPnl(QuoteTick last) {
        return snapshot().unrealizedPnl(last);
    }

    public Money entryNotional() {
        return snapshot().entryNotional();
    }

    public PositionSnapshot snapshot() {
        return new PositionSnapshot(
            id, strategyId, symbol, baseCurrency, quoteCurrency,
            entrySide, side, quantity, peakQuantity,
            avgEntryPrice, averageExit(), realizedPnl, commissions,
            fillCount, openedTime, closedTime, lastUpdated, lastEventId
        );
    }

    private BigDecimal averageExit() {
        if (exitedQuantity.isZero()) {
            return null;
        }
        return exitNotional.divide(exitedQuantity.value(), AVG_PRICE_SCALE, RoundingMode.HALF_UP);
    }

    @Override
    public String toString() {
        return "Position(" + id + " " + symbol + " " + side + " " + quantity + ")";
    }
}
