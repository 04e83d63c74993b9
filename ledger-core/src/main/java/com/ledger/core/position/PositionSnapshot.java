package com.ledger.core.position;

import com.ledger.core.event.QuoteTick;
import com.ledger.core.identifier.EventId;
import com.ledger.core.identifier.PositionId;
import com.ledger.core.identifier.StrategyId;
import com.ledger.core.model.Currency;
import com.ledger.core.model.Instrument;
import com.ledger.core.model.Money;
import com.ledger.core.model.PositionSide;
import com.ledger.core.model.Price;
import com.ledger.core.model.Quantity;
import com.ledger.core.model.Symbol;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable copy of a {@link Position}'s state at one point in time.
 * This is what position events carry and what the portfolio stores.
 *
 * {@code avgEntryPrice} is null while FLAT; {@code avgExitPrice} is null until a fill
 * has reduced the position; {@code closedTime} is null while open.
 */
public record PositionSnapshot(
    PositionId id,
    StrategyId strategyId,
    Symbol symbol,
    Currency baseCurrency,
    Currency quoteCurrency,
    PositionSide entrySide,
    PositionSide side,
    Quantity quantity,
    Quantity peakQuantity,
    BigDecimal avgEntryPrice,
    BigDecimal avgExitPrice,
    Money realizedPnl,
    Map<Currency, Money> commissions,
    int fillCount,
    Instant openedTime,
    Instant closedTime,
    Instant lastUpdated,
    EventId lastEventId
) {
    public PositionSnapshot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(strategyId, "strategyId");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(baseCurrency, "baseCurrency");
        Objects.requireNonNull(quoteCurrency, "quoteCurrency");
        Objects.requireNonNull(entrySide, "entrySide");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(quantity, "quantity");
        Objects.requireNonNull(peakQuantity, "peakQuantity");
        Objects.requireNonNull(realizedPnl, "realizedPnl");
        Objects.requireNonNull(openedTime, "openedTime");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
        Objects.requireNonNull(lastEventId, "lastEventId");
        if ((side == PositionSide.FLAT) != quantity.isZero()) {
            throw new IllegalArgumentException(
                "Position " + id + " side " + side + " inconsistent with quantity " + quantity);
        }
        if ((side == PositionSide.FLAT) != (avgEntryPrice == null)) {
            throw new IllegalArgumentException(
                "Position " + id + " average entry price must be present exactly when open");
        }
        if (!realizedPnl.currency().equals(quoteCurrency)) {
            throw new IllegalArgumentException(
                "Position " + id + " realized PnL must be in quote currency " + quoteCurrency);
        }
        commissions = Map.copyOf(commissions);
    }

    public boolean isOpen() {
        return side != PositionSide.FLAT;
    }

    public boolean isClosed() {
        return side == PositionSide.FLAT;
    }

    public Instrument instrument() {
        return new Instrument(symbol, baseCurrency, quoteCurrency);
    }

    public Optional<BigDecimal> averageEntryPrice() {
        return Optional.ofNullable(avgEntryPrice);
    }

    public Optional<BigDecimal> averageExitPrice() {
        return Optional.ofNullable(avgExitPrice);
    }

    public Optional<Instant> closedAt() {
        return Optional.ofNullable(closedTime);
    }

    /**
     * Mark-to-market PnL of the open quantity against {@code mark}, in quote currency.
     * LONG: (mark - avgEntry) * qty. SHORT: (avgEntry - mark) * qty. FLAT: zero.
     */
    public Money unrealizedPnl(Price mark) {
        return Money.of(unrealizedPnlAmount(mark), quoteCurrency);
    }

    /**
     * Mark against the side a closing order would trade at: bid for LONG, ask for SHORT.
     */
    public Money unrealizedPnl(QuoteTick last) {
        return Money.of(unrealizedPnlAmount(last), quoteCurrency);
    }

    /**
     * Unrounded quote-currency amount behind {@link #unrealizedPnl(Price)}.
     * Converting callers round once, in the target currency.
     */
    public BigDecimal unrealizedPnlAmount(Price mark) {
        Objects.requireNonNull(mark, "mark");
        return switch (side) {
            case FLAT -> BigDecimal.ZERO;
            case LONG -> mark.value().subtract(avgEntryPrice).multiply(quantity.value());
            case SHORT -> avgEntryPrice.subtract(mark.value()).multiply(quantity.value());
        };
    }

    public BigDecimal unrealizedPnlAmount(QuoteTick last) {
        Objects.requireNonNull(last, "last");
        if (!last.symbol().equals(symbol)) {
            throw new IllegalArgumentException(
                "Quote for " + last.symbol() + " cannot mark position " + id + " on " + symbol);
        }
        return switch (side) {
            case FLAT -> BigDecimal.ZERO;
            case LONG -> unrealizedPnlAmount(last.bid());
            case SHORT -> unrealizedPnlAmount(last.ask());
        };
    }

    /**
     * Committed notional at entry: avgEntry * qty in quote currency, zero when FLAT.
     */
    public Money entryNotional() {
        return Money.of(entryNotionalAmount(), quoteCurrency);
    }

    /** Unrounded amount behind {@link #entryNotional()}. */
    public BigDecimal entryNotionalAmount() {
        if (isClosed()) {
            return BigDecimal.ZERO;
        }
        return avgEntryPrice.multiply(quantity.value());
    }

    public Money commission(Currency currency) {
        return commissions.getOrDefault(currency, Money.zero(currency));
    }
}
