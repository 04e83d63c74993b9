package com.ledger.core.event;

import com.ledger.core.model.Price;
import com.ledger.core.model.PriceType;
import com.ledger.core.model.Quantity;
import com.ledger.core.model.Symbol;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable two-sided quote. Only the latest tick per symbol is retained by the portfolio.
 */
public record QuoteTick(
    Symbol symbol,
    Price bid,
    Price ask,
    Quantity bidSize,
    Quantity askSize,
    Instant timestamp
) implements LedgerEvent {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public QuoteTick {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(bid, "bid");
        Objects.requireNonNull(ask, "ask");
        Objects.requireNonNull(bidSize, "bidSize");
        Objects.requireNonNull(askSize, "askSize");
        Objects.requireNonNull(timestamp, "timestamp");
        if (bid.compareTo(ask) > 0) {
            throw new IllegalArgumentException("Crossed quote for " + symbol + ": bid " + bid + " > ask " + ask);
        }
    }

    @Override
    public LedgerEventKind kind() {
        return LedgerEventKind.QUOTE;
    }

    /**
     * Price of the requested type. MID keeps one extra digit over the quoted precision.
     */
    public BigDecimal extractPrice(PriceType priceType) {
        return switch (priceType) {
            case BID -> bid.value();
            case ASK -> ask.value();
            case MID -> {
                int scale = Math.max(bid.precision(), ask.precision()) + 1;
                yield bid.value().add(ask.value()).divide(TWO, scale, RoundingMode.HALF_UP);
            }
        };
    }
}
