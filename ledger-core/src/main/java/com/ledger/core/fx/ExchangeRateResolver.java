package com.ledger.core.fx;

import com.ledger.core.event.QuoteTick;
import com.ledger.core.model.Currency;
import com.ledger.core.model.CurrencyPair;
import com.ledger.core.model.PriceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Conversion rate between two currencies from the latest two-sided quotes.
 *
 * Resolution order: identity, direct pair, inverse pair (reciprocal). Triangulation
 * through a third currency is not attempted; an empty result is a valid outcome that
 * callers must handle, not an error.
 */
public final class ExchangeRateResolver {
    private static final Logger logger = LoggerFactory.getLogger(ExchangeRateResolver.class);

    public static final MathContext RATE_CONTEXT = new MathContext(20, RoundingMode.HALF_EVEN);

    /**
     * @param quotes latest quote per currency pair
     * @return units of {@code to} per unit of {@code from}, or empty when no quote covers the pair
     */
    public Optional<BigDecimal> rate(Currency from,
                                     Currency to,
                                     PriceType priceType,
                                     Map<CurrencyPair, QuoteTick> quotes) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(priceType, "priceType");
        Objects.requireNonNull(quotes, "quotes");

        if (from.equals(to)) {
            return Optional.of(BigDecimal.ONE);
        }

        var direct = new CurrencyPair(from, to);
        QuoteTick directQuote = quotes.get(direct);
        if (directQuote != null) {
            return Optional.of(directQuote.extractPrice(priceType));
        }

        QuoteTick inverseQuote = quotes.get(direct.inverse());
        if (inverseQuote != null) {
            BigDecimal price = inverseQuote.extractPrice(priceType);
            return Optional.of(BigDecimal.ONE.divide(price, RATE_CONTEXT));
        }

        logger.debug("No {} quote for {} or {}, exchange rate unavailable", priceType, direct, direct.inverse());
        return Optional.empty();
    }
}
