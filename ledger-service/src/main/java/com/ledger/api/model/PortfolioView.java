package com.ledger.api.model;

import java.util.List;

/**
 * Valuation of one venue in its account currency.
 */
public record PortfolioView(
    String venue,
    String currency,
    MoneyView unrealizedPnl,
    MoneyView openValue,
    MoneyView orderMargin,
    MoneyView positionMargin,
    List<PositionView> openPositions
) {
}
