package com.ledger.core.portfolio;

import com.ledger.core.account.AccountSnapshot;
import com.ledger.core.model.Money;
import com.ledger.core.model.Venue;
import com.ledger.core.position.PositionSnapshot;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the portfolio knows about one venue, taken under a single read lock.
 * An empty valuation means a quote or an exchange rate into the account currency is missing.
 */
public record VenueValuation(
    Venue venue,
    AccountSnapshot account,
    Optional<Money> unrealizedPnl,
    Optional<Money> openValue,
    List<PositionSnapshot> openPositions
) {
    public VenueValuation {
        Objects.requireNonNull(venue, "venue");
        Objects.requireNonNull(account, "account");
        Objects.requireNonNull(unrealizedPnl, "unrealizedPnl");
        Objects.requireNonNull(openValue, "openValue");
        openPositions = List.copyOf(openPositions);
    }

    public Money orderMargin() {
        return account.orderMargin();
    }

    public Money positionMargin() {
        return account.positionMargin();
    }
}
