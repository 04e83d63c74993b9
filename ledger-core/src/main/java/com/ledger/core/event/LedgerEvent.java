package com.ledger.core.event;

import java.time.Instant;

/**
 * Every event the portfolio consumes. The set of kinds is closed; consumers dispatch
 * on {@link #kind()} with switch expressions so a new kind fails compilation until handled.
 */
public sealed interface LedgerEvent permits AccountState, PositionEvent, QuoteTick {

    LedgerEventKind kind();

    Instant timestamp();
}
