package com.ledger.core.portfolio;

import com.ledger.core.account.Account;
import com.ledger.core.account.AccountFacade;
import com.ledger.core.account.AccountSnapshot;
import com.ledger.core.config.LedgerConfig;
import com.ledger.core.event.AccountState;
import com.ledger.core.event.PositionEvent;
import com.ledger.core.event.QuoteTick;
import com.ledger.core.fx.ExchangeRateResolver;
import com.ledger.core.identifier.PositionId;
import com.ledger.core.model.Currency;
import com.ledger.core.model.CurrencyPair;
import com.ledger.core.model.CurrencyRegistry;
import com.ledger.core.model.Instrument;
import com.ledger.core.model.Money;
import com.ledger.core.model.PriceType;
import com.ledger.core.model.Symbol;
import com.ledger.core.model.Venue;
import com.ledger.core.position.PositionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.StampedLock;
import java.util.function.Supplier;

/**
 * Aggregates accounts (one per venue), open positions and the latest quote per symbol,
 * and answers valuation queries per venue on demand.
 *
 * Valuations are never cached. A venue total is either fully valued or empty: if any
 * contributing position lacks a mark price or an exchange rate into the account
 * currency, the whole result is empty rather than a partial sum.
 *
 * Amounts are converted unrounded and rounded once, at the account currency's
 * precision as configured in the {@link CurrencyRegistry}.
 *
 * Thread-Safety: a single StampedLock guards all registries. Mutations take the write
 * lock, queries the read lock. Callers are expected to funnel mutations from one ordered
 * event context; the lock only keeps concurrent readers consistent with it. Accounts are
 * owned by the portfolio: registration copies, queries return immutable snapshots.
 */
public final class Portfolio {
    private static final Logger logger = LoggerFactory.getLogger(Portfolio.class);
    private static final Comparator<QuoteTick> LATEST_QUOTE =
        Comparator.comparing(QuoteTick::timestamp).thenComparing(tick -> tick.symbol().toString());

    private final StampedLock lock = new StampedLock();
    private final ExchangeRateResolver xrateResolver = new ExchangeRateResolver();
    private final PriceType xratePriceType;
    private final CurrencyRegistry currencies;

    private final Map<Venue, Account> accounts = new HashMap<>();
    private final Map<PositionId, PositionSnapshot> positionsOpen = new LinkedHashMap<>();
    private final Map<PositionId, PositionSnapshot> positionsClosed = new LinkedHashMap<>();
    private final Map<Symbol, Instrument> instruments = new HashMap<>();
    private final Map<Symbol, QuoteTick> lastQuotes = new HashMap<>();

    public Portfolio() {
        this(PriceType.MID, CurrencyRegistry.defaults());
    }

    public Portfolio(LedgerConfig config) {
        this(config.xratePriceType(), config.currencies());
    }

    public Portfolio(PriceType xratePriceType, CurrencyRegistry currencies) {
        this.xratePriceType = Objects.requireNonNull(xratePriceType, "xratePriceType");
        this.currencies = Objects.requireNonNull(currencies, "currencies");
        logger.info("Portfolio initialized (exchange rates at {} price)", xratePriceType);
    }

    // ==================== Mutations ====================

    /**
     * Insert or replace the account for the account's venue (last write wins).
     * The portfolio keeps a copy; later changes to {@code account} do not reach it.
     */
    public void registerAccount(Account account) {
        Objects.requireNonNull(account, "account");
        Account owned = account.copy();
        long stamp = lock.writeLock();
        try {
            Account previous = accounts.put(owned.venue(), owned);
            if (previous != null) {
                logger.info("Account for {} replaced: {} -> {}", account.venue(), previous.id(), account.id());
            } else {
                logger.info("Account registered for {}: {} ({})", account.venue(), account.id(), account.currency());
            }
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Route an account snapshot: refresh the venue's account when the id matches,
     * otherwise register a new account for the venue.
     */
    public void updateAccount(AccountState state) {
        Objects.requireNonNull(state, "state");
        Venue venue = state.accountId().venue();
        long stamp = lock.writeLock();
        try {
            Account existing = accounts.get(venue);
            if (existing != null && existing.id().equals(state.accountId())
                    && existing.currency().equals(state.currency())) {
                existing.applyState(state);
                logger.debug("Account {} updated: balance={}", state.accountId(), state.balance());
                return;
            }
            Account account = new Account(state);
            accounts.put(venue, account);
            if (existing != null) {
                logger.info("Account for {} replaced: {} -> {}", venue, existing.id(), account.id());
            } else {
                logger.info("Account registered for {}: {} ({})", venue, account.id(), account.currency());
            }
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Declare the currency pair of a symbol. Position events declare their own symbol.
     */
    public void registerInstrument(Instrument instrument) {
        Objects.requireNonNull(instrument, "instrument");
        long stamp = lock.writeLock();
        try {
            instruments.put(instrument.symbol(), instrument);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Apply a position lifecycle event.
     *
     * @return false when the event was stale (unknown or already closed position id) and ignored
     */
    public boolean updatePosition(PositionEvent event) {
        Objects.requireNonNull(event, "event");
        long stamp = lock.writeLock();
        try {
            PositionSnapshot position = event.position();
            return switch (event.type()) {
                case OPENED -> handleOpened(position);
                case MODIFIED -> handleModified(position);
                case CLOSED -> handleClosed(position);
            };
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    private boolean handleOpened(PositionSnapshot position) {
        if (positionsClosed.containsKey(position.id())) {
            logger.warn("PositionOpened for already closed position {}, ignoring", position.id());
            return false;
        }
        instruments.put(position.symbol(), position.instrument());
        if (position.isClosed()) {
            positionsClosed.put(position.id(), position);
            logger.warn("PositionOpened for {} carries a flat position, recorded as closed", position.id());
            return true;
        }
        if (positionsOpen.put(position.id(), position) != null) {
            logger.warn("Duplicate PositionOpened for {}, snapshot replaced", position.id());
        } else {
            logger.info("Position opened: {} {} {} {} @ {}", position.id(), position.symbol(),
                position.side(), position.quantity(), position.avgEntryPrice().toPlainString());
        }
        return true;
    }

    private boolean handleModified(PositionSnapshot position) {
        if (!positionsOpen.containsKey(position.id())) {
            logger.warn("PositionModified for unknown position {}, ignoring", position.id());
            return false;
        }
        if (position.isClosed()) {
            positionsOpen.remove(position.id());
            positionsClosed.put(position.id(), position);
            logger.info("Position {} went flat on modification, moved to closed", position.id());
            return true;
        }
        positionsOpen.put(position.id(), position);
        logger.debug("Position modified: {} {} {}", position.id(), position.side(), position.quantity());
        return true;
    }

    private boolean handleClosed(PositionSnapshot position) {
        if (positionsOpen.remove(position.id()) == null) {
            logger.warn("PositionClosed for unknown position {}, ignoring", position.id());
            return false;
        }
        positionsClosed.put(position.id(), position);
        logger.info("Position closed: {} {} realized {}", position.id(), position.symbol(), position.realizedPnl());
        return true;
    }

    /**
     * Keep the latest quote for the quote's symbol.
     */
    public void updateTick(QuoteTick tick) {
        Objects.requireNonNull(tick, "tick");
        long stamp = lock.writeLock();
        try {
            lastQuotes.put(tick.symbol(), tick);
            logger.debug("Quote {} bid={} ask={}", tick.symbol(), tick.bid(), tick.ask());
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Clear positions and quotes. Accounts and declared instruments are kept.
     */
    public void reset() {
        long stamp = lock.writeLock();
        try {
            int open = positionsOpen.size();
            positionsOpen.clear();
            positionsClosed.clear();
            lastQuotes.clear();
            logger.info("Portfolio reset: {} open positions and quote cache cleared", open);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    // ==================== Queries ====================

    /**
     * Snapshot of the venue's account. It does not follow later account states.
     */
    public Optional<AccountFacade> account(Venue venue) {
        Objects.requireNonNull(venue, "venue");
        return read(() -> Optional.ofNullable(accounts.get(venue)).<AccountFacade>map(Account::snapshot));
    }

    /**
     * Account, valuations and open positions of the venue, all read under one lock.
     * Empty when no account is registered for the venue.
     */
    public Optional<VenueValuation> valuation(Venue venue) {
        Objects.requireNonNull(venue, "venue");
        return read(() -> {
            Account account = accounts.get(venue);
            if (account == null) {
                return Optional.empty();
            }
            AccountSnapshot snapshot = account.snapshot();
            return Optional.of(new VenueValuation(
                venue,
                snapshot,
                valueOpenPositions(venue, this::unrealizedPnlOf),
                valueOpenPositions(venue, this::openValueOf),
                openPositionsOn(venue)));
        });
    }

    /**
     * Sum of open positions' mark-to-market PnL on the venue, in the account currency.
     * Empty when no account is registered, or when any position has no quote or no
     * exchange rate into the account currency.
     */
    public Optional<Money> unrealizedPnl(Venue venue) {
        Objects.requireNonNull(venue, "venue");
        return read(() -> valueOpenPositions(venue, this::unrealizedPnlOf));
    }

    /**
     * Sum of open positions' entry-basis notional on the venue, in the account currency.
     * Same empty-propagation rule as {@link #unrealizedPnl(Venue)}.
     */
    public Optional<Money> openValue(Venue venue) {
        Objects.requireNonNull(venue, "venue");
        return read(() -> valueOpenPositions(venue, this::openValueOf));
    }

    public Optional<Money> orderMargin(Venue venue) {
        Objects.requireNonNull(venue, "venue");
        return read(() -> Optional.ofNullable(accounts.get(venue)).map(Account::orderMargin));
    }

    public Optional<Money> positionMargin(Venue venue) {
        Objects.requireNonNull(venue, "venue");
        return read(() -> Optional.ofNullable(accounts.get(venue)).map(Account::positionMargin));
    }

    public Optional<PositionSnapshot> position(PositionId id) {
        return read(() -> Optional.ofNullable(positionsOpen.get(id)));
    }

    public Optional<PositionSnapshot> closedPosition(PositionId id) {
        return read(() -> Optional.ofNullable(positionsClosed.get(id)));
    }

    public List<PositionSnapshot> openPositions(Venue venue) {
        return read(() -> openPositionsOn(venue));
    }

    public int openPositionCount() {
        return read(positionsOpen::size);
    }

    public boolean isFlat(Venue venue) {
        return openPositions(venue).isEmpty();
    }

    public Optional<QuoteTick> lastQuote(Symbol symbol) {
        return read(() -> Optional.ofNullable(lastQuotes.get(symbol)));
    }

    public Optional<Instrument> instrument(Symbol symbol) {
        return read(() -> Optional.ofNullable(instruments.get(symbol)));
    }

    public PriceType xratePriceType() {
        return xratePriceType;
    }

    // ==================== Valuation (caller holds the read lock) ====================

    private List<PositionSnapshot> openPositionsOn(Venue venue) {
        var result = new ArrayList<PositionSnapshot>();
        for (PositionSnapshot position : positionsOpen.values()) {
            if (position.symbol().venue().equals(venue)) {
                result.add(position);
            }
        }
        return List.copyOf(result);
    }

    private interface PositionValuer {
        Optional<Money> value(PositionSnapshot position, Currency accountCurrency, Map<CurrencyPair, QuoteTick> rates);
    }

    private Optional<Money> valueOpenPositions(Venue venue, PositionValuer valuer) {
        Account account = accounts.get(venue);
        if (account == null) {
            return Optional.empty();
        }
        Currency accountCurrency = currencies.find(account.currency().code()).orElse(account.currency());
        Map<CurrencyPair, QuoteTick> rates = quotesByPair(venue);

        Money total = Money.zero(accountCurrency);
        for (PositionSnapshot position : positionsOpen.values()) {
            if (!position.symbol().venue().equals(venue)) {
                continue;
            }
            Optional<Money> value = valuer.value(position, accountCurrency, rates);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            total = total.add(value.get());
        }
        return Optional.of(total);
    }

    private Optional<Money> unrealizedPnlOf(PositionSnapshot position,
                                            Currency accountCurrency,
                                            Map<CurrencyPair, QuoteTick> rates) {
        QuoteTick last = lastQuotes.get(position.symbol());
        if (last == null) {
            logger.debug("No quote for {}, unrealized PnL of {} unavailable", position.symbol(), position.id());
            return Optional.empty();
        }
        BigDecimal pnl = position.unrealizedPnlAmount(last);
        return xrateResolver.rate(position.quoteCurrency(), accountCurrency, xratePriceType, rates)
            .map(rate -> Money.of(pnl.multiply(rate), accountCurrency));
    }

    private Optional<Money> openValueOf(PositionSnapshot position,
                                        Currency accountCurrency,
                                        Map<CurrencyPair, QuoteTick> rates) {
        if (position.baseCurrency().equals(accountCurrency)
                && !position.quoteCurrency().equals(accountCurrency)) {
            // Entry notional converted at the entry price is the open quantity itself.
            return Optional.of(Money.of(position.quantity().value(), accountCurrency));
        }
        BigDecimal notional = position.entryNotionalAmount();
        return xrateResolver.rate(position.quoteCurrency(), accountCurrency, xratePriceType, rates)
            .map(rate -> Money.of(notional.multiply(rate), accountCurrency));
    }

    /**
     * Venue quotes keyed by currency pair. When several symbols quote the same pair the
     * latest quote wins; equal timestamps fall back to symbol order.
     */
    private Map<CurrencyPair, QuoteTick> quotesByPair(Venue venue) {
        var byPair = new HashMap<CurrencyPair, QuoteTick>();
        for (QuoteTick tick : lastQuotes.values()) {
            if (!tick.symbol().venue().equals(venue)) {
                continue;
            }
            currencyPairOf(tick.symbol()).ifPresent(pair ->
                byPair.merge(pair, tick, (a, b) -> LATEST_QUOTE.compare(a, b) >= 0 ? a : b));
        }
        return byPair;
    }

    private Optional<CurrencyPair> currencyPairOf(Symbol symbol) {
        Instrument instrument = instruments.get(symbol);
        if (instrument != null) {
            return instrument.currencyPair();
        }
        return CurrencyPair.parse(symbol.code(), currencies);
    }

    private <T> T read(Supplier<T> query) {
        long stamp = lock.readLock();
        try {
            return query.get();
        } finally {
            lock.unlockRead(stamp);
        }
    }
}
