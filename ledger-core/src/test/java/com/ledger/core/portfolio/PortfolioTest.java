package com.ledger.core.portfolio;

import com.ledger.core.account.Account;
import com.ledger.core.account.AccountFacade;
import com.ledger.core.account.AccountSnapshot;
import com.ledger.core.event.OrderFilled;
import com.ledger.core.event.PositionClosed;
import com.ledger.core.event.PositionModified;
import com.ledger.core.event.PositionOpened;
import com.ledger.core.identifier.PositionId;
import com.ledger.core.model.Currencies;
import com.ledger.core.model.CurrencyRegistry;
import com.ledger.core.model.Instrument;
import com.ledger.core.model.Money;
import com.ledger.core.model.OrderSide;
import com.ledger.core.model.PositionSide;
import com.ledger.core.model.PriceType;
import com.ledger.core.model.Quantity;
import com.ledger.core.model.Symbol;
import com.ledger.core.position.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.ledger.core.LedgerStubs.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Portfolio valuation across venues, accounts and currencies.
 */
@DisplayName("Portfolio Tests")
class PortfolioTest {

    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        portfolio = new Portfolio();
    }

    private Position open(OrderFilled fill) {
        Position position = new Position(fill);
        assertTrue(portfolio.updatePosition(PositionOpened.of(position.snapshot())));
        return position;
    }

    private void modify(Position position, OrderFilled fill) {
        position.apply(fill);
        portfolio.updatePosition(PositionModified.of(position.snapshot()));
    }

    private void close(Position position, OrderFilled fill) {
        position.apply(fill);
        portfolio.updatePosition(PositionClosed.of(position.snapshot()));
    }

    @Nested
    @DisplayName("Accounts")
    class AccountTests {

        @Test
        @DisplayName("Unknown venue has no account and no valuations")
        void unknownVenue() {
            assertTrue(portfolio.account(FXCM).isEmpty());
            assertTrue(portfolio.unrealizedPnl(FXCM).isEmpty());
            assertTrue(portfolio.openValue(FXCM).isEmpty());
            assertTrue(portfolio.orderMargin(FXCM).isEmpty());
            assertTrue(portfolio.positionMargin(FXCM).isEmpty());
        }

        @Test
        @DisplayName("Registered account is returned for its venue")
        void registersAccount() {
            portfolio.registerAccount(new Account(accountState("BINANCE-1513111-SIMULATED", Currencies.BTC, "10")));

            AccountFacade account = portfolio.account(BINANCE).orElseThrow();
            assertEquals(Currencies.BTC, account.currency());
            assertEquals(Money.of(10, Currencies.BTC), account.balance());
            assertTrue(portfolio.account(FXCM).isEmpty());
        }

        @Test
        @DisplayName("Second registration for a venue replaces the first")
        void replacesAccount() {
            portfolio.registerAccount(new Account(accountState("FXCM-001-SIMULATED", Currencies.USD, "1000")));
            portfolio.registerAccount(new Account(accountState("FXCM-002-SIMULATED", Currencies.EUR, "500")));

            AccountFacade account = portfolio.account(FXCM).orElseThrow();
            assertEquals("002", account.id().identifier());
            assertEquals(Currencies.EUR, account.currency());
        }

        @Test
        @DisplayName("Account state refreshes the existing account")
        void updateAccountRefreshes() {
            portfolio.updateAccount(accountState("FXCM-001-SIMULATED", Currencies.USD, "1000"));
            portfolio.updateAccount(accountState("FXCM-001-SIMULATED", Currencies.USD, "1250.50"));

            AccountFacade account = portfolio.account(FXCM).orElseThrow();
            assertEquals(Money.of("1250.50", Currencies.USD), account.balance());
            assertEquals(2, account.stateCount());
        }

        @Test
        @DisplayName("Registration keeps a copy of the caller's account")
        void registrationCopiesAccount() {
            Account mine = new Account(accountState("FXCM-001-SIMULATED", Currencies.USD, "1000"));
            portfolio.registerAccount(mine);

            mine.applyState(accountState("FXCM-001-SIMULATED", Currencies.USD, "1"));

            assertEquals(Money.of("1000", Currencies.USD), portfolio.account(FXCM).orElseThrow().balance());
        }

        @Test
        @DisplayName("Account view is a snapshot that later states do not change")
        void accountViewIsSnapshot() {
            portfolio.updateAccount(accountState("FXCM-001-SIMULATED", Currencies.USD, "1000"));

            AccountFacade before = portfolio.account(FXCM).orElseThrow();
            portfolio.updateAccount(accountState("FXCM-001-SIMULATED", Currencies.USD, "7"));

            assertThat(before).isInstanceOf(AccountSnapshot.class).isNotInstanceOf(Account.class);
            assertEquals(Money.of("1000", Currencies.USD), before.balance());
            assertEquals(Money.of("7", Currencies.USD), portfolio.account(FXCM).orElseThrow().balance());
        }

        @Test
        @DisplayName("Concurrent readers always see balances from one account state")
        void concurrentReadsSeeWholeStates() throws Exception {
            portfolio.updateAccount(accountState("FXCM-001-SIMULATED", Currencies.USD, "10", "1", "9", "0"));
            AtomicBoolean writing = new AtomicBoolean(true);
            ExecutorService executor = Executors.newFixedThreadPool(3);
            try {
                List<Future<Integer>> readers = new ArrayList<>();
                for (int r = 0; r < 2; r++) {
                    readers.add(executor.submit(() -> {
                        int reads = 0;
                        while (writing.get() || reads == 0) {
                            AccountFacade account = portfolio.account(FXCM).orElseThrow();
                            assertEquals(account.balance(), account.freeBalance().add(account.lockedBalance()));
                            reads++;
                        }
                        return reads;
                    }));
                }
                Future<?> writer = executor.submit(() -> {
                    try {
                        for (int i = 1; i <= 2_000; i++) {
                            portfolio.updateAccount(accountState("FXCM-001-SIMULATED", Currencies.USD,
                                String.valueOf(10 * i), String.valueOf(i), String.valueOf(9 * i), "0"));
                        }
                    } finally {
                        writing.set(false);
                    }
                });

                writer.get(30, TimeUnit.SECONDS);
                for (Future<Integer> reader : readers) {
                    assertTrue(reader.get(30, TimeUnit.SECONDS) > 0);
                }
                assertEquals(Money.of("20000", Currencies.USD), portfolio.account(FXCM).orElseThrow().balance());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Margins come from the latest account state")
        void margins() {
            portfolio.updateAccount(accountState("FXCM-001-SIMULATED", Currencies.USD,
                "100000", "3000", "97000", "1000"));

            assertEquals(Optional.of(Money.of("1000", Currencies.USD)), portfolio.orderMargin(FXCM));
            assertEquals(Optional.of(Money.of("2000", Currencies.USD)), portfolio.positionMargin(FXCM));
        }
    }

    @Nested
    @DisplayName("Single currency venue")
    class SingleCurrencyTests {

        @BeforeEach
        void accounts() {
            portfolio.registerAccount(new Account(accountState("FXCM-001-SIMULATED", Currencies.USD, "1000000")));
            portfolio.registerAccount(new Account(accountState("BINANCE-1513111-SIMULATED", Currencies.BTC, "10")));
        }

        @Test
        @DisplayName("No positions values to zero in the account currency")
        void emptyIsZero() {
            assertEquals(Optional.of(Money.zero(Currencies.USD)), portfolio.unrealizedPnl(FXCM));
            assertEquals(Optional.of(Money.zero(Currencies.USD)), portfolio.openValue(FXCM));
            assertTrue(portfolio.isFlat(FXCM));
        }

        @Test
        @DisplayName("Two open positions are valued against their latest quotes")
        void twoOpenPositions() {
            open(audusdFill("P-1", OrderSide.BUY, "100000", "1.00000"));
            open(fill("P-2", GBPUSD_FXCM, OrderSide.BUY, "100000", "1.00000", Currencies.GBP, Currencies.USD));
            portfolio.updateTick(quote(AUDUSD_FXCM, "0.80501", "0.80505"));
            portfolio.updateTick(quote(GBPUSD_FXCM, "1.30315", "1.30317"));

            assertEquals(Optional.of(Money.of("10816.00", Currencies.USD)), portfolio.unrealizedPnl(FXCM));
            assertEquals(Optional.of(Money.of("200000.00", Currencies.USD)), portfolio.openValue(FXCM));
            assertEquals(2, portfolio.openPositions(FXCM).size());
            assertEquals(Optional.of(Money.zero(Currencies.BTC)), portfolio.unrealizedPnl(BINANCE));
            assertEquals(Optional.of(Money.zero(Currencies.BTC)), portfolio.openValue(BINANCE));
        }

        @Test
        @DisplayName("Modified position is valued at its new quantity")
        void modifiedPosition() {
            Position position = open(audusdFill("P-1", OrderSide.BUY, "100000", "1.00000"));
            modify(position, audusdFill("P-1", OrderSide.SELL, "50000", "1.00000"));
            portfolio.updateTick(quote(AUDUSD_FXCM, "0.80501", "0.80505"));

            assertEquals(Optional.of(Money.of("-9749.50", Currencies.USD)), portfolio.unrealizedPnl(FXCM));
            assertEquals(Optional.of(Money.of("50000.00", Currencies.USD)), portfolio.openValue(FXCM));
        }

        @Test
        @DisplayName("Closed position no longer contributes")
        void closedPosition() {
            Position position = open(audusdFill("P-1", OrderSide.BUY, "100000", "1.00000"));
            portfolio.updateTick(quote(AUDUSD_FXCM, "0.80501", "0.80505"));
            close(position, audusdFill("P-1", OrderSide.SELL, "100000", "1.00010"));

            assertEquals(Optional.of(Money.zero(Currencies.USD)), portfolio.unrealizedPnl(FXCM));
            assertEquals(Optional.of(Money.zero(Currencies.USD)), portfolio.openValue(FXCM));
            assertTrue(portfolio.position(new PositionId("P-1")).isEmpty());
            assertEquals(Money.of("10.00", Currencies.USD),
                portfolio.closedPosition(new PositionId("P-1")).orElseThrow().realizedPnl());
        }

        @Test
        @DisplayName("Several positions with one closed in between")
        void severalPositionsOneClosed() {
            open(audusdFill("P-1", OrderSide.BUY, "100000", "1.00000"));
            open(audusdFill("P-2", OrderSide.BUY, "100000", "1.00000"));
            Position gbp = open(fill("P-3", GBPUSD_FXCM, OrderSide.BUY, "100000", "1.00000",
                Currencies.GBP, Currencies.USD));
            portfolio.updateTick(quote(AUDUSD_FXCM, "0.80501", "0.80505"));
            portfolio.updateTick(quote(GBPUSD_FXCM, "1.30315", "1.30317"));
            close(gbp, fill("P-3", GBPUSD_FXCM, OrderSide.SELL, "100000", "1.00100",
                Currencies.GBP, Currencies.USD));

            assertEquals(Optional.of(Money.of("-38998.00", Currencies.USD)), portfolio.unrealizedPnl(FXCM));
            assertEquals(Optional.of(Money.of("200000.00", Currencies.USD)), portfolio.openValue(FXCM));
            assertEquals(2, portfolio.openPositionCount());
        }

        @Test
        @DisplayName("Latest quote replaces the previous one")
        void latestQuoteWins() {
            open(audusdFill("P-1", OrderSide.BUY, "100000", "1.00000"));
            portfolio.updateTick(quote(AUDUSD_FXCM, "0.80501", "0.80505"));
            portfolio.updateTick(quote(AUDUSD_FXCM, "1.00010", "1.00012"));

            assertEquals(Optional.of(Money.of("10.00", Currencies.USD)), portfolio.unrealizedPnl(FXCM));
            assertEquals("1.00010", portfolio.lastQuote(AUDUSD_FXCM).orElseThrow().bid().toString());
        }

        @Test
        @DisplayName("Venue valuation gathers account, totals and positions together")
        void venueValuation() {
            portfolio.updateAccount(accountState("FXCM-001-SIMULATED", Currencies.USD,
                "1000000", "3000", "997000", "1000"));
            open(audusdFill("P-1", OrderSide.BUY, "100000", "1.00000"));
            open(fill("P-2", GBPUSD_FXCM, OrderSide.BUY, "100000", "1.00000", Currencies.GBP, Currencies.USD));
            portfolio.updateTick(quote(AUDUSD_FXCM, "0.80501", "0.80505"));
            portfolio.updateTick(quote(GBPUSD_FXCM, "1.30315", "1.30317"));

            VenueValuation valuation = portfolio.valuation(FXCM).orElseThrow();

            assertEquals(FXCM, valuation.venue());
            assertEquals(Money.of("1000000", Currencies.USD), valuation.account().balance());
            assertEquals(Optional.of(Money.of("10816.00", Currencies.USD)), valuation.unrealizedPnl());
            assertEquals(Optional.of(Money.of("200000.00", Currencies.USD)), valuation.openValue());
            assertEquals(Money.of("1000", Currencies.USD), valuation.orderMargin());
            assertEquals(Money.of("2000", Currencies.USD), valuation.positionMargin());
            assertThat(valuation.openPositions()).extracting(p -> p.id().value()).containsExactly("P-1", "P-2");
            assertTrue(portfolio.valuation(BITMEX).isEmpty());
        }

        @Test
        @DisplayName("Venue valuation stays consistent while positions are being opened")
        void venueValuationUnderConcurrentWrites() throws Exception {
            AtomicBoolean writing = new AtomicBoolean(true);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<Integer> reader = executor.submit(() -> {
                    int reads = 0;
                    while (writing.get() || reads == 0) {
                        VenueValuation valuation = portfolio.valuation(FXCM).orElseThrow();
                        Money expected = Money.of(valuation.openPositions().size(), Currencies.USD);
                        assertEquals(Optional.of(expected), valuation.openValue());
                        reads++;
                    }
                    return reads;
                });
                Future<?> writer = executor.submit(() -> {
                    try {
                        for (int i = 0; i < 500; i++) {
                            Position position = new Position(audusdFill("P-" + i, OrderSide.BUY, "1", "1.00000"));
                            portfolio.updatePosition(PositionOpened.of(position.snapshot()));
                        }
                    } finally {
                        writing.set(false);
                    }
                });

                writer.get(30, TimeUnit.SECONDS);
                assertTrue(reader.get(30, TimeUnit.SECONDS) > 0);
                assertEquals(500, portfolio.openPositions(FXCM).size());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Position without a quote makes unrealized PnL unavailable")
        void missingQuote() {
            open(audusdFill("P-1", OrderSide.BUY, "100000", "1.00000"));
            open(fill("P-2", GBPUSD_FXCM, OrderSide.BUY, "100000", "1.00000", Currencies.GBP, Currencies.USD));
            portfolio.updateTick(quote(AUDUSD_FXCM, "0.80501", "0.80505"));

            assertTrue(portfolio.unrealizedPnl(FXCM).isEmpty());
            assertEquals(Optional.of(Money.of("200000.00", Currencies.USD)), portfolio.openValue(FXCM));
        }
    }

    @Nested
    @DisplayName("Cross currency venue")
    class CrossCurrencyTests {

        @Test
        @DisplayName("Base-currency account values a BTC/USD position in BTC")
        void btcAccount() {
            portfolio.registerAccount(new Account(accountState("BINANCE-1513111-SIMULATED", Currencies.BTC, "10")));
            open(fill("P-1", BTCUSDT_BINANCE, OrderSide.BUY, "10", "10500.00", Currencies.BTC, Currencies.USD));
            portfolio.updateTick(quote(BTCUSDT_BINANCE, "10500.05", "10501.51"));

            assertEquals(Optional.of(Money.of(10, Currencies.BTC)), portfolio.openValue(BINANCE));
            assertEquals(Optional.of(Money.of("0.00004762", Currencies.BTC)), portfolio.unrealizedPnl(BINANCE));
        }

        @Test
        @DisplayName("No rate into the account currency makes valuations unavailable")
        void noRate() {
            portfolio.registerAccount(new Account(accountState("BITMEX-01234-SIMULATED", Currencies.XBT, "10")));
            open(fill("P-1", ETHUSD_BITMEX, OrderSide.BUY, "10", "376.05", Currencies.ETH, Currencies.USD));

            assertTrue(portfolio.unrealizedPnl(BITMEX).isEmpty());

            portfolio.updateTick(quote(ETHUSD_BITMEX, "376.05", "377.10"));

            assertTrue(portfolio.unrealizedPnl(BITMEX).isEmpty());
            assertTrue(portfolio.openValue(BITMEX).isEmpty());
        }

        @Test
        @DisplayName("Rate through an inverse quote converts into the account currency")
        void inverseRate() {
            portfolio.registerAccount(new Account(accountState("BITMEX-01234-SIMULATED", Currencies.XBT, "10")));
            open(fill("P-1", ETHUSD_BITMEX, OrderSide.BUY, "10", "376.05", Currencies.ETH, Currencies.USD));
            portfolio.updateTick(quote(ETHUSD_BITMEX, "377.05", "377.10"));
            portfolio.updateTick(quote(XBTUSD_BITMEX, "10000.00", "10000.00"));

            assertEquals(Optional.of(Money.of("0.37605", Currencies.XBT)), portfolio.openValue(BITMEX));
            assertEquals(Optional.of(Money.of("0.001", Currencies.XBT)), portfolio.unrealizedPnl(BITMEX));
        }

        @Test
        @DisplayName("Short position is marked at the ask and valued by magnitude")
        void shortPosition() {
            portfolio.registerAccount(new Account(accountState("BITMEX-01234-SIMULATED", Currencies.XBT, "10")));
            open(fill("P-1", ETHUSD_BITMEX, OrderSide.SELL, "10", "376.05", Currencies.ETH, Currencies.USD));
            portfolio.updateTick(quote(ETHUSD_BITMEX, "377.05", "377.10"));
            portfolio.updateTick(quote(XBTUSD_BITMEX, "10000.00", "10000.00"));

            // (376.05 - 377.10) * 10 = -10.50 USD at the ask
            assertEquals(Optional.of(Money.of("-0.00105", Currencies.XBT)), portfolio.unrealizedPnl(BITMEX));
            assertEquals(Optional.of(Money.of("0.37605", Currencies.XBT)), portfolio.openValue(BITMEX));
        }

        @Test
        @DisplayName("Sub-cent PnL survives conversion into a base-currency account")
        void subCentPnlConvertedOnce() {
            portfolio.registerAccount(new Account(accountState("BINANCE-1513111-SIMULATED", Currencies.BTC, "10")));
            open(fill("P-1", BTCUSDT_BINANCE, OrderSide.BUY, "0.1", "10500.00", Currencies.BTC, Currencies.USD));
            portfolio.updateTick(quote(BTCUSDT_BINANCE, "10500.04", "10500.06"));

            // 0.004 USD / 10500.05 (mid)
            assertEquals(Optional.of(Money.of("0.00000038", Currencies.BTC)), portfolio.unrealizedPnl(BINANCE));
            assertEquals(Optional.of(Money.of("0.1", Currencies.BTC)), portfolio.openValue(BINANCE));
        }

        @Test
        @DisplayName("Configured precision override still finds rates")
        void precisionOverrideKeepsRates() {
            portfolio = new Portfolio(PriceType.MID, CurrencyRegistry.withOverrides(Map.of("USD", 4)));
            portfolio.registerAccount(new Account(accountState("BITMEX-01234-SIMULATED", Currencies.XBT, "10")));
            open(fill("P-1", ETHUSD_BITMEX, OrderSide.BUY, "10", "376.05", Currencies.ETH, Currencies.USD));
            portfolio.updateTick(quote(ETHUSD_BITMEX, "377.05", "377.10"));
            portfolio.updateTick(quote(XBTUSD_BITMEX, "10000.00", "10000.00"));

            assertEquals(Optional.of(Money.of("0.37605", Currencies.XBT)), portfolio.openValue(BITMEX));
            assertEquals(Optional.of(Money.of("0.001", Currencies.XBT)), portfolio.unrealizedPnl(BITMEX));
        }

        @Test
        @DisplayName("Configured precision override sets the rounding of account totals")
        void precisionOverrideRoundsTotals() {
            portfolio = new Portfolio(PriceType.MID, CurrencyRegistry.withOverrides(Map.of("USD", 4)));
            portfolio.registerAccount(new Account(accountState("FXCM-001-SIMULATED", Currencies.USD, "1000")));
            open(audusdFill("P-1", OrderSide.BUY, "1", "1.00000"));
            portfolio.updateTick(quote(AUDUSD_FXCM, "0.80501", "0.80505"));

            Money pnl = portfolio.unrealizedPnl(FXCM).orElseThrow();

            assertEquals(new BigDecimal("-0.1950"), pnl.amount());
            assertEquals(4, pnl.currency().precision());
        }

        @Test
        @DisplayName("Latest quote wins when two symbols quote the same pair")
        void latestQuoteForPair() {
            Symbol xbtPerp = new Symbol("XBT-PERP", BITMEX);
            portfolio.registerAccount(new Account(accountState("BITMEX-01234-SIMULATED", Currencies.XBT, "10")));
            portfolio.registerInstrument(new Instrument(xbtPerp, Currencies.XBT, Currencies.USD));
            open(fill("P-1", ETHUSD_BITMEX, OrderSide.BUY, "10", "376.05", Currencies.ETH, Currencies.USD));

            portfolio.updateTick(quote(XBTUSD_BITMEX, "10000.00", "10000.00", UNIX_EPOCH.plusSeconds(2)));
            portfolio.updateTick(quote(xbtPerp, "8000.00", "8000.00", UNIX_EPOCH.plusSeconds(1)));
            assertEquals(Optional.of(Money.of("0.37605", Currencies.XBT)), portfolio.openValue(BITMEX));

            portfolio.updateTick(quote(xbtPerp, "8000.00", "8000.00", UNIX_EPOCH.plusSeconds(3)));
            assertEquals(Optional.of(Money.of("0.47006250", Currencies.XBT)), portfolio.openValue(BITMEX));
        }

        @Test
        @DisplayName("Quotes from another venue are not used for rates")
        void ratesAreVenueScoped() {
            portfolio.registerAccount(new Account(accountState("BITMEX-01234-SIMULATED", Currencies.XBT, "10")));
            open(fill("P-1", ETHUSD_BITMEX, OrderSide.BUY, "10", "376.05", Currencies.ETH, Currencies.USD));
            portfolio.updateTick(quote(ETHUSD_BITMEX, "377.05", "377.10"));
            portfolio.updateTick(quote(new Symbol("XBTUSD", FXCM), "10000.00", "10000.00"));

            assertTrue(portfolio.openValue(BITMEX).isEmpty());
        }

        @Test
        @DisplayName("Declared instrument supplies the pair for a non-standard code")
        void registeredInstrument() {
            Symbol xbtPerp = new Symbol("XBT-PERP", BITMEX);
            portfolio.registerAccount(new Account(accountState("BITMEX-01234-SIMULATED", Currencies.XBT, "10")));
            portfolio.registerInstrument(new Instrument(xbtPerp, Currencies.XBT, Currencies.USD));
            open(fill("P-1", ETHUSD_BITMEX, OrderSide.BUY, "10", "376.05", Currencies.ETH, Currencies.USD));
            portfolio.updateTick(quote(xbtPerp, "10000.00", "10000.00"));

            assertEquals(Optional.of(Money.of("0.37605", Currencies.XBT)), portfolio.openValue(BITMEX));
            assertEquals(Currencies.XBT, portfolio.instrument(xbtPerp).orElseThrow().baseCurrency());
        }

        @Test
        @DisplayName("Configured price type selects the side used for rates")
        void priceTypeForRates() {
            portfolio = new Portfolio(PriceType.BID, CurrencyRegistry.defaults());
            portfolio.registerAccount(new Account(accountState("BITMEX-01234-SIMULATED", Currencies.XBT, "10")));
            open(fill("P-1", ETHUSD_BITMEX, OrderSide.BUY, "10", "376.05", Currencies.ETH, Currencies.USD));
            portfolio.updateTick(quote(XBTUSD_BITMEX, "8000.00", "10000.00"));

            // 3760.50 USD / 8000 (bid)
            assertEquals(Optional.of(Money.of("0.47006250", Currencies.XBT)), portfolio.openValue(BITMEX));
            assertEquals(PriceType.BID, portfolio.xratePriceType());
        }
    }

    @Nested
    @DisplayName("Position events")
    class PositionEventTests {

        @Test
        @DisplayName("Modified for an unknown position is stale")
        void staleModified() {
            Position position = new Position(audusdFill("P-1", OrderSide.BUY, "100", "1.0"));

            assertFalse(portfolio.updatePosition(PositionModified.of(position.snapshot())));
            assertEquals(0, portfolio.openPositionCount());
        }

        @Test
        @DisplayName("Closed for an unknown position is stale")
        void staleClosed() {
            Position position = new Position(audusdFill("P-1", OrderSide.BUY, "100", "1.0"));
            position.apply(audusdFill("P-1", OrderSide.SELL, "100", "1.0"));

            assertFalse(portfolio.updatePosition(PositionClosed.of(position.snapshot())));
            assertTrue(portfolio.closedPosition(new PositionId("P-1")).isEmpty());
        }

        @Test
        @DisplayName("Opened for an already closed position id is ignored")
        void reopenIgnored() {
            Position position = open(audusdFill("P-1", OrderSide.BUY, "100", "1.0"));
            close(position, audusdFill("P-1", OrderSide.SELL, "100", "1.0"));
            Position again = new Position(audusdFill("P-1", OrderSide.BUY, "100", "1.0"));

            assertFalse(portfolio.updatePosition(PositionOpened.of(again.snapshot())));
            assertTrue(portfolio.position(new PositionId("P-1")).isEmpty());
        }

        @Test
        @DisplayName("Modified across zero keeps the position open on the other side")
        void flippedPosition() {
            portfolio.registerAccount(new Account(accountState("FXCM-001-SIMULATED", Currencies.USD, "1000000")));
            Position position = open(audusdFill("P-1", OrderSide.BUY, "100000", "1.00000"));
            modify(position, audusdFill("P-1", OrderSide.SELL, "150000", "1.00010"));
            portfolio.updateTick(quote(AUDUSD_FXCM, "0.80501", "0.80505"));

            var flipped = portfolio.position(new PositionId("P-1")).orElseThrow();
            assertEquals(PositionSide.SHORT, flipped.side());
            assertEquals(Quantity.of(50000), flipped.quantity());
            // (1.00010 - 0.80505) * 50000 at the ask
            assertEquals(Optional.of(Money.of("9752.50", Currencies.USD)), portfolio.unrealizedPnl(FXCM));
            assertEquals(Optional.of(Money.of("50005.00", Currencies.USD)), portfolio.openValue(FXCM));
            assertTrue(portfolio.closedPosition(new PositionId("P-1")).isEmpty());
        }

        @Test
        @DisplayName("Modified to flat moves the position to closed")
        void modifiedToFlat() {
            Position position = open(audusdFill("P-1", OrderSide.BUY, "100", "1.0"));
            modify(position, audusdFill("P-1", OrderSide.SELL, "100", "1.5"));

            assertTrue(portfolio.position(new PositionId("P-1")).isEmpty());
            assertTrue(portfolio.closedPosition(new PositionId("P-1")).isPresent());
        }

        @Test
        @DisplayName("Open positions are listed per venue")
        void openPositionsPerVenue() {
            open(audusdFill("P-1", OrderSide.BUY, "100", "1.0"));
            open(fill("P-2", BTCUSDT_BINANCE, OrderSide.BUY, "1", "10000", Currencies.BTC, Currencies.USD));

            assertThat(portfolio.openPositions(FXCM)).extracting(p -> p.id().value()).containsExactly("P-1");
            assertThat(portfolio.openPositions(BINANCE)).extracting(p -> p.id().value()).containsExactly("P-2");
            assertFalse(portfolio.isFlat(FXCM));
            assertTrue(portfolio.isFlat(BITMEX));
        }
    }

    @Nested
    @DisplayName("Reset")
    class ResetTests {

        @Test
        @DisplayName("Reset clears positions and quotes but keeps accounts")
        void reset() {
            portfolio.registerAccount(new Account(accountState("FXCM-001-SIMULATED", Currencies.USD, "1000000")));
            Position p1 = open(audusdFill("P-1", OrderSide.BUY, "100000", "1.00000"));
            open(audusdFill("P-2", OrderSide.BUY, "100000", "1.00000"));
            close(p1, audusdFill("P-1", OrderSide.SELL, "100000", "1.00000"));
            portfolio.updateTick(quote(AUDUSD_FXCM, "0.80501", "0.80505"));

            portfolio.reset();

            assertEquals(0, portfolio.openPositionCount());
            assertTrue(portfolio.closedPosition(new PositionId("P-1")).isEmpty());
            assertTrue(portfolio.lastQuote(AUDUSD_FXCM).isEmpty());
            assertTrue(portfolio.account(FXCM).isPresent());
            assertEquals(Optional.of(Money.zero(Currencies.USD)), portfolio.openValue(FXCM));
        }
    }
}
