package com.ledger.engine;

import com.ledger.core.event.AccountState;
import com.ledger.core.event.LedgerEvent;
import com.ledger.core.event.LedgerEventKind;
import com.ledger.core.event.PositionEvent;
import com.ledger.core.event.QuoteTick;
import com.ledger.core.portfolio.Portfolio;
import com.ledger.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Single-writer event context for a {@link Portfolio}.
 *
 * Events are applied one at a time, in submission order, on one worker thread. The
 * queue is bounded; a full queue rejects the submission instead of blocking the
 * producer. Queries go straight to the portfolio and may run on any thread.
 */
public final class PortfolioEventLoop implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PortfolioEventLoop.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final Portfolio portfolio;
    private final MetricsService metrics;
    private final ThreadPoolExecutor worker;

    public PortfolioEventLoop(Portfolio portfolio, MetricsService metrics, int queueCapacity) {
        this.portfolio = Objects.requireNonNull(portfolio, "portfolio");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be at least 1: " + queueCapacity);
        }
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(queueCapacity), r -> {
                Thread t = new Thread(r, "ledger-event-loop");
                t.setDaemon(true);
                return t;
            }, new ThreadPoolExecutor.AbortPolicy());
        logger.info("Event loop started (queue capacity {})", queueCapacity);
    }

    /**
     * Queue an event for application.
     *
     * @return completes once the event is applied, or exceptionally if applying it failed
     * @throws RejectedExecutionException if the queue is full or the loop is closed
     */
    public CompletableFuture<Void> submit(LedgerEvent event) {
        Objects.requireNonNull(event, "event");
        try {
            return CompletableFuture.runAsync(() -> apply(event), worker);
        } catch (RejectedExecutionException e) {
            metrics.incrementEventsRejected(event.kind(), "queue_full");
            logger.warn("Event queue full or closed, rejected {} event", event.kind());
            throw e;
        }
    }

    private void apply(LedgerEvent event) {
        try {
            boolean applied = switch (event.kind()) {
                case ACCOUNT_STATE -> {
                    portfolio.updateAccount((AccountState) event);
                    yield true;
                }
                case POSITION -> portfolio.updatePosition((PositionEvent) event);
                case QUOTE -> {
                    portfolio.updateTick((QuoteTick) event);
                    yield true;
                }
            };
            if (applied) {
                metrics.incrementEventsApplied(event.kind());
            } else {
                metrics.incrementEventsStale(event.kind());
            }
            if (event.kind() != LedgerEventKind.QUOTE) {
                metrics.setOpenPositions(portfolio.openPositionCount());
            }
        } catch (RuntimeException e) {
            metrics.incrementEventsRejected(event.kind(), "invalid");
            logger.error("❌ Failed to apply {} event: {}", event.kind(), e.getMessage(), e);
            throw e;
        }
    }

    public int pendingEvents() {
        return worker.getQueue().size();
    }

    public boolean isClosed() {
        return worker.isShutdown();
    }

    /**
     * Stop accepting events and drain the ones already queued.
     */
    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                int dropped = worker.shutdownNow().size();
                logger.warn("Event loop did not drain within {}s, {} events dropped", SHUTDOWN_TIMEOUT_SECONDS, dropped);
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Event loop stopped");
    }
}
