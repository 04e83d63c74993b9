package com.ledger.metrics;

import com.ledger.core.event.LedgerEventKind;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for the ledger service.
 *
 * Provides:
 * - Prometheus-compatible counters for applied, stale and rejected events
 * - A gauge of open positions
 * - The scrape text served on /metrics
 *
 * Uses the Initialization-on-Demand Holder pattern for the process-wide instance;
 * tests build their own instance over a fresh registry.
 *
 * Usage:
 *   var metrics = MetricsService.getInstance();
 *   metrics.incrementEventsApplied(LedgerEventKind.QUOTE);
 */
public class MetricsService {
    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    private final PrometheusMeterRegistry registry;
    private final AtomicInteger openPositions = new AtomicInteger();

    public MetricsService() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public MetricsService(PrometheusMeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("ledger.positions.open", openPositions, AtomicInteger::get)
            .description("Open positions across all venues")
            .register(registry);
        logger.info("MetricsService initialized with Prometheus registry");
    }

    private static class Holder {
        private static final MetricsService INSTANCE = new MetricsService();
    }

    public static MetricsService getInstance() {
        return Holder.INSTANCE;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Get Prometheus-formatted metrics for scraping
     */
    public String scrape() {
        return registry.scrape();
    }

    public void incrementEventsApplied(LedgerEventKind kind) {
        registry.counter("ledger.events.applied",
            "kind", kind.name().toLowerCase()).increment();
    }

    public void incrementEventsStale(LedgerEventKind kind) {
        registry.counter("ledger.events.stale",
            "kind", kind.name().toLowerCase()).increment();
    }

    public void incrementEventsRejected(LedgerEventKind kind, String reason) {
        registry.counter("ledger.events.rejected",
            "kind", kind.name().toLowerCase(),
            "reason", reason).increment();
    }

    /**
     * Record a valuation query that could not be answered (missing quote or rate).
     */
    public void incrementValuationUnavailable(String venue, String measure) {
        registry.counter("ledger.valuation.unavailable",
            "venue", venue,
            "measure", measure).increment();
    }

    public void setOpenPositions(int count) {
        openPositions.set(count);
    }
}
