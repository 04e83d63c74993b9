package com.ledger.app;

import com.ledger.api.PortfolioApiServer;
import com.ledger.core.config.LedgerConfig;
import com.ledger.core.portfolio.Portfolio;
import com.ledger.engine.PortfolioEventLoop;
import com.ledger.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Ledger service: one portfolio fed through a single event loop, exposed over HTTP.
 * Upstream feeds embed this class and publish through {@link #eventLoop()}.
 */
public final class LedgerApp implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LedgerApp.class);

    private final LedgerConfig config;
    private final Portfolio portfolio;
    private final PortfolioEventLoop eventLoop;
    private final PortfolioApiServer server;

    public LedgerApp(LedgerConfig config, MetricsService metrics) {
        this.config = config;
        this.portfolio = new Portfolio(config);
        this.eventLoop = new PortfolioEventLoop(portfolio, metrics, config.eventQueueCapacity());
        this.server = new PortfolioApiServer(portfolio, eventLoop, metrics);
    }

    public void start() {
        server.start(config.httpPort());
        logger.info("Ledger service running (exchange rates at {} price)", config.xratePriceType());
    }

    public Portfolio portfolio() {
        return portfolio;
    }

    public PortfolioEventLoop eventLoop() {
        return eventLoop;
    }

    public int port() {
        return server.port();
    }

    @Override
    public void close() {
        server.stop();
        eventLoop.close();
    }

    public static void main(String[] args) throws InterruptedException {
        LedgerConfig config;
        try {
            config = LedgerConfig.getInstance();
        } catch (IllegalStateException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        var app = new LedgerApp(config, MetricsService.getInstance());
        var stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping ledger...");
            app.close();
            stopped.countDown();
        }, "ledger-shutdown"));

        app.start();
        stopped.await();
    }
}
