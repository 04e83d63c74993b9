package com.ledger.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ledger.api.model.AccountView;
import com.ledger.api.model.MoneyView;
import com.ledger.api.model.PortfolioView;
import com.ledger.api.model.PositionView;
import com.ledger.core.account.AccountFacade;
import com.ledger.core.model.Money;
import com.ledger.core.model.Venue;
import com.ledger.core.portfolio.Portfolio;
import com.ledger.core.portfolio.VenueValuation;
import com.ledger.engine.PortfolioEventLoop;
import com.ledger.metrics.MetricsService;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only HTTP surface over the portfolio: account balances, per-venue valuations,
 * health and Prometheus metrics.
 *
 * Missing data is a normal outcome here. A venue without an account answers 404; a
 * valuation that cannot be computed is rendered with {@code "available": false}.
 */
public final class PortfolioApiServer {
    private static final Logger logger = LoggerFactory.getLogger(PortfolioApiServer.class);

    private final Javalin app;
    private final Portfolio portfolio;
    private final PortfolioEventLoop eventLoop;
    private final MetricsService metrics;

    public PortfolioApiServer(Portfolio portfolio, PortfolioEventLoop eventLoop, MetricsService metrics) {
        this.portfolio = portfolio;
        this.eventLoop = eventLoop;
        this.metrics = metrics;

        this.app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;

            var objectMapper = new ObjectMapper();
            objectMapper.registerModule(new JavaTimeModule());
            objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));
        });

        registerRoutes();
    }

    private void registerRoutes() {
        app.get("/health", ctx -> ctx.json(Map.of(
            "status", eventLoop.isClosed() ? "DOWN" : "UP",
            "openPositions", portfolio.openPositionCount(),
            "pendingEvents", eventLoop.pendingEvents()
        )));

        app.get("/api/accounts/{venue}", ctx -> {
            Venue venue = new Venue(ctx.pathParam("venue"));
            Optional<AccountFacade> account = portfolio.account(venue);
            if (account.isEmpty()) {
                notFound(ctx, venue);
                return;
            }
            ctx.json(AccountView.of(account.get()));
        });

        app.get("/api/portfolio/{venue}", ctx -> {
            Venue venue = new Venue(ctx.pathParam("venue"));
            Optional<VenueValuation> valuation = portfolio.valuation(venue);
            if (valuation.isEmpty()) {
                notFound(ctx, venue);
                return;
            }
            VenueValuation v = valuation.get();
            String currency = v.account().currency().code();
            ctx.json(new PortfolioView(
                venue.name(),
                currency,
                valuation(venue, "unrealized_pnl", v.unrealizedPnl(), currency),
                valuation(venue, "open_value", v.openValue(), currency),
                MoneyView.of(v.orderMargin()),
                MoneyView.of(v.positionMargin()),
                v.openPositions().stream().map(PositionView::of).toList()
            ));
        });

        app.get("/metrics", ctx -> {
            ctx.contentType("text/plain; version=0.0.4");
            ctx.result(metrics.scrape());
        });
    }

    private MoneyView valuation(Venue venue, String measure, Optional<Money> value, String currency) {
        if (value.isEmpty()) {
            metrics.incrementValuationUnavailable(venue.name(), measure);
        }
        return MoneyView.of(value, currency);
    }

    private static void notFound(Context ctx, Venue venue) {
        ctx.status(404);
        ctx.json(Map.of("error", "No account registered for venue " + venue.name()));
    }

    /**
     * @param port 0 binds a free port, see {@link #port()}
     */
    public void start(int port) {
        app.start(port);
        logger.info("🚀 Ledger API started at http://localhost:{}", app.port());
        logger.info("   Portfolio: http://localhost:{}/api/portfolio/{venue}", app.port());
        logger.info("   Metrics: http://localhost:{}/metrics", app.port());
    }

    public int port() {
        return app.port();
    }

    public void stop() {
        app.stop();
        logger.info("Ledger API stopped");
    }
}
