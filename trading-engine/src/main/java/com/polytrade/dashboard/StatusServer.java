package com.polytrade.dashboard;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytrade.circuit.CircuitBreakerRegistry;
import com.polytrade.ledger.PortfolioState;
import com.polytrade.ledger.Position;
import com.polytrade.ledger.PositionLedger;
import com.polytrade.metrics.MetricsRecorder;
import com.polytrade.metrics.PerformanceSummary;
import com.polytrade.risk.RiskGate;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only HTTP view of the running engine.
 *
 * Every handler reads through the components' own locks, so responses are consistent
 * copies and never block the decision loop for longer than one read.
 */
public final class StatusServer {
    private static final Logger logger = LoggerFactory.getLogger(StatusServer.class);

    private final PositionLedger ledger;
    private final RiskGate riskGate;
    private final CircuitBreakerRegistry breakers;
    private final MetricsRecorder metrics;
    private final PrometheusMeterRegistry prometheus;
    private final ObjectMapper mapper;
    private final Javalin app;

    public StatusServer(PositionLedger ledger,
                        RiskGate riskGate,
                        CircuitBreakerRegistry breakers,
                        MetricsRecorder metrics,
                        PrometheusMeterRegistry prometheus,
                        ObjectMapper mapper) {
        this.ledger = ledger;
        this.riskGate = riskGate;
        this.breakers = breakers;
        this.metrics = metrics;
        this.prometheus = prometheus;
        this.mapper = mapper;

        this.app = Javalin.create(config -> {
            config.showJavalinBanner = false;
        });

        app.get("/healthz", ctx -> ctx.result("OK"));
        app.get("/api/portfolio", ctx -> json(ctx, portfolio()));
        app.get("/api/circuits", ctx -> json(ctx, breakers.states()));
        app.get("/api/metrics/summary", this::summary);
        app.get("/metrics", ctx -> {
            ctx.contentType("text/plain; version=0.0.4");
            ctx.result(prometheus.scrape());
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Status request failed: {}", ctx.path(), e);
            ctx.status(500);
            ctx.contentType("application/json");
            ctx.result("{\"error\":\"internal error\"}");
        });
    }

    /**
     * @param port 0 picks a free port
     * @return the bound port
     */
    public int start(int port) {
        app.start(port);
        logger.info("📊 Status server listening on http://localhost:{}", app.port());
        return app.port();
    }

    public void stop() {
        app.stop();
        logger.info("Status server stopped");
    }

    private Map<String, Object> portfolio() {
        PortfolioState state = ledger.portfolioSummary();
        List<Position> open = ledger.openPositions();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("balance", state.balance());
        body.put("peakBalance", state.peakBalance());
        body.put("realizedPnl", state.realizedPnlTotal());
        body.put("dailyPnl", state.dailyPnl());
        body.put("weeklyPnl", state.weeklyPnl());
        body.put("drawdown", state.drawdown());
        body.put("consecutiveLosses", state.consecutiveLosses());
        body.put("closedTrades", state.closedTrades());
        body.put("risk", riskGate.status());
        body.put("openPositions", open.stream().map(p -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", p.id().toString());
            row.put("marketId", p.marketId());
            row.put("marketTitle", p.marketTitle());
            row.put("side", p.side());
            row.put("size", p.size());
            row.put("entryPrice", p.entryPrice());
            row.put("openedAt", p.openedAt());
            return row;
        }).toList());
        return body;
    }

    private void summary(Context ctx) throws Exception {
        PerformanceSummary summary = metrics.summarize();
        if (summary == null) {
            ctx.status(404);
            json(ctx, Map.of("error", "no snapshots yet"));
            return;
        }
        json(ctx, summary);
    }

    private void json(Context ctx, Object body) throws Exception {
        ctx.contentType("application/json");
        ctx.result(mapper.writeValueAsString(body));
    }
}
