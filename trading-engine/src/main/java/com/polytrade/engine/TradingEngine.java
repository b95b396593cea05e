package com.polytrade.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytrade.circuit.CircuitBreakerRegistry;
import com.polytrade.circuit.CircuitBreakerState;
import com.polytrade.config.EngineConfig;
import com.polytrade.dashboard.StatusServer;
import com.polytrade.execution.OrderExecutor;
import com.polytrade.execution.OrderExecutors;
import com.polytrade.execution.OrderGateway;
import com.polytrade.execution.ResilientOrderExecutor;
import com.polytrade.ledger.PortfolioState;
import com.polytrade.ledger.PositionLedger;
import com.polytrade.metrics.MetricsRecorder;
import com.polytrade.persistence.JsonMappers;
import com.polytrade.persistence.SnapshotStore;
import com.polytrade.risk.RiskGate;
import com.polytrade.scanner.ExitSignalSource;
import com.polytrade.scanner.MarketScanner;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the engine from an {@link EngineConfig} and owns its lifecycle.
 *
 * The executor variant (paper or live) is chosen here once. {@link #start()} runs the
 * decision loop on its own thread; {@link #stop()} interrupts the inter-cycle wait.
 */
public final class TradingEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TradingEngine.class);

    private final EngineConfig config;
    private final PrometheusMeterRegistry meterRegistry;
    private final PositionLedger ledger;
    private final RiskGate riskGate;
    private final CircuitBreakerRegistry breakers;
    private final ResilientOrderExecutor executor;
    private final MetricsRecorder metrics;
    private final Orchestrator orchestrator;
    private final StatusServer statusServer;

    private Thread loopThread;
    private boolean stopped;
    private boolean statusStarted;

    /**
     * @param gateway venue gateway for live mode; may be null when paper trading
     */
    public TradingEngine(EngineConfig config,
                         MarketScanner scanner,
                         ExitSignalSource exitSource,
                         OrderGateway gateway,
                         Clock clock) {
        this.config = config;
        ObjectMapper mapper = JsonMappers.create();
        this.meterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        this.ledger = new PositionLedger(config.getInitialBalance(), config.riskLimits(), clock, config.getPnlZone());
        this.riskGate = new RiskGate(ledger, config.riskLimits());
        this.breakers = new CircuitBreakerRegistry(config.getCircuitFailureThreshold(),
            Duration.ofSeconds(config.getCircuitCooldownSeconds()), clock);

        OrderExecutor base = OrderExecutors.forMode(config.isPaperTrading(), config.getPaperSlippageBps(), gateway);
        this.executor = new ResilientOrderExecutor(base, breakers.breaker(Orchestrator.EXECUTOR),
            Duration.ofMillis(config.getExecutorTimeoutMs()));

        SnapshotStore store = new SnapshotStore(Path.of(config.getSnapshotFile()), mapper);
        this.metrics = new MetricsRecorder(clock, config.getSharpePeriodsPerYear(), meterRegistry, store);
        store.latest().ifPresent(metrics::restoreCounters);

        this.orchestrator = new Orchestrator(scanner, exitSource, breakers.breaker(Orchestrator.SCANNER),
            riskGate, ledger, executor, metrics,
            config.getMaxOpportunitiesPerCycle(), Duration.ofSeconds(config.getScanIntervalSeconds()));

        this.statusServer = config.getStatusPort() > 0
            ? new StatusServer(ledger, riskGate, breakers, metrics, meterRegistry, mapper)
            : null;

        logger.info("TradingEngine initialized: {}", config.getSummary());
    }

    public TradingEngine(EngineConfig config, MarketScanner scanner, OrderGateway gateway) {
        this(config, scanner, ExitSignalSource.NONE, gateway, Clock.systemUTC());
    }

    // ==================== Lifecycle ====================

    public synchronized void start() {
        if (loopThread != null || stopped) {
            throw new IllegalStateException("Engine already started");
        }
        if (!config.isPaperTrading()) {
            logger.warn("⚠️ LIVE TRADING - real orders will be placed");
        }
        if (statusServer != null) {
            statusServer.start(config.getStatusPort());
            statusStarted = true;
        }
        loopThread = new Thread(orchestrator, "trading-loop");
        loopThread.start();
    }

    /**
     * Stop the loop promptly and release resources. Safe to call more than once.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        orchestrator.stop();
        if (loopThread != null) {
            try {
                loopThread.join(Duration.ofMillis(config.getExecutorTimeoutMs()).plusSeconds(5).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (loopThread.isAlive()) {
                logger.warn("Trading loop did not stop in time");
            }
            loopThread = null;
        }
        if (statusServer != null && statusStarted) {
            statusServer.stop();
        }
        executor.close();
        logger.info(metrics.formatSummary());
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Run a single cycle on the caller's thread.
     */
    public CycleReport runOnce() {
        return orchestrator.runCycle();
    }

    // ==================== Reporting ====================

    public PortfolioState portfolioSummary() {
        return ledger.portfolioSummary();
    }

    public CircuitBreakerState circuitState(String dependency) {
        return breakers.state(dependency);
    }

    public RiskGate riskGate() {
        return riskGate;
    }

    public MetricsRecorder metrics() {
        return metrics;
    }

    public PrometheusMeterRegistry meterRegistry() {
        return meterRegistry;
    }
}
