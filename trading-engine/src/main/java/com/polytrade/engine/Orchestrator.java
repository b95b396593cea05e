package com.polytrade.engine;

import com.polytrade.circuit.CircuitBreaker;
import com.polytrade.circuit.CircuitOpenException;
import com.polytrade.execution.ExecutionResult;
import com.polytrade.execution.OrderExecutor;
import com.polytrade.execution.OrderRequest;
import com.polytrade.ledger.PositionId;
import com.polytrade.ledger.PositionLedger;
import com.polytrade.ledger.Trade;
import com.polytrade.ledger.UnknownPositionException;
import com.polytrade.metrics.MetricSnapshot;
import com.polytrade.metrics.MetricsRecorder;
import com.polytrade.persistence.SnapshotPersistenceException;
import com.polytrade.risk.Decision;
import com.polytrade.risk.RiskGate;
import com.polytrade.scanner.ExitSignal;
import com.polytrade.scanner.ExitSignalSource;
import com.polytrade.scanner.MarketScanner;
import com.polytrade.scanner.Opportunity;
import com.polytrade.scanner.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the decision loop: exits, scan, gate, execute, commit, snapshot.
 *
 * One opportunity failing (risk rejection, open circuit, failed or timed-out order,
 * unexpected exception) never aborts the cycle. The ledger is only written after the
 * executor call has resolved.
 */
public final class Orchestrator implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(Orchestrator.class);

    public static final String SCANNER = "scanner";
    public static final String EXECUTOR = "executor";

    private final MarketScanner scanner;
    private final ExitSignalSource exitSource;
    private final CircuitBreaker scannerBreaker;
    private final RiskGate riskGate;
    private final PositionLedger ledger;
    private final OrderExecutor executor;
    private final MetricsRecorder metrics;
    private final int maxOpportunitiesPerCycle;
    private final Duration scanInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private long cycleCount;

    /**
     * @param executor order executor already wrapped by the "executor" circuit breaker
     */
    public Orchestrator(MarketScanner scanner,
                        ExitSignalSource exitSource,
                        CircuitBreaker scannerBreaker,
                        RiskGate riskGate,
                        PositionLedger ledger,
                        OrderExecutor executor,
                        MetricsRecorder metrics,
                        int maxOpportunitiesPerCycle,
                        Duration scanInterval) {
        this.scanner = scanner;
        this.exitSource = exitSource;
        this.scannerBreaker = scannerBreaker;
        this.riskGate = riskGate;
        this.ledger = ledger;
        this.executor = executor;
        this.metrics = metrics;
        this.maxOpportunitiesPerCycle = maxOpportunitiesPerCycle;
        this.scanInterval = scanInterval;
    }

    // ==================== Loop ====================

    /**
     * Run cycles until {@link #stop()} is called. The inter-cycle wait returns as soon as
     * the stop signal arrives.
     */
    @Override
    public void run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Orchestrator already running");
        }
        logger.info("🚀 Trading loop started (interval {}s, top {} per cycle)",
            scanInterval.toSeconds(), maxOpportunitiesPerCycle);
        try {
            while (stopSignal.getCount() > 0) {
                try {
                    runCycle();
                } catch (RuntimeException e) {
                    logger.error("Error in trading cycle", e);
                }
                if (stopSignal.await(scanInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            logger.info("Trading loop interrupted, shutting down");
            Thread.currentThread().interrupt();
        } finally {
            running.set(false);
            logger.info("Trading loop stopped after {} cycles", cycleCount);
        }
    }

    public void stop() {
        logger.info("Shutdown signal received");
        stopSignal.countDown();
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== Cycle ====================

    public CycleReport runCycle() {
        cycleCount++;
        logger.info("===== Cycle {} =====", cycleCount);

        int exitsClosed = processExits();

        ScanResult scan = scan();
        metrics.recordScan(scan.marketsScanned(), scan.opportunities().size());

        List<Opportunity> candidates = scan.opportunities().stream()
            .sorted(Comparator.comparingDouble(Opportunity::expectedValuePerDollar).reversed())
            .limit(maxOpportunitiesPerCycle)
            .toList();

        int executed = 0;
        int failed = 0;
        int rejected = 0;
        for (Opportunity opportunity : candidates) {
            try {
                switch (process(opportunity)) {
                    case EXECUTED -> executed++;
                    case FAILED -> failed++;
                    case REJECTED -> rejected++;
                }
            } catch (RuntimeException e) {
                failed++;
                metrics.recordExecution(false);
                logger.error("Unexpected error processing {}", opportunity.marketId(), e);
            }
        }

        boolean persisted = persistSnapshot();
        CycleReport report = new CycleReport(exitsClosed, scan.marketsScanned(), candidates.size(),
            executed, failed, rejected, persisted);
        logger.info("Cycle {} complete: {} | {}", cycleCount, report.getSummary(),
            ledger.portfolioSummary().getSummary());
        return report;
    }

    private enum Outcome { EXECUTED, FAILED, REJECTED }

    private Outcome process(Opportunity opportunity) {
        Decision decision = riskGate.evaluate(opportunity);
        if (!decision.approved()) {
            metrics.recordRejection(decision.reason());
            return Outcome.REJECTED;
        }

        OrderRequest request = new OrderRequest(opportunity.marketId(), opportunity.marketTitle(),
            opportunity.side(), decision.size(), opportunity.currentPrice());

        ExecutionResult result;
        long start = System.nanoTime();
        try {
            result = executor.execute(request);
        } catch (CircuitOpenException e) {
            logger.warn("⚡ Skipping {}: {}", opportunity.marketId(), e.getMessage());
            metrics.recordExecution(false);
            return Outcome.FAILED;
        }
        Duration latency = Duration.ofNanos(System.nanoTime() - start);
        metrics.recordApiCall(EXECUTOR, latency, result.success());

        if (!result.success()) {
            logger.error("❌ Order failed for {}: {}", opportunity.marketId(), result.error());
            metrics.recordExecution(false);
            return Outcome.FAILED;
        }

        PositionId id = ledger.open(opportunity.marketId(), opportunity.marketTitle(),
            opportunity.side(), decision.size(), result.fillPrice());
        metrics.recordExecution(true);
        logger.info("Opened {} {} {} ${} @ {}", id, opportunity.side(), opportunity.marketTitle(),
            String.format("%.2f", decision.size()), String.format("%.4f", result.fillPrice()));
        return Outcome.EXECUTED;
    }

    private int processExits() {
        List<ExitSignal> exits;
        try {
            exits = exitSource.pendingExits(ledger.openPositions());
        } catch (RuntimeException e) {
            logger.error("Exit signal source failed, no exits this cycle", e);
            return 0;
        }

        int closed = 0;
        for (ExitSignal exit : exits) {
            try {
                Trade trade = ledger.close(exit.positionId(), exit.exitPrice());
                metrics.record(trade);
                closed++;
                logger.info("Closed {} ({}): {} ${}", exit.positionId(), exit.reason(),
                    trade.outcome(), String.format("%+.2f", trade.realizedPnl()));
            } catch (UnknownPositionException e) {
                logger.warn("Ignoring exit for {}: {}", exit.positionId(), e.getMessage());
            } catch (RuntimeException e) {
                logger.error("Failed to close {}", exit.positionId(), e);
            }
        }
        return closed;
    }

    private ScanResult scan() {
        long start = System.nanoTime();
        try {
            ScanResult result = scannerBreaker.execute(scanner::scan);
            metrics.recordApiCall(SCANNER, Duration.ofNanos(System.nanoTime() - start), true);
            return result == null ? ScanResult.empty() : result;
        } catch (CircuitOpenException e) {
            logger.warn("⚡ Market scan skipped: {}", e.getMessage());
            return ScanResult.empty();
        } catch (RuntimeException e) {
            metrics.recordApiCall(SCANNER, Duration.ofNanos(System.nanoTime() - start), false);
            logger.error("Market scan failed: {}", e.getMessage());
            return ScanResult.empty();
        }
    }

    private boolean persistSnapshot() {
        try {
            MetricSnapshot snapshot = metrics.snapshot(ledger.portfolioSummary(), riskGate.status().isHalted());
            metrics.persist(snapshot);
            return true;
        } catch (SnapshotPersistenceException e) {
            logger.error("Snapshot not persisted this cycle: {}", e.getMessage());
            return false;
        }
    }
}
