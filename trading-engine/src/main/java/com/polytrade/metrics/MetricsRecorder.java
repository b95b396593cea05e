package com.polytrade.metrics;

import com.polytrade.ledger.PortfolioState;
import com.polytrade.ledger.PositionId;
import com.polytrade.ledger.Trade;
import com.polytrade.persistence.SnapshotStore;
import com.polytrade.risk.RejectReason;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Collects trade outcomes, cycle statistics and API call statistics, and produces
 * durable {@link MetricSnapshot}s.
 *
 * Closed trades are keyed by position id; re-delivering the same trade does not count it twice.
 * Every counter is mirrored to the injected Micrometer registry for scraping.
 *
 * Thread-Safety: all mutations and snapshot reads go through one lock.
 */
public final class MetricsRecorder {
    private static final Logger logger = LoggerFactory.getLogger(MetricsRecorder.class);
    private static final int LATENCY_WINDOW = 1000;

    private final Clock clock;
    private final double periodsPerYear;
    private final MeterRegistry registry;
    private final SnapshotStore store;
    private final ReentrantLock lock = new ReentrantLock();

    // Trade outcomes
    private final Set<PositionId> recordedTrades = new HashSet<>();
    private final List<Double> returns = new ArrayList<>();
    private long wins;
    private long losses;
    private long breakevens;

    // Cycle statistics
    private long marketsScanned;
    private long opportunitiesFound;
    private long tradesExecuted;
    private long tradesFailed;
    private final Map<RejectReason, Long> rejections = new EnumMap<>(RejectReason.class);
    // Rejections carried over from before a restart; snapshots keep only the total
    private long restoredRejections;

    // API statistics
    private final Map<String, ApiAccumulator> apiCalls = new TreeMap<>();

    public MetricsRecorder(Clock clock, double periodsPerYear, MeterRegistry registry, SnapshotStore store) {
        if (!(periodsPerYear > 0)) {
            throw new IllegalArgumentException("periodsPerYear must be positive");
        }
        this.clock = clock;
        this.periodsPerYear = periodsPerYear;
        this.registry = registry;
        this.store = store;
        logger.info("MetricsRecorder initialized (Sharpe annualization: {} periods/year, store: {})",
            periodsPerYear, store.getPath());
    }

    // ==================== Recording ====================

    /**
     * Record a closed trade.
     *
     * @return false if this trade was already recorded
     */
    public boolean record(Trade trade) {
        lock.lock();
        try {
            if (!recordedTrades.add(trade.positionId())) {
                logger.debug("Ignoring duplicate trade for {}", trade.positionId());
                return false;
            }
            switch (trade.outcome()) {
                case WIN -> wins++;
                case LOSS -> losses++;
                case BREAKEVEN -> breakevens++;
            }
            returns.add(trade.returnOnSize());
        } finally {
            lock.unlock();
        }

        registry.counter("polytrade.trades.closed", "outcome", trade.outcome().name()).increment();
        registry.summary("polytrade.trade.pnl").record(trade.realizedPnl());
        return true;
    }

    public void recordApiCall(String dependency, Duration latency, boolean success) {
        lock.lock();
        try {
            apiCalls.computeIfAbsent(dependency, k -> new ApiAccumulator()).add(latency, success);
        } finally {
            lock.unlock();
        }
        registry.timer("polytrade.api.call",
            "dependency", dependency,
            "outcome", success ? "success" : "failure").record(latency);
    }

    public void recordExecution(boolean success) {
        lock.lock();
        try {
            if (success) {
                tradesExecuted++;
            } else {
                tradesFailed++;
            }
        } finally {
            lock.unlock();
        }
        registry.counter(success ? "polytrade.orders.executed" : "polytrade.orders.failed").increment();
    }

    public void recordRejection(RejectReason reason) {
        lock.lock();
        try {
            rejections.merge(reason, 1L, Long::sum);
        } finally {
            lock.unlock();
        }
        registry.counter("polytrade.risk.rejections", "reason", reason.name()).increment();
    }

    public void recordScan(int markets, int opportunities) {
        lock.lock();
        try {
            marketsScanned += markets;
            opportunitiesFound += opportunities;
        } finally {
            lock.unlock();
        }
        logger.debug("Market scan recorded: {} markets, {} opportunities", markets, opportunities);
    }

    /**
     * Carry every cumulative counter over from the last persisted snapshot: scans,
     * trade outcomes, executions, rejections and API statistics.
     *
     * Per-trade returns are not persisted, so the Sharpe ratio covers trades closed
     * since this start. Rejections restored here count toward the snapshot total but
     * not toward {@link #rejectionCount(RejectReason)}.
     */
    public void restoreCounters(MetricSnapshot previous) {
        lock.lock();
        try {
            MetricSnapshot.TradeCounts trades = previous.trades();
            marketsScanned = previous.marketsScanned();
            opportunitiesFound = previous.opportunitiesFound();
            wins = trades.wins();
            losses = trades.losses();
            breakevens = trades.breakevens();
            tradesExecuted = trades.executed();
            tradesFailed = trades.failed();
            restoredRejections = trades.rejected();
            previous.apiCalls().forEach((dependency, stats) ->
                apiCalls.put(dependency, ApiAccumulator.from(stats)));
            logger.info("Restored counters from snapshot {}: closed={}, executed={}, failed={}, rejected={}, api deps={}",
                previous.timestamp(), trades.closed(), tradesExecuted, tradesFailed, restoredRejections,
                apiCalls.size());
        } finally {
            lock.unlock();
        }
    }

    // ==================== Derived metrics ====================

    public double winRate() {
        lock.lock();
        try {
            long closed = wins + losses + breakevens;
            return closed == 0 ? 0.0 : (double) wins / closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Annualized Sharpe ratio over per-trade returns, or null with fewer than two
     * returns or zero dispersion.
     */
    public Double sharpeRatio() {
        lock.lock();
        try {
            return computeSharpe();
        } finally {
            lock.unlock();
        }
    }

    private Double computeSharpe() {
        if (returns.size() < 2) {
            return null;
        }
        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = returns.stream()
            .mapToDouble(r -> Math.pow(r - mean, 2))
            .average()
            .orElse(0.0);
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0) {
            return null;
        }
        return mean / stdDev * Math.sqrt(periodsPerYear);
    }

    public Map<String, ApiCallStats> apiCallStats() {
        lock.lock();
        try {
            Map<String, ApiCallStats> result = new TreeMap<>();
            apiCalls.forEach((dependency, acc) -> result.put(dependency, acc.toStats()));
            return result;
        } finally {
            lock.unlock();
        }
    }

    public long rejectionCount(RejectReason reason) {
        lock.lock();
        try {
            return rejections.getOrDefault(reason, 0L);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Snapshots ====================

    /**
     * Capture the current aggregates together with the given portfolio state.
     */
    public MetricSnapshot snapshot(PortfolioState portfolio, boolean halted) {
        lock.lock();
        try {
            long closed = wins + losses + breakevens;
            long rejected = restoredRejections
                + rejections.values().stream().mapToLong(Long::longValue).sum();
            Map<String, ApiCallStats> api = new TreeMap<>();
            apiCalls.forEach((dependency, acc) -> api.put(dependency, acc.toStats()));

            return new MetricSnapshot(
                clock.instant(),
                portfolio.balance(),
                portfolio.peakBalance(),
                new MetricSnapshot.PnlFields(portfolio.realizedPnlTotal(), portfolio.dailyPnl(),
                    portfolio.weeklyPnl(), portfolio.drawdown()),
                closed == 0 ? 0.0 : (double) wins / closed,
                computeSharpe(),
                new MetricSnapshot.TradeCounts(closed, wins, losses, breakevens,
                    portfolio.openPositions(), tradesExecuted, tradesFailed, rejected),
                marketsScanned,
                opportunitiesFound,
                portfolio.consecutiveLosses(),
                halted,
                api
            );
        } finally {
            lock.unlock();
        }
    }

    public void persist(MetricSnapshot snapshot) {
        store.append(snapshot);
        logger.info("Metrics snapshot persisted: P&L=${}, Win Rate={}%, Positions={}",
            String.format("%.2f", snapshot.pnl().realized()),
            String.format("%.1f", snapshot.winRate() * 100),
            snapshot.trades().open());
    }

    public List<MetricSnapshot> history() {
        return store.loadAll();
    }

    /**
     * Summary over all persisted snapshots, or null when none exist yet.
     */
    public PerformanceSummary summarize() {
        List<MetricSnapshot> history = store.loadAll();
        if (history.isEmpty()) {
            return null;
        }
        MetricSnapshot latest = history.get(history.size() - 1);
        double max = history.stream().mapToDouble(s -> s.pnl().realized()).max().orElse(0.0);
        double min = history.stream().mapToDouble(s -> s.pnl().realized()).min().orElse(0.0);

        long calls = latest.apiCalls().values().stream().mapToLong(ApiCallStats::calls).sum();
        long errors = latest.apiCalls().values().stream().mapToLong(ApiCallStats::errors).sum();
        long attempts = latest.trades().executed() + latest.trades().failed();

        return new PerformanceSummary(latest, history.size(), max, min,
            calls > 0 ? (double) (calls - errors) / calls : 0.0,
            attempts > 0 ? (double) latest.trades().executed() / attempts : 0.0);
    }

    /**
     * Multi-line performance report for the periodic summary output.
     */
    public String formatSummary() {
        PerformanceSummary summary = summarize();
        if (summary == null) {
            return "No metrics available yet";
        }
        MetricSnapshot s = summary.latest();
        StringBuilder sb = new StringBuilder();
        sb.append("\n").append("=".repeat(60)).append("\n");
        sb.append("PREDICTION MARKET AGENT - PERFORMANCE SUMMARY\n");
        sb.append("=".repeat(60)).append("\n");
        sb.append("\nPORTFOLIO\n");
        sb.append(String.format("  Balance:            $%,.2f%n", s.balance()));
        sb.append(String.format("  Total P&L:          $%+,.2f%n", s.pnl().realized()));
        sb.append(String.format("  Daily P&L:          $%+,.2f%n", s.pnl().daily()));
        sb.append(String.format("  Weekly P&L:         $%+,.2f%n", s.pnl().weekly()));
        sb.append(String.format("  Drawdown:           %.2f%%%n", s.pnl().drawdown() * 100));
        sb.append("\nTRADING\n");
        sb.append(String.format("  Closed Trades:      %d%n", s.trades().closed()));
        sb.append(String.format("  Open Positions:     %d%n", s.trades().open()));
        sb.append(String.format("  Win Rate:           %.2f%%%n", s.winRate() * 100));
        if (s.sharpeRatio() != null) {
            sb.append(String.format("  Sharpe Ratio:       %.3f%n", s.sharpeRatio()));
        }
        sb.append(String.format("  Executed / Failed:  %d / %d (%.1f%% success)%n",
            s.trades().executed(), s.trades().failed(), summary.tradeSuccessRate() * 100));
        sb.append(String.format("  Rejected by risk:   %d%n", s.trades().rejected()));
        sb.append("\nAPI\n");
        s.apiCalls().forEach((dependency, stats) -> sb.append(String.format(
            "  %-18s  %d calls, %d errors, avg %.1f ms%n",
            dependency + ":", stats.calls(), stats.errors(), stats.averageLatencyMs())));
        sb.append(String.format("%nStatus: %s%n", s.halted() ? "HALTED" : "ACTIVE"));
        sb.append("=".repeat(60)).append("\n");
        return sb.toString();
    }

    /**
     * Running call/error counts plus a bounded latency window.
     */
    private static final class ApiAccumulator {
        private long calls;
        private long errors;
        private final ArrayDeque<Double> latenciesMs = new ArrayDeque<>();
        private double latencySum;

        static ApiAccumulator from(ApiCallStats stats) {
            ApiAccumulator acc = new ApiAccumulator();
            acc.calls = stats.calls();
            acc.errors = stats.errors();
            return acc;
        }

        void add(Duration latency, boolean success) {
            calls++;
            if (!success) {
                errors++;
                return;
            }
            double ms = latency.toNanos() / 1_000_000.0;
            latenciesMs.addLast(ms);
            latencySum += ms;
            if (latenciesMs.size() > LATENCY_WINDOW) {
                latencySum -= latenciesMs.removeFirst();
            }
        }

        ApiCallStats toStats() {
            double avg = latenciesMs.isEmpty() ? 0.0 : latencySum / latenciesMs.size();
            return new ApiCallStats(calls, errors, avg);
        }
    }
}
