package com.polytrade.risk;

import com.polytrade.ledger.PortfolioState;
import com.polytrade.ledger.PositionLedger;
import com.polytrade.scanner.Opportunity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides whether, and at what size, a trade may proceed.
 *
 * Checks run in a fixed order and stop at the first failure:
 * <ol>
 *   <li>manual halt</li>
 *   <li>daily loss limit (latched until the next calendar day or {@link #clearDailyHalt()})</li>
 *   <li>weekly loss limit (latched until the next ISO week or {@link #clearWeeklyHalt()})</li>
 *   <li>drawdown from peak (latched until {@link #clearDrawdownHalt()})</li>
 *   <li>total open positions</li>
 *   <li>open positions in this market</li>
 *   <li>post-trade market concentration</li>
 * </ol>
 * Sizing happens between checks 6 and 7: fractional Kelly, clipped to [minSize, maxSize],
 * then shrunk to the concentration headroom. A shrunk size below minSize is rejected,
 * never rounded up.
 */
public final class RiskGate {
    private static final Logger logger = LoggerFactory.getLogger(RiskGate.class);

    private final PositionLedger ledger;
    private final RiskLimits limits;
    private final KellySizer sizer;
    private final ReentrantLock lock = new ReentrantLock();

    // Latched halt state
    private volatile boolean manualHalt;
    private String haltReason;
    private LocalDate dailyHaltDay;
    private long weeklyHaltWeek = -1;
    private boolean drawdownHalted;

    // Loss already "forgiven" by a manual clear within the current period
    private double dailyBaseline;
    private LocalDate dailyBaselineDay;
    private double weeklyBaseline;
    private long weeklyBaselineWeek = -1;

    // High-water mark since the last drawdown clearance; NaN means the ledger peak applies
    private double drawdownReference = Double.NaN;
    private double peakAtClearance;

    public RiskGate(PositionLedger ledger, RiskLimits limits) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.limits = Objects.requireNonNull(limits, "limits");
        this.sizer = new KellySizer(limits.kellyFraction());

        logger.info("RiskGate initialized: daily=${}, weekly=${}, maxDD={}%, size=${}-${}, " +
                "positions={} ({} per market), concentration={}%, kelly={}",
            String.format("%.2f", limits.dailyLossLimit()),
            String.format("%.2f", limits.weeklyLossLimit()),
            String.format("%.1f", limits.maxDrawdownPct() * 100),
            String.format("%.2f", limits.minSize()),
            String.format("%.2f", limits.maxSize()),
            limits.maxPositionsTotal(), limits.maxPositionsPerMarket(),
            String.format("%.1f", limits.maxConcentrationPct() * 100),
            limits.kellyFraction());
    }

    public Decision evaluate(Opportunity opportunity) {
        return evaluate(opportunity, opportunity.edge(), opportunity.confidence());
    }

    /**
     * Run all checks and size the trade.
     */
    public Decision evaluate(Opportunity opportunity, double proposedEdge, double confidence) {
        Objects.requireNonNull(opportunity, "opportunity");
        lock.lock();
        try {
            Decision decision = runChecks(opportunity, proposedEdge, confidence);
            if (decision.approved()) {
                logger.info("✅ {} {} approved: ${}", opportunity.side(), opportunity.marketId(),
                    String.format("%.2f", decision.size()));
            } else if (decision.reason().isHalt()) {
                logger.warn("🛑 {} blocked: {}", opportunity.marketId(), decision.detail());
            } else {
                logger.info("{} rejected: {}", opportunity.marketId(), decision.detail());
            }
            return decision;
        } finally {
            lock.unlock();
        }
    }

    private Decision runChecks(Opportunity opportunity, double edge, double confidence) {
        PortfolioState state = ledger.portfolioSummary();
        String marketId = opportunity.marketId();

        // 1. Manual halt
        if (manualHalt) {
            return Decision.reject(RejectReason.HALTED, "Trading halted: " + haltReason);
        }

        // 2. Daily loss
        LocalDate today = ledger.currentDay();
        if (dailyHaltDay != null && !dailyHaltDay.equals(today)) {
            logger.info("Daily loss halt from {} lifted by rollover", dailyHaltDay);
            dailyHaltDay = null;
        }
        if (!today.equals(dailyBaselineDay)) {
            dailyBaseline = 0.0;
            dailyBaselineDay = today;
        }
        double dayLoss = state.dailyPnl() - dailyBaseline;
        if (dailyHaltDay != null) {
            return Decision.reject(RejectReason.DAILY_LOSS,
                String.format("Daily loss limit reached on %s", dailyHaltDay));
        }
        if (dayLoss <= -limits.dailyLossLimit()) {
            dailyHaltDay = today;
            logger.error("🛑 DAILY LOSS LIMIT HIT: ${} (limit ${}) - halting until {} rollover",
                String.format("%.2f", dayLoss), String.format("%.2f", limits.dailyLossLimit()), today);
            return Decision.reject(RejectReason.DAILY_LOSS,
                String.format("Daily loss limit reached: $%.2f", -dayLoss));
        }

        // 3. Weekly loss
        long week = ledger.currentWeek();
        if (weeklyHaltWeek != -1 && weeklyHaltWeek != week) {
            logger.info("Weekly loss halt lifted by rollover");
            weeklyHaltWeek = -1;
        }
        if (weeklyBaselineWeek != week) {
            weeklyBaseline = 0.0;
            weeklyBaselineWeek = week;
        }
        double weekLoss = state.weeklyPnl() - weeklyBaseline;
        if (weeklyHaltWeek != -1) {
            return Decision.reject(RejectReason.WEEKLY_LOSS, "Weekly loss limit reached");
        }
        if (weekLoss <= -limits.weeklyLossLimit()) {
            weeklyHaltWeek = week;
            logger.error("🛑 WEEKLY LOSS LIMIT HIT: ${} (limit ${})",
                String.format("%.2f", weekLoss), String.format("%.2f", limits.weeklyLossLimit()));
            return Decision.reject(RejectReason.WEEKLY_LOSS,
                String.format("Weekly loss limit reached: $%.2f", -weekLoss));
        }

        // 4. Drawdown
        if (drawdownHalted) {
            return Decision.reject(RejectReason.DRAWDOWN, "Drawdown halt requires manual clearance");
        }
        double reference = drawdownReference(state);
        double drawdown = reference > 0 ? Math.max(0.0, (reference - state.balance()) / reference) : 0.0;
        if (drawdown >= limits.maxDrawdownPct()) {
            drawdownHalted = true;
            logger.error("CRITICAL: Max drawdown exceeded! Peak=${}, Current=${}, Drawdown={}%",
                String.format("%.2f", reference),
                String.format("%.2f", state.balance()),
                String.format("%.2f", drawdown * 100));
            return Decision.reject(RejectReason.DRAWDOWN,
                String.format("Max drawdown reached: %.2f%%", drawdown * 100));
        }

        // 5. Total positions
        if (state.openPositions() >= limits.maxPositionsTotal()) {
            return Decision.reject(RejectReason.MAX_POSITIONS,
                String.format("Max total positions reached: %d", state.openPositions()));
        }

        // 6. Positions in this market
        int inMarket = ledger.positionsInMarket(marketId);
        if (inMarket >= limits.maxPositionsPerMarket()) {
            return Decision.reject(RejectReason.PER_MARKET_LIMIT,
                String.format("Max positions per market reached for %s (%d)", marketId, inMarket));
        }

        // Sizing
        double stake = sizer.stake(opportunity, edge, confidence, state.balance());
        if (stake <= 0.0) {
            return Decision.reject(RejectReason.BELOW_MIN_SIZE, "No positive Kelly stake for this edge");
        }
        double size = Math.min(limits.maxSize(), Math.max(limits.minSize(), stake));

        // 7. Concentration after adding the candidate
        double exposure = ledger.exposure(marketId);
        double cap = limits.maxConcentrationPct() * state.balance();
        if (exposure + size > cap) {
            double headroom = cap - exposure;
            if (headroom <= 0.0) {
                return Decision.reject(RejectReason.CONCENTRATION, String.format(
                    "Market %s already at concentration cap ($%.2f of $%.2f)", marketId, exposure, cap));
            }
            logger.debug("{}: size ${} shrunk to concentration headroom ${}", marketId,
                String.format("%.2f", size), String.format("%.2f", headroom));
            size = headroom;
            if (size < limits.minSize()) {
                return Decision.reject(RejectReason.BELOW_MIN_SIZE, String.format(
                    "Concentration headroom $%.2f below minimum $%.2f", size, limits.minSize()));
            }
        }

        return Decision.approve(size);
    }

    // ==================== Manual controls ====================

    public void halt(String reason) {
        lock.lock();
        try {
            haltReason = reason == null ? "manual" : reason;
            manualHalt = true;
            logger.warn("🛑 Trading halted manually: {}", haltReason);
        } finally {
            lock.unlock();
        }
    }

    public void resume() {
        lock.lock();
        try {
            manualHalt = false;
            haltReason = null;
            logger.info("Manual halt cleared");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clear a daily halt before rollover. Losses realized so far today are forgiven;
     * a further full daily limit of losses trips the halt again.
     */
    public void clearDailyHalt() {
        lock.lock();
        try {
            dailyHaltDay = null;
            dailyBaseline = ledger.portfolioSummary().dailyPnl();
            dailyBaselineDay = ledger.currentDay();
            logger.warn("MANUAL RESET: daily loss halt cleared (baseline ${})",
                String.format("%.2f", dailyBaseline));
        } finally {
            lock.unlock();
        }
    }

    public void clearWeeklyHalt() {
        lock.lock();
        try {
            weeklyHaltWeek = -1;
            weeklyBaseline = ledger.portfolioSummary().weeklyPnl();
            weeklyBaselineWeek = ledger.currentWeek();
            logger.warn("MANUAL RESET: weekly loss halt cleared (baseline ${})",
                String.format("%.2f", weeklyBaseline));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clear the drawdown halt after manual review. Drawdown is measured from the balance
     * at clearance until the ledger sets a new all-time peak; the ledger's peak itself
     * is left untouched.
     */
    public void clearDrawdownHalt() {
        lock.lock();
        try {
            PortfolioState state = ledger.portfolioSummary();
            drawdownHalted = false;
            drawdownReference = state.balance();
            peakAtClearance = state.peakBalance();
            logger.warn("MANUAL RESET: drawdown halt cleared (baseline ${}, peak ${})",
                String.format("%.2f", drawdownReference), String.format("%.2f", peakAtClearance));
        } finally {
            lock.unlock();
        }
    }

    public RiskStatus status() {
        lock.lock();
        try {
            LocalDate today = ledger.currentDay();
            LocalDate daily = dailyHaltDay != null && dailyHaltDay.equals(today) ? dailyHaltDay : null;
            boolean weekly = weeklyHaltWeek != -1 && weeklyHaltWeek == ledger.currentWeek();
            return new RiskStatus(manualHalt, haltReason, daily, weekly, drawdownHalted);
        } finally {
            lock.unlock();
        }
    }

    /** Caller holds the lock. */
    private double drawdownReference(PortfolioState state) {
        if (Double.isNaN(drawdownReference)) {
            return state.peakBalance();
        }
        if (state.peakBalance() > peakAtClearance) {
            drawdownReference = Double.NaN;
            return state.peakBalance();
        }
        drawdownReference = Math.max(drawdownReference, state.balance());
        return drawdownReference;
    }
}
