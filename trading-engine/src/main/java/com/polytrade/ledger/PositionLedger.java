package com.polytrade.ledger;

import com.polytrade.risk.RiskLimits;
import com.polytrade.scanner.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.StampedLock;

/**
 * Owns open positions and the realized P&L aggregates.
 *
 * Thread-Safety: every mutation takes the write lock, so there is never more than one writer.
 * Reads used by the reporting path take the read lock and return copies, so a reader never
 * observes a half-applied close.
 *
 * Daily and weekly P&L roll over at the calendar boundary of the configured zone
 * (local date, ISO week).
 */
public final class PositionLedger {
    private static final Logger logger = LoggerFactory.getLogger(PositionLedger.class);

    private final RiskLimits limits;
    private final Clock clock;
    private final ZoneId zone;
    private final StampedLock lock = new StampedLock();
    private final AtomicLong idSequence = new AtomicLong();

    private final Map<PositionId, Position> openPositions = new LinkedHashMap<>();
    private final List<Trade> trades = new ArrayList<>();

    private double balance;
    private double peakBalance;
    private double realizedPnlTotal;
    private double dailyPnl;
    private double weeklyPnl;
    private int consecutiveLosses;
    private LocalDate dayKey;
    private long weekKey;

    public PositionLedger(double initialBalance, RiskLimits limits, Clock clock, ZoneId zone) {
        if (!Double.isFinite(initialBalance) || initialBalance <= 0.0) {
            throw new IllegalArgumentException("initialBalance must be positive: " + initialBalance);
        }
        this.limits = Objects.requireNonNull(limits, "limits");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.balance = initialBalance;
        this.peakBalance = initialBalance;

        Instant now = clock.instant();
        this.dayKey = dayOf(now);
        this.weekKey = weekOf(now);

        logger.info("PositionLedger initialized: balance=${}, P&L zone={}",
            String.format("%.2f", initialBalance), zone);
    }

    // ==================== Mutations ====================

    public PositionId open(String marketId, Side side, double size, double price) {
        return open(marketId, marketId, side, size, price);
    }

    /**
     * Record a filled entry. Re-checks the position caps the RiskGate already evaluated.
     *
     * @throws LimitExceededException if the total or per-market cap is already reached
     */
    public PositionId open(String marketId, String marketTitle, Side side, double size, double price) {
        Objects.requireNonNull(marketId, "marketId");
        Objects.requireNonNull(side, "side");
        if (!Double.isFinite(size) || size <= 0.0) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        if (!Double.isFinite(price) || price <= 0.0 || price >= 1.0) {
            throw new IllegalArgumentException("price must be within (0, 1): " + price);
        }

        long stamp = lock.writeLock();
        try {
            rollPeriods(clock.instant());

            if (openPositions.size() >= limits.maxPositionsTotal()) {
                throw new LimitExceededException(String.format(
                    "Total position cap reached (%d/%d)", openPositions.size(), limits.maxPositionsTotal()));
            }
            int inMarket = countInMarket(marketId);
            if (inMarket >= limits.maxPositionsPerMarket()) {
                throw new LimitExceededException(String.format(
                    "Per-market cap reached for %s (%d/%d)", marketId, inMarket, limits.maxPositionsPerMarket()));
            }

            PositionId id = new PositionId(idSequence.incrementAndGet());
            Position position = new Position(id, marketId, marketTitle == null ? marketId : marketTitle,
                side, size, price, clock.instant(), PositionStatus.OPEN);
            openPositions.put(id, position);

            logger.atInfo()
                .addKeyValue("position", id)
                .addKeyValue("market", marketId)
                .addKeyValue("side", side)
                .addKeyValue("size", size)
                .addKeyValue("price", price)
                .log("Position opened");
            return id;
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Close an open position at the given YES price and realize its P&L.
     *
     * @throws UnknownPositionException if the id is not an open position
     */
    public Trade close(PositionId id, double exitPrice) {
        Objects.requireNonNull(id, "id");
        if (!Double.isFinite(exitPrice) || exitPrice < 0.0 || exitPrice > 1.0) {
            throw new IllegalArgumentException("exitPrice must be within [0, 1]: " + exitPrice);
        }

        long stamp = lock.writeLock();
        try {
            Instant now = clock.instant();
            rollPeriods(now);

            Position position = openPositions.remove(id);
            if (position == null) {
                throw new UnknownPositionException(id);
            }

            double pnl = position.pnlAt(exitPrice);
            balance += pnl;
            if (balance > peakBalance) {
                peakBalance = balance;
            }
            realizedPnlTotal += pnl;
            dailyPnl += pnl;
            weeklyPnl += pnl;

            TradeOutcome outcome = TradeOutcome.of(pnl);
            if (outcome == TradeOutcome.LOSS) {
                consecutiveLosses++;
            } else {
                consecutiveLosses = 0;
            }

            Position closed = position.closed();
            Trade trade = new Trade(id, closed.marketId(), closed.marketTitle(), closed.side(),
                closed.size(), closed.entryPrice(), exitPrice, pnl, now, outcome);
            trades.add(trade);

            logger.atInfo()
                .addKeyValue("position", id)
                .addKeyValue("market", closed.marketId())
                .addKeyValue("pnl", String.format("%.2f", pnl))
                .addKeyValue("balance", String.format("%.2f", balance))
                .log("Position closed: {}", outcome);
            return trade;
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * External balance sync (e.g. on-chain bankroll). Raises the peak if the new balance exceeds it.
     */
    public void syncBalance(double newBalance) {
        if (!Double.isFinite(newBalance) || newBalance < 0.0) {
            throw new IllegalArgumentException("balance must be non-negative: " + newBalance);
        }
        long stamp = lock.writeLock();
        try {
            double previous = balance;
            balance = newBalance;
            if (balance > peakBalance) {
                peakBalance = balance;
            }
            logger.info("Balance synced: ${} -> ${} (peak ${})",
                String.format("%.2f", previous), String.format("%.2f", balance),
                String.format("%.2f", peakBalance));
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    // ==================== Reads ====================

    /**
     * Sum of open sizes in a market.
     */
    public double exposure(String marketId) {
        long stamp = lock.readLock();
        try {
            double total = 0.0;
            for (Position p : openPositions.values()) {
                if (p.marketId().equals(marketId)) {
                    total += p.size();
                }
            }
            return total;
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public int positionsInMarket(String marketId) {
        long stamp = lock.readLock();
        try {
            return countInMarket(marketId);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public int openPositionCount() {
        long stamp = lock.readLock();
        try {
            return openPositions.size();
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public List<Position> openPositions() {
        long stamp = lock.readLock();
        try {
            return List.copyOf(openPositions.values());
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public List<Trade> trades() {
        long stamp = lock.readLock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(trades));
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /**
     * Consistent copy of the portfolio aggregates. Daily/weekly P&L read as zero once the
     * period has rolled over, even if no mutation has happened since.
     */
    public PortfolioState portfolioSummary() {
        long stamp = lock.readLock();
        try {
            Instant now = clock.instant();
            double day = dayOf(now).equals(dayKey) ? dailyPnl : 0.0;
            double week = weekOf(now) == weekKey ? weeklyPnl : 0.0;
            return new PortfolioState(balance, peakBalance, realizedPnlTotal, day, week,
                openPositions.size(), trades.size(), consecutiveLosses);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public LocalDate currentDay() {
        return dayOf(clock.instant());
    }

    public long currentWeek() {
        return weekOf(clock.instant());
    }

    // ==================== Internals ====================

    private int countInMarket(String marketId) {
        int count = 0;
        for (Position p : openPositions.values()) {
            if (p.marketId().equals(marketId)) {
                count++;
            }
        }
        return count;
    }

    /** Caller must hold the write lock. */
    private void rollPeriods(Instant now) {
        LocalDate day = dayOf(now);
        if (!day.equals(dayKey)) {
            logger.info("Daily P&L rollover {} -> {} (closing day P&L ${})",
                dayKey, day, String.format("%.2f", dailyPnl));
            dayKey = day;
            dailyPnl = 0.0;
        }
        long week = weekOf(now);
        if (week != weekKey) {
            logger.info("Weekly P&L rollover (closing week P&L ${})", String.format("%.2f", weeklyPnl));
            weekKey = week;
            weeklyPnl = 0.0;
        }
    }

    private LocalDate dayOf(Instant instant) {
        return instant.atZone(zone).toLocalDate();
    }

    /** Week-based-year * 100 + ISO week number. */
    private long weekOf(Instant instant) {
        LocalDate date = dayOf(instant);
        return date.get(IsoFields.WEEK_BASED_YEAR) * 100L + date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }
}
