package com.polytrade.risk;

import com.polytrade.ledger.PositionId;
import com.polytrade.ledger.PositionLedger;
import com.polytrade.scanner.Opportunity;
import com.polytrade.scanner.Side;
import com.polytrade.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Ordered checks, sizing and the latching behavior of the loss halts.
 */
@DisplayName("RiskGate Tests")
class RiskGateTest {

    private static final Instant START = Instant.parse("2024-03-06T10:00:00Z");

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
    }

    private PositionLedger ledger(double balance, RiskLimits limits) {
        return new PositionLedger(balance, limits, clock, ZoneOffset.UTC);
    }

    /** p = 0.6 at even odds: raw Kelly 0.2, always above max size on a 10k balance. */
    private static Opportunity strong(String marketId) {
        return new Opportunity(marketId, Side.BUY, 0.1, 0.8, 0.5, 10_000);
    }

    /** Lose exactly 200: 800 shares bought at 0.5, closed at 0.25. */
    private static void lose200(PositionLedger ledger, String marketId) {
        PositionId id = ledger.open(marketId, Side.BUY, 400, 0.5);
        ledger.close(id, 0.25);
    }

    // ========================================================================
    // SIZING
    // ========================================================================

    @Nested
    @DisplayName("Sizing")
    class Sizing {

        @Test
        @DisplayName("Kelly 180 is clipped to 100, then shrunk to the 40 of concentration headroom")
        void testClipThenShrink() {
            RiskLimits limits = new RiskLimits(500, 2000, 0.20, 10, 100, 10, 5, 0.30, 0.25);
            PositionLedger ledger = ledger(1000, limits);
            RiskGate gate = new RiskGate(ledger, limits);
            ledger.open("m1", Side.BUY, 100, 0.2);
            ledger.open("m1", Side.BUY, 100, 0.2);
            ledger.open("m1", Side.BUY, 60, 0.2);

            Opportunity opp = new Opportunity("m1", Side.BUY, 0.576, 1.0, 0.2, 5000);
            Decision decision = gate.evaluate(opp, 0.576, 1.0);

            assertThat(decision.approved()).isTrue();
            assertThat(decision.size()).isCloseTo(40.0, within(1e-9));
        }

        @Test
        @DisplayName("Without concentration pressure the size is capped at max size")
        void testMaxSize() {
            RiskLimits limits = RiskLimits.defaults();
            RiskGate gate = new RiskGate(ledger(10_000, limits), limits);

            Decision decision = gate.evaluate(strong("m1"));

            assertThat(decision.approved()).isTrue();
            assertThat(decision.size()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("A small positive stake is raised to min size")
        void testClipUpToMin() {
            RiskLimits limits = RiskLimits.defaults();
            RiskGate gate = new RiskGate(ledger(10_000, limits), limits);

            // raw Kelly 0.002 -> $5 stake
            Decision decision = gate.evaluate(new Opportunity("m1", Side.BUY, 0.001, 1.0, 0.5, 1000));

            assertThat(decision.approved()).isTrue();
            assertThat(decision.size()).isEqualTo(10.0);
        }

        @Test
        @DisplayName("No edge is rejected as below min size")
        void testNoEdge() {
            RiskLimits limits = RiskLimits.defaults();
            RiskGate gate = new RiskGate(ledger(10_000, limits), limits);

            Decision decision = gate.evaluate(new Opportunity("m1", Side.BUY, -0.1, 1.0, 0.5, 1000));

            assertThat(decision.reason()).isEqualTo(RejectReason.BELOW_MIN_SIZE);
        }

        @Test
        @DisplayName("Headroom below min size is rejected, not rounded up")
        void testHeadroomBelowMin() {
            RiskLimits limits = new RiskLimits(500, 2000, 0.20, 10, 100, 10, 5, 0.30, 0.25);
            PositionLedger ledger = ledger(1000, limits);
            RiskGate gate = new RiskGate(ledger, limits);
            ledger.open("m1", Side.BUY, 295, 0.5);

            Decision decision = gate.evaluate(strong("m1"));

            assertThat(decision.approved()).isFalse();
            assertThat(decision.reason()).isEqualTo(RejectReason.BELOW_MIN_SIZE);
        }

        @Test
        @DisplayName("A market already at its cap is a concentration rejection")
        void testNoHeadroom() {
            RiskLimits limits = new RiskLimits(500, 2000, 0.20, 10, 100, 10, 5, 0.30, 0.25);
            PositionLedger ledger = ledger(1000, limits);
            RiskGate gate = new RiskGate(ledger, limits);
            ledger.open("m1", Side.BUY, 300, 0.5);

            assertThat(gate.evaluate(strong("m1")).reason()).isEqualTo(RejectReason.CONCENTRATION);
        }

        @Test
        @DisplayName("Every approval respects size bounds and post-trade concentration")
        void testApprovalBounds() {
            RiskLimits limits = new RiskLimits(5000, 20000, 0.50, 10, 100, 50, 10, 0.05, 0.25);
            PositionLedger ledger = ledger(2000, limits);
            RiskGate gate = new RiskGate(ledger, limits);
            Random random = new Random(42);

            for (int i = 0; i < 300; i++) {
                String market = "m" + random.nextInt(5);
                double price = 0.05 + random.nextDouble() * 0.9;
                double edge = (random.nextDouble() - 0.5) * 0.3;
                double yes = price + edge;
                if (yes <= 0.0 || yes >= 1.0) {
                    continue;
                }
                Side side = Side.fromEdge(edge);
                Opportunity opp = new Opportunity(market, side, edge, random.nextDouble(), price, 1000);

                Decision decision = gate.evaluate(opp);
                if (decision.approved()) {
                    assertThat(decision.size()).isBetween(limits.minSize(), limits.maxSize());
                    double balance = ledger.portfolioSummary().balance();
                    assertThat(ledger.exposure(market) + decision.size())
                        .isLessThanOrEqualTo(limits.maxConcentrationPct() * balance + 1e-9);
                    if (ledger.positionsInMarket(market) < limits.maxPositionsPerMarket()) {
                        ledger.open(market, side, decision.size(), price);
                    }
                }
            }
        }
    }

    // ========================================================================
    // CHECK ORDER
    // ========================================================================

    @Nested
    @DisplayName("Check order")
    class CheckOrder {

        @Test
        @DisplayName("Manual halt wins over every other failing check")
        void testManualHaltFirst() {
            RiskLimits limits = new RiskLimits(500, 2000, 0.20, 10, 100, 1, 1, 0.30, 0.25);
            PositionLedger ledger = ledger(10_000, limits);
            RiskGate gate = new RiskGate(ledger, limits);
            ledger.open("m1", Side.BUY, 100, 0.5);
            gate.halt("maintenance");

            Decision decision = gate.evaluate(strong("m1"));

            assertThat(decision.reason()).isEqualTo(RejectReason.HALTED);
            assertThat(decision.detail()).contains("maintenance");

            gate.resume();
            assertThat(gate.evaluate(strong("m1")).reason()).isEqualTo(RejectReason.MAX_POSITIONS);
        }

        @Test
        @DisplayName("Total position cap is checked before the per-market cap")
        void testTotalBeforePerMarket() {
            RiskLimits limits = new RiskLimits(500, 2000, 0.20, 10, 100, 2, 1, 0.30, 0.25);
            PositionLedger ledger = ledger(10_000, limits);
            RiskGate gate = new RiskGate(ledger, limits);
            ledger.open("m1", Side.BUY, 50, 0.5);

            assertThat(gate.evaluate(strong("m1")).reason()).isEqualTo(RejectReason.PER_MARKET_LIMIT);

            ledger.open("m2", Side.BUY, 50, 0.5);
            assertThat(gate.evaluate(strong("m1")).reason()).isEqualTo(RejectReason.MAX_POSITIONS);
        }

        @Test
        @DisplayName("Weekly loss is checked after daily loss")
        void testWeeklyLoss() {
            RiskLimits limits = new RiskLimits(500, 500, 0.50, 10, 100, 10, 5, 0.30, 0.25);
            PositionLedger ledger = ledger(10_000, limits);
            RiskGate gate = new RiskGate(ledger, limits);
            lose200(ledger, "m1");
            lose200(ledger, "m1");
            clock.advance(Duration.ofDays(1));
            lose200(ledger, "m1");

            // -200 today, -600 this week
            assertThat(gate.evaluate(strong("m2")).reason()).isEqualTo(RejectReason.WEEKLY_LOSS);
            assertThat(gate.status().weeklyHalted()).isTrue();
        }
    }

    // ========================================================================
    // HALTS
    // ========================================================================

    @Nested
    @DisplayName("Loss halts")
    class LossHalts {

        private RiskLimits limits;
        private PositionLedger ledger;
        private RiskGate gate;

        @BeforeEach
        void setUp() {
            limits = RiskLimits.defaults();
            ledger = ledger(10_000, limits);
            gate = new RiskGate(ledger, limits);
        }

        @Test
        @DisplayName("Three losses of 200 trip the 500 daily limit on the next evaluation")
        void testDailyLossScenario() {
            lose200(ledger, "a");
            lose200(ledger, "b");
            assertThat(gate.evaluate(strong("x")).approved()).isTrue();

            lose200(ledger, "c");

            Decision decision = gate.evaluate(strong("x"));
            assertThat(decision.approved()).isFalse();
            assertThat(decision.reason()).isEqualTo(RejectReason.DAILY_LOSS);
        }

        @Test
        @DisplayName("Daily halt stays in force after a recovery and lifts at the next day")
        void testDailySticky() {
            lose200(ledger, "a");
            lose200(ledger, "b");
            lose200(ledger, "c");
            assertThat(gate.evaluate(strong("x")).reason()).isEqualTo(RejectReason.DAILY_LOSS);

            // +300 brings the day back to -300
            PositionId win = ledger.open("d", Side.BUY, 300, 0.5);
            ledger.close(win, 1.0);
            assertThat(gate.evaluate(strong("x")).reason()).isEqualTo(RejectReason.DAILY_LOSS);
            assertThat(gate.status().isHalted()).isTrue();

            clock.advance(Duration.ofDays(1));
            assertThat(gate.evaluate(strong("x")).approved()).isTrue();
            assertThat(gate.status().dailyHaltDay()).isNull();
        }

        @Test
        @DisplayName("Manual daily clear forgives losses so far; a further full limit trips it again")
        void testDailyManualClear() {
            lose200(ledger, "a");
            lose200(ledger, "b");
            lose200(ledger, "c");
            gate.evaluate(strong("x"));

            gate.clearDailyHalt();
            assertThat(gate.evaluate(strong("x")).approved()).isTrue();

            lose200(ledger, "d");
            lose200(ledger, "e");
            assertThat(gate.evaluate(strong("x")).approved()).isTrue();
            lose200(ledger, "f");
            assertThat(gate.evaluate(strong("x")).reason()).isEqualTo(RejectReason.DAILY_LOSS);
        }

        @Test
        @DisplayName("Drawdown halt latches until manually cleared")
        void testDrawdownLatch() {
            ledger.syncBalance(7_900);

            assertThat(gate.evaluate(strong("x")).reason()).isEqualTo(RejectReason.DRAWDOWN);

            ledger.syncBalance(10_000);
            clock.advance(Duration.ofDays(30));
            assertThat(gate.evaluate(strong("x")).reason()).isEqualTo(RejectReason.DRAWDOWN);

            gate.clearDrawdownHalt();
            assertThat(gate.evaluate(strong("x")).approved()).isTrue();
            assertThat(gate.status().drawdownHalted()).isFalse();
        }

        @Test
        @DisplayName("Clearing a drawdown halt re-baselines the gate, not the ledger peak")
        void testDrawdownClearRebaselines() {
            ledger.syncBalance(7_000);
            assertThat(gate.evaluate(strong("x")).reason()).isEqualTo(RejectReason.DRAWDOWN);

            gate.clearDrawdownHalt();

            assertThat(ledger.portfolioSummary().peakBalance()).isEqualTo(10_000.0);
            assertThat(gate.evaluate(strong("x")).approved()).isTrue();

            // 20% below the post-clearance high trips it again
            ledger.syncBalance(8_000);
            assertThat(gate.evaluate(strong("x")).approved()).isTrue();
            ledger.syncBalance(6_300);
            assertThat(gate.evaluate(strong("x")).reason()).isEqualTo(RejectReason.DRAWDOWN);
            assertThat(ledger.portfolioSummary().peakBalance()).isEqualTo(10_000.0);
        }

        @Test
        @DisplayName("A new all-time peak after clearance hands drawdown back to the ledger peak")
        void testDrawdownBaselineYieldsToNewPeak() {
            ledger.syncBalance(7_000);
            gate.evaluate(strong("x"));
            gate.clearDrawdownHalt();

            ledger.syncBalance(12_000);
            assertThat(gate.evaluate(strong("x")).approved()).isTrue();

            ledger.syncBalance(9_500);
            assertThat(gate.evaluate(strong("x")).reason()).isEqualTo(RejectReason.DRAWDOWN);
        }
    }
}
