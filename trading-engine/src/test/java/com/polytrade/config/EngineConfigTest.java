package com.polytrade.config;

import com.polytrade.risk.RiskLimits;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EngineConfig Tests")
class EngineConfigTest {

    private static Properties props(String... keyValues) {
        Properties props = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            props.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return props;
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Absent keys take the documented defaults")
        void testDefaults() {
            EngineConfig config = EngineConfig.fromProperties(new Properties());

            assertThat(config.isPaperTrading()).isTrue();
            assertThat(config.getInitialBalance()).isEqualTo(10_000.0);
            assertThat(config.getScanIntervalSeconds()).isEqualTo(300);
            assertThat(config.getMaxOpportunitiesPerCycle()).isEqualTo(5);
            assertThat(config.getExecutorTimeoutMs()).isEqualTo(30_000);
            assertThat(config.getCircuitFailureThreshold()).isEqualTo(5);
            assertThat(config.getCircuitCooldownSeconds()).isEqualTo(300);
            assertThat(config.getSnapshotFile()).isEqualTo("metrics-snapshots.jsonl");
            assertThat(config.getSharpePeriodsPerYear()).isEqualTo(365.0);
            assertThat(config.getPnlZone()).isEqualTo(ZoneId.of("UTC"));
            assertThat(config.getStatusPort()).isZero();
            assertThat(config.riskLimits()).isEqualTo(RiskLimits.defaults());
        }

        @Test
        @DisplayName("Explicit values override defaults")
        void testOverrides() {
            EngineConfig config = EngineConfig.fromProperties(props(
                "DAILY_LOSS_LIMIT", "250",
                "MAX_POSITIONS_PER_MARKET", "2",
                "KELLY_FRACTION", " 0.5 ",
                "PNL_ZONE", "America/New_York"));

            RiskLimits limits = config.riskLimits();
            assertThat(limits.dailyLossLimit()).isEqualTo(250.0);
            assertThat(limits.maxPositionsPerMarket()).isEqualTo(2);
            assertThat(limits.kellyFraction()).isEqualTo(0.5);
            assertThat(config.getPnlZone()).isEqualTo(ZoneId.of("America/New_York"));
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Every invalid field is reported at once")
        void testAllViolations() {
            Properties props = props(
                "INITIAL_BALANCE", "lots",
                "KELLY_FRACTION", "1.5",
                "MIN_POSITION_SIZE", "50",
                "MAX_POSITION_SIZE", "20",
                "PNL_ZONE", "Mars/Olympus",
                "MAX_TOTAL_POSITIONS", "0",
                "PAPER_TRADING", "false");

            assertThatThrownBy(() -> EngineConfig.fromProperties(props))
                .isInstanceOfSatisfying(ConfigInvalidException.class, e -> assertThat(e.getViolations())
                    .hasSize(6)
                    .anyMatch(v -> v.startsWith("INITIAL_BALANCE"))
                    .anyMatch(v -> v.startsWith("KELLY_FRACTION"))
                    .anyMatch(v -> v.startsWith("MAX_POSITION_SIZE must be greater"))
                    .anyMatch(v -> v.startsWith("PNL_ZONE"))
                    .anyMatch(v -> v.startsWith("MAX_TOTAL_POSITIONS"))
                    .anyMatch(v -> v.startsWith("LIVE_API_KEY")));
        }

        @Test
        @DisplayName("A malformed value is a violation, not a silent default")
        void testMalformedNotDefaulted() {
            assertThatThrownBy(() -> EngineConfig.fromProperties(props("PAPER_TRADING", "yes")))
                .isInstanceOf(ConfigInvalidException.class)
                .hasMessageContaining("PAPER_TRADING");
        }

        @Test
        @DisplayName("Weekly limit below the daily limit is rejected")
        void testLossLimitOrder() {
            assertThatThrownBy(() -> EngineConfig.fromProperties(props(
                "DAILY_LOSS_LIMIT", "500", "WEEKLY_LOSS_LIMIT", "100")))
                .isInstanceOfSatisfying(ConfigInvalidException.class,
                    e -> assertThat(e.getViolations()).containsExactly(
                        "WEEKLY_LOSS_LIMIT must be at least DAILY_LOSS_LIMIT"));
        }

        @Test
        @DisplayName("Live mode is valid once a credential is present")
        void testLiveWithKey() {
            EngineConfig config = EngineConfig.fromProperties(props(
                "PAPER_TRADING", "false", "LIVE_API_KEY", "k-123"));

            assertThat(config.isPaperTrading()).isFalse();
            assertThat(config.getLiveApiKey()).isEqualTo("k-123");
        }
    }

    @Test
    @DisplayName("Loads from a properties file")
    void testLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("config.properties");
        Files.writeString(file, "INITIAL_BALANCE=2500\nSTATUS_PORT=8088\n");

        EngineConfig config = EngineConfig.load(file);

        assertThat(config.getInitialBalance()).isEqualTo(2500.0);
        assertThat(config.getStatusPort()).isEqualTo(8088);
    }
}
