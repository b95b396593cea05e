package com.polytrade.config;

import com.polytrade.risk.RiskLimits;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Engine configuration loaded from {@code config.properties}.
 *
 * Absent keys fall back to documented defaults (and say so in the log); values that
 * are present but malformed are reported as violations. {@link #validate()} reports every
 * violation at once in a {@link ConfigInvalidException}.
 */
public final class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);
    private static final String CONFIG_FILE = "config.properties";

    private final boolean paperTrading;

    @Positive(message = "INITIAL_BALANCE must be positive")
    private final double initialBalance;

    @Min(value = 1, message = "SCAN_INTERVAL_SECONDS must be at least 1")
    private final long scanIntervalSeconds;

    @Min(value = 1, message = "MAX_OPPORTUNITIES_PER_CYCLE must be at least 1")
    private final int maxOpportunitiesPerCycle;

    @Min(value = 1, message = "EXECUTOR_TIMEOUT_MS must be at least 1")
    private final long executorTimeoutMs;

    @Min(value = 1, message = "CIRCUIT_FAILURE_THRESHOLD must be at least 1")
    private final int circuitFailureThreshold;

    @Min(value = 1, message = "CIRCUIT_COOLDOWN_SECONDS must be at least 1")
    private final long circuitCooldownSeconds;

    @NotBlank(message = "SNAPSHOT_FILE must not be blank")
    private final String snapshotFile;

    @Positive(message = "SHARPE_PERIODS_PER_YEAR must be positive")
    private final double sharpePeriodsPerYear;

    private final ZoneId pnlZone;

    @Min(value = 0, message = "STATUS_PORT must be between 0 and 65535")
    @Max(value = 65535, message = "STATUS_PORT must be between 0 and 65535")
    private final int statusPort;

    @PositiveOrZero(message = "PAPER_SLIPPAGE_BPS must not be negative")
    private final double paperSlippageBps;

    // Risk limits
    @Positive(message = "DAILY_LOSS_LIMIT must be positive")
    private final double dailyLossLimit;

    @Positive(message = "WEEKLY_LOSS_LIMIT must be positive")
    private final double weeklyLossLimit;

    @DecimalMin(value = "0", inclusive = false, message = "MAX_DRAWDOWN_PCT must be in (0, 1]")
    @DecimalMax(value = "1", message = "MAX_DRAWDOWN_PCT must be in (0, 1]")
    private final double maxDrawdownPct;

    @PositiveOrZero(message = "MIN_POSITION_SIZE must not be negative")
    private final double minPositionSize;

    @Positive(message = "MAX_POSITION_SIZE must be positive")
    private final double maxPositionSize;

    @Min(value = 1, message = "MAX_TOTAL_POSITIONS must be at least 1")
    private final int maxTotalPositions;

    @Min(value = 1, message = "MAX_POSITIONS_PER_MARKET must be at least 1")
    private final int maxPositionsPerMarket;

    @DecimalMin(value = "0", inclusive = false, message = "MAX_CONCENTRATION_PCT must be in (0, 1]")
    @DecimalMax(value = "1", message = "MAX_CONCENTRATION_PCT must be in (0, 1]")
    private final double maxConcentrationPct;

    @DecimalMin(value = "0", inclusive = false, message = "KELLY_FRACTION must be in (0, 1]")
    @DecimalMax(value = "1", message = "KELLY_FRACTION must be in (0, 1]")
    private final double kellyFraction;

    private final String liveApiKey;

    private final List<String> parseErrors = new ArrayList<>();

    private EngineConfig(Properties props) {
        this.paperTrading = booleanValue(props, "PAPER_TRADING", true);
        this.initialBalance = doubleValue(props, "INITIAL_BALANCE", 10_000.0);
        this.scanIntervalSeconds = longValue(props, "SCAN_INTERVAL_SECONDS", 300);
        this.maxOpportunitiesPerCycle = intValue(props, "MAX_OPPORTUNITIES_PER_CYCLE", 5);
        this.executorTimeoutMs = longValue(props, "EXECUTOR_TIMEOUT_MS", 30_000);
        this.circuitFailureThreshold = intValue(props, "CIRCUIT_FAILURE_THRESHOLD", 5);
        this.circuitCooldownSeconds = longValue(props, "CIRCUIT_COOLDOWN_SECONDS", 300);
        this.snapshotFile = stringValue(props, "SNAPSHOT_FILE", "metrics-snapshots.jsonl");
        this.sharpePeriodsPerYear = doubleValue(props, "SHARPE_PERIODS_PER_YEAR", 365.0);
        this.pnlZone = zoneValue(props, "PNL_ZONE", ZoneId.of("UTC"));
        this.statusPort = intValue(props, "STATUS_PORT", 0);
        this.paperSlippageBps = doubleValue(props, "PAPER_SLIPPAGE_BPS", 0.0);

        this.dailyLossLimit = doubleValue(props, "DAILY_LOSS_LIMIT", 500.0);
        this.weeklyLossLimit = doubleValue(props, "WEEKLY_LOSS_LIMIT", 2000.0);
        this.maxDrawdownPct = doubleValue(props, "MAX_DRAWDOWN_PCT", 0.20);
        this.minPositionSize = doubleValue(props, "MIN_POSITION_SIZE", 10.0);
        this.maxPositionSize = doubleValue(props, "MAX_POSITION_SIZE", 100.0);
        this.maxTotalPositions = intValue(props, "MAX_TOTAL_POSITIONS", 10);
        this.maxPositionsPerMarket = intValue(props, "MAX_POSITIONS_PER_MARKET", 1);
        this.maxConcentrationPct = doubleValue(props, "MAX_CONCENTRATION_PCT", 0.30);
        this.kellyFraction = doubleValue(props, "KELLY_FRACTION", 0.25);

        this.liveApiKey = props.getProperty("LIVE_API_KEY");
    }

    // ==================== Loading ====================

    /**
     * Load from {@code config.properties} in the working directory, falling back to the classpath.
     * {@code LIVE_API_KEY} may also come from the environment.
     */
    public static EngineConfig load() {
        return load(Path.of(CONFIG_FILE));
    }

    public static EngineConfig load(Path file) {
        Properties props = new Properties();
        if (Files.isRegularFile(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                props.load(in);
                logger.info("Loaded configuration from {}", file.toAbsolutePath());
            } catch (IOException e) {
                throw new ConfigInvalidException(List.of("Cannot read " + file + ": " + e.getMessage()));
            }
        } else {
            try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
                if (in != null) {
                    props.load(in);
                    logger.info("Loaded configuration from classpath:{}", CONFIG_FILE);
                } else {
                    logger.warn("No {} found, using defaults", CONFIG_FILE);
                }
            } catch (IOException e) {
                throw new ConfigInvalidException(List.of("Cannot read classpath:" + CONFIG_FILE + ": " + e.getMessage()));
            }
        }

        String envKey = System.getenv("LIVE_API_KEY");
        if (envKey != null) {
            props.setProperty("LIVE_API_KEY", envKey);
            logger.debug("LIVE_API_KEY taken from environment");
        }
        return fromProperties(props);
    }

    /**
     * Build and validate a configuration from the given properties.
     *
     * @throws ConfigInvalidException listing every violation
     */
    public static EngineConfig fromProperties(Properties props) {
        EngineConfig config = new EngineConfig(props);
        config.validate();
        return config;
    }

    /**
     * Validate configuration using Bean Validation, merged with the parse errors.
     */
    public void validate() {
        List<String> errors = new ArrayList<>(parseErrors);
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            Set<ConstraintViolation<EngineConfig>> violations = validator.validate(this);
            violations.stream()
                .map(ConstraintViolation::getMessage)
                .sorted()
                .forEach(errors::add);
        }
        if (!errors.isEmpty()) {
            logger.error("❌ Invalid configuration: {} violation(s)", errors.size());
            errors.forEach(e -> logger.error("   - {}", e));
            throw new ConfigInvalidException(errors);
        }
        logger.info("Configuration valid: {}", getSummary());
    }

    // ==================== Cross-field rules ====================

    @AssertTrue(message = "MAX_POSITION_SIZE must be greater than MIN_POSITION_SIZE")
    public boolean isPositionSizeRangeValid() {
        return maxPositionSize > minPositionSize;
    }

    @AssertTrue(message = "WEEKLY_LOSS_LIMIT must be at least DAILY_LOSS_LIMIT")
    public boolean isLossLimitOrderValid() {
        return weeklyLossLimit >= dailyLossLimit;
    }

    @AssertTrue(message = "LIVE_API_KEY is required when PAPER_TRADING=false")
    public boolean isLiveCredentialPresent() {
        return paperTrading || (liveApiKey != null && !liveApiKey.isBlank());
    }

    // ==================== Parsing ====================

    private String raw(Properties props, String key, Object defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            logger.info("{} not set, using default {}", key, defaultValue);
            return null;
        }
        return value.trim();
    }

    private boolean booleanValue(Properties props, String key, boolean defaultValue) {
        String value = raw(props, key, defaultValue);
        if (value == null) {
            return defaultValue;
        }
        if (value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        parseErrors.add(key + " must be true or false, got '" + value + "'");
        return defaultValue;
    }

    private double doubleValue(Properties props, String key, double defaultValue) {
        String value = raw(props, key, defaultValue);
        if (value == null) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(value);
            if (!Double.isFinite(parsed)) {
                parseErrors.add(key + " must be a finite number, got '" + value + "'");
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            parseErrors.add(key + " must be a number, got '" + value + "'");
            return defaultValue;
        }
    }

    private int intValue(Properties props, String key, int defaultValue) {
        String value = raw(props, key, defaultValue);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            parseErrors.add(key + " must be an integer, got '" + value + "'");
            return defaultValue;
        }
    }

    private long longValue(Properties props, String key, long defaultValue) {
        String value = raw(props, key, defaultValue);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            parseErrors.add(key + " must be an integer, got '" + value + "'");
            return defaultValue;
        }
    }

    private String stringValue(Properties props, String key, String defaultValue) {
        String value = raw(props, key, defaultValue);
        return value == null ? defaultValue : value;
    }

    private ZoneId zoneValue(Properties props, String key, ZoneId defaultValue) {
        String value = raw(props, key, defaultValue);
        if (value == null) {
            return defaultValue;
        }
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            parseErrors.add(key + " is not a valid time zone: '" + value + "'");
            return defaultValue;
        }
    }

    // ==================== Accessors ====================

    public RiskLimits riskLimits() {
        return new RiskLimits(dailyLossLimit, weeklyLossLimit, maxDrawdownPct,
            minPositionSize, maxPositionSize, maxTotalPositions, maxPositionsPerMarket,
            maxConcentrationPct, kellyFraction);
    }

    public boolean isPaperTrading() {
        return paperTrading;
    }

    public double getInitialBalance() {
        return initialBalance;
    }

    public long getScanIntervalSeconds() {
        return scanIntervalSeconds;
    }

    public int getMaxOpportunitiesPerCycle() {
        return maxOpportunitiesPerCycle;
    }

    public long getExecutorTimeoutMs() {
        return executorTimeoutMs;
    }

    public int getCircuitFailureThreshold() {
        return circuitFailureThreshold;
    }

    public long getCircuitCooldownSeconds() {
        return circuitCooldownSeconds;
    }

    public String getSnapshotFile() {
        return snapshotFile;
    }

    public double getSharpePeriodsPerYear() {
        return sharpePeriodsPerYear;
    }

    public ZoneId getPnlZone() {
        return pnlZone;
    }

    public int getStatusPort() {
        return statusPort;
    }

    public double getPaperSlippageBps() {
        return paperSlippageBps;
    }

    public String getLiveApiKey() {
        return liveApiKey;
    }

    public String getSummary() {
        return String.format(
            "mode=%s balance=$%.2f interval=%ds top=%d timeout=%dms breaker=%d/%ds zone=%s port=%d",
            paperTrading ? "PAPER" : "LIVE", initialBalance, scanIntervalSeconds, maxOpportunitiesPerCycle,
            executorTimeoutMs, circuitFailureThreshold, circuitCooldownSeconds, pnlZone, statusPort);
    }
}
