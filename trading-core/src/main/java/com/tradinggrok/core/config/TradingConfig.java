package com.tradinggrok.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only trading configuration loaded once at start from config.properties.
 * Invalid numbers fall back to their defaults with a warning; out-of-range risk fractions are fatal.
 */
public final class TradingConfig {
    private static final Logger logger = LoggerFactory.getLogger(TradingConfig.class);
    private static final String CONFIG_FILE = "config.properties";

    static final String DEFAULT_WATCHLIST = "AAPL,GOOGL,MSFT,NVDA,AMD,TSLA,META";

    private final Properties properties;

    // Risk
    private final BigDecimal maxPositionSize;
    private final int maxPositions;
    private final BigDecimal stopLossPct;
    private final BigDecimal takeProfitPct;
    private final double minConfidence;

    // Session
    private final LocalTime tradingStart;
    private final LocalTime tradingEnd;
    private final String marketTimezone;
    private final int bufferMinutes;
    private final int pollIntervalMinutes;
    private final Set<LocalDate> marketHolidays;

    // Runtime
    private final boolean paperTrading;
    private final List<String> watchlist;
    private final Duration analysisTimeout;
    private final Duration executionTimeout;
    private final int maxConsecutiveExecutionFailures;
    private final Duration pendingOrderTimeout;
    private final Path stateFile;

    private TradingConfig(Properties props) {
        this.properties = props;

        this.maxPositionSize = parseFraction("MAX_POSITION_SIZE", "0.40");
        this.maxPositions = (int) parseLong("MAX_POSITIONS", 4);
        this.stopLossPct = parseFraction("STOP_LOSS_PCT", "0.05");
        this.takeProfitPct = parseFraction("TAKE_PROFIT_PCT", "0.15");
        this.minConfidence = parseDouble("MIN_CONFIDENCE", 0.60);

        this.tradingStart = parseTime("TRADING_START", LocalTime.of(9, 30));
        this.tradingEnd = parseTime("TRADING_END", LocalTime.of(16, 0));
        this.marketTimezone = properties.getProperty("MARKET_TIMEZONE", "America/New_York").trim();
        this.bufferMinutes = (int) parseLong("BUFFER_MINUTES", 10);
        this.pollIntervalMinutes = (int) parseLong("POLL_INTERVAL_MINUTES", 10);
        this.marketHolidays = parseHolidays(properties.getProperty("MARKET_HOLIDAYS", ""));

        this.paperTrading = parseBoolean("PAPER_TRADING", true);
        this.watchlist = parseWatchlist(properties.getProperty("WATCHLIST", DEFAULT_WATCHLIST));
        this.analysisTimeout = Duration.ofSeconds(parseLong("ANALYSIS_TIMEOUT_SECONDS", 30));
        this.executionTimeout = Duration.ofSeconds(parseLong("EXECUTION_TIMEOUT_SECONDS", 10));
        this.maxConsecutiveExecutionFailures = (int) parseLong("MAX_CONSECUTIVE_EXECUTION_FAILURES", 3);
        this.pendingOrderTimeout = Duration.ofMinutes(parseLong("PENDING_ORDER_TIMEOUT_MINUTES", 30));
        this.stateFile = Path.of(properties.getProperty("STATE_FILE", "trading-state.json").trim());

        validate();

        logger.info("📊 Trading Configuration Loaded:");
        logger.info("   Max position size: {} of equity, max positions: {}", maxPositionSize, maxPositions);
        logger.info("   Stop-loss: {}, take-profit: {}, min confidence: {}", stopLossPct, takeProfitPct, minConfidence);
        logger.info("   Window: {}-{} {} (buffer {}m), poll every {}m", tradingStart, tradingEnd, marketTimezone,
            bufferMinutes, pollIntervalMinutes);
        logger.info("   Mode: {}, watchlist: {}", paperTrading ? "PAPER" : "LIVE", watchlist);
    }

    /**
     * Load configuration from config.properties: working directory first, then classpath.
     */
    public static TradingConfig load() {
        Properties props = new Properties();

        Path configPath = Path.of(CONFIG_FILE);
        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new TradingConfig(props);
            } catch (IOException e) {
                logger.warn("Failed to load {} from filesystem: {}", CONFIG_FILE, e.getMessage());
            }
        }

        try (InputStream is = TradingConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
                return new TradingConfig(props);
            }
        } catch (IOException e) {
            logger.warn("Failed to load {} from classpath: {}", CONFIG_FILE, e.getMessage());
        }

        logger.warn("No {} found, using defaults", CONFIG_FILE);
        return new TradingConfig(props);
    }

    /**
     * Create an instance from explicit properties. Missing keys take their defaults.
     */
    public static TradingConfig forTest(Properties testProps) {
        return new TradingConfig(testProps);
    }

    /**
     * A copy with the trading mode decided elsewhere, so status and logs report the mode the
     * broker connection actually uses.
     */
    public TradingConfig withPaperTrading(boolean paper) {
        if (paper == paperTrading) {
            return this;
        }
        Properties overridden = new Properties();
        overridden.putAll(properties);
        overridden.setProperty("PAPER_TRADING", Boolean.toString(paper));
        logger.warn("Trading mode overridden to {}", paper ? "PAPER" : "LIVE");
        return new TradingConfig(overridden);
    }

    private void validate() {
        if (maxPositionSize.signum() <= 0 || maxPositionSize.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalStateException("MAX_POSITION_SIZE must be in (0, 1]: " + maxPositionSize);
        }
        if (stopLossPct.signum() <= 0 || stopLossPct.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalStateException("STOP_LOSS_PCT must be in (0, 1): " + stopLossPct);
        }
        if (takeProfitPct.signum() <= 0 || takeProfitPct.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalStateException("TAKE_PROFIT_PCT must be in (0, 1]: " + takeProfitPct);
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalStateException("MIN_CONFIDENCE must be in [0, 1]: " + minConfidence);
        }
        if (maxPositions < 1) {
            throw new IllegalStateException("MAX_POSITIONS must be at least 1: " + maxPositions);
        }
        if (maxConsecutiveExecutionFailures < 1) {
            throw new IllegalStateException("MAX_CONSECUTIVE_EXECUTION_FAILURES must be at least 1");
        }
        if (watchlist.isEmpty()) {
            throw new IllegalStateException("WATCHLIST must name at least one symbol");
        }
    }

    private BigDecimal parseFraction(String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return new BigDecimal(defaultValue);
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return new BigDecimal(defaultValue);
        }
    }

    private double parseDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long parseLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean parseBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    private LocalTime parseTime(String key, LocalTime defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static Set<LocalDate> parseHolidays(String raw) {
        Set<LocalDate> holidays = new LinkedHashSet<>();
        for (String token : raw.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                holidays.add(LocalDate.parse(trimmed));
            } catch (DateTimeParseException e) {
                logger.warn("Ignoring invalid MARKET_HOLIDAYS entry '{}'", trimmed);
            }
        }
        return Set.copyOf(holidays);
    }

    private static List<String> parseWatchlist(String raw) {
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(s -> s.toUpperCase(Locale.ROOT))
            .distinct()
            .collect(Collectors.toUnmodifiableList());
    }

    // ========== Getters ==========

    public BigDecimal getMaxPositionSize() {
        return maxPositionSize;
    }

    public int getMaxPositions() {
        return maxPositions;
    }

    public BigDecimal getStopLossPct() {
        return stopLossPct;
    }

    public BigDecimal getTakeProfitPct() {
        return takeProfitPct;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public LocalTime getTradingStart() {
        return tradingStart;
    }

    public LocalTime getTradingEnd() {
        return tradingEnd;
    }

    public String getMarketTimezone() {
        return marketTimezone;
    }

    public int getBufferMinutes() {
        return bufferMinutes;
    }

    public Duration getPollInterval() {
        return Duration.ofMinutes(pollIntervalMinutes);
    }

    public Set<LocalDate> getMarketHolidays() {
        return marketHolidays;
    }

    public boolean isPaperTrading() {
        return paperTrading;
    }

    public List<String> getWatchlist() {
        return watchlist;
    }

    public Duration getAnalysisTimeout() {
        return analysisTimeout;
    }

    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public int getMaxConsecutiveExecutionFailures() {
        return maxConsecutiveExecutionFailures;
    }

    public Duration getPendingOrderTimeout() {
        return pendingOrderTimeout;
    }

    public Path getStateFile() {
        return stateFile;
    }
}
