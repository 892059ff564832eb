package com.tradinggrok.core.support;

import com.tradinggrok.core.config.TradingConfig;
import com.tradinggrok.core.model.AccountSnapshot;
import com.tradinggrok.core.model.BrokerPosition;
import com.tradinggrok.core.model.Recommendation;
import com.tradinggrok.core.model.RecommendedAction;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Properties;

/**
 * Shared builders for core tests.
 */
public final class TestFixtures {

    /** Tuesday 2024-03-12 11:00 America/New_York, inside the default window. */
    public static final Instant IN_WINDOW = Instant.parse("2024-03-12T15:00:00Z");

    /** Saturday 2024-03-16 noon New York. */
    public static final Instant WEEKEND = Instant.parse("2024-03-16T16:00:00Z");

    private TestFixtures() {
    }

    public static Properties baseProperties() {
        Properties props = new Properties();
        props.setProperty("MAX_POSITION_SIZE", "0.25");
        props.setProperty("MAX_POSITIONS", "4");
        props.setProperty("STOP_LOSS_PCT", "0.05");
        props.setProperty("TAKE_PROFIT_PCT", "0.15");
        props.setProperty("MIN_CONFIDENCE", "0.6");
        props.setProperty("WATCHLIST", "AAPL,MSFT,NVDA");
        props.setProperty("POLL_INTERVAL_MINUTES", "10");
        props.setProperty("BUFFER_MINUTES", "10");
        props.setProperty("ANALYSIS_TIMEOUT_SECONDS", "1");
        props.setProperty("EXECUTION_TIMEOUT_SECONDS", "1");
        props.setProperty("MAX_CONSECUTIVE_EXECUTION_FAILURES", "3");
        return props;
    }

    public static TradingConfig config() {
        return TradingConfig.forTest(baseProperties());
    }

    public static TradingConfig config(Properties props) {
        return TradingConfig.forTest(props);
    }

    public static AccountSnapshot account(String equity) {
        BigDecimal value = new BigDecimal(equity);
        return new AccountSnapshot(value, value, value, 0, IN_WINDOW);
    }

    public static Recommendation recommendation(String symbol, RecommendedAction action, double confidence,
                                                Instant at) {
        return new Recommendation(symbol, action, confidence, null, null, "test", at);
    }

    public static BrokerPosition brokerPosition(String symbol, long quantity, String avgEntry, String current) {
        return new BrokerPosition(symbol, quantity, new BigDecimal(avgEntry), new BigDecimal(current));
    }
}
