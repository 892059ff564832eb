package com.tradinggrok.core.engine;

import com.tradinggrok.core.config.TradingConfig;
import com.tradinggrok.core.ledger.PositionLedger;
import com.tradinggrok.core.model.AccountSnapshot;
import com.tradinggrok.core.model.Fill;
import com.tradinggrok.core.model.IntentReason;
import com.tradinggrok.core.model.OrderHandle;
import com.tradinggrok.core.model.OrderIntent;
import com.tradinggrok.core.model.OrderSide;
import com.tradinggrok.core.model.Recommendation;
import com.tradinggrok.core.model.RecommendedAction;
import com.tradinggrok.core.risk.RiskPolicy;
import com.tradinggrok.core.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DecisionEngine Tests")
class DecisionEngineTest {

    private static final Instant NOW = TestFixtures.IN_WINDOW;
    private static final AccountSnapshot ACCOUNT = TestFixtures.account("10000");

    private RiskPolicy riskPolicy;
    private PositionLedger ledger;
    private DecisionEngine engine;

    @BeforeEach
    void setUp() {
        TradingConfig config = TestFixtures.config();
        riskPolicy = new RiskPolicy(config);
        ledger = new PositionLedger(config.getWatchlist(), riskPolicy::computeThresholds, Duration.ofMinutes(30));
        engine = new DecisionEngine(config, riskPolicy);
    }

    private void holdOpen(String symbol, String entry) {
        BigDecimal price = new BigDecimal(entry);
        ledger.recordSubmission(OrderIntent.entry(symbol, 10, price, riskPolicy.computeThresholds(price)),
            new OrderHandle("buy-" + symbol, symbol, OrderSide.BUY, NOW), NOW);
        ledger.recordEntry(new Fill(symbol, OrderSide.BUY, 10, price, NOW, "buy-" + symbol));
    }

    private Recommendation rec(String symbol, RecommendedAction action, double confidence) {
        return TestFixtures.recommendation(symbol, action, confidence, NOW.minusSeconds(30));
    }

    private Decision evaluate(String symbol, Recommendation recommendation, String mark) {
        return engine.evaluate(symbol, recommendation, mark == null ? null : new BigDecimal(mark), ledger, ACCOUNT,
            NOW, true);
    }

    // ==================== Exit Tests ====================

    @Nested
    @DisplayName("Held Positions")
    class HeldPositions {

        @Test
        @DisplayName("Mark 94.99 under stop 95.00 exits on stop_loss even with a BUY signal")
        void testStopLossFirst() {
            holdOpen("AAPL", "100.00");

            Decision decision = evaluate("AAPL", rec("AAPL", RecommendedAction.BUY, 0.95), "94.99");

            assertThat(decision).isInstanceOf(Decision.Exit.class);
            OrderIntent intent = decision.orderIntent().orElseThrow();
            assertThat(intent.reason()).isEqualTo(IntentReason.STOP_LOSS);
            assertThat(intent.side()).isEqualTo(OrderSide.SELL);
            assertThat(intent.quantity()).isEqualTo(10);
        }

        @Test
        @DisplayName("Stop-loss wins over a confident SELL")
        void testStopLossBeatsSignal() {
            holdOpen("AAPL", "100.00");

            Decision decision = evaluate("AAPL", rec("AAPL", RecommendedAction.SELL, 0.99), "95.00");

            assertThat(decision.orderIntent().orElseThrow().reason()).isEqualTo(IntentReason.STOP_LOSS);
        }

        @Test
        @DisplayName("Take-profit at the threshold")
        void testTakeProfit() {
            holdOpen("AAPL", "100.00");

            Decision decision = evaluate("AAPL", null, "115.00");

            assertThat(decision.orderIntent().orElseThrow().reason()).isEqualTo(IntentReason.TAKE_PROFIT);
        }

        @Test
        @DisplayName("Confident SELL exits on signal")
        void testSignalExit() {
            holdOpen("AAPL", "100.00");

            Decision decision = evaluate("AAPL", rec("AAPL", RecommendedAction.SELL, 0.7), "101.00");

            assertThat(decision.orderIntent().orElseThrow().reason()).isEqualTo(IntentReason.SIGNAL);
            assertThat(decision.toAction()).isEqualTo("EXIT");
        }

        @Test
        @DisplayName("Weak SELL holds")
        void testWeakSell() {
            holdOpen("AAPL", "100.00");

            Decision decision = evaluate("AAPL", rec("AAPL", RecommendedAction.SELL, 0.5), "101.00");

            assertThat(decision).isInstanceOf(Decision.Hold.class);
        }

        @Test
        @DisplayName("Pending entry is never exited")
        void testPendingEntryHolds() {
            BigDecimal price = new BigDecimal("100.00");
            ledger.recordSubmission(OrderIntent.entry("AAPL", 10, price, riskPolicy.computeThresholds(price)),
                new OrderHandle("buy-1", "AAPL", OrderSide.BUY, NOW), NOW);

            Decision decision = evaluate("AAPL", rec("AAPL", RecommendedAction.SELL, 0.99), "90.00");

            assertThat(decision).isInstanceOf(Decision.Hold.class);
        }

        @Test
        @DisplayName("Exits are still evaluated while entries are suspended")
        void testExitWhileSuspended() {
            holdOpen("AAPL", "100.00");

            Decision decision = engine.evaluate("AAPL", null, new BigDecimal("90.00"), ledger, ACCOUNT, NOW, false);

            assertThat(decision).isInstanceOf(Decision.Exit.class);
        }
    }

    // ==================== Entry Tests ====================

    @Nested
    @DisplayName("Flat Symbols")
    class FlatSymbols {

        @Test
        @DisplayName("Confident BUY sizes the entry from equity")
        void testEntry() {
            Decision decision = evaluate("MSFT", rec("MSFT", RecommendedAction.BUY, 0.8), "50.00");

            assertThat(decision).isInstanceOf(Decision.Enter.class);
            OrderIntent intent = decision.orderIntent().orElseThrow();
            assertThat(intent.quantity()).isEqualTo(50);
            assertThat(intent.stopLoss()).isEqualByComparingTo("47.50");
            assertThat(intent.takeProfit()).isEqualByComparingTo("57.50");
            assertThat(decision.toAction()).isEqualTo("ENTER");
        }

        @Test
        @DisplayName("Four open positions block a fifth BUY at 0.9")
        void testPositionCap() {
            for (String symbol : List.of("AAPL", "MSFT", "NVDA", "AMD")) {
                holdOpen(symbol, "100.00");
            }

            Decision decision = evaluate("TSLA", rec("TSLA", RecommendedAction.BUY, 0.9), "200.00");

            assertThat(decision).isInstanceOf(Decision.Hold.class);
            assertThat(((Decision.Hold) decision).reason()).contains("position limit");
        }

        @Test
        @DisplayName("Stale recommendation is discarded")
        void testStaleRecommendation() {
            Recommendation stale = TestFixtures.recommendation("MSFT", RecommendedAction.BUY, 0.9,
                NOW.minus(Duration.ofMinutes(11)));

            Decision decision = evaluate("MSFT", stale, "50.00");

            assertThat(decision).isEqualTo(new Decision.Hold("MSFT", "no fresh recommendation"));
        }

        @Test
        @DisplayName("Recommendation for another symbol is discarded")
        void testWrongSymbol() {
            Decision decision = evaluate("MSFT", rec("AAPL", RecommendedAction.BUY, 0.9), "50.00");

            assertThat(decision).isEqualTo(new Decision.Hold("MSFT", "no fresh recommendation"));
        }

        @Test
        @DisplayName("Confidence below the minimum holds")
        void testLowConfidence() {
            Decision decision = evaluate("MSFT", rec("MSFT", RecommendedAction.BUY, 0.59), "50.00");

            assertThat(decision).isInstanceOf(Decision.Hold.class);
        }

        @Test
        @DisplayName("Entries suspended holds")
        void testSuspended() {
            Decision decision = engine.evaluate("MSFT", rec("MSFT", RecommendedAction.BUY, 0.9),
                new BigDecimal("50.00"), ledger, ACCOUNT, NOW, false);

            assertThat(decision).isEqualTo(new Decision.Hold("MSFT", "entries suspended"));
        }

        @Test
        @DisplayName("Price above the position budget holds on insufficient funds")
        void testInsufficientFunds() {
            Decision decision = evaluate("NVDA", rec("NVDA", RecommendedAction.BUY, 0.9), "2600.00");

            assertThat(decision).isEqualTo(new Decision.Hold("NVDA", "insufficient funds"));
        }

        @Test
        @DisplayName("No price holds")
        void testNoPrice() {
            Decision decision = evaluate("MSFT", rec("MSFT", RecommendedAction.BUY, 0.9), null);

            assertThat(decision).isEqualTo(new Decision.Hold("MSFT", "no price available for sizing"));
        }
    }
}
