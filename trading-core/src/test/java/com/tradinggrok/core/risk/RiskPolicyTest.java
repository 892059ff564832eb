package com.tradinggrok.core.risk;

import com.tradinggrok.core.config.TradingConfig;
import com.tradinggrok.core.error.InsufficientFunds;
import com.tradinggrok.core.error.RiskLimitExceeded;
import com.tradinggrok.core.ledger.PositionLedger;
import com.tradinggrok.core.model.AccountSnapshot;
import com.tradinggrok.core.model.IntentReason;
import com.tradinggrok.core.model.OrderHandle;
import com.tradinggrok.core.model.OrderIntent;
import com.tradinggrok.core.model.OrderSide;
import com.tradinggrok.core.model.Thresholds;
import com.tradinggrok.core.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RiskPolicy Tests")
class RiskPolicyTest {

    private RiskPolicy riskPolicy;
    private PositionLedger ledger;

    @BeforeEach
    void setUp() {
        TradingConfig config = TestFixtures.config();
        riskPolicy = new RiskPolicy(config);
        ledger = new PositionLedger(config.getWatchlist(), riskPolicy::computeThresholds, Duration.ofMinutes(30));
    }

    private void openPending(String symbol) {
        OrderIntent intent = OrderIntent.entry(symbol, 10, new BigDecimal("100.00"),
            riskPolicy.computeThresholds(new BigDecimal("100.00")));
        ledger.recordSubmission(intent, new OrderHandle("order-" + symbol, symbol, OrderSide.BUY, Instant.now()),
            TestFixtures.IN_WINDOW);
    }

    @Nested
    @DisplayName("Position Sizing")
    class PositionSizing {

        @Test
        @DisplayName("$10,000 equity at 25% and $50 price buys 50 shares")
        void testSizingScenario() {
            long quantity = riskPolicy.computeSize(TestFixtures.account("10000"), new BigDecimal("50"));

            assertThat(quantity).isEqualTo(50);
            assertThat(new BigDecimal("50").multiply(BigDecimal.valueOf(quantity)))
                .isEqualByComparingTo("2500");
        }

        @Test
        @DisplayName("Rounds down to whole shares")
        void testRoundsDown() {
            // 10000 * 0.25 / 333 = 7.5 shares
            assertThat(riskPolicy.computeSize(TestFixtures.account("10000"), new BigDecimal("333"))).isEqualTo(7);
        }

        @Test
        @DisplayName("Cost never exceeds equity x max position size")
        void testCostBoundHoldsForRandomInputs() {
            Random random = new Random(42);
            for (int i = 0; i < 2_000; i++) {
                BigDecimal equity = BigDecimal.valueOf(1_000 + random.nextInt(1_000_000), 2).movePointRight(2);
                BigDecimal price = BigDecimal.valueOf(1 + random.nextInt(200_000), 2);
                AccountSnapshot account = new AccountSnapshot(equity, equity, equity, 0, TestFixtures.IN_WINDOW);
                try {
                    long quantity = riskPolicy.computeSize(account, price);
                    assertThat(price.multiply(BigDecimal.valueOf(quantity)))
                        .isLessThanOrEqualTo(riskPolicy.maxPositionValue(account));
                } catch (InsufficientFunds expected) {
                    assertThat(price).isGreaterThan(riskPolicy.maxPositionValue(account));
                }
            }
        }

        @Test
        @DisplayName("Zero shares is InsufficientFunds")
        void testInsufficientFunds() {
            assertThatThrownBy(() -> riskPolicy.computeSize(TestFixtures.account("100"), new BigDecimal("50")))
                .isInstanceOfSatisfying(InsufficientFunds.class, e -> {
                    assertThat(e.getEquity()).isEqualByComparingTo("100");
                    assertThat(e.getPrice()).isEqualByComparingTo("50");
                });
        }

        @Test
        @DisplayName("Non-positive price or equity is InsufficientFunds")
        void testInvalidInputs() {
            assertThatThrownBy(() -> riskPolicy.computeSize(TestFixtures.account("10000"), BigDecimal.ZERO))
                .isInstanceOf(InsufficientFunds.class);
            assertThatThrownBy(() -> riskPolicy.computeSize(TestFixtures.account("-5"), new BigDecimal("10")))
                .isInstanceOf(InsufficientFunds.class);
        }
    }

    @Nested
    @DisplayName("Thresholds")
    class ThresholdTests {

        @Test
        @DisplayName("Entry $100 gives stop $95.00 and take $115.00")
        void testThresholdScenario() {
            Thresholds thresholds = riskPolicy.computeThresholds(new BigDecimal("100"));

            assertThat(thresholds.stopLoss()).isEqualTo(new BigDecimal("95.00"));
            assertThat(thresholds.takeProfit()).isEqualTo(new BigDecimal("115.00"));
        }

        @ParameterizedTest(name = "entry {0}")
        @CsvSource({"0.01", "0.02", "0.99", "1.07", "12.345", "99.99", "4321.01", "150000"})
        @DisplayName("stop < entry < take for awkward prices")
        void testOrdering(String entry) {
            BigDecimal price = new BigDecimal(entry);
            Thresholds thresholds = riskPolicy.computeThresholds(price);

            assertThat(thresholds.stopLoss()).isLessThan(price);
            assertThat(thresholds.takeProfit()).isGreaterThan(price);
        }

        @Test
        @DisplayName("stop < entry < take for random prices")
        void testOrderingRandom() {
            Random random = new Random(7);
            for (int i = 0; i < 5_000; i++) {
                BigDecimal price = BigDecimal.valueOf(1 + random.nextInt(10_000_000), 4);
                Thresholds thresholds = riskPolicy.computeThresholds(price);
                assertThat(thresholds.brackets(price)).as("price %s", price).isTrue();
            }
        }
    }

    @Nested
    @DisplayName("Position Limits")
    class PositionLimits {

        @Test
        @DisplayName("Allows a new symbol under the cap")
        void testUnderCap() {
            openPending("AAPL");

            assertThat(riskPolicy.canOpenNewPosition(ledger, "MSFT")).isTrue();
        }

        @Test
        @DisplayName("Refuses a second position in the same symbol")
        void testSameSymbol() {
            openPending("AAPL");

            assertThat(riskPolicy.canOpenNewPosition(ledger, "AAPL")).isFalse();
        }

        @Test
        @DisplayName("Refuses a fifth symbol when four are active")
        void testCapReached() {
            for (String symbol : List.of("AAPL", "MSFT", "NVDA", "AMD")) {
                openPending(symbol);
            }

            assertThat(riskPolicy.canOpenNewPosition(ledger, "TSLA")).isFalse();
        }
    }

    @Nested
    @DisplayName("Intent Validation")
    class Validation {

        @Test
        @DisplayName("Accepts a correctly sized entry")
        void testValidEntry() {
            OrderIntent intent = OrderIntent.entry("AAPL", 50, new BigDecimal("50"),
                riskPolicy.computeThresholds(new BigDecimal("50")));

            assertThatCode(() -> riskPolicy.validate(intent, TestFixtures.account("10000"), ledger))
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Rejects an entry above the position value cap")
        void testOversizedEntry() {
            OrderIntent intent = OrderIntent.entry("AAPL", 51, new BigDecimal("50"),
                riskPolicy.computeThresholds(new BigDecimal("50")));

            assertThatThrownBy(() -> riskPolicy.validate(intent, TestFixtures.account("10000"), ledger))
                .isInstanceOf(RiskLimitExceeded.class)
                .hasMessageContaining("max position value");
        }

        @Test
        @DisplayName("Rejects an entry above buying power")
        void testBuyingPower() {
            AccountSnapshot account = new AccountSnapshot(new BigDecimal("10000"), new BigDecimal("1000"),
                new BigDecimal("1000"), 0, TestFixtures.IN_WINDOW);
            OrderIntent intent = OrderIntent.entry("AAPL", 40, new BigDecimal("50"),
                riskPolicy.computeThresholds(new BigDecimal("50")));

            assertThatThrownBy(() -> riskPolicy.validate(intent, account, ledger))
                .isInstanceOf(RiskLimitExceeded.class)
                .hasMessageContaining("buying power");
        }

        @Test
        @DisplayName("Rejects an entry whose thresholds do not bracket the price")
        void testBadThresholds() {
            OrderIntent intent = OrderIntent.entry("AAPL", 10, new BigDecimal("50"),
                new Thresholds(new BigDecimal("51"), new BigDecimal("60")));

            assertThatThrownBy(() -> riskPolicy.validate(intent, TestFixtures.account("10000"), ledger))
                .isInstanceOf(RiskLimitExceeded.class);
        }

        @Test
        @DisplayName("Rejects an exit with no OPEN position")
        void testExitWithoutPosition() {
            OrderIntent intent = OrderIntent.exit("AAPL", 10, new BigDecimal("50"), IntentReason.SIGNAL);

            assertThatThrownBy(() -> riskPolicy.validate(intent, TestFixtures.account("10000"), ledger))
                .isInstanceOf(RiskLimitExceeded.class)
                .hasMessageContaining("no OPEN position");
        }
    }
}
