package com.tradinggrok.core.risk;

import com.tradinggrok.core.config.TradingConfig;
import com.tradinggrok.core.error.InsufficientFunds;
import com.tradinggrok.core.error.RiskLimitExceeded;
import com.tradinggrok.core.ledger.PositionLedger;
import com.tradinggrok.core.model.AccountSnapshot;
import com.tradinggrok.core.model.OrderIntent;
import com.tradinggrok.core.model.Position;
import com.tradinggrok.core.model.PositionStatus;
import com.tradinggrok.core.model.Thresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Position sizing, stop-loss/take-profit thresholds and position-count limits.
 * All parameters come from {@link TradingConfig}; every method is a pure function of its arguments.
 */
public final class RiskPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RiskPolicy.class);
    private static final int PRICE_SCALE = 2;

    private final BigDecimal maxPositionSize;
    private final int maxPositions;
    private final BigDecimal stopLossPct;
    private final BigDecimal takeProfitPct;

    public RiskPolicy(TradingConfig config) {
        this.maxPositionSize = config.getMaxPositionSize();
        this.maxPositions = config.getMaxPositions();
        this.stopLossPct = config.getStopLossPct();
        this.takeProfitPct = config.getTakeProfitPct();

        logger.info("RiskPolicy initialized: size={} of equity, maxPositions={}, SL={}, TP={}",
            maxPositionSize, maxPositions, stopLossPct, takeProfitPct);
    }

    /**
     * Whole shares affordable with {@code equity x maxPositionSize} at {@code price}, rounded down.
     *
     * @throws InsufficientFunds if the result is zero or the inputs are not positive
     */
    public long computeSize(AccountSnapshot account, BigDecimal price) {
        BigDecimal equity = account.equity();
        if (price == null || price.signum() <= 0 || equity.signum() <= 0) {
            throw new InsufficientFunds(equity, price);
        }
        long quantity = maxPositionValue(account)
            .divide(price, 0, RoundingMode.FLOOR)
            .longValueExact();
        if (quantity <= 0) {
            throw new InsufficientFunds(equity, price);
        }
        return quantity;
    }

    /**
     * Stop rounds down and take rounds up to the cent, so stop &lt; entry &lt; take for any positive entry.
     */
    public Thresholds computeThresholds(BigDecimal entryPrice) {
        if (entryPrice == null || entryPrice.signum() <= 0) {
            throw new IllegalArgumentException("Entry price must be positive: " + entryPrice);
        }
        BigDecimal stop = entryPrice.multiply(BigDecimal.ONE.subtract(stopLossPct))
            .setScale(PRICE_SCALE, RoundingMode.FLOOR);
        BigDecimal take = entryPrice.multiply(BigDecimal.ONE.add(takeProfitPct))
            .setScale(PRICE_SCALE, RoundingMode.CEILING);
        return new Thresholds(stop, take);
    }

    /**
     * True iff the active position count is under the cap and {@code symbol} has no active position.
     */
    public boolean canOpenNewPosition(PositionLedger ledger, String symbol) {
        if (ledger.activePosition(symbol).isPresent()) {
            return false;
        }
        return ledger.activeCount() < maxPositions;
    }

    public BigDecimal maxPositionValue(AccountSnapshot account) {
        return account.equity().multiply(maxPositionSize);
    }

    /**
     * Final check before an intent reaches the broker.
     *
     * @throws RiskLimitExceeded if the intent breaks any bound
     */
    public void validate(OrderIntent intent, AccountSnapshot account, PositionLedger ledger) {
        String symbol = intent.symbol();
        if (intent.isEntry()) {
            BigDecimal cost = intent.notional();
            if (cost.compareTo(maxPositionValue(account)) > 0) {
                throw new RiskLimitExceeded(symbol, "cost " + cost + " exceeds max position value "
                    + maxPositionValue(account));
            }
            if (cost.compareTo(account.buyingPower()) > 0) {
                throw new RiskLimitExceeded(symbol, "cost " + cost + " exceeds buying power " + account.buyingPower());
            }
            if (!canOpenNewPosition(ledger, symbol)) {
                throw new RiskLimitExceeded(symbol, "position limit reached or symbol already active ("
                    + ledger.activeCount() + "/" + maxPositions + ")");
            }
            if (!intent.thresholds().brackets(intent.referencePrice())) {
                throw new RiskLimitExceeded(symbol, "thresholds " + intent.thresholds()
                    + " do not bracket reference price " + intent.referencePrice());
            }
            return;
        }

        Optional<Position> held = ledger.activePosition(symbol);
        if (held.isEmpty() || held.get().status() != PositionStatus.OPEN) {
            throw new RiskLimitExceeded(symbol, "no OPEN position to exit");
        }
        if (intent.quantity() > held.get().quantity()) {
            throw new RiskLimitExceeded(symbol, "exit quantity " + intent.quantity()
                + " exceeds held quantity " + held.get().quantity());
        }
    }

    public int getMaxPositions() {
        return maxPositions;
    }
}
