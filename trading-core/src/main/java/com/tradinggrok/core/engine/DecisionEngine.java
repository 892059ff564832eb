package com.tradinggrok.core.engine;

import com.tradinggrok.core.config.TradingConfig;
import com.tradinggrok.core.error.InsufficientFunds;
import com.tradinggrok.core.error.RiskLimitExceeded;
import com.tradinggrok.core.ledger.PositionLedger;
import com.tradinggrok.core.model.AccountSnapshot;
import com.tradinggrok.core.model.IntentReason;
import com.tradinggrok.core.model.OrderIntent;
import com.tradinggrok.core.model.Position;
import com.tradinggrok.core.model.PositionStatus;
import com.tradinggrok.core.model.Recommendation;
import com.tradinggrok.core.model.RecommendedAction;
import com.tradinggrok.core.risk.RiskPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Turns a recommendation plus ledger and account state into at most one order intent per symbol.
 *
 * <p>Held positions are checked for exits in fixed priority: stop-loss, take-profit, then a SELL
 * recommendation. Flat symbols enter only on a fresh, confident BUY with room under the position cap.
 */
public final class DecisionEngine {
    private static final Logger logger = LoggerFactory.getLogger(DecisionEngine.class);

    private final RiskPolicy riskPolicy;
    private final double minConfidence;
    private final Duration maxRecommendationAge;

    public DecisionEngine(TradingConfig config, RiskPolicy riskPolicy) {
        this.riskPolicy = riskPolicy;
        this.minConfidence = config.getMinConfidence();
        this.maxRecommendationAge = config.getPollInterval();
    }

    /**
     * @param recommendation latest recommendation, or null when analysis was unavailable
     * @param markPrice      current price, or null when unknown
     * @param entriesAllowed false while emergency-stopped
     * @throws RiskLimitExceeded if the intent that would be emitted breaks a risk bound
     */
    public Decision evaluate(String symbol, Recommendation recommendation, BigDecimal markPrice,
                             PositionLedger ledger, AccountSnapshot account, Instant cycleTime,
                             boolean entriesAllowed) {
        Recommendation usable = usableRecommendation(symbol, recommendation, cycleTime);
        Optional<Position> held = ledger.activePosition(symbol);

        Decision decision = held.isPresent()
            ? evaluateHeld(held.get(), usable, markPrice)
            : evaluateFlat(symbol, usable, markPrice, ledger, account, entriesAllowed);

        decision.orderIntent().ifPresent(intent -> riskPolicy.validate(intent, account, ledger));
        logger.debug("{}: {}", symbol, decision);
        return decision;
    }

    private Decision evaluateHeld(Position position, Recommendation recommendation, BigDecimal markPrice) {
        String symbol = position.symbol();
        if (position.status() != PositionStatus.OPEN) {
            return new Decision.Hold(symbol, "awaiting broker confirmation (" + position.status() + ")");
        }

        if (markPrice != null) {
            if (position.isStopLossHit(markPrice)) {
                logger.warn("🛑 {} stop-loss hit: mark {} <= stop {}", symbol, markPrice, position.stopLoss());
                return exit(position, markPrice, IntentReason.STOP_LOSS);
            }
            if (position.isTakeProfitHit(markPrice)) {
                logger.info("🎯 {} take-profit hit: mark {} >= take {}", symbol, markPrice, position.takeProfit());
                return exit(position, markPrice, IntentReason.TAKE_PROFIT);
            }
        }

        if (recommendation != null && recommendation.action() == RecommendedAction.SELL
                && recommendation.confidence() >= minConfidence) {
            logger.info("{} SELL signal at confidence {}", symbol, recommendation.confidence());
            return exit(position, markPrice != null ? markPrice : position.entryPrice(), IntentReason.SIGNAL);
        }
        return new Decision.Hold(symbol, "holding, no exit trigger");
    }

    private Decision evaluateFlat(String symbol, Recommendation recommendation, BigDecimal markPrice,
                                  PositionLedger ledger, AccountSnapshot account, boolean entriesAllowed) {
        if (!entriesAllowed) {
            return new Decision.Hold(symbol, "entries suspended");
        }
        if (recommendation == null) {
            return new Decision.Hold(symbol, "no fresh recommendation");
        }
        if (recommendation.action() != RecommendedAction.BUY) {
            return new Decision.Hold(symbol, "recommendation is " + recommendation.action());
        }
        if (recommendation.confidence() < minConfidence) {
            return new Decision.Hold(symbol, String.format("confidence %.2f below minimum %.2f",
                recommendation.confidence(), minConfidence));
        }
        if (!riskPolicy.canOpenNewPosition(ledger, symbol)) {
            return new Decision.Hold(symbol, "position limit reached (" + ledger.activeCount() + ")");
        }
        if (markPrice == null) {
            return new Decision.Hold(symbol, "no price available for sizing");
        }

        long quantity;
        try {
            quantity = riskPolicy.computeSize(account, markPrice);
        } catch (InsufficientFunds e) {
            logger.info("{} skipped: price {} does not fit equity {}", symbol, e.getPrice(), e.getEquity());
            return new Decision.Hold(symbol, "insufficient funds");
        }
        OrderIntent intent = OrderIntent.entry(symbol, quantity, markPrice, riskPolicy.computeThresholds(markPrice));
        logger.info("📈 {} BUY signal at confidence {}: {} shares @ ~{} (stop {}, take {})", symbol,
            recommendation.confidence(), quantity, markPrice, intent.stopLoss(), intent.takeProfit());
        return new Decision.Enter(intent);
    }

    private Decision exit(Position position, BigDecimal referencePrice, IntentReason reason) {
        return new Decision.Exit(OrderIntent.exit(position.symbol(), position.quantity(), referencePrice, reason));
    }

    private Recommendation usableRecommendation(String symbol, Recommendation recommendation, Instant cycleTime) {
        if (recommendation == null) {
            return null;
        }
        if (!recommendation.symbol().equalsIgnoreCase(symbol)) {
            logger.warn("Discarding recommendation for {} delivered for {}", recommendation.symbol(), symbol);
            return null;
        }
        if (recommendation.timestamp().isBefore(cycleTime.minus(maxRecommendationAge))) {
            logger.info("Discarding stale recommendation for {} from {}", symbol, recommendation.timestamp());
            return null;
        }
        return recommendation;
    }
}
