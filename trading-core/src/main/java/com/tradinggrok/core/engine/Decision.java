package com.tradinggrok.core.engine;

import com.tradinggrok.core.model.OrderIntent;

import java.util.Optional;

/**
 * Outcome of evaluating one symbol in one cycle: at most one order intent.
 */
public sealed interface Decision permits Decision.Hold, Decision.Enter, Decision.Exit {

    record Hold(String symbol, String reason) implements Decision {}

    record Enter(OrderIntent intent) implements Decision {}

    record Exit(OrderIntent intent) implements Decision {}

    default Optional<OrderIntent> orderIntent() {
        if (this instanceof Enter enter) {
            return Optional.of(enter.intent());
        }
        if (this instanceof Exit exit) {
            return Optional.of(exit.intent());
        }
        return Optional.empty();
    }

    default String toAction() {
        if (this instanceof Enter) {
            return "ENTER";
        }
        if (this instanceof Exit) {
            return "EXIT";
        }
        return "HOLD";
    }
}
