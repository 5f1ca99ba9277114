package org.carma.merchant.model;

import java.util.Objects;

/**
 * Realized result of an executed decision, reported back by the execution layer.
 */
public record Outcome(
        Decision decision,
        double profit,
        boolean success,
        String marketState,
        long timestamp
) {

    public Outcome {
        Objects.requireNonNull(decision, "Decision cannot be null");
        marketState = marketState != null ? marketState : "";
    }

    public static Outcome of(Decision decision, double profit, boolean success, String marketState) {
        return new Outcome(decision, profit, success, marketState, System.currentTimeMillis());
    }

    public String itemId() {
        return decision.itemId();
    }

    public DecisionType decisionType() {
        return decision.type();
    }
}
