package org.carma.merchant.mechanism;

import org.carma.merchant.model.Decision;
import org.carma.merchant.strategy.StrategyKind;

import java.util.Objects;

/**
 * A decision together with the kind of strategy that produced it.
 */
public record StrategyDecision(StrategyKind strategy, Decision decision) {

    public StrategyDecision {
        Objects.requireNonNull(strategy, "Strategy kind cannot be null");
        Objects.requireNonNull(decision, "Decision cannot be null");
    }
}
