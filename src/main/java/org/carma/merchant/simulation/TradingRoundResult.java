package org.carma.merchant.simulation;

import org.carma.merchant.model.Decision;
import org.carma.merchant.model.Outcome;
import org.carma.merchant.strategy.StrategyKind;

import java.util.Optional;

/**
 * What one agent did in a trading round. HOLD decisions have no outcome.
 */
public record TradingRoundResult(
        String agentId,
        StrategyKind strategy,
        Decision decision,
        Outcome outcome
) {

    public Optional<Outcome> getOutcome() {
        return Optional.ofNullable(outcome);
    }

    public boolean executed() {
        return outcome != null;
    }
}
