package org.carma.merchant.simulation;

import org.carma.merchant.model.Agent;
import org.carma.merchant.model.Decision;
import org.carma.merchant.model.MarketSnapshot;
import org.carma.merchant.model.Outcome;

/**
 * The trade execution collaborator.
 *
 * Implementations own funds and inventory: they apply the decision, then
 * describe what happened. The returned outcome is the only way results
 * reach the learning loop.
 */
@FunctionalInterface
public interface TradeExecutor {

    /**
     * Execute a BUY or SELL decision for the agent.
     * @return Fully populated outcome, whether the trade succeeded or not
     */
    Outcome execute(Agent agent, Decision decision, MarketSnapshot snapshot);
}
