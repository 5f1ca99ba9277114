package org.carma.merchant.model;

/**
 * Summary mined from an agent's outcome history.
 *
 * @param mostProfitableItem item with the highest positive summed profit, empty if none
 * @param mostSuccessfulAction decision type with the best success rate, HOLD if none succeeded
 * @param optimalMarketState market state with the best positive success rate, empty if none
 */
public record Pattern(
        String mostProfitableItem,
        DecisionType mostSuccessfulAction,
        String optimalMarketState
) {}
