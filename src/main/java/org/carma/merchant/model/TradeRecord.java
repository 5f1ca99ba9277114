package org.carma.merchant.model;

/**
 * A single completed trade as kept in an agent's statistics.
 */
public record TradeRecord(
        String itemId,
        int quantity,
        double buyPrice,
        double sellPrice,
        double profit,
        long timestamp
) {

    /**
     * Derive a trade record from an executed outcome. The decision price is
     * the buy price for purchases and the sell price for sales.
     */
    public static TradeRecord fromOutcome(Outcome outcome) {
        Decision d = outcome.decision();
        double buy = d.type() == DecisionType.BUY ? d.price() : 0.0;
        double sell = d.type() == DecisionType.SELL ? d.price() : 0.0;
        return new TradeRecord(d.itemId(), d.quantity(), buy, sell, outcome.profit(), outcome.timestamp());
    }
}
