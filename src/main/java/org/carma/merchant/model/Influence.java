package org.carma.merchant.model;

/**
 * Modeled distortion an agent, or a group of agents, applies to the market.
 */
public record Influence(
        double priceImpact,
        double demandImpact,
        double supplyImpact,
        double reputation
) {

    public static final Influence NONE = new Influence(0, 0, 0, 0);

    public double priceEffect(double basePrice) {
        return basePrice * (1.0 + priceImpact);
    }

    public int demandEffect(int baseDemand) {
        return (int) Math.round(baseDemand * (1.0 + demandImpact));
    }

    public int supplyEffect(int baseSupply) {
        return (int) Math.round(baseSupply * (1.0 + supplyImpact));
    }

    @Override
    public String toString() {
        return String.format("Influence[price=%.4f, demand=%.4f, supply=%.4f, rep=%.1f]",
            priceImpact, demandImpact, supplyImpact, reputation);
    }
}
