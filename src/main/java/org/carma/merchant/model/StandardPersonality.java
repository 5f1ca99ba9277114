package org.carma.merchant.model;

/**
 * The four built-in personality bundles.
 */
public enum StandardPersonality implements PersonalityProfile {
    AGGRESSIVE(Archetype.AGGRESSIVE, 0.8, 1.5, 0.3, 1.2, 0.5),
    CONSERVATIVE(Archetype.CONSERVATIVE, 0.2, 0.7, 0.5, 0.8, 1.5),
    BALANCED(Archetype.BALANCED, 0.5, 1.0, 0.4, 1.0, 1.0),
    OPPORTUNISTIC(Archetype.OPPORTUNISTIC, 0.6, 1.3, 0.35, 1.1, 0.8);

    private final Archetype type;
    private final double riskTolerance;
    private final double tradingFrequency;
    private final double profitMarginTarget;
    private final double competitivenessFactor;
    private final double patienceFactor;

    StandardPersonality(Archetype type, double riskTolerance, double tradingFrequency,
                        double profitMarginTarget, double competitivenessFactor, double patienceFactor) {
        this.type = type;
        this.riskTolerance = riskTolerance;
        this.tradingFrequency = tradingFrequency;
        this.profitMarginTarget = profitMarginTarget;
        this.competitivenessFactor = competitivenessFactor;
        this.patienceFactor = patienceFactor;
    }

    /**
     * Look up the built-in bundle for an archetype.
     * CUSTOM has no built-in bundle and resolves to BALANCED.
     */
    public static StandardPersonality of(Archetype archetype) {
        switch (archetype) {
            case AGGRESSIVE:
                return AGGRESSIVE;
            case CONSERVATIVE:
                return CONSERVATIVE;
            case OPPORTUNISTIC:
                return OPPORTUNISTIC;
            default:
                return BALANCED;
        }
    }

    @Override
    public Archetype getType() { return type; }

    @Override
    public double getRiskTolerance() { return riskTolerance; }

    @Override
    public double getTradingFrequency() { return tradingFrequency; }

    @Override
    public double getProfitMarginTarget() { return profitMarginTarget; }

    @Override
    public double getCompetitivenessFactor() { return competitivenessFactor; }

    @Override
    public double getPatienceFactor() { return patienceFactor; }
}
