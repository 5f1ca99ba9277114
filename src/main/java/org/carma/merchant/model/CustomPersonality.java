package org.carma.merchant.model;

import java.util.Objects;

/**
 * A user-defined personality, typically declared in a scenario file.
 */
public record CustomPersonality(
        String name,
        double riskTolerance,
        double tradingFrequency,
        double profitMarginTarget,
        double competitivenessFactor,
        double patienceFactor
) implements PersonalityProfile {

    public CustomPersonality {
        Objects.requireNonNull(name, "Personality name cannot be null");
        if (riskTolerance < 0 || riskTolerance > 1) {
            throw new IllegalArgumentException("Risk tolerance must be in [0, 1]: " + riskTolerance);
        }
        if (tradingFrequency < 0) {
            throw new IllegalArgumentException("Trading frequency cannot be negative");
        }
        if (profitMarginTarget < 0) {
            throw new IllegalArgumentException("Profit margin target cannot be negative: " + profitMarginTarget);
        }
        if (competitivenessFactor < 0) {
            throw new IllegalArgumentException("Competitiveness cannot be negative: " + competitivenessFactor);
        }
        if (patienceFactor < 0) {
            throw new IllegalArgumentException("Patience cannot be negative: " + patienceFactor);
        }
    }

    @Override
    public Archetype getType() { return Archetype.CUSTOM; }

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
