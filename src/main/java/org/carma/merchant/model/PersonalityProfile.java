package org.carma.merchant.model;

/**
 * Fixed behavioural traits of a merchant.
 *
 * Implementations are immutable and may be shared between agents.
 * The four built-in bundles live in {@link StandardPersonality};
 * {@link CustomPersonality} carries any other combination.
 */
public interface PersonalityProfile {

    Archetype getType();

    /** 0.0 (risk-averse) to 1.0 (risk-seeking). */
    double getRiskTolerance();

    /** Multiplier on how often, and how confidently, the merchant trades. */
    double getTradingFrequency();

    /** Profit margin at which the merchant is willing to sell. */
    double getProfitMarginTarget();

    /** How strongly the merchant reacts to competitors. */
    double getCompetitivenessFactor();

    /** How long the merchant waits for a good deal. */
    double getPatienceFactor();
}
