package org.carma.merchant.mechanism;

import org.carma.merchant.model.Agent;
import org.carma.merchant.model.Influence;
import org.carma.merchant.model.PersonalityProfile;

import java.util.List;
import java.util.Objects;

/**
 * Models how merchants distort market price, demand and supply.
 *
 * Per agent (base influence b = 0.01):
 *   gold        g = log10(funds/100 + 1), capped at 3; 0 without funds
 *   reputation  r = (reputation + 100) / 100, from 0 to 2
 *   personality p = (competitiveness + tradingFrequency) / 2
 *
 *   price  = min(b·g·p, 0.2)
 *   demand = min(b·r·p, 0.15)
 *   supply = min(b·g·0.5, 0.1)
 *
 * Aggregation folds impacts with diminishing returns,
 *   acc := acc + impact·(1 − acc·0.5),
 * in list order, then caps the totals at 0.5 / 0.4 / 0.3. The fold equals
 * 2·(1 − Π(1 − impactᵢ/2)), so input order only affects floating-point
 * rounding; callers wanting bit-identical totals keep a stable order.
 *
 * Stateless and safe for concurrent use.
 */
public class MarketInfluenceModel {

    public static final double DEFAULT_BASE_INFLUENCE = 0.01;

    public static final double MAX_PRICE_IMPACT = 0.2;
    public static final double MAX_DEMAND_IMPACT = 0.15;
    public static final double MAX_SUPPLY_IMPACT = 0.1;

    public static final double MAX_AGGREGATE_PRICE = 0.5;
    public static final double MAX_AGGREGATE_DEMAND = 0.4;
    public static final double MAX_AGGREGATE_SUPPLY = 0.3;

    private static final double MAX_GOLD_FACTOR = 3.0;

    private final double baseInfluence;

    public MarketInfluenceModel() {
        this(DEFAULT_BASE_INFLUENCE);
    }

    public MarketInfluenceModel(double baseInfluence) {
        if (baseInfluence < 0) {
            throw new IllegalArgumentException("Base influence cannot be negative: " + baseInfluence);
        }
        this.baseInfluence = baseInfluence;
    }

    /**
     * Influence of a single agent.
     */
    public Influence calculate(Agent agent) {
        Objects.requireNonNull(agent, "Agent cannot be null");
        return calculate(agent.getFunds(), agent.getReputation(), agent.getPersonality());
    }

    /**
     * Influence for raw traits. Reputation is clamped to [-100, 100] and every
     * impact stays within [0, cap].
     */
    public Influence calculate(int funds, double reputation, PersonalityProfile personality) {
        Objects.requireNonNull(personality, "Personality cannot be null");
        double clampedReputation = Math.max(Agent.MIN_REPUTATION, Math.min(Agent.MAX_REPUTATION, reputation));
        double gold = goldFactor(funds);
        double rep = reputationFactor(clampedReputation);
        double character = personalityFactor(personality);

        double price = baseInfluence * gold * character;
        double demand = baseInfluence * rep * character;
        double supply = baseInfluence * gold * 0.5;

        return new Influence(
            bounded(price, MAX_PRICE_IMPACT),
            bounded(demand, MAX_DEMAND_IMPACT),
            bounded(supply, MAX_SUPPLY_IMPACT),
            clampedReputation);
    }

    private static double bounded(double impact, double cap) {
        return Math.max(0.0, Math.min(impact, cap));
    }

    /**
     * Combined influence of several agents, folded in list order.
     */
    public Influence aggregate(List<Influence> influences) {
        if (influences == null || influences.isEmpty()) {
            return Influence.NONE;
        }

        double price = 0.0;
        double demand = 0.0;
        double supply = 0.0;
        double reputation = 0.0;

        for (Influence influence : influences) {
            price += influence.priceImpact() * (1.0 - price * 0.5);
            demand += influence.demandImpact() * (1.0 - demand * 0.5);
            supply += influence.supplyImpact() * (1.0 - supply * 0.5);
            reputation += influence.reputation();
        }

        return new Influence(
            Math.min(price, MAX_AGGREGATE_PRICE),
            Math.min(demand, MAX_AGGREGATE_DEMAND),
            Math.min(supply, MAX_AGGREGATE_SUPPLY),
            reputation / influences.size());
    }

    // ========================================================================
    // Factors
    // ========================================================================

    static double goldFactor(int funds) {
        if (funds <= 0) {
            return 0.0;
        }
        double factor = Math.log10(funds / 100.0 + 1);
        return Math.max(0.0, Math.min(MAX_GOLD_FACTOR, factor));
    }

    static double reputationFactor(double reputation) {
        return (reputation + 100) / 100.0;
    }

    static double personalityFactor(PersonalityProfile personality) {
        return (personality.getCompetitivenessFactor() + personality.getTradingFrequency()) / 2.0;
    }

    public double getBaseInfluence() {
        return baseInfluence;
    }
}
