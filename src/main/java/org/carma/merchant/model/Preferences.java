package org.carma.merchant.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Learned affinities of one merchant.
 *
 * An item is either preferred (with a score) or avoided (with a positive
 * magnitude), never both. Maps keep insertion order so iteration over them
 * is deterministic.
 *
 * Not thread-safe; owners guard instances with their own lock and hand out
 * {@link #copy()}s.
 */
public final class Preferences {

    private final Map<String, Double> preferredItems;
    private final Map<String, Double> avoidedItems;
    private final Map<String, Double> preferredStrategies;
    private final Map<String, Double> marketConditions;

    public Preferences() {
        this.preferredItems = new LinkedHashMap<>();
        this.avoidedItems = new LinkedHashMap<>();
        this.preferredStrategies = new LinkedHashMap<>();
        this.marketConditions = new LinkedHashMap<>();
    }

    private Preferences(Preferences other) {
        this.preferredItems = new LinkedHashMap<>(other.preferredItems);
        this.avoidedItems = new LinkedHashMap<>(other.avoidedItems);
        this.preferredStrategies = new LinkedHashMap<>(other.preferredStrategies);
        this.marketConditions = new LinkedHashMap<>(other.marketConditions);
    }

    /**
     * Independent deep copy.
     */
    public Preferences copy() {
        return new Preferences(this);
    }

    // ========================================================================
    // Items
    // ========================================================================

    /**
     * Signed preference for an item: the preferred score, the negated
     * avoidance magnitude, or 0.0 when the item is unknown.
     */
    public double getItemPreference(String itemId) {
        Double preferred = preferredItems.get(itemId);
        if (preferred != null) {
            return preferred;
        }
        Double avoided = avoidedItems.get(itemId);
        if (avoided != null) {
            return -avoided;
        }
        return 0.0;
    }

    public boolean isPreferred(String itemId) {
        return preferredItems.containsKey(itemId);
    }

    public boolean isAvoided(String itemId) {
        return avoidedItems.containsKey(itemId);
    }

    public double getPreferredScore(String itemId) {
        return preferredItems.getOrDefault(itemId, 0.0);
    }

    public double getAvoidedScore(String itemId) {
        return avoidedItems.getOrDefault(itemId, 0.0);
    }

    public void setPreferred(String itemId, double score) {
        avoidedItems.remove(itemId);
        preferredItems.put(itemId, score);
    }

    public void setAvoided(String itemId, double magnitude) {
        if (magnitude < 0) {
            throw new IllegalArgumentException("Avoidance magnitude cannot be negative: " + magnitude);
        }
        preferredItems.remove(itemId);
        avoidedItems.put(itemId, magnitude);
    }

    public Map<String, Double> getPreferredItems() {
        return Collections.unmodifiableMap(preferredItems);
    }

    public Map<String, Double> getAvoidedItems() {
        return Collections.unmodifiableMap(avoidedItems);
    }

    // ========================================================================
    // Strategies and market conditions
    // ========================================================================

    public void adjustStrategy(String strategyName, double delta) {
        preferredStrategies.merge(strategyName, delta, Double::sum);
    }

    public void adjustMarketCondition(String marketState, double delta) {
        marketConditions.merge(marketState, delta, Double::sum);
    }

    public double getStrategyScore(String strategyName) {
        return preferredStrategies.getOrDefault(strategyName, 0.0);
    }

    public double getMarketConditionScore(String marketState) {
        return marketConditions.getOrDefault(marketState, 0.0);
    }

    public Map<String, Double> getPreferredStrategies() {
        return Collections.unmodifiableMap(preferredStrategies);
    }

    public Map<String, Double> getMarketConditions() {
        return Collections.unmodifiableMap(marketConditions);
    }

    /**
     * Preferred strategy name for a market state.
     *
     * Without learned strategy scores: "momentum" for volatile markets,
     * "value" for stable ones, "balanced" otherwise. With scores: the
     * strategy with the highest positive score, first learned wins ties,
     * "balanced" if none is positive.
     */
    public String strategyForMarket(String marketState) {
        if (preferredStrategies.isEmpty()) {
            if ("volatile".equals(marketState)) {
                return "momentum";
            }
            if ("stable".equals(marketState)) {
                return "value";
            }
            return "balanced";
        }

        String best = "balanced";
        double bestScore = 0.0;
        for (Map.Entry<String, Double> entry : preferredStrategies.entrySet()) {
            if (entry.getValue() > bestScore) {
                best = entry.getKey();
                bestScore = entry.getValue();
            }
        }
        return best;
    }

    @Override
    public String toString() {
        return String.format("Preferences[preferred=%s, avoided=%s, strategies=%s, conditions=%s]",
            preferredItems, avoidedItems, preferredStrategies, marketConditions);
    }
}
