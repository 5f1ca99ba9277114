package org.carma.merchant.network;

import org.carma.merchant.model.TradeRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Undirected link between two merchants.
 *
 * Instances held by {@link RelationshipNetwork} are mutated only under its
 * write lock; callers receive copies.
 */
public final class Relationship {

    public static final double INITIAL_STRENGTH = 0.5;
    public static final double INITIAL_TRUST = 0.5;
    public static final int TRADE_HISTORY_LIMIT = 100;

    private final AgentPair pair;
    private final RelationshipType type;
    private double strength;
    private double trust;
    private final Deque<TradeRecord> tradeHistory;

    Relationship(AgentPair pair, RelationshipType type) {
        this.pair = Objects.requireNonNull(pair);
        this.type = Objects.requireNonNull(type);
        this.strength = INITIAL_STRENGTH;
        this.trust = INITIAL_TRUST;
        this.tradeHistory = new ArrayDeque<>();
    }

    private Relationship(Relationship other) {
        this.pair = other.pair;
        this.type = other.type;
        this.strength = other.strength;
        this.trust = other.trust;
        this.tradeHistory = new ArrayDeque<>(other.tradeHistory);
    }

    Relationship copy() {
        return new Relationship(this);
    }

    /**
     * strength += delta; trust moves by half of a gain or 30% of a loss.
     * Both stay within [0, 1].
     */
    void applyInteraction(double delta) {
        strength = clamp01(strength + delta);
        trust = clamp01(trust + (delta > 0 ? delta * 0.5 : delta * 0.3));
    }

    void addTrade(TradeRecord record) {
        tradeHistory.addLast(record);
        while (tradeHistory.size() > TRADE_HISTORY_LIMIT) {
            tradeHistory.removeFirst();
        }
    }

    /**
     * Whether this link binds its members into one cluster.
     */
    boolean isClusterBond() {
        return type == RelationshipType.ALLIED
            || (type == RelationshipType.FRIENDLY && strength > 0.7);
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    public AgentPair getPair() { return pair; }
    public RelationshipType getType() { return type; }
    public double getStrength() { return strength; }
    public double getTrust() { return trust; }
    public List<TradeRecord> getTradeHistory() { return List.copyOf(tradeHistory); }

    @Override
    public String toString() {
        return String.format("Relationship[%s %s, strength=%.2f, trust=%.2f]", pair, type, strength, trust);
    }
}
