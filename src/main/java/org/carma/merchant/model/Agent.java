package org.carma.merchant.model;

import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A simulated merchant.
 *
 * Each agent has:
 * - Unique identifier and name
 * - Funds (whole gold, never negative)
 * - Reputation, always within [-100, 100]
 * - A shared, immutable personality
 * - Learned preferences and trading statistics
 *
 * Funds and reputation are mutated by the external execution layer and by
 * reputation events; all access goes through a read/write lock.
 */
public class Agent {

    public static final double MIN_REPUTATION = -100.0;
    public static final double MAX_REPUTATION = 100.0;

    private final String id;
    private final String name;
    private final PersonalityProfile personality;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private int funds;
    private double reputation;
    private Preferences preferences;
    private final TradingStatistics statistics;

    public Agent(String id, String name, int funds, PersonalityProfile personality) {
        this.id = Objects.requireNonNull(id, "Agent ID cannot be null");
        this.name = Objects.requireNonNull(name, "Agent name cannot be null");
        this.personality = Objects.requireNonNull(personality, "Personality cannot be null");
        if (funds < 0) {
            throw new IllegalArgumentException("Funds cannot be negative: " + funds);
        }
        this.funds = funds;
        this.reputation = 0.0;
        this.preferences = new Preferences();
        this.statistics = new TradingStatistics();
    }

    // ========================================================================
    // Funds
    // ========================================================================

    public int getFunds() {
        lock.readLock().lock();
        try {
            return funds;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setFunds(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Funds cannot be negative: " + amount);
        }
        lock.writeLock().lock();
        try {
            funds = amount;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws ArithmeticException if the balance would exceed Integer.MAX_VALUE
     */
    public void addFunds(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Cannot add negative funds");
        }
        lock.writeLock().lock();
        try {
            funds = Math.addExact(funds, amount);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove funds if the balance covers the amount.
     * @return false, leaving the balance untouched, when it does not
     */
    public boolean removeFunds(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Cannot remove negative funds");
        }
        lock.writeLock().lock();
        try {
            if (funds < amount) {
                return false;
            }
            funds -= amount;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========================================================================
    // Reputation
    // ========================================================================

    public double getReputation() {
        lock.readLock().lock();
        try {
            return reputation;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void setReputation(double value) {
        lock.writeLock().lock();
        try {
            reputation = clampReputation(value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void adjustReputation(double delta) {
        lock.writeLock().lock();
        try {
            reputation = clampReputation(reputation + delta);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static double clampReputation(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(MIN_REPUTATION, Math.min(MAX_REPUTATION, value));
    }

    // ========================================================================
    // Preferences and statistics
    // ========================================================================

    /**
     * Copy of the agent's current preferences.
     */
    public Preferences getPreferences() {
        lock.readLock().lock();
        try {
            return preferences.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replace the agent's preferences with a copy of the given ones,
     * typically a fresh snapshot from the learning engine.
     */
    public void updatePreferences(Preferences learned) {
        Objects.requireNonNull(learned, "Preferences cannot be null");
        Preferences copy = learned.copy();
        lock.writeLock().lock();
        try {
            preferences = copy;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordTrade(TradeRecord record) {
        Objects.requireNonNull(record, "Trade record cannot be null");
        lock.writeLock().lock();
        try {
            statistics.record(record);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public TradingStatistics getTradingStatistics() {
        lock.readLock().lock();
        try {
            return statistics.copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public PersonalityProfile getPersonality() {
        return personality;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Agent agent = (Agent) o;
        return Objects.equals(id, agent.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("Agent[%s: %s, %s, funds=%d, rep=%.1f]",
            id, name, personality.getType().getDisplayName(), getFunds(), getReputation());
    }
}
