package org.carma.merchant.mechanism;

import org.carma.merchant.model.DecisionType;
import org.carma.merchant.model.Outcome;
import org.carma.merchant.model.Pattern;
import org.carma.merchant.model.Preferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Learns per-agent preferences from trade outcomes.
 *
 * Each recorded outcome is appended to a bounded history (oldest evicted
 * first) and immediately folded into the agent's preferences:
 * - success: item score +0.1 (capped at 1.0), item no longer avoided
 * - failure: item score -0.2; below -1.0 the item moves to the avoided set
 * - market state score +/-0.05 when the outcome names a state
 *
 * Append and adaptation happen under one write lock.
 */
public class LearningEngine {

    private static final Logger log = LoggerFactory.getLogger(LearningEngine.class);

    public static final int DEFAULT_HISTORY_LIMIT = 100;
    public static final int MIN_OUTCOMES_FOR_PATTERNS = 10;

    static final double SUCCESS_REWARD = 0.1;
    static final double FAILURE_PENALTY = 0.2;
    static final double MAX_ITEM_SCORE = 1.0;
    static final double AVOID_THRESHOLD = -1.0;
    static final double CONDITION_STEP = 0.05;
    static final double STRATEGY_STEP = 0.05;

    private final int historyLimit;
    private final Map<String, Deque<Outcome>> outcomes = new HashMap<>();
    private final Map<String, Preferences> preferences = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public LearningEngine() {
        this(DEFAULT_HISTORY_LIMIT);
    }

    public LearningEngine(int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("History limit must be positive: " + historyLimit);
        }
        this.historyLimit = historyLimit;
    }

    // ========================================================================
    // Recording
    // ========================================================================

    /**
     * Record a completed trade and adapt the agent's preferences.
     */
    public void recordOutcome(String agentId, Outcome outcome) {
        Objects.requireNonNull(agentId, "Agent ID cannot be null");
        Objects.requireNonNull(outcome, "Outcome cannot be null");

        lock.writeLock().lock();
        try {
            Deque<Outcome> history = outcomes.computeIfAbsent(agentId, k -> new ArrayDeque<>());
            history.addLast(outcome);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
            adapt(agentId, outcome);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Caller holds the write lock
    private void adapt(String agentId, Outcome outcome) {
        Preferences prefs = preferences.computeIfAbsent(agentId, k -> new Preferences());
        String itemId = outcome.itemId();

        if (outcome.success()) {
            double score = Math.min(MAX_ITEM_SCORE, prefs.getPreferredScore(itemId) + SUCCESS_REWARD);
            prefs.setPreferred(itemId, score);
        } else if (prefs.isAvoided(itemId)) {
            // Keep the item out of the preferred map; deepen the avoidance instead
            prefs.setAvoided(itemId, prefs.getAvoidedScore(itemId) + FAILURE_PENALTY);
        } else {
            double score = prefs.getPreferredScore(itemId) - FAILURE_PENALTY;
            if (score < AVOID_THRESHOLD) {
                prefs.setAvoided(itemId, -score);
                log.debug("Agent {} now avoids item {} (score {})", agentId, itemId, String.format("%.2f", score));
            } else {
                prefs.setPreferred(itemId, score);
            }
        }

        if (!outcome.marketState().isEmpty()) {
            prefs.adjustMarketCondition(outcome.marketState(),
                outcome.success() ? CONDITION_STEP : -CONDITION_STEP);
        }
    }

    /**
     * Reinforce or weaken the strategy that produced a trade.
     */
    public void recordStrategyResult(String agentId, String strategyName, boolean success) {
        Objects.requireNonNull(agentId, "Agent ID cannot be null");
        Objects.requireNonNull(strategyName, "Strategy name cannot be null");
        lock.writeLock().lock();
        try {
            preferences.computeIfAbsent(agentId, k -> new Preferences())
                .adjustStrategy(strategyName, success ? STRATEGY_STEP : -STRATEGY_STEP);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Forget all outcomes and preferences of an agent.
     */
    public void reset(String agentId) {
        lock.writeLock().lock();
        try {
            outcomes.remove(agentId);
            preferences.remove(agentId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Independent copy of the agent's learned preferences; empty preferences
     * for an agent with no outcomes.
     */
    public Preferences getPreferences(String agentId) {
        lock.readLock().lock();
        try {
            Preferences prefs = preferences.get(agentId);
            return prefs != null ? prefs.copy() : new Preferences();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Retained outcomes, oldest first. */
    public List<Outcome> getOutcomes(String agentId) {
        lock.readLock().lock();
        try {
            Deque<Outcome> history = outcomes.get(agentId);
            return history != null ? List.copyOf(history) : List.of();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getOutcomeCount(String agentId) {
        lock.readLock().lock();
        try {
            Deque<Outcome> history = outcomes.get(agentId);
            return history != null ? history.size() : 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Share of successful outcomes; 0.5 when there is no history.
     */
    public double getSuccessRate(String agentId) {
        lock.readLock().lock();
        try {
            Deque<Outcome> history = outcomes.get(agentId);
            if (history == null || history.isEmpty()) {
                return 0.5;
            }
            long successes = history.stream().filter(Outcome::success).count();
            return (double) successes / history.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Mean profit per outcome; 0.0 when there is no history.
     */
    public double getAverageProfit(String agentId) {
        lock.readLock().lock();
        try {
            Deque<Outcome> history = outcomes.get(agentId);
            if (history == null || history.isEmpty()) {
                return 0.0;
            }
            return history.stream().mapToDouble(Outcome::profit).average().orElse(0.0);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Mine the retained history for the best item, action and market state.
     *
     * Ties go to the key seen first in chronological order. Returns empty
     * with fewer than {@value #MIN_OUTCOMES_FOR_PATTERNS} outcomes.
     */
    public Optional<Pattern> analyzePatterns(String agentId) {
        lock.readLock().lock();
        try {
            Deque<Outcome> history = outcomes.get(agentId);
            if (history == null || history.size() < MIN_OUTCOMES_FOR_PATTERNS) {
                return Optional.empty();
            }

            Map<String, Double> itemProfits = new LinkedHashMap<>();
            Map<DecisionType, int[]> actionStats = new LinkedHashMap<>();
            Map<String, int[]> stateStats = new LinkedHashMap<>();

            for (Outcome outcome : history) {
                itemProfits.merge(outcome.itemId(), outcome.profit(), Double::sum);

                tally(actionStats.computeIfAbsent(outcome.decisionType(), k -> new int[2]), outcome.success());

                if (!outcome.marketState().isEmpty()) {
                    tally(stateStats.computeIfAbsent(outcome.marketState(), k -> new int[2]), outcome.success());
                }
            }

            String bestItem = "";
            double maxProfit = 0.0;
            for (Map.Entry<String, Double> entry : itemProfits.entrySet()) {
                if (entry.getValue() > maxProfit) {
                    maxProfit = entry.getValue();
                    bestItem = entry.getKey();
                }
            }

            DecisionType bestAction = DecisionType.HOLD;
            double bestActionRate = 0.0;
            for (Map.Entry<DecisionType, int[]> entry : actionStats.entrySet()) {
                double rate = rate(entry.getValue());
                if (rate > bestActionRate) {
                    bestActionRate = rate;
                    bestAction = entry.getKey();
                }
            }

            String bestState = "";
            double bestStateRate = 0.0;
            for (Map.Entry<String, int[]> entry : stateStats.entrySet()) {
                double rate = rate(entry.getValue());
                if (rate > bestStateRate) {
                    bestStateRate = rate;
                    bestState = entry.getKey();
                }
            }

            return Optional.of(new Pattern(bestItem, bestAction, bestState));
        } finally {
            lock.readLock().unlock();
        }
    }

    // stats[0] = successes, stats[1] = count
    private static void tally(int[] stats, boolean success) {
        if (success) {
            stats[0]++;
        }
        stats[1]++;
    }

    private static double rate(int[] stats) {
        return stats[1] == 0 ? 0.0 : (double) stats[0] / stats[1];
    }

    public int getHistoryLimit() {
        return historyLimit;
    }
}
