package org.carma.merchant.mechanism;

import org.carma.merchant.model.Agent;
import org.carma.merchant.model.Archetype;
import org.carma.merchant.model.Decision;
import org.carma.merchant.model.ItemQuote;
import org.carma.merchant.model.MarketSnapshot;
import org.carma.merchant.model.PersonalityProfile;
import org.carma.merchant.strategy.StrategyKind;
import org.carma.merchant.strategy.TemporalContext;
import org.carma.merchant.strategy.TradingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Turns a market snapshot into trading decisions for one agent.
 *
 * Single decision flow:
 * 1. Score the market and classify it (bullish / neutral / bearish)
 * 2. Select a strategy from the agent's archetype and the condition
 * 3. Let the strategy evaluate the snapshot
 * 4. Scale quantity by risk tolerance and confidence by trading frequency
 *
 * The multi-decision scan ({@link #decideMany}) walks items in snapshot
 * order and applies simple margin/discount rules instead of a strategy.
 *
 * Strategies are registered per {@link StrategyKind}; VALUE must always be
 * present as it is the universal fallback.
 */
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    /** Market score used when the snapshot carries no usable items. */
    public static final double NEUTRAL_MARKET_SCORE = 0.5;
    /** Buy discount required from a merchant with zero risk tolerance. */
    public static final double BASE_REQUIRED_DISCOUNT = 0.1;
    /** Half-width of the confidence jitter in {@link #decideMany}. */
    public static final double JITTER_AMPLITUDE = 0.05;

    private final Map<StrategyKind, TradingStrategy> strategies;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Engine with the value, momentum and seasonal strategies registered.
     */
    public DecisionEngine() {
        this(List.of(
            new TradingStrategy.ValueStrategy(),
            new TradingStrategy.MomentumStrategy(),
            new TradingStrategy.SeasonalStrategy()));
    }

    public DecisionEngine(List<? extends TradingStrategy> initialStrategies) {
        this.strategies = new EnumMap<>(StrategyKind.class);
        for (TradingStrategy strategy : initialStrategies) {
            strategies.put(strategy.getKind(), strategy);
        }
        if (!strategies.containsKey(StrategyKind.VALUE)) {
            throw new IllegalArgumentException("A VALUE strategy is required as fallback");
        }
    }

    // ========================================================================
    // Strategy Registry
    // ========================================================================

    /**
     * Register or replace the strategy for its kind.
     */
    public void register(TradingStrategy strategy) {
        Objects.requireNonNull(strategy, "Strategy cannot be null");
        lock.writeLock().lock();
        try {
            strategies.put(strategy.getKind(), strategy);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove a strategy. The VALUE fallback cannot be removed.
     */
    public void unregister(StrategyKind kind) {
        if (kind == StrategyKind.VALUE) {
            throw new IllegalStateException("The VALUE strategy cannot be removed");
        }
        lock.writeLock().lock();
        try {
            strategies.remove(kind);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean hasStrategy(StrategyKind kind) {
        lock.readLock().lock();
        try {
            return strategies.containsKey(kind);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<StrategyKind> getRegisteredKinds() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(EnumSet.copyOf(strategies.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // Market Evaluation
    // ========================================================================

    /**
     * Overall market score in [0, 1]: the mean over items of
     * clamp((currentPrice/basePrice + demand/(supply+1)) / 2, 0, 1).
     * Items with a non-positive base price are ignored.
     */
    public double evaluateMarket(MarketSnapshot snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            return NEUTRAL_MARKET_SCORE;
        }

        double total = 0.0;
        int count = 0;
        for (ItemQuote item : snapshot.getItems()) {
            if (item.getBasePrice() <= 0) {
                continue;
            }
            double priceRatio = item.getCurrentPrice() / item.getBasePrice();
            double supplyDemandRatio = (double) item.getDemand() / (item.getSupply() + 1);
            total += TradingStrategy.clamp01((priceRatio + supplyDemandRatio) / 2.0);
            count++;
        }

        return count == 0 ? NEUTRAL_MARKET_SCORE : total / count;
    }

    public MarketCondition classify(double marketScore) {
        return MarketCondition.classify(marketScore);
    }

    /**
     * Strategy kind for a personality under a market condition.
     * Archetypes without a dedicated rule follow the balanced rule.
     */
    public StrategyKind selectStrategyKind(PersonalityProfile personality, MarketCondition condition) {
        Archetype archetype = personality.getType();
        switch (archetype) {
            case AGGRESSIVE:
                return condition == MarketCondition.BULLISH ? StrategyKind.MOMENTUM : StrategyKind.VALUE;
            case CONSERVATIVE:
                return StrategyKind.VALUE;
            case OPPORTUNISTIC:
                return condition == MarketCondition.BEARISH ? StrategyKind.VALUE : StrategyKind.MOMENTUM;
            default:
                return hasStrategy(StrategyKind.SEASONAL) ? StrategyKind.SEASONAL : StrategyKind.VALUE;
        }
    }

    /**
     * Registered strategy for a personality under a market condition,
     * falling back to VALUE when the preferred kind is not registered.
     */
    public TradingStrategy selectStrategy(PersonalityProfile personality, MarketCondition condition) {
        StrategyKind kind = selectStrategyKind(personality, condition);
        lock.readLock().lock();
        try {
            TradingStrategy strategy = strategies.get(kind);
            return strategy != null ? strategy : strategies.get(StrategyKind.VALUE);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // Decisions
    // ========================================================================

    public Decision decide(Agent agent, MarketSnapshot snapshot) {
        return decide(agent, snapshot, TemporalContext.empty());
    }

    /**
     * Single best decision for the agent this turn.
     */
    public Decision decide(Agent agent, MarketSnapshot snapshot, TemporalContext context) {
        return decideWithStrategy(agent, snapshot, context).decision();
    }

    /**
     * Like {@link #decide(Agent, MarketSnapshot, TemporalContext)}, also
     * reporting the strategy that actually evaluated the snapshot.
     */
    public StrategyDecision decideWithStrategy(Agent agent, MarketSnapshot snapshot, TemporalContext context) {
        Objects.requireNonNull(agent, "Agent cannot be null");
        double marketScore = evaluateMarket(snapshot);
        MarketCondition condition = classify(marketScore);
        TradingStrategy strategy = selectStrategy(agent.getPersonality(), condition);

        Decision raw = strategy.evaluate(agent, snapshot, context);
        Decision decision = applyPersonalityModifiers(raw, agent.getPersonality());

        log.debug("Agent {} in {} market ({}) using {}: {}",
            agent.getId(), condition, String.format("%.3f", marketScore), strategy.getName(), decision);
        return new StrategyDecision(strategy.getKind(), decision);
    }

    /**
     * quantity := round(quantity * (0.5 + riskTolerance));
     * confidence := clamp(confidence * tradingFrequency, 0, 1).
     */
    public Decision applyPersonalityModifiers(Decision decision, PersonalityProfile personality) {
        int quantity = (int) Math.round(decision.quantity() * (0.5 + personality.getRiskTolerance()));
        double confidence = TradingStrategy.clamp01(decision.confidence() * personality.getTradingFrequency());
        return decision.withSizing(Math.max(0, quantity), confidence);
    }

    /**
     * Up to {@code maxDecisions} decisions, one per item at most, in snapshot
     * order. Each item is tested for selling before buying.
     *
     * @param rng Seeded source for the confidence jitter
     */
    public List<Decision> decideMany(Agent agent, MarketSnapshot snapshot, int maxDecisions, Random rng) {
        Objects.requireNonNull(agent, "Agent cannot be null");
        Objects.requireNonNull(rng, "Random source cannot be null");
        if (snapshot == null || maxDecisions <= 0) {
            return Collections.emptyList();
        }

        PersonalityProfile personality = agent.getPersonality();
        int funds = agent.getFunds();
        List<Decision> decisions = new ArrayList<>(Math.min(maxDecisions, snapshot.size()));

        for (ItemQuote item : snapshot.getItems()) {
            if (decisions.size() >= maxDecisions) {
                break;
            }
            if (item.getBasePrice() <= 0 || item.getCurrentPrice() <= 0) {
                continue;
            }

            if (shouldSell(personality, item)) {
                decisions.add(Decision.sell(item.getItemId(),
                    sellQuantity(personality),
                    item.getCurrentPrice(),
                    scanConfidence(personality, item, rng),
                    "High profit margin"));
            } else if (shouldBuy(personality, item, funds)) {
                decisions.add(Decision.buy(item.getItemId(),
                    buyQuantity(personality, item, funds),
                    item.getCurrentPrice(),
                    scanConfidence(personality, item, rng),
                    "Good value opportunity"));
            }
        }

        log.debug("Agent {} produced {} decision(s) from {} item(s)",
            agent.getId(), decisions.size(), snapshot.size());
        return decisions;
    }

    boolean shouldSell(PersonalityProfile personality, ItemQuote item) {
        double profitMargin = (item.getCurrentPrice() - item.getBasePrice()) / item.getBasePrice();
        return profitMargin >= personality.getProfitMarginTarget();
    }

    // More risk-tolerant merchants buy at smaller discounts
    boolean shouldBuy(PersonalityProfile personality, ItemQuote item, int funds) {
        if (item.affordableUnits(funds) < 1) {
            return false;
        }
        double discount = (item.getBasePrice() - item.getCurrentPrice()) / item.getBasePrice();
        double requiredDiscount = BASE_REQUIRED_DISCOUNT * (1.0 - personality.getRiskTolerance());
        return discount >= requiredDiscount;
    }

    int buyQuantity(PersonalityProfile personality, ItemQuote item, int funds) {
        int affordable = item.affordableUnits(funds);
        int quantity = (int) (affordable * personality.getRiskTolerance() * 0.3);
        return Math.max(1, quantity);
    }

    int sellQuantity(PersonalityProfile personality) {
        switch (personality.getType()) {
            case AGGRESSIVE:
                return 10;
            case CONSERVATIVE:
                return 2;
            default:
                return 5;
        }
    }

    /**
     * Calmer prices and prices near base give higher confidence, scaled by
     * trading frequency plus a jitter in [-0.05, 0.05).
     */
    double scanConfidence(PersonalityProfile personality, ItemQuote item, Random rng) {
        double priceRatio = item.getCurrentPrice() / item.getBasePrice();
        double volatilityFactor = 1.0 - item.getVolatility();
        double priceFactor = 1.0 - Math.abs(1.0 - priceRatio);

        double confidence = (volatilityFactor + priceFactor) / 2.0;
        confidence *= personality.getTradingFrequency();
        confidence += (rng.nextDouble() - 0.5) * (2 * JITTER_AMPLITUDE);

        return TradingStrategy.clamp01(confidence);
    }
}
