package org.carma.merchant.simulation;

import org.carma.merchant.mechanism.DecisionEngine;
import org.carma.merchant.mechanism.LearningEngine;
import org.carma.merchant.mechanism.MarketInfluenceModel;
import org.carma.merchant.mechanism.StrategyDecision;
import org.carma.merchant.model.Agent;
import org.carma.merchant.model.Decision;
import org.carma.merchant.model.Influence;
import org.carma.merchant.model.MarketSnapshot;
import org.carma.merchant.model.Outcome;
import org.carma.merchant.model.TradeRecord;
import org.carma.merchant.network.RelationshipNetwork;
import org.carma.merchant.strategy.StrategyKind;
import org.carma.merchant.strategy.TemporalContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Coordinates the merchant engines for a simulation loop.
 *
 * Holds the registered agents (in registration order) and references to the
 * decision engine, learning engine, influence model and relationship network
 * it was constructed with. Nothing here is global: a simulation builds one
 * system and passes it to its per-turn loop.
 *
 * Usage:
 * <pre>
 * MerchantSystem system = new MerchantSystem();
 * system.addAgent(new Agent("m1", "Alice", 1000, StandardPersonality.AGGRESSIVE));
 * Map&lt;String, TradingRoundResult&gt; round = system.runTradingRound(snapshot, context, executor);
 *
 * system.configureScan(2, new Random(42));
 * Map&lt;String, List&lt;Outcome&gt;&gt; scan = system.runScanRound(snapshot, executor);
 * </pre>
 */
public class MerchantSystem {

    private static final Logger log = LoggerFactory.getLogger(MerchantSystem.class);

    public static final int DEFAULT_MAX_DECISIONS = 3;

    private final DecisionEngine decisionEngine;
    private final LearningEngine learningEngine;
    private final MarketInfluenceModel influenceModel;
    private final RelationshipNetwork network;

    private final Map<String, Agent> agents = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private int maxDecisions = DEFAULT_MAX_DECISIONS;
    private Random scanRandom = new Random(0L);

    public MerchantSystem() {
        this(new DecisionEngine(), new LearningEngine(), new MarketInfluenceModel(), new RelationshipNetwork());
    }

    public MerchantSystem(DecisionEngine decisionEngine, LearningEngine learningEngine,
                          MarketInfluenceModel influenceModel, RelationshipNetwork network) {
        this.decisionEngine = Objects.requireNonNull(decisionEngine, "Decision engine cannot be null");
        this.learningEngine = Objects.requireNonNull(learningEngine, "Learning engine cannot be null");
        this.influenceModel = Objects.requireNonNull(influenceModel, "Influence model cannot be null");
        this.network = Objects.requireNonNull(network, "Network cannot be null");
    }

    // ========================================================================
    // Agent Registry
    // ========================================================================

    /**
     * Register an agent with the system and the relationship network.
     * @throws IllegalArgumentException if the id is already registered
     */
    public void addAgent(Agent agent) {
        Objects.requireNonNull(agent, "Agent cannot be null");
        lock.writeLock().lock();
        try {
            if (agents.containsKey(agent.getId())) {
                throw new IllegalArgumentException("Agent already registered: " + agent.getId());
            }
            agents.put(agent.getId(), agent);
            network.addAgent(agent.getId());
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Registered {}", agent);
    }

    /**
     * Unregister an agent, dropping its relationships and learned history.
     */
    public void removeAgent(String agentId) {
        Agent removed;
        lock.writeLock().lock();
        try {
            removed = agents.remove(agentId);
            if (removed == null) {
                return;
            }
            network.removeAgent(agentId);
            learningEngine.reset(agentId);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Removed {}", removed);
    }

    public Optional<Agent> getAgent(String agentId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(agents.get(agentId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Registered agents in registration order. */
    public List<Agent> getAgents() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(agents.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================================================
    // Trading Rounds
    // ========================================================================

    /**
     * One decision per agent, executed through the given executor.
     *
     * Agents are processed in registration order. HOLD decisions are not
     * executed. For every executed decision the outcome is recorded for
     * learning, the producing strategy is reinforced or weakened, the agent's
     * statistics and preferences are refreshed.
     */
    public Map<String, TradingRoundResult> runTradingRound(MarketSnapshot snapshot, TemporalContext context,
                                                           TradeExecutor executor) {
        Objects.requireNonNull(executor, "Trade executor cannot be null");
        Map<String, TradingRoundResult> results = new LinkedHashMap<>();

        for (Agent agent : getAgents()) {
            StrategyDecision chosen = decisionEngine.decideWithStrategy(agent, snapshot, context);
            StrategyKind kind = chosen.strategy();
            Decision decision = chosen.decision();

            Outcome outcome = null;
            if (!decision.isHold()) {
                outcome = execute(agent, decision, snapshot, executor);
                if (outcome != null) {
                    learningEngine.recordStrategyResult(agent.getId(), kind.strategyName(), outcome.success());
                }
            }

            results.put(agent.getId(), new TradingRoundResult(agent.getId(), kind, decision, outcome));
        }

        log.debug("Trading round: {} agent(s), {} executed", results.size(),
            results.values().stream().filter(TradingRoundResult::executed).count());
        return results;
    }

    /**
     * Multi-decision scan for every agent, using the configured decision
     * limit and random source (see {@link #configureScan}).
     *
     * Each agent's decisions come from {@link DecisionEngine#decideMany} and
     * are executed in snapshot order; outcomes feed learning and statistics
     * as in {@link #runTradingRound}. No strategy is reinforced since the scan
     * does not use one.
     *
     * @return recorded outcomes per agent, in registration order
     */
    public Map<String, List<Outcome>> runScanRound(MarketSnapshot snapshot, TradeExecutor executor) {
        Objects.requireNonNull(executor, "Trade executor cannot be null");
        int limit;
        Random rng;
        lock.readLock().lock();
        try {
            limit = maxDecisions;
            rng = scanRandom;
        } finally {
            lock.readLock().unlock();
        }

        Map<String, List<Outcome>> results = new LinkedHashMap<>();
        for (Agent agent : getAgents()) {
            List<Outcome> outcomes = new ArrayList<>();
            for (Decision decision : decisionEngine.decideMany(agent, snapshot, limit, rng)) {
                Outcome outcome = execute(agent, decision, snapshot, executor);
                if (outcome != null) {
                    outcomes.add(outcome);
                }
            }
            results.put(agent.getId(), outcomes);
        }
        return results;
    }

    // Executes one decision and records a returned outcome
    private Outcome execute(Agent agent, Decision decision, MarketSnapshot snapshot, TradeExecutor executor) {
        Outcome outcome = executor.execute(agent, decision, snapshot);
        if (outcome == null) {
            log.warn("Executor returned no outcome for {} of agent {}", decision, agent.getId());
            return null;
        }
        learningEngine.recordOutcome(agent.getId(), outcome);
        agent.recordTrade(TradeRecord.fromOutcome(outcome));
        agent.updatePreferences(learningEngine.getPreferences(agent.getId()));
        return outcome;
    }

    /**
     * Decision limit and seeded random source for {@link #runScanRound}.
     */
    public void configureScan(int maxDecisions, Random rng) {
        if (maxDecisions < 0) {
            throw new IllegalArgumentException("Max decisions cannot be negative: " + maxDecisions);
        }
        Objects.requireNonNull(rng, "Random source cannot be null");
        lock.writeLock().lock();
        try {
            this.maxDecisions = maxDecisions;
            this.scanRandom = rng;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getMaxDecisions() {
        lock.readLock().lock();
        try {
            return maxDecisions;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Combined market influence of all agents, folded in registration order.
     */
    public Influence getMarketInfluence() {
        List<Influence> influences = new ArrayList<>();
        for (Agent agent : getAgents()) {
            influences.add(influenceModel.calculate(agent));
        }
        return influenceModel.aggregate(influences);
    }

    /**
     * Interaction feedback between two agents.
     * @return false if they are not related
     */
    public boolean updateRelationship(String a, String b, double delta) {
        return network.updateStrength(a, b, delta);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public DecisionEngine getDecisionEngine() { return decisionEngine; }
    public LearningEngine getLearningEngine() { return learningEngine; }
    public MarketInfluenceModel getInfluenceModel() { return influenceModel; }
    public RelationshipNetwork getNetwork() { return network; }

    @Override
    public String toString() {
        return String.format("MerchantSystem[agents=%d, %s]", getAgents().size(), network);
    }
}
