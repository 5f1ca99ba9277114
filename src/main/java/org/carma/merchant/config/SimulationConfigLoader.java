package org.carma.merchant.config;

import org.carma.merchant.mechanism.DecisionEngine;
import org.carma.merchant.mechanism.LearningEngine;
import org.carma.merchant.mechanism.MarketInfluenceModel;
import org.carma.merchant.model.Agent;
import org.carma.merchant.model.Archetype;
import org.carma.merchant.model.CustomPersonality;
import org.carma.merchant.model.PersonalityProfile;
import org.carma.merchant.model.StandardPersonality;
import org.carma.merchant.network.RelationshipNetwork;
import org.carma.merchant.network.RelationshipType;
import org.carma.merchant.simulation.MerchantSystem;
import org.carma.merchant.strategy.StrategyKind;
import org.carma.merchant.strategy.TemporalContext;
import org.carma.merchant.strategy.TradingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads merchant simulation setups from YAML files.
 *
 * A simulation file declares:
 * - Engine settings (seed, decisions per turn, season, enabled strategies)
 * - Agents with funds, reputation and a built-in or custom personality
 * - Relationships between agents, with optional initial strength feedback
 *
 * Example:
 * <pre>
 * name: river-market
 * engine:
 *   seed: 42
 *   season: winter
 * agents:
 *   - id: m1
 *     name: Alice
 *     funds: 1000
 *     personality: aggressive
 * relationships:
 *   - between: [m1, m2]
 *     type: allied
 * </pre>
 */
public class SimulationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(SimulationConfigLoader.class);

    // ========================================================================
    // CONFIGURATION DATA CLASSES
    // ========================================================================

    /**
     * Root configuration for a simulation.
     */
    public static class SimulationConfig {
        public String name;
        public String description;
        public EngineConfig engine = new EngineConfig();
        public List<AgentConfig> agents = new ArrayList<>();
        public List<RelationshipConfig> relationships = new ArrayList<>();

        @Override
        public String toString() {
            return String.format("SimulationConfig[name=%s, agents=%d, relationships=%d]",
                name, agents.size(), relationships.size());
        }
    }

    /**
     * Engine-wide settings.
     */
    public static class EngineConfig {
        public long seed = 0L;
        public int maxDecisions = MerchantSystem.DEFAULT_MAX_DECISIONS;
        public String season = TemporalContext.DEFAULT_SEASON;
        public int historyLimit = LearningEngine.DEFAULT_HISTORY_LIMIT;
        public double baseInfluence = MarketInfluenceModel.DEFAULT_BASE_INFLUENCE;
        public List<String> strategies = new ArrayList<>(List.of("value", "momentum", "seasonal"));
    }

    /**
     * One merchant. {@code personality} names a built-in archetype;
     * {@code traits} defines a custom one instead.
     */
    public static class AgentConfig {
        public String id;
        public String name;
        public int funds;
        public double reputation;
        public String personality = "balanced";
        public Map<String, Double> traits;

        @Override
        public String toString() {
            return String.format("AgentConfig[id=%s, personality=%s]", id, traits != null ? "custom" : personality);
        }
    }

    /**
     * Relationship between two agents.
     */
    public static class RelationshipConfig {
        public String a;
        public String b;
        public String type = "neutral";
        public double strengthDelta;

        @Override
        public String toString() {
            return String.format("RelationshipConfig[%s-%s, %s]", a, b, type);
        }
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    private final Yaml yaml;

    public SimulationConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    /**
     * Load a simulation from a YAML file.
     */
    public SimulationConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Simulation file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            SimulationConfig config = load(is);
            log.info("Loaded {} from {}", config, file);
            return config;
        }
    }

    public SimulationConfig load(InputStream in) {
        Map<String, Object> raw = yaml.load(in);
        if (raw == null) {
            raw = Collections.emptyMap();
        }
        return parseSimulationConfig(raw);
    }

    /**
     * Parse raw YAML into SimulationConfig.
     */
    @SuppressWarnings("unchecked")
    private SimulationConfig parseSimulationConfig(Map<String, Object> raw) {
        SimulationConfig config = new SimulationConfig();
        config.name = getString(raw, "name", "unnamed");
        config.description = getString(raw, "description", "");

        Map<String, Object> engineMap = (Map<String, Object>) raw.get("engine");
        if (engineMap != null) {
            EngineConfig engine = config.engine;
            engine.seed = getLong(engineMap, "seed", 0L);
            engine.maxDecisions = getInt(engineMap, "maxDecisions", MerchantSystem.DEFAULT_MAX_DECISIONS);
            engine.season = getString(engineMap, "season", TemporalContext.DEFAULT_SEASON);
            engine.historyLimit = getInt(engineMap, "historyLimit", LearningEngine.DEFAULT_HISTORY_LIMIT);
            engine.baseInfluence = getDouble(engineMap, "baseInfluence", MarketInfluenceModel.DEFAULT_BASE_INFLUENCE);
            List<String> strategies = (List<String>) engineMap.get("strategies");
            if (strategies != null) {
                engine.strategies = new ArrayList<>(strategies);
            }
        }

        Set<String> seenIds = new HashSet<>();
        List<Map<String, Object>> agentList = (List<Map<String, Object>>) raw.get("agents");
        if (agentList != null) {
            for (Map<String, Object> agentMap : agentList) {
                AgentConfig agent = new AgentConfig();
                agent.id = getString(agentMap, "id");
                if (agent.id == null) {
                    throw new IllegalArgumentException("Agent entry without id: " + agentMap);
                }
                if (!seenIds.add(agent.id)) {
                    throw new IllegalArgumentException("Duplicate agent id: " + agent.id);
                }
                agent.name = getString(agentMap, "name", agent.id);
                agent.funds = getInt(agentMap, "funds", 0);
                agent.reputation = getDouble(agentMap, "reputation", 0.0);

                Object personality = agentMap.get("personality");
                if (personality instanceof Map) {
                    agent.traits = new LinkedHashMap<>();
                    for (Map.Entry<String, Object> entry : ((Map<String, Object>) personality).entrySet()) {
                        if (entry.getValue() instanceof Number) {
                            agent.traits.put(entry.getKey(), ((Number) entry.getValue()).doubleValue());
                        }
                    }
                    agent.personality = "custom";
                } else if (personality != null) {
                    agent.personality = personality.toString();
                }
                config.agents.add(agent);
            }
        }

        List<Map<String, Object>> relList = (List<Map<String, Object>>) raw.get("relationships");
        if (relList != null) {
            for (Map<String, Object> relMap : relList) {
                RelationshipConfig rel = new RelationshipConfig();
                List<Object> between = (List<Object>) relMap.get("between");
                if (between == null || between.size() != 2) {
                    throw new IllegalArgumentException("Relationship needs exactly two agents in 'between': " + relMap);
                }
                rel.a = between.get(0).toString();
                rel.b = between.get(1).toString();
                rel.type = getString(relMap, "type", "neutral");
                rel.strengthDelta = getDouble(relMap, "strengthDelta", 0.0);
                config.relationships.add(rel);
            }
        }

        return config;
    }

    // ========================================================================
    // BUILDING
    // ========================================================================

    /**
     * Build a ready system: engines and scan settings configured, agents
     * registered and relationships applied.
     */
    public MerchantSystem buildSystem(SimulationConfig config) {
        EngineConfig engine = config.engine;
        MerchantSystem system = new MerchantSystem(
            buildDecisionEngine(engine),
            new LearningEngine(engine.historyLimit),
            new MarketInfluenceModel(engine.baseInfluence),
            new RelationshipNetwork());

        system.configureScan(engine.maxDecisions, buildRandom(config));

        for (AgentConfig agentConfig : config.agents) {
            system.addAgent(buildAgent(agentConfig));
        }

        RelationshipNetwork network = system.getNetwork();
        for (RelationshipConfig rel : config.relationships) {
            RelationshipType type = RelationshipType.fromName(rel.type);
            if (!network.addRelationship(rel.a, rel.b, type)) {
                log.warn("Skipping {}: both agents must be declared and distinct", rel);
                continue;
            }
            if (rel.strengthDelta != 0.0) {
                network.updateStrength(rel.a, rel.b, rel.strengthDelta);
            }
        }

        return system;
    }

    /**
     * Decision engine with the configured strategies. VALUE is always
     * registered since it is the fallback.
     */
    public DecisionEngine buildDecisionEngine(EngineConfig engine) {
        Set<StrategyKind> kinds = EnumSet.of(StrategyKind.VALUE);
        for (String name : engine.strategies) {
            try {
                kinds.add(StrategyKind.valueOf(name.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring unknown strategy '{}'", name);
            }
        }

        List<TradingStrategy> strategies = new ArrayList<>();
        for (StrategyKind kind : kinds) {
            strategies.add(createStrategy(kind));
        }
        return new DecisionEngine(strategies);
    }

    private TradingStrategy createStrategy(StrategyKind kind) {
        switch (kind) {
            case MOMENTUM:
                return new TradingStrategy.MomentumStrategy();
            case SEASONAL:
                return new TradingStrategy.SeasonalStrategy();
            default:
                return new TradingStrategy.ValueStrategy();
        }
    }

    public Agent buildAgent(AgentConfig config) {
        Agent agent = new Agent(config.id, config.name, config.funds, buildPersonality(config));
        agent.setReputation(config.reputation);
        return agent;
    }

    public PersonalityProfile buildPersonality(AgentConfig config) {
        if (config.traits != null) {
            Map<String, Double> t = config.traits;
            StandardPersonality base = StandardPersonality.BALANCED;
            return new CustomPersonality(
                config.id + "-custom",
                t.getOrDefault("riskTolerance", base.getRiskTolerance()),
                t.getOrDefault("tradingFrequency", base.getTradingFrequency()),
                t.getOrDefault("profitMarginTarget", base.getProfitMarginTarget()),
                t.getOrDefault("competitivenessFactor", base.getCompetitivenessFactor()),
                t.getOrDefault("patienceFactor", base.getPatienceFactor()));
        }
        return StandardPersonality.of(Archetype.fromName(config.personality));
    }

    public TemporalContext buildContext(SimulationConfig config) {
        return TemporalContext.ofSeason(config.engine.season);
    }

    /**
     * Seeded random source for reproducible multi-decision scans.
     */
    public Random buildRandom(SimulationConfig config) {
        return new Random(config.engine.seed);
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private String getString(Map<String, Object> map, String key) {
        return getString(map, key, null);
    }

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return defaultValue;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }
}
