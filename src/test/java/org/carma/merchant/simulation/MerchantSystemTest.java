package org.carma.merchant.simulation;

import org.carma.merchant.mechanism.DecisionEngine;
import org.carma.merchant.mechanism.LearningEngine;
import org.carma.merchant.mechanism.MarketInfluenceModel;
import org.carma.merchant.mechanism.StrategyDecision;
import org.carma.merchant.model.Agent;
import org.carma.merchant.model.Decision;
import org.carma.merchant.model.DecisionType;
import org.carma.merchant.model.Influence;
import org.carma.merchant.model.ItemQuote;
import org.carma.merchant.model.MarketSnapshot;
import org.carma.merchant.model.Outcome;
import org.carma.merchant.model.StandardPersonality;
import org.carma.merchant.network.RelationshipNetwork;
import org.carma.merchant.network.RelationshipType;
import org.carma.merchant.strategy.StrategyKind;
import org.carma.merchant.strategy.TemporalContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MerchantSystemTest {

    @Mock
    private TradeExecutor executor;

    private MerchantSystem system;
    private MarketSnapshot market;
    private Agent cautious;
    private Agent bold;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        system = new MerchantSystem();
        market = MarketSnapshot.of(
            ItemQuote.builder("A").basePrice(100).currentPrice(80).demand(50).supply(30).build(),
            ItemQuote.builder("B").basePrice(100).currentPrice(120).demand(30).supply(50).build());
        cautious = new Agent("m1", "Cara", 1000, StandardPersonality.CONSERVATIVE);
        bold = new Agent("m2", "Alice", 1000, StandardPersonality.AGGRESSIVE);
    }

    @Test
    void shouldExecuteAndLearnFromTrades() {
        system.addAgent(cautious);
        when(executor.execute(any(), any(), any()))
            .thenAnswer(inv -> Outcome.of(inv.getArgument(1), 30.0, true, "bullish"));

        Map<String, TradingRoundResult> round = system.runTradingRound(market, TemporalContext.empty(), executor);

        TradingRoundResult result = round.get("m1");
        assertTrue(result.executed());
        assertEquals(StrategyKind.VALUE, result.strategy());
        assertEquals(DecisionType.BUY, result.decision().type());
        assertEquals("A", result.decision().itemId());
        verify(executor).execute(eq(cautious), eq(result.decision()), eq(market));

        assertEquals(1, system.getLearningEngine().getOutcomeCount("m1"));
        assertEquals(0.05, system.getLearningEngine().getPreferences("m1").getStrategyScore("value"), 1e-9);
        assertEquals(1, cautious.getTradingStatistics().getTotalTrades());
        assertEquals(30.0, cautious.getTradingStatistics().getTotalProfit());
        assertEquals(0.1, cautious.getPreferences().getPreferredScore("A"), 1e-9);
    }

    @Test
    void shouldNotExecuteHoldDecisions() {
        system.addAgent(bold);

        Map<String, TradingRoundResult> round = system.runTradingRound(market, TemporalContext.empty(), executor);

        TradingRoundResult result = round.get("m2");
        assertTrue(result.decision().isHold());
        assertEquals(StrategyKind.MOMENTUM, result.strategy());
        assertFalse(result.executed());
        assertTrue(result.getOutcome().isEmpty());
        verify(executor, never()).execute(any(), any(), any());
        assertEquals(0, system.getLearningEngine().getOutcomeCount("m2"));
    }

    @Test
    void shouldTolerateMissingOutcome() {
        system.addAgent(cautious);
        when(executor.execute(any(), any(), any())).thenReturn(null);

        TradingRoundResult result = system.runTradingRound(market, TemporalContext.empty(), executor).get("m1");

        assertFalse(result.executed());
        assertEquals(0, system.getLearningEngine().getOutcomeCount("m1"));
        assertEquals(0, cautious.getTradingStatistics().getTotalTrades());
    }

    @Test
    void shouldReportAgentsInRegistrationOrder() {
        system.addAgent(bold);
        system.addAgent(cautious);
        when(executor.execute(any(), any(), any()))
            .thenAnswer(inv -> Outcome.of(inv.getArgument(1), -5.0, false, "bullish"));

        Map<String, TradingRoundResult> round = system.runTradingRound(market, TemporalContext.empty(), executor);

        assertEquals(List.of("m2", "m1"), List.copyOf(round.keySet()));
        verify(executor, times(1)).execute(any(), any(), any());
        assertEquals(-0.05, system.getLearningEngine().getPreferences("m1").getStrategyScore("value"), 1e-9);
    }

    @Test
    void shouldRejectDuplicateAgents() {
        system.addAgent(cautious);
        Agent twin = new Agent("m1", "Twin", 10, StandardPersonality.BALANCED);

        assertThrows(IllegalArgumentException.class, () -> system.addAgent(twin));
        assertEquals(1, system.getAgents().size());
    }

    @Test
    void shouldRegisterAgentsWithNetwork() {
        system.addAgent(cautious);
        system.addAgent(bold);

        assertTrue(system.getNetwork().containsAgent("m1"));
        assertTrue(system.getNetwork().addRelationship("m1", "m2", RelationshipType.FRIENDLY));
        assertTrue(system.updateRelationship("m2", "m1", 0.3));
        assertEquals(0.8, system.getNetwork().getRelationship("m1", "m2").orElseThrow().getStrength(), 1e-9);
        assertFalse(system.updateRelationship("m1", "ghost", 0.3));
    }

    @Test
    void shouldForgetRemovedAgents() {
        system.addAgent(cautious);
        system.addAgent(bold);
        system.getNetwork().addRelationship("m1", "m2", RelationshipType.ALLIED);
        system.getLearningEngine().recordOutcome("m1",
            Outcome.of(Decision.buy("A", 1, 80, 0.5, ""), 5.0, true, ""));

        system.removeAgent("m1");

        assertTrue(system.getAgent("m1").isEmpty());
        assertFalse(system.getNetwork().containsAgent("m1"));
        assertTrue(system.getNetwork().getRelationshipsOf("m2").isEmpty());
        assertEquals(0, system.getLearningEngine().getOutcomeCount("m1"));
    }

    @Test
    void shouldAggregateInfluenceOfAllAgents() {
        assertEquals(Influence.NONE, system.getMarketInfluence());

        system.addAgent(new Agent("m3", "Bob", 900, StandardPersonality.BALANCED));
        Influence single = system.getMarketInfluence();
        assertEquals(0.01, single.priceImpact(), 1e-12);

        system.addAgent(new Agent("m4", "Dan", 900, StandardPersonality.BALANCED));
        Influence pair = system.getMarketInfluence();
        assertEquals(0.01 + 0.01 * (1 - 0.005), pair.priceImpact(), 1e-12);
    }

    @Test
    void shouldReinforceStrategyThatActuallyDecided() {
        DecisionEngine engine = mock(DecisionEngine.class);
        Decision buy = Decision.buy("A", 2, 80, 0.6, "stub");
        when(engine.decideWithStrategy(any(), any(), any()))
            .thenReturn(new StrategyDecision(StrategyKind.SEASONAL, buy));
        MerchantSystem stubbed = new MerchantSystem(engine, new LearningEngine(),
            new MarketInfluenceModel(), new RelationshipNetwork());
        stubbed.addAgent(cautious);
        when(executor.execute(any(), any(), any()))
            .thenAnswer(inv -> Outcome.of(inv.getArgument(1), 12.0, true, ""));

        TradingRoundResult result = stubbed.runTradingRound(market, TemporalContext.empty(), executor).get("m1");

        assertEquals(StrategyKind.SEASONAL, result.strategy());
        assertEquals(0.05, stubbed.getLearningEngine().getPreferences("m1").getStrategyScore("seasonal"), 1e-9);
        assertEquals(0.0, stubbed.getLearningEngine().getPreferences("m1").getStrategyScore("value"));
        verify(engine, never()).selectStrategy(any(), any());
    }

    // ===== Scan rounds =====

    @Test
    void shouldExecuteScanDecisionsUpToConfiguredLimit() {
        Agent scanner = new Agent("m5", "Bob", 1000, StandardPersonality.BALANCED);
        system.addAgent(scanner);
        system.configureScan(2, new Random(7));
        MarketSnapshot scanMarket = MarketSnapshot.of(
            ItemQuote.builder("X").basePrice(100).currentPrice(150).volatility(0.2).build(),
            ItemQuote.builder("Y").basePrice(100).currentPrice(90).volatility(0.1).build(),
            ItemQuote.builder("Z").basePrice(100).currentPrice(50).volatility(0.1).build());
        when(executor.execute(any(), any(), any()))
            .thenAnswer(inv -> Outcome.of(inv.getArgument(1), 4.0, true, "neutral"));

        Map<String, List<Outcome>> scan = system.runScanRound(scanMarket, executor);

        List<Outcome> outcomes = scan.get("m5");
        assertEquals(2, outcomes.size());
        assertEquals("X", outcomes.get(0).itemId());
        assertEquals("Y", outcomes.get(1).itemId());
        verify(executor, times(2)).execute(eq(scanner), any(), eq(scanMarket));
        assertEquals(2, system.getLearningEngine().getOutcomeCount("m5"));
        assertEquals(2, scanner.getTradingStatistics().getTotalTrades());
        assertTrue(system.getLearningEngine().getPreferences("m5").getPreferredStrategies().isEmpty());
    }

    @Test
    void shouldUseDefaultScanLimit() {
        assertEquals(MerchantSystem.DEFAULT_MAX_DECISIONS, system.getMaxDecisions());
        assertThrows(IllegalArgumentException.class, () -> system.configureScan(-1, new Random(1)));

        system.configureScan(0, new Random(1));
        system.addAgent(cautious);
        assertTrue(system.runScanRound(market, executor).get("m1").isEmpty());
        verify(executor, never()).execute(any(), any(), any());
    }
}
