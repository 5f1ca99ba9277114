package org.carma.merchant.mechanism;

import org.carma.merchant.model.Agent;
import org.carma.merchant.model.Decision;
import org.carma.merchant.model.DecisionType;
import org.carma.merchant.model.ItemQuote;
import org.carma.merchant.model.MarketSnapshot;
import org.carma.merchant.model.StandardPersonality;
import org.carma.merchant.strategy.StrategyKind;
import org.carma.merchant.strategy.TemporalContext;
import org.carma.merchant.strategy.TradingStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DecisionEngineTest {

    private DecisionEngine engine;
    private MarketSnapshot valueMarket;

    @BeforeEach
    void setUp() {
        engine = new DecisionEngine();
        valueMarket = MarketSnapshot.of(
            ItemQuote.builder("A").basePrice(100).currentPrice(80).demand(50).supply(30).build(),
            ItemQuote.builder("B").basePrice(100).currentPrice(120).demand(30).supply(50).build());
    }

    // ===== Market evaluation =====

    @Test
    void shouldScoreEmptyMarketAsNeutral() {
        assertEquals(0.5, engine.evaluateMarket(MarketSnapshot.empty()));
        assertEquals(MarketCondition.NEUTRAL, engine.classify(0.5));
    }

    @Test
    void shouldIgnoreItemsWithoutBasePrice() {
        MarketSnapshot snapshot = MarketSnapshot.of(
            ItemQuote.builder("nobase").basePrice(0).currentPrice(10).build());
        assertEquals(DecisionEngine.NEUTRAL_MARKET_SCORE, engine.evaluateMarket(snapshot));
    }

    @Test
    void shouldAverageClampedItemScores() {
        // A clamps to 1.0, B scores (1.2 + 30/51) / 2
        double expected = (1.0 + (1.2 + 30.0 / 51) / 2) / 2;
        assertEquals(expected, engine.evaluateMarket(valueMarket), 1e-9);
        assertEquals(MarketCondition.BULLISH, engine.classify(engine.evaluateMarket(valueMarket)));
    }

    @Test
    void shouldClassifyAtStrictThresholds() {
        assertEquals(MarketCondition.NEUTRAL, engine.classify(0.7));
        assertEquals(MarketCondition.BULLISH, engine.classify(0.71));
        assertEquals(MarketCondition.NEUTRAL, engine.classify(0.3));
        assertEquals(MarketCondition.BEARISH, engine.classify(0.29));
    }

    // ===== Strategy selection =====

    @Test
    void shouldSelectStrategyByArchetypeAndCondition() {
        assertEquals(StrategyKind.MOMENTUM,
            engine.selectStrategyKind(StandardPersonality.AGGRESSIVE, MarketCondition.BULLISH));
        assertEquals(StrategyKind.VALUE,
            engine.selectStrategyKind(StandardPersonality.AGGRESSIVE, MarketCondition.NEUTRAL));
        assertEquals(StrategyKind.VALUE,
            engine.selectStrategyKind(StandardPersonality.CONSERVATIVE, MarketCondition.BULLISH));
        assertEquals(StrategyKind.VALUE,
            engine.selectStrategyKind(StandardPersonality.OPPORTUNISTIC, MarketCondition.BEARISH));
        assertEquals(StrategyKind.MOMENTUM,
            engine.selectStrategyKind(StandardPersonality.OPPORTUNISTIC, MarketCondition.NEUTRAL));
        assertEquals(StrategyKind.SEASONAL,
            engine.selectStrategyKind(StandardPersonality.BALANCED, MarketCondition.BEARISH));
    }

    @Test
    void shouldFallBackToValueWhenSeasonalIsMissing() {
        engine.unregister(StrategyKind.SEASONAL);

        assertFalse(engine.hasStrategy(StrategyKind.SEASONAL));
        assertEquals(StrategyKind.VALUE,
            engine.selectStrategy(StandardPersonality.BALANCED, MarketCondition.NEUTRAL).getKind());
    }

    @Test
    void shouldFallBackToValueWhenMomentumIsMissing() {
        engine.unregister(StrategyKind.MOMENTUM);

        assertEquals(StrategyKind.VALUE,
            engine.selectStrategy(StandardPersonality.AGGRESSIVE, MarketCondition.BULLISH).getKind());
    }

    @Test
    void shouldProtectValueStrategy() {
        assertThrows(IllegalStateException.class, () -> engine.unregister(StrategyKind.VALUE));
        assertThrows(IllegalArgumentException.class,
            () -> new DecisionEngine(List.of(new TradingStrategy.MomentumStrategy())));
        assertTrue(engine.getRegisteredKinds().contains(StrategyKind.VALUE));
    }

    // ===== Single decisions =====

    @Test
    void conservativeMerchantShouldBuyUndervaluedItem() {
        Agent agent = new Agent("m1", "Cara", 1000, StandardPersonality.CONSERVATIVE);

        Decision decision = engine.decide(agent, valueMarket);

        assertEquals(DecisionType.BUY, decision.type());
        assertEquals("A", decision.itemId());
        // round(3 * 0.7) units, confidence 0.125 * 0.7
        assertEquals(2, decision.quantity());
        assertEquals(0.0875, decision.confidence(), 1e-9);
    }

    @Test
    void aggressiveMerchantShouldHoldInBullishMarketWithoutHistory() {
        Agent agent = new Agent("m1", "Alice", 1000, StandardPersonality.AGGRESSIVE);

        Decision decision = engine.decide(agent, valueMarket);

        assertTrue(decision.isHold());
        assertEquals(0.45, decision.confidence(), 1e-9);
    }

    @Test
    void shouldDelegateToSelectedStrategyWithContext() {
        TradingStrategy strategy = mock(TradingStrategy.class);
        when(strategy.getKind()).thenReturn(StrategyKind.VALUE);
        when(strategy.evaluate(any(), any(), any()))
            .thenReturn(Decision.sell("B", 4, 120, 0.5, "stub"));
        DecisionEngine stubbed = new DecisionEngine(List.of(strategy));
        Agent agent = new Agent("m1", "Cara", 1000, StandardPersonality.CONSERVATIVE);
        TemporalContext winter = TemporalContext.ofSeason("winter");

        Decision decision = stubbed.decide(agent, valueMarket, winter);

        verify(strategy).evaluate(eq(agent), eq(valueMarket), eq(winter));
        assertEquals(DecisionType.SELL, decision.type());
        assertEquals(3, decision.quantity());
        assertEquals(0.35, decision.confidence(), 1e-9);
    }

    @Test
    void shouldClampModifiedConfidence() {
        Decision raw = Decision.buy("A", 10, 80, 0.8, "");

        Decision modified = engine.applyPersonalityModifiers(raw, StandardPersonality.AGGRESSIVE);

        assertEquals(13, modified.quantity());
        assertEquals(1.0, modified.confidence());
        assertEquals("A", modified.itemId());
    }

    // ===== Multi-decision scan =====

    @Test
    void shouldScanItemsInOrderUpToLimit() {
        Agent agent = new Agent("m1", "Bob", 1000, StandardPersonality.BALANCED);
        MarketSnapshot snapshot = MarketSnapshot.of(
            ItemQuote.builder("X").basePrice(100).currentPrice(150).volatility(0.2).build(),
            ItemQuote.builder("Y").basePrice(100).currentPrice(90).volatility(0.1).build(),
            ItemQuote.builder("Z").basePrice(100).currentPrice(50).volatility(0.1).build());

        List<Decision> decisions = engine.decideMany(agent, snapshot, 2, new Random(7));

        assertEquals(2, decisions.size());
        Decision sell = decisions.get(0);
        assertEquals(DecisionType.SELL, sell.type());
        assertEquals("X", sell.itemId());
        assertEquals(5, sell.quantity());

        Decision buy = decisions.get(1);
        assertEquals(DecisionType.BUY, buy.type());
        assertEquals("Y", buy.itemId());
        assertEquals(1, buy.quantity());
        assertTrue(buy.confidence() >= 0.85 && buy.confidence() <= 0.95, "confidence " + buy.confidence());
    }

    @Test
    void shouldBeReproducibleForSameSeed() {
        Agent agent = new Agent("m1", "Bob", 1000, StandardPersonality.OPPORTUNISTIC);
        MarketSnapshot snapshot = MarketSnapshot.of(
            ItemQuote.builder("X").basePrice(100).currentPrice(95).volatility(0.3).build(),
            ItemQuote.builder("Y").basePrice(100).currentPrice(140).volatility(0.6).build());

        List<Decision> first = engine.decideMany(agent, snapshot, 5, new Random(42));
        List<Decision> second = engine.decideMany(agent, snapshot, 5, new Random(42));

        assertEquals(first, second);
    }

    @Test
    void shouldReturnNothingForNonPositiveLimit() {
        Agent agent = new Agent("m1", "Bob", 1000, StandardPersonality.BALANCED);
        assertTrue(engine.decideMany(agent, valueMarket, 0, new Random(1)).isEmpty());
    }

    @Test
    void shouldSizeSellsByArchetype() {
        assertEquals(10, engine.sellQuantity(StandardPersonality.AGGRESSIVE));
        assertEquals(2, engine.sellQuantity(StandardPersonality.CONSERVATIVE));
        assertEquals(5, engine.sellQuantity(StandardPersonality.OPPORTUNISTIC));
    }

    @Test
    void riskTolerantMerchantsShouldAcceptSmallerDiscounts() {
        ItemQuote slightDiscount = ItemQuote.builder("X").basePrice(100).currentPrice(97).build();

        assertTrue(engine.shouldBuy(StandardPersonality.AGGRESSIVE, slightDiscount, 1000));
        assertFalse(engine.shouldBuy(StandardPersonality.CONSERVATIVE, slightDiscount, 1000));
        assertFalse(engine.shouldBuy(StandardPersonality.AGGRESSIVE, slightDiscount, 50));
    }

    @Test
    void shouldReportStrategyThatDecided() {
        Agent balanced = new Agent("m1", "Bob", 1000, StandardPersonality.BALANCED);

        StrategyDecision seasonal = engine.decideWithStrategy(balanced, valueMarket, TemporalContext.empty());
        assertEquals(StrategyKind.SEASONAL, seasonal.strategy());
        assertTrue(seasonal.decision().isHold());

        engine.unregister(StrategyKind.SEASONAL);
        StrategyDecision fallback = engine.decideWithStrategy(balanced, valueMarket, TemporalContext.empty());
        assertEquals(StrategyKind.VALUE, fallback.strategy());
        assertEquals("A", fallback.decision().itemId());
        assertEquals(fallback.decision(), engine.decide(balanced, valueMarket));
    }
}
