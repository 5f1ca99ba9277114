package org.carma.merchant.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PersonalityProfileTest {

    @Test
    void shouldExposeBuiltInTraitTable() {
        PersonalityProfile aggressive = StandardPersonality.AGGRESSIVE;
        assertEquals(0.8, aggressive.getRiskTolerance());
        assertEquals(1.5, aggressive.getTradingFrequency());
        assertEquals(0.3, aggressive.getProfitMarginTarget());
        assertEquals(1.2, aggressive.getCompetitivenessFactor());
        assertEquals(0.5, aggressive.getPatienceFactor());

        assertEquals(0.2, StandardPersonality.CONSERVATIVE.getRiskTolerance());
        assertEquals(1.5, StandardPersonality.CONSERVATIVE.getPatienceFactor());
        assertEquals(0.4, StandardPersonality.BALANCED.getProfitMarginTarget());
        assertEquals(0.35, StandardPersonality.OPPORTUNISTIC.getProfitMarginTarget());
    }

    @Test
    void shouldKeepBuiltInRiskToleranceInUnitRange() {
        for (StandardPersonality p : StandardPersonality.values()) {
            assertTrue(p.getRiskTolerance() >= 0 && p.getRiskTolerance() <= 1, p.name());
            assertTrue(p.getTradingFrequency() > 0, p.name());
        }
    }

    @Test
    void shouldResolveArchetypesToBundles() {
        assertSame(StandardPersonality.OPPORTUNISTIC, StandardPersonality.of(Archetype.OPPORTUNISTIC));
        assertSame(StandardPersonality.BALANCED, StandardPersonality.of(Archetype.CUSTOM));
    }

    @Test
    void shouldParseArchetypeNamesLeniently() {
        assertEquals(Archetype.AGGRESSIVE, Archetype.fromName(" Aggressive "));
        assertEquals(Archetype.BALANCED, Archetype.fromName("reckless"));
        assertEquals(Archetype.BALANCED, Archetype.fromName(null));
    }

    @Test
    void shouldValidateCustomTraits() {
        CustomPersonality custom = new CustomPersonality("trader", 0.9, 2.0, 0.25, 1.4, 0.3);
        assertEquals(Archetype.CUSTOM, custom.getType());
        assertEquals(0.9, custom.getRiskTolerance());

        assertThrows(IllegalArgumentException.class,
            () -> new CustomPersonality("bad", 1.5, 1.0, 0.3, 1.0, 1.0));
        assertThrows(IllegalArgumentException.class,
            () -> new CustomPersonality("bad", 0.5, -1.0, 0.3, 1.0, 1.0));
    }

    @Test
    void shouldRejectInvalidDecisions() {
        assertThrows(IllegalArgumentException.class, () -> Decision.buy("a", -1, 10, 0.5, ""));
        assertThrows(IllegalArgumentException.class, () -> Decision.sell("a", 1, 10, 1.5, ""));
        assertEquals("", Decision.hold(0.3, null).reason());
    }

    @Test
    void shouldRejectNegativeCustomFactors() {
        assertThrows(IllegalArgumentException.class,
            () -> new CustomPersonality("odd", 0.5, 0.2, 0.4, -3.0, 1.0));
        assertThrows(IllegalArgumentException.class,
            () -> new CustomPersonality("odd", 0.5, 1.0, -0.1, 1.0, 1.0));
        assertThrows(IllegalArgumentException.class,
            () -> new CustomPersonality("odd", 0.5, 1.0, 0.3, 1.0, -1.0));
    }
}
