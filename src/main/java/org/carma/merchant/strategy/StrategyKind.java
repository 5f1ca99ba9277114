package org.carma.merchant.strategy;

import java.util.Locale;

/**
 * Interchangeable trading evaluators known to the decision engine.
 */
public enum StrategyKind {
    VALUE,
    MOMENTUM,
    SEASONAL;

    /** Lower-case name used in preferences and logs. */
    public String strategyName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
