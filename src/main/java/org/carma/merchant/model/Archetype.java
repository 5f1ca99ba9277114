package org.carma.merchant.model;

import java.util.Locale;

/**
 * Trading archetypes a merchant personality can belong to.
 *
 * CUSTOM covers user-defined trait bundles; the decision engine treats it
 * like BALANCED when choosing a strategy.
 */
public enum Archetype {
    AGGRESSIVE("Aggressive"),
    CONSERVATIVE("Conservative"),
    BALANCED("Balanced"),
    OPPORTUNISTIC("Opportunistic"),
    CUSTOM("Custom");

    private final String displayName;

    Archetype(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse an archetype name case-insensitively.
     * Unknown or missing names resolve to BALANCED.
     */
    public static Archetype fromName(String name) {
        if (name == null || name.isBlank()) {
            return BALANCED;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return BALANCED;
        }
    }
}
