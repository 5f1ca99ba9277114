package org.carma.merchant.network;

import java.util.Locale;

public enum RelationshipType {
    NEUTRAL,
    FRIENDLY,
    RIVAL,
    ALLIED;

    /**
     * Parse a relationship type name case-insensitively.
     * @throws IllegalArgumentException for unknown names
     */
    public static RelationshipType fromName(String name) {
        if (name == null || name.isBlank()) {
            return NEUTRAL;
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
