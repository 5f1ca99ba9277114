package org.carma.merchant.network;

import java.util.Objects;

/**
 * Market information shared by one merchant with its relations.
 */
public record InformationPacket(
        String itemId,
        double priceChange,
        String sourceId,
        double reliability,
        long timestamp
) {

    public InformationPacket {
        Objects.requireNonNull(itemId, "Item ID cannot be null");
        Objects.requireNonNull(sourceId, "Source ID cannot be null");
        if (!(reliability >= 0.0 && reliability <= 1.0)) {
            throw new IllegalArgumentException("Reliability must be in [0, 1]: " + reliability);
        }
    }
}
