package org.carma.merchant.model;

import java.util.Objects;

/**
 * A proposed trading action. Produced per evaluation and never retained by
 * the engine that produced it.
 */
public record Decision(
        DecisionType type,
        String itemId,
        int quantity,
        double price,
        double confidence,
        String reason
) {

    public Decision {
        Objects.requireNonNull(type, "Decision type cannot be null");
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + quantity);
        }
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Confidence must be in [0, 1]: " + confidence);
        }
        itemId = itemId != null ? itemId : "";
        reason = reason != null ? reason : "";
    }

    public static Decision hold(double confidence, String reason) {
        return new Decision(DecisionType.HOLD, "", 0, 0.0, confidence, reason);
    }

    public static Decision buy(String itemId, int quantity, double price, double confidence, String reason) {
        return new Decision(DecisionType.BUY, itemId, quantity, price, confidence, reason);
    }

    public static Decision sell(String itemId, int quantity, double price, double confidence, String reason) {
        return new Decision(DecisionType.SELL, itemId, quantity, price, confidence, reason);
    }

    public boolean isHold() {
        return type == DecisionType.HOLD;
    }

    /**
     * Copy with adjusted quantity and confidence, as done by personality modifiers.
     */
    public Decision withSizing(int newQuantity, double newConfidence) {
        return new Decision(type, itemId, newQuantity, price, newConfidence, reason);
    }

    @Override
    public String toString() {
        if (isHold()) {
            return String.format("Decision[HOLD, conf=%.2f, %s]", confidence, reason);
        }
        return String.format("Decision[%s %dx %s @ %.2f, conf=%.2f, %s]",
            type, quantity, itemId, price, confidence, reason);
    }
}
