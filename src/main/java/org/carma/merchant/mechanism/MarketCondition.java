package org.carma.merchant.mechanism;

/**
 * Coarse market classification derived from the overall market score.
 */
public enum MarketCondition {
    BULLISH,
    NEUTRAL,
    BEARISH;

    public static final double BULLISH_THRESHOLD = 0.7;
    public static final double BEARISH_THRESHOLD = 0.3;

    public static MarketCondition classify(double marketScore) {
        if (marketScore > BULLISH_THRESHOLD) {
            return BULLISH;
        }
        if (marketScore < BEARISH_THRESHOLD) {
            return BEARISH;
        }
        return NEUTRAL;
    }
}
