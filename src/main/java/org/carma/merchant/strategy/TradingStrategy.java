package org.carma.merchant.strategy;

import org.carma.merchant.model.Agent;
import org.carma.merchant.model.Decision;
import org.carma.merchant.model.ItemQuote;
import org.carma.merchant.model.MarketSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Evaluates a market snapshot into a single candidate decision.
 *
 * Implementations never return null: HOLD is the answer when nothing
 * qualifies. Confidence is always within [0, 1] and quantities are never
 * negative. Among candidates the strictly highest score wins, so the first
 * item in snapshot order wins a tie.
 */
public interface TradingStrategy {

    double NO_DATA_CONFIDENCE = 0.5;
    double NO_OPPORTUNITY_CONFIDENCE = 0.3;

    /**
     * Pick the best opportunity in the snapshot.
     * @param agent The agent deciding; only funds are read
     * @param snapshot Current market, never mutated
     * @param context Ambient turn context
     */
    Decision evaluate(Agent agent, MarketSnapshot snapshot, TemporalContext context);

    StrategyKind getKind();

    default String getName() {
        return getKind().strategyName();
    }

    static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    // ==========================================================================
    // STRATEGY IMPLEMENTATIONS
    // ==========================================================================

    /**
     * Value Strategy: buys items trading well below base price and sells
     * items trading well above it.
     */
    class ValueStrategy implements TradingStrategy {
        private static final double BUY_RATIO = 1.2;   // 20% undervalued
        private static final double SELL_RATIO = 0.8;  // 20% overvalued
        private static final int SELL_QUANTITY = 5;

        @Override
        public Decision evaluate(Agent agent, MarketSnapshot snapshot, TemporalContext context) {
            if (snapshot == null || snapshot.isEmpty()) {
                return Decision.hold(NO_DATA_CONFIDENCE, "No market data available");
            }

            int funds = agent.getFunds();
            Decision best = null;
            double bestScore = 0.0;

            for (ItemQuote item : snapshot.getItems()) {
                if (item.getCurrentPrice() <= 0) {
                    continue;
                }
                double valueRatio = item.getBasePrice() / item.getCurrentPrice();

                if (valueRatio > BUY_RATIO) {
                    int affordable = item.affordableUnits(funds);
                    double score = (valueRatio - 1.0) * item.getDemand() / (item.getSupply() + 1);
                    if (affordable >= 1 && score > bestScore) {
                        bestScore = score;
                        best = Decision.buy(item.getItemId(),
                            Math.max(1, affordable / 4),
                            item.getCurrentPrice(),
                            confidence(valueRatio),
                            "Undervalued item with good demand");
                    }
                }

                if (valueRatio < SELL_RATIO) {
                    double score = (1.0 - valueRatio) * item.getSupply() / (item.getDemand() + 1);
                    if (score > bestScore) {
                        bestScore = score;
                        best = Decision.sell(item.getItemId(),
                            SELL_QUANTITY,
                            item.getCurrentPrice(),
                            confidence(1.0 / valueRatio),
                            "Overvalued item with low demand");
                    }
                }
            }

            return best != null ? best : Decision.hold(NO_OPPORTUNITY_CONFIDENCE, "No valuable opportunities found");
        }

        static double confidence(double ratio) {
            return clamp01((ratio - 1.0) * 0.5);
        }

        @Override
        public StrategyKind getKind() {
            return StrategyKind.VALUE;
        }
    }

    /**
     * Momentum Strategy: follows the most recent price move.
     * Needs at least two history points per item.
     */
    class MomentumStrategy implements TradingStrategy {
        private static final double THRESHOLD = 0.1;  // 10% move
        private static final int SELL_QUANTITY = 10;

        @Override
        public Decision evaluate(Agent agent, MarketSnapshot snapshot, TemporalContext context) {
            if (snapshot == null || snapshot.isEmpty()) {
                return Decision.hold(NO_DATA_CONFIDENCE, "No market data available");
            }

            int funds = agent.getFunds();
            Decision best = null;
            double bestScore = 0.0;

            for (ItemQuote item : snapshot.getItems()) {
                if (item.getPriceHistory().size() < 2 || item.getCurrentPrice() <= 0) {
                    continue;
                }
                double momentum = momentum(item.getPriceHistory());

                if (momentum > THRESHOLD) {
                    int affordable = item.affordableUnits(funds);
                    if (affordable >= 1 && momentum > bestScore) {
                        bestScore = momentum;
                        best = Decision.buy(item.getItemId(),
                            buyQuantity(affordable, momentum),
                            item.getCurrentPrice(),
                            clamp01(momentum * 2),
                            "Strong upward price momentum");
                    }
                }

                if (momentum < -THRESHOLD) {
                    double magnitude = -momentum;
                    if (magnitude > bestScore) {
                        bestScore = magnitude;
                        best = Decision.sell(item.getItemId(),
                            SELL_QUANTITY,
                            item.getCurrentPrice(),
                            clamp01(magnitude * 2),
                            "Strong downward price momentum");
                    }
                }
            }

            return best != null ? best : Decision.hold(NO_OPPORTUNITY_CONFIDENCE, "No strong momentum detected");
        }

        /**
         * Relative change between the last two prices; 0 when the earlier one is 0.
         */
        static double momentum(List<Double> history) {
            if (history.size() < 2) {
                return 0.0;
            }
            double recent = history.get(history.size() - 1);
            double previous = history.get(history.size() - 2);
            if (previous == 0) {
                return 0.0;
            }
            return (recent - previous) / previous;
        }

        // Capped at half of what is affordable, but never below one unit
        static int buyQuantity(int affordable, double momentum) {
            int quantity = (int) (affordable * momentum * 2);
            quantity = Math.min(quantity, affordable / 2);
            return Math.max(1, quantity);
        }

        @Override
        public StrategyKind getKind() {
            return StrategyKind.MOMENTUM;
        }
    }

    /**
     * Seasonal Strategy: buys in-season items and sells out-of-season ones.
     * The season comes from the temporal context.
     */
    class SeasonalStrategy implements TradingStrategy {
        private static final double IN_SEASON = 0.8;
        private static final double THRESHOLD = 0.5;
        private static final int SELL_QUANTITY = 5;

        private static final Map<String, String> OPPOSITE_SEASONS = Map.of(
            "summer", "winter",
            "winter", "summer",
            "spring", "autumn",
            "autumn", "spring"
        );

        @Override
        public Decision evaluate(Agent agent, MarketSnapshot snapshot, TemporalContext context) {
            if (snapshot == null || snapshot.isEmpty()) {
                return Decision.hold(NO_DATA_CONFIDENCE, "No market data available");
            }

            String season = context != null ? context.getSeason() : TemporalContext.DEFAULT_SEASON;
            int funds = agent.getFunds();
            Decision best = null;
            double bestScore = 0.0;

            for (ItemQuote item : snapshot.getItems()) {
                if (item.getCurrentPrice() <= 0) {
                    continue;
                }
                double score = seasonalScore(item, season);

                if (score > THRESHOLD && score > bestScore) {
                    int affordable = item.affordableUnits(funds);
                    if (affordable >= 1) {
                        bestScore = score;
                        best = Decision.buy(item.getItemId(),
                            Math.max(1, (int) (affordable * score * 0.3)),
                            item.getCurrentPrice(),
                            clamp01(score),
                            "Seasonal item in high demand");
                    }
                } else if (score < -THRESHOLD && -score > bestScore) {
                    bestScore = -score;
                    best = Decision.sell(item.getItemId(),
                        SELL_QUANTITY,
                        item.getCurrentPrice(),
                        clamp01(-score),
                        "Out of season item");
                }
            }

            return best != null ? best : Decision.hold(NO_OPPORTUNITY_CONFIDENCE, "No seasonal opportunities");
        }

        /**
         * Score an item for a season. The first tag naming the season or its
         * opposite decides; otherwise potions sell in winter and summer and
         * food at harvest.
         */
        static double seasonalScore(ItemQuote item, String season) {
            String opposite = OPPOSITE_SEASONS.get(season);
            for (String tag : item.getTags()) {
                if (tag.equals(season)) {
                    return IN_SEASON;
                }
                if (tag.equals(opposite)) {
                    return -IN_SEASON;
                }
            }

            switch (item.getCategory()) {
                case "Potion":
                    return "winter".equals(season) || "summer".equals(season) ? 0.4 : 0.0;
                case "Food":
                    return "autumn".equals(season) ? 0.6 : 0.0;
                default:
                    return 0.0;
            }
        }

        @Override
        public StrategyKind getKind() {
            return StrategyKind.SEASONAL;
        }
    }
}
