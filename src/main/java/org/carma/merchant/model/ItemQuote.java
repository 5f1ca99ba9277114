package org.carma.merchant.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Market data for a single item as seen in one turn.
 */
public final class ItemQuote {

    private final String itemId;
    private final double currentPrice;
    private final double basePrice;
    private final int supply;
    private final int demand;
    private final double volatility;
    private final List<Double> priceHistory;
    private final String category;
    private final List<String> tags;

    private ItemQuote(Builder builder) {
        this.itemId = Objects.requireNonNull(builder.itemId, "Item ID cannot be null");
        if (builder.supply < 0) throw new IllegalArgumentException("Supply cannot be negative");
        if (builder.demand < 0) throw new IllegalArgumentException("Demand cannot be negative");
        this.currentPrice = builder.currentPrice;
        this.basePrice = builder.basePrice;
        this.supply = builder.supply;
        this.demand = builder.demand;
        this.volatility = builder.volatility;
        this.priceHistory = Collections.unmodifiableList(new ArrayList<>(builder.priceHistory));
        this.category = builder.category;
        this.tags = Collections.unmodifiableList(new ArrayList<>(builder.tags));
    }

    public static Builder builder(String itemId) {
        return new Builder(itemId);
    }

    public String getItemId() { return itemId; }
    public double getCurrentPrice() { return currentPrice; }
    public double getBasePrice() { return basePrice; }
    public int getSupply() { return supply; }
    public int getDemand() { return demand; }
    public double getVolatility() { return volatility; }
    /** Oldest first. */
    public List<Double> getPriceHistory() { return priceHistory; }
    public String getCategory() { return category; }
    public List<String> getTags() { return tags; }

    /**
     * Whole units purchasable with the given funds; 0 for non-positive prices.
     */
    public int affordableUnits(int funds) {
        if (currentPrice <= 0 || funds <= 0) {
            return 0;
        }
        return (int) (funds / currentPrice);
    }

    @Override
    public String toString() {
        return String.format("ItemQuote[%s: %.2f (base %.2f), supply=%d, demand=%d]",
            itemId, currentPrice, basePrice, supply, demand);
    }

    public static class Builder {
        private final String itemId;
        private double currentPrice;
        private double basePrice;
        private int supply;
        private int demand;
        private double volatility;
        private List<Double> priceHistory = List.of();
        private String category = "";
        private List<String> tags = List.of();

        private Builder(String itemId) {
            this.itemId = itemId;
        }

        public Builder currentPrice(double currentPrice) {
            this.currentPrice = currentPrice;
            return this;
        }

        public Builder basePrice(double basePrice) {
            this.basePrice = basePrice;
            return this;
        }

        public Builder supply(int supply) {
            this.supply = supply;
            return this;
        }

        public Builder demand(int demand) {
            this.demand = demand;
            return this;
        }

        public Builder volatility(double volatility) {
            this.volatility = volatility;
            return this;
        }

        public Builder priceHistory(List<Double> priceHistory) {
            this.priceHistory = Objects.requireNonNull(priceHistory);
            return this;
        }

        public Builder priceHistory(double... prices) {
            List<Double> history = new ArrayList<>(prices.length);
            for (double p : prices) {
                history.add(p);
            }
            this.priceHistory = history;
            return this;
        }

        public Builder category(String category) {
            this.category = category != null ? category : "";
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = List.of(tags);
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = Objects.requireNonNull(tags);
            return this;
        }

        public ItemQuote build() {
            return new ItemQuote(this);
        }
    }
}
