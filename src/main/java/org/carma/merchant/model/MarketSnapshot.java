package org.carma.merchant.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the market for one turn. Item order is significant:
 * multi-decision scans walk the items in this order.
 */
public final class MarketSnapshot {

    private static final MarketSnapshot EMPTY = new MarketSnapshot(List.of());

    private final List<ItemQuote> items;

    public MarketSnapshot(List<ItemQuote> items) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static MarketSnapshot of(ItemQuote... items) {
        return new MarketSnapshot(List.of(items));
    }

    public static MarketSnapshot empty() {
        return EMPTY;
    }

    public List<ItemQuote> getItems() {
        return items;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    public Optional<ItemQuote> find(String itemId) {
        return items.stream().filter(i -> i.getItemId().equals(itemId)).findFirst();
    }

    @Override
    public String toString() {
        return String.format("MarketSnapshot[%d items]", items.size());
    }
}
