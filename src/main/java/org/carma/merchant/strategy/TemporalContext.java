package org.carma.merchant.strategy;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ambient key/value context for a turn. Only the season is read today.
 */
public final class TemporalContext {

    public static final String SEASON_KEY = "season";
    public static final String DEFAULT_SEASON = "spring";

    private static final TemporalContext EMPTY = new TemporalContext(Map.of());

    private final Map<String, String> values;

    private TemporalContext(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    public static TemporalContext empty() {
        return EMPTY;
    }

    public static TemporalContext ofSeason(String season) {
        if (season == null) {
            return EMPTY;
        }
        return new TemporalContext(Map.of(SEASON_KEY, season));
    }

    public static TemporalContext of(Map<String, String> values) {
        return new TemporalContext(values);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Current season, "spring" when absent.
     */
    public String getSeason() {
        return values.getOrDefault(SEASON_KEY, DEFAULT_SEASON);
    }

    @Override
    public String toString() {
        return "TemporalContext" + values;
    }
}
