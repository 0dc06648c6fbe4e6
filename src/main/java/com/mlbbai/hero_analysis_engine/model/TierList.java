package com.mlbbai.hero_analysis_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered mapping of tier label to hero names. Iteration order is the
 * presentation order; only non-empty buckets are present.
 */
public final class TierList {

    private static final TierList EMPTY = new TierList(Map.of());

    private final Map<String, List<String>> buckets;

    public TierList(Map<String, List<String>> buckets) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        buckets.forEach((label, names) -> {
            if (names != null && !names.isEmpty()) {
                copy.put(label, List.copyOf(names));
            }
        });
        this.buckets = Collections.unmodifiableMap(copy);
    }

    public static TierList empty() {
        return EMPTY;
    }

    @JsonValue
    public Map<String, List<String>> asMap() {
        return buckets;
    }

    public List<String> labels() {
        return List.copyOf(buckets.keySet());
    }

    public List<String> heroesIn(String label) {
        return buckets.getOrDefault(label, List.of());
    }

    public int heroCount() {
        return buckets.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof TierList other && buckets.equals(other.buckets);
    }

    @Override
    public int hashCode() {
        return buckets.hashCode();
    }

    @Override
    public String toString() {
        return "TierList" + buckets;
    }
}
