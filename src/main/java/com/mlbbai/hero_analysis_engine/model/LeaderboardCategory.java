package com.mlbbai.hero_analysis_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.function.Function;

/**
 * Leaderboard categories, declared in output order.
 */
public enum LeaderboardCategory {
    WIN_RATE("Top Win Rate", Hero::getWinRate),
    BAN_RATE("Most Banned", Hero::getBanRate),
    PICK_RATE("Most Picked", Hero::getPickRate);

    private final String label;
    private final Function<Hero, RateMetric> metric;

    LeaderboardCategory(String label, Function<Hero, RateMetric> metric) {
        this.label = label;
        this.metric = metric;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public RateMetric metricOf(Hero hero) {
        RateMetric value = metric.apply(hero);
        return value == null ? RateMetric.unknown() : value;
    }
}
