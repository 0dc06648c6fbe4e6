package com.mlbbai.hero_analysis_engine.model;

/**
 * One ranked row of a leaderboard category. Rank is 1-based within its category.
 */
public record LeaderboardEntry(int rank,
                               String name,
                               String category,
                               String metricValue,
                               String role,
                               String imageRef) {
}
