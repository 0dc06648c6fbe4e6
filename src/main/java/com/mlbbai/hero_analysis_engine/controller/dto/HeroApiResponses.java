package com.mlbbai.hero_analysis_engine.controller.dto;

import com.mlbbai.hero_analysis_engine.model.HeroAnalysis;
import com.mlbbai.hero_analysis_engine.model.LeaderboardEntry;
import com.mlbbai.hero_analysis_engine.model.SnapshotStatus;
import com.mlbbai.hero_analysis_engine.model.SynergyReport;
import com.mlbbai.hero_analysis_engine.model.TierList;

import java.time.Instant;
import java.util.List;

/**
 * Response envelopes of the hero API.
 */
public final class HeroApiResponses {

    private HeroApiResponses() {
    }

    public record ServiceStatusResponse(String service,
                                        SnapshotStatus status,
                                        Instant lastUpdated,
                                        int heroCount,
                                        int consecutiveFailures,
                                        List<String> endpoints) {
    }

    public record HeroListResponse(int count, Instant lastUpdated, SnapshotStatus status, List<HeroDto> data) {
    }

    public record SearchResponse(String query, int count, List<HeroDto> data) {
    }

    public record HeroDetailResponse(String source, HeroDto data) {
    }

    public record TierListResponse(Instant lastUpdated, TierList data) {
    }

    public record LeaderboardResponse(Instant lastUpdated, int count, List<LeaderboardEntry> data) {
    }

    public record HeroAnalysisResponse(String source, HeroDto hero, HeroAnalysis analysis) {
    }

    public record SynergyResponse(String source, List<HeroDto> heroes, SynergyReport synergy) {
    }

    public record ScrapeResponse(String message) {
    }
}
