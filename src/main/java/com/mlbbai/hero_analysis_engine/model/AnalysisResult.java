package com.mlbbai.hero_analysis_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Wraps an analysis report with where it came from and when it was produced.
 *
 * @param origin MODEL when parsed from backend output, FALLBACK when templated
 * @param report the {@link HeroAnalysis} or {@link SynergyReport}
 * @param generatedAt creation time
 */
public record AnalysisResult<T>(Origin origin, T report, Instant generatedAt) {

    public enum Origin {
        MODEL,
        FALLBACK
    }

    public static <T> AnalysisResult<T> fromModel(T report, Instant now) {
        return new AnalysisResult<>(Origin.MODEL, report, now);
    }

    public static <T> AnalysisResult<T> fallback(T report, Instant now) {
        return new AnalysisResult<>(Origin.FALLBACK, report, now);
    }

    @JsonIgnore
    public boolean isFallback() {
        return origin == Origin.FALLBACK;
    }
}
