package com.mlbbai.hero_analysis_engine.model;

import java.util.List;
import java.util.Set;

/**
 * Structured single-hero analysis, either parsed from model output or built
 * from the fallback template.
 */
public record HeroAnalysis(String overview,
                           String playstyle,
                           List<String> strengths,
                           List<String> weaknesses,
                           String earlyGame,
                           String lateGame,
                           List<String> tips,
                           String metaRating,
                           String difficulty) {

    public static final Set<String> DIFFICULTIES = Set.of("Easy", "Medium", "Hard", "Expert");
    public static final String DEFAULT_DIFFICULTY = "Medium";

    public HeroAnalysis {
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        tips = tips == null ? List.of() : List.copyOf(tips);
    }
}
