package com.mlbbai.hero_analysis_engine.model;

import java.util.List;

/**
 * Structured two-hero synergy report. Score is always within 0..100.
 */
public record SynergyReport(int synergyScore,
                            String verdict,
                            String comboPotential,
                            String laneRecommendation,
                            List<String> strengths,
                            List<String> weaknesses,
                            String counterStrategy,
                            String tip) {

    public SynergyReport {
        synergyScore = Math.max(0, Math.min(100, synergyScore));
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
    }
}
