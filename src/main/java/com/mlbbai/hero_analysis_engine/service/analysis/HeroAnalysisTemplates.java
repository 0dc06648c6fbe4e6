package com.mlbbai.hero_analysis_engine.service.analysis;

import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.HeroAnalysis;
import com.mlbbai.hero_analysis_engine.model.SynergyReport;
import com.mlbbai.hero_analysis_engine.util.ValidationUtils;

import java.util.List;

/**
 * Deterministic reports used when the generative backend is disabled or exhausted.
 * Output depends only on the heroes' known fields.
 */
public final class HeroAnalysisTemplates {

    public static final int FALLBACK_SYNERGY_SCORE = 65;

    private HeroAnalysisTemplates() {
    }

    public static HeroAnalysis heroAnalysis(Hero hero) {
        String role = hero.getRole();
        boolean knownRole = ValidationUtils.hasText(role) && !Hero.UNKNOWN_ROLE.equals(role);
        return new HeroAnalysis(
            hero.getName() + " is a " + (knownRole ? role : "versatile") + " hero in the current meta.",
            "Focus on objectives and team coordination.",
            List.of("Strong kit", "Good scaling", "Team utility"),
            List.of("Situational", "Requires practice", "Item dependent"),
            "Farm efficiently and secure early objectives.",
            "Capitalize on power spikes and teamfights.",
            List.of("Master your skill combos", "Communicate with team", "Watch the minimap"),
            "Solid pick in the current meta.",
            HeroAnalysis.DEFAULT_DIFFICULTY
        );
    }

    public static SynergyReport synergyReport(Hero first, Hero second) {
        return new SynergyReport(
            FALLBACK_SYNERGY_SCORE,
            first.getName() + " and " + second.getName() + " can work well together with coordination.",
            "Combine abilities for maximum effect in team fights.",
            "Flexible lane assignments based on enemy picks.",
            List.of("Complementary kits", "Good team fight presence"),
            List.of("Requires coordination", "Can be countered by CC"),
            "Split push to avoid their team fight strength.",
            "Communicate cooldowns before engaging."
        );
    }
}
