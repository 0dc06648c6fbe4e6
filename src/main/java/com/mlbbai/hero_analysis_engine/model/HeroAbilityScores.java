package com.mlbbai.hero_analysis_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Provider ability ratings of a hero. Missing ratings are 0.
 */
public record HeroAbilityScores(int durability, int offense, int control, int mobility, int support) {

    private static final HeroAbilityScores NONE = new HeroAbilityScores(0, 0, 0, 0, 0);

    public static HeroAbilityScores none() {
        return NONE;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return durability == 0 && offense == 0 && control == 0 && mobility == 0 && support == 0;
    }
}
