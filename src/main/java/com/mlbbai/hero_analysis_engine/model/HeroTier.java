package com.mlbbai.hero_analysis_engine.model;

import java.util.List;

/**
 * Tier labels in their fixed presentation order.
 */
public final class HeroTier {

    public static final String S_PLUS = "S+";
    public static final String S = "S";
    public static final String A = "A";
    public static final String B = "B";
    public static final String C = "C";
    public static final String UNRANKED = "Unranked";

    public static final List<String> ORDER = List.of(S_PLUS, S, A, B, C, UNRANKED);

    private HeroTier() {
        // Constants holder
    }
}
