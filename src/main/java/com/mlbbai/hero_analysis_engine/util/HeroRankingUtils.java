package com.mlbbai.hero_analysis_engine.util;

import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.HeroTier;
import com.mlbbai.hero_analysis_engine.model.LeaderboardCategory;
import com.mlbbai.hero_analysis_engine.model.LeaderboardEntry;
import com.mlbbai.hero_analysis_engine.model.RateMetric;
import com.mlbbai.hero_analysis_engine.model.TierList;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure derivation of tiers, tier lists and leaderboards from a hero list.
 *
 * @author William Callahan
 *
 * Features:
 * - Win-rate thresholds: S+ at 56%, S at 53%, A at 51%, B at 49%, C below
 * - Tier list keeps the fixed label order and appends unknown labels as first seen
 * - Leaderboard takes the top ten per category using a stable descending sort
 */
public final class HeroRankingUtils {

    public static final int LEADERBOARD_SIZE = 10;

    private static final BigDecimal S_PLUS_MIN = new BigDecimal("56");
    private static final BigDecimal S_MIN = new BigDecimal("53");
    private static final BigDecimal A_MIN = new BigDecimal("51");
    private static final BigDecimal B_MIN = new BigDecimal("49");

    private HeroRankingUtils() {
    }

    /**
     * Classifies a win rate into a tier label.
     * The percentage is rounded to six decimals before comparison so that
     * values such as 0.51 land on the boundary they denote.
     *
     * @param winRate provider win rate
     * @return tier label, {@link HeroTier#UNRANKED} when the rate is unknown
     */
    public static String classifyTier(RateMetric winRate) {
        if (winRate == null || !winRate.known()) {
            return HeroTier.UNRANKED;
        }
        BigDecimal pct = BigDecimal.valueOf(winRate.raw()).movePointRight(2).setScale(6, RoundingMode.HALF_UP);
        if (pct.compareTo(S_PLUS_MIN) >= 0) {
            return HeroTier.S_PLUS;
        }
        if (pct.compareTo(S_MIN) >= 0) {
            return HeroTier.S;
        }
        if (pct.compareTo(A_MIN) >= 0) {
            return HeroTier.A;
        }
        if (pct.compareTo(B_MIN) >= 0) {
            return HeroTier.B;
        }
        return HeroTier.C;
    }

    public static TierList buildTierList(List<Hero> heroes) {
        Map<String, List<String>> buckets = new LinkedHashMap<>();
        HeroTier.ORDER.forEach(label -> buckets.put(label, new ArrayList<>()));
        for (Hero hero : heroes) {
            String label = ValidationUtils.hasText(hero.getTier()) ? hero.getTier() : HeroTier.UNRANKED;
            buckets.computeIfAbsent(label, k -> new ArrayList<>()).add(hero.getName());
        }
        return new TierList(buckets);
    }

    public static List<LeaderboardEntry> buildLeaderboard(List<Hero> heroes) {
        List<LeaderboardEntry> entries = new ArrayList<>();
        for (LeaderboardCategory category : LeaderboardCategory.values()) {
            List<Hero> ranked = heroes.stream()
                .sorted(Comparator.comparingDouble((Hero h) -> category.metricOf(h).raw()).reversed())
                .limit(LEADERBOARD_SIZE)
                .toList();
            for (int i = 0; i < ranked.size(); i++) {
                Hero hero = ranked.get(i);
                entries.add(new LeaderboardEntry(
                    i + 1,
                    hero.getName(),
                    category.getLabel(),
                    category.metricOf(hero).display(),
                    hero.getRole(),
                    hero.getImageRef()
                ));
            }
        }
        return List.copyOf(entries);
    }
}
