package com.mlbbai.hero_analysis_engine.service.analysis;

import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.HeroAbilityScores;
import com.mlbbai.hero_analysis_engine.model.HeroDetail;
import com.mlbbai.hero_analysis_engine.model.RateMetric;

/**
 * Prompt text for hero analyses and synergy reports.
 */
public final class HeroAnalysisPrompts {
    private HeroAnalysisPrompts() {}

    public static String buildSystemPrompt() {
        return "You are an elite Mobile Legends: Bang Bang analyst with deep knowledge of the current meta. "
            + "Return ONLY valid JSON, no markdown, no extra text.";
    }

    public static String buildHeroPrompt(Hero hero) {
        StringBuilder sb = new StringBuilder();
        sb.append("Hero Data:\n");
        sb.append("- Name: ").append(safe(hero.getName())).append("\n");
        sb.append("- Role: ").append(orUnknown(hero.getRole())).append("\n");
        sb.append("- Win Rate: ").append(rate(hero.getWinRate())).append("\n");
        sb.append("- Ban Rate: ").append(rate(hero.getBanRate())).append("\n");
        sb.append("- Pick Rate: ").append(rate(hero.getPickRate())).append("\n");
        sb.append("- Tier: ").append(safe(hero.getTier())).append("\n");

        HeroDetail detail = hero.getDetail();
        if (detail != null) {
            HeroAbilityScores scores = detail.getAbilityScores();
            if (scores != null && !scores.isEmpty()) {
                sb.append("- Ability Scores: Durability ").append(scores.durability())
                    .append(", Offense ").append(scores.offense())
                    .append(", Control ").append(scores.control())
                    .append(", Mobility ").append(scores.mobility())
                    .append(", Support ").append(scores.support()).append("\n");
            }
            if (!detail.getItemBuild().isEmpty()) {
                sb.append("- Recommended Build: ").append(String.join(", ", detail.getItemBuild())).append("\n");
            }
        }

        sb.append("\nProvide a comprehensive analysis as JSON with exactly these fields:\n");
        sb.append("{\n");
        sb.append("  \"overview\": \"2-3 sentences on this hero's identity and current meta role\",\n");
        sb.append("  \"playstyle\": \"How to play effectively: key mechanics, skill order and combos\",\n");
        sb.append("  \"strengths\": [\"strength 1\", \"strength 2\", \"strength 3\"],\n");
        sb.append("  \"weaknesses\": [\"weakness 1\", \"weakness 2\", \"weakness 3\"],\n");
        sb.append("  \"earlyGame\": \"Early game strategy and laning priorities\",\n");
        sb.append("  \"lateGame\": \"Late game impact and win conditions\",\n");
        sb.append("  \"tips\": [\"actionable tip 1\", \"actionable tip 2\", \"actionable tip 3\"],\n");
        sb.append("  \"metaRating\": \"One sentence verdict on their current meta standing\",\n");
        sb.append("  \"difficulty\": \"Easy | Medium | Hard | Expert\"\n");
        sb.append("}\n");
        return sb.toString();
    }

    public static String buildSynergyPrompt(Hero first, Hero second) {
        StringBuilder sb = new StringBuilder();
        sb.append("Analyze the team synergy between:\n");
        appendSynergyHero(sb, 1, first);
        appendSynergyHero(sb, 2, second);
        sb.append("\nReturn JSON with exactly these fields:\n");
        sb.append("{\n");
        sb.append("  \"synergyScore\": 78,\n");
        sb.append("  \"verdict\": \"One sentence verdict on this combo's viability\",\n");
        sb.append("  \"comboPotential\": \"Specific ability interaction or combo sequence between these two heroes\",\n");
        sb.append("  \"laneRecommendation\": \"Best lane/role assignments for this duo\",\n");
        sb.append("  \"strengths\": [\"combined strength 1\", \"combined strength 2\"],\n");
        sb.append("  \"weaknesses\": [\"combined weakness 1\", \"combined weakness 2\"],\n");
        sb.append("  \"counterStrategy\": \"How opponents should play against this duo\",\n");
        sb.append("  \"tip\": \"One key tip to maximize this combo's effectiveness\"\n");
        sb.append("}\n");
        sb.append("\nsynergyScore: 0-100 integer. Be specific to these heroes, not generic.\n");
        return sb.toString();
    }

    private static void appendSynergyHero(StringBuilder sb, int position, Hero hero) {
        sb.append("Hero ").append(position).append(": ").append(safe(hero.getName()))
            .append(" (").append(orUnknown(hero.getRole())).append(")")
            .append(", Win Rate: ").append(rate(hero.getWinRate()))
            .append(", Tier: ").append(safe(hero.getTier()))
            .append("\n");
    }

    private static String rate(RateMetric metric) {
        return metric == null || !metric.known() ? "N/A" : metric.display();
    }

    private static String orUnknown(String role) {
        String value = safe(role);
        return value.isEmpty() || Hero.UNKNOWN_ROLE.equals(value) ? "Unknown" : value;
    }

    private static String safe(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r", " ")
                .replace("\n", " ")
                .trim();
    }
}
