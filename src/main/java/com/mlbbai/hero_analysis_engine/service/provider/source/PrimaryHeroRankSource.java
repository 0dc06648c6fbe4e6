package com.mlbbai.hero_analysis_engine.service.provider.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.RateMetric;
import com.mlbbai.hero_analysis_engine.util.HeroJsonFields;
import com.mlbbai.hero_analysis_engine.util.HeroRankingUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Reads the ranked hero list in its documented shape:
 * {@code {data: {main_hero: {data: {name, head}}, main_hero_win_rate, main_hero_ban_rate,
 * main_hero_appearance_rate, main_heroid}}}, with or without the outer {@code data} wrapper.
 */
@Component
@Order(1)
public class PrimaryHeroRankSource implements HeroListSource {

    public static final String PATH = "/hero-rank/";

    @Override
    public String name() {
        return "primary-hero-rank";
    }

    @Override
    public String path() {
        return PATH;
    }

    @Override
    public List<JsonNode> extractRows(JsonNode response) {
        if (response == null || response.isArray()) {
            return List.of();
        }
        return HeroJsonFields.firstArray(response, "/data", "/data/records");
    }

    @Override
    public Optional<Hero> adapt(JsonNode row) {
        if (row == null || !row.isObject()) {
            return Optional.empty();
        }
        JsonNode d = row.path("data").isObject() ? row.get("data") : row;
        JsonNode mainHero = d.path("main_hero");
        JsonNode heroData = mainHero.path("data").isObject() ? mainHero.get("data") : mainHero;

        Optional<String> name = HeroJsonFields.firstText(heroData, "name", "hero_name");
        if (name.isEmpty()) {
            return Optional.empty();
        }

        RateMetric winRate = RateMetric.of(HeroJsonFields.firstRate(d, "main_hero_win_rate").orElse(null));
        RateMetric banRate = RateMetric.of(HeroJsonFields.firstRate(d, "main_hero_ban_rate").orElse(null));
        RateMetric pickRate = RateMetric.of(HeroJsonFields.firstRate(d, "main_hero_appearance_rate").orElse(null));

        return Optional.of(Hero.builder()
            .id(HeroJsonFields.firstText(d, "main_heroid")
                .or(() -> HeroJsonFields.firstText(heroData, "id", "heroid"))
                .orElse(null))
            .name(name.get())
            .role(HeroJsonFields.firstText(heroData, "role", "type", "hero_type").orElse(Hero.UNKNOWN_ROLE))
            .winRate(winRate)
            .banRate(banRate)
            .pickRate(pickRate)
            .tier(HeroRankingUtils.classifyTier(winRate))
            .imageRef(HeroJsonFields.firstText(heroData, "head", "image", "icon").orElse(""))
            .build());
    }
}
