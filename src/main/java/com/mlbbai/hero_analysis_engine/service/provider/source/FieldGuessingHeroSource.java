package com.mlbbai.hero_analysis_engine.service.provider.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.RateMetric;
import com.mlbbai.hero_analysis_engine.util.HeroJsonFields;
import com.mlbbai.hero_analysis_engine.util.HeroRankingUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Last-resort reader for the ranked hero list after a shape change.
 * Probes the row, its {@code data} wrapper and any nested {@code main_hero} object
 * for alternate field names, and accepts rates as fractions, percentages or strings.
 */
@Component
@Order(3)
public class FieldGuessingHeroSource implements HeroListSource {

    private static final String[] NAME_FIELDS = {"name", "hero_name", "heroName", "title"};
    private static final String[] ID_FIELDS = {"main_heroid", "hero_id", "heroid", "heroId", "id"};
    private static final String[] ROLE_FIELDS = {"role", "type", "hero_type", "heroType", "roles"};
    private static final String[] IMAGE_FIELDS = {"head", "image", "icon", "img", "avatar"};
    private static final String[] WIN_FIELDS = {"main_hero_win_rate", "win_rate", "winRate", "winrate", "win"};
    private static final String[] BAN_FIELDS = {"main_hero_ban_rate", "ban_rate", "banRate", "banrate", "ban"};
    private static final String[] PICK_FIELDS = {"main_hero_appearance_rate", "appearance_rate", "pick_rate", "pickRate", "pickrate", "pick"};

    @Override
    public String name() {
        return "field-guessing";
    }

    @Override
    public String path() {
        return PrimaryHeroRankSource.PATH;
    }

    @Override
    public List<JsonNode> extractRows(JsonNode response) {
        return HeroJsonFields.firstArray(response, "/data", "/data/records", "/records", "/heroes", "/data/heroes");
    }

    @Override
    public Optional<Hero> adapt(JsonNode row) {
        if (row == null || !row.isObject()) {
            return Optional.empty();
        }
        List<JsonNode> scopes = scopes(row);
        Optional<String> name = probeText(scopes, NAME_FIELDS);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        RateMetric winRate = RateMetric.of(probeRate(scopes, WIN_FIELDS).orElse(null));
        return Optional.of(Hero.builder()
            .id(probeText(scopes, ID_FIELDS).orElse(null))
            .name(name.get())
            .role(probeText(scopes, ROLE_FIELDS).orElse(Hero.UNKNOWN_ROLE))
            .winRate(winRate)
            .banRate(RateMetric.of(probeRate(scopes, BAN_FIELDS).orElse(null)))
            .pickRate(RateMetric.of(probeRate(scopes, PICK_FIELDS).orElse(null)))
            .tier(HeroRankingUtils.classifyTier(winRate))
            .imageRef(probeText(scopes, IMAGE_FIELDS).orElse(""))
            .build());
    }

    // Innermost hero object first, then its wrappers.
    private List<JsonNode> scopes(JsonNode row) {
        List<JsonNode> scopes = new ArrayList<>();
        JsonNode d = row.path("data").isObject() ? row.get("data") : row;
        for (String heroKey : new String[]{"main_hero", "hero"}) {
            JsonNode hero = d.path(heroKey);
            if (hero.isObject()) {
                scopes.add(hero.path("data").isObject() ? hero.get("data") : hero);
            }
        }
        scopes.add(d);
        if (d != row) {
            scopes.add(row);
        }
        return scopes;
    }

    private Optional<String> probeText(List<JsonNode> scopes, String[] fields) {
        for (JsonNode scope : scopes) {
            Optional<String> value = HeroJsonFields.firstText(scope, fields);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private Optional<Double> probeRate(List<JsonNode> scopes, String[] fields) {
        for (JsonNode scope : scopes) {
            Optional<Double> value = HeroJsonFields.firstRate(scope, fields);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
