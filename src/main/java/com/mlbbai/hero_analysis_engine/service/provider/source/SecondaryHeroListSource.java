package com.mlbbai.hero_analysis_engine.service.provider.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.util.HeroJsonFields;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the plain hero roster. The roster carries no statistics, so every hero
 * comes back with unknown rates and the Unranked tier.
 * Accepts either an array of hero objects or an {@code id -> name} object under {@code data}.
 */
@Component
@Order(2)
public class SecondaryHeroListSource implements HeroListSource {

    public static final String PATH = "/hero-list/";

    @Override
    public String name() {
        return "secondary-hero-list";
    }

    @Override
    public String path() {
        return PATH;
    }

    @Override
    public List<JsonNode> extractRows(JsonNode response) {
        if (response == null) {
            return List.of();
        }
        List<JsonNode> rows = HeroJsonFields.firstArray(response, "/data", "/data/records", "/data/heroes");
        if (!rows.isEmpty()) {
            return rows;
        }
        JsonNode data = response.path("data");
        if (!data.isObject()) {
            return List.of();
        }
        List<JsonNode> synthetic = new ArrayList<>();
        data.fields().forEachRemaining(entry -> {
            if (entry.getValue().isTextual()) {
                ObjectNode row = JsonNodeFactory.instance.objectNode();
                row.put("hero_id", entry.getKey());
                row.put("hero_name", entry.getValue().asText());
                synthetic.add(row);
            }
        });
        return synthetic;
    }

    @Override
    public Optional<Hero> adapt(JsonNode row) {
        if (row == null || !row.isObject()) {
            return Optional.empty();
        }
        JsonNode d = HeroJsonFields.unwrapData(row, 2);
        return HeroJsonFields.firstText(d, "hero_name", "name")
            .map(name -> Hero.builder()
                .id(HeroJsonFields.firstText(d, "hero_id", "heroid", "id").orElse(null))
                .name(name)
                .role(HeroJsonFields.firstText(d, "role", "type", "hero_type").orElse(Hero.UNKNOWN_ROLE))
                .imageRef(HeroJsonFields.firstText(d, "head", "image", "icon").orElse(""))
                .build());
    }
}
