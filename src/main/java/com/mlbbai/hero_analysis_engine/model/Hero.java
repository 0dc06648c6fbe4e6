package com.mlbbai.hero_analysis_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Canonical hero record produced by the normalizer, independent of the
 * provider response shape it was read from.
 *
 * @author William Callahan
 *
 * Features:
 * - Identity is the provider id when known, otherwise the lower-cased name
 * - Missing role renders as "—", missing image as an empty string
 * - Rates carry raw value and display string together in {@link RateMetric}
 */
@Value
@Builder(toBuilder = true)
public class Hero {

    public static final String UNKNOWN_ROLE = "—";

    String id;

    String name;

    @Builder.Default
    String role = UNKNOWN_ROLE;

    @Builder.Default
    RateMetric winRate = RateMetric.unknown();

    @Builder.Default
    RateMetric banRate = RateMetric.unknown();

    @Builder.Default
    RateMetric pickRate = RateMetric.unknown();

    @Builder.Default
    String tier = HeroTier.UNRANKED;

    @Builder.Default
    String imageRef = "";

    HeroDetail detail;

    @JsonIgnore
    public String identity() {
        if (id != null && !id.isBlank()) {
            return "id:" + id;
        }
        return "name:" + normalizedName();
    }

    @JsonIgnore
    public String normalizedName() {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public static Hero named(String name) {
        return Hero.builder().name(name).build();
    }
}
