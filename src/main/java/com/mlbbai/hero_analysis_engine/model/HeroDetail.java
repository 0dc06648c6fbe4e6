package com.mlbbai.hero_analysis_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Extended hero record assembled from the provider's detail, counter,
 * compatibility and build endpoints. Each part degrades to its empty value
 * when the matching sub-fetch fails.
 */
@Value
@Builder(toBuilder = true)
public class HeroDetail {

    private static final HeroDetail EMPTY = HeroDetail.builder().build();

    @Builder.Default
    String description = "";

    @Builder.Default
    String imageRef = "";

    @Builder.Default
    HeroAbilityScores abilityScores = HeroAbilityScores.none();

    @JsonProperty("build")
    @Builder.Default
    List<String> itemBuild = List.of();

    @Builder.Default
    List<String> counters = List.of();

    @Builder.Default
    List<String> teammates = List.of();

    public static HeroDetail empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return description.isEmpty()
            && imageRef.isEmpty()
            && abilityScores.isEmpty()
            && itemBuild.isEmpty()
            && counters.isEmpty()
            && teammates.isEmpty();
    }
}
