package com.mlbbai.hero_analysis_engine.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mlbbai.hero_analysis_engine.model.HeroDetail;

/**
 * API view of a hero. Rates are display strings only; raw values stay internal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HeroDto(String id,
                      String name,
                      String role,
                      String winRate,
                      String banRate,
                      String pickRate,
                      String tier,
                      String img,
                      HeroDetail detail) {
}
