package com.mlbbai.hero_analysis_engine.controller.dto;

import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.HeroDetail;
import com.mlbbai.hero_analysis_engine.model.RateMetric;

import java.util.List;

/**
 * Maps canonical heroes to their API representation.
 */
public final class HeroDtoMapper {

    private HeroDtoMapper() {
    }

    public static HeroDto fromHero(Hero hero) {
        if (hero == null) {
            return null;
        }
        HeroDetail detail = hero.getDetail();
        return new HeroDto(
            hero.getId(),
            hero.getName(),
            hero.getRole(),
            display(hero.getWinRate()),
            display(hero.getBanRate()),
            display(hero.getPickRate()),
            hero.getTier(),
            hero.getImageRef(),
            detail == null || detail.isEmpty() ? null : detail
        );
    }

    public static List<HeroDto> fromHeroes(List<Hero> heroes) {
        return heroes.stream().map(HeroDtoMapper::fromHero).toList();
    }

    private static String display(RateMetric metric) {
        return metric == null ? RateMetric.UNKNOWN_DISPLAY : metric.display();
    }
}
