/**
 * REST controller for generated hero analyses and synergy reports.
 * Both routes always answer 200 with a report; the source field tells
 * whether it came from the cache, the model or the fallback template.
 */
package com.mlbbai.hero_analysis_engine.controller;

import com.mlbbai.hero_analysis_engine.controller.dto.HeroApiResponses.HeroAnalysisResponse;
import com.mlbbai.hero_analysis_engine.controller.dto.HeroApiResponses.SynergyResponse;
import com.mlbbai.hero_analysis_engine.controller.dto.HeroDtoMapper;
import com.mlbbai.hero_analysis_engine.controller.support.ErrorResponseUtils;
import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.HeroAnalysis;
import com.mlbbai.hero_analysis_engine.model.SynergyReport;
import com.mlbbai.hero_analysis_engine.service.HeroQueryService;
import com.mlbbai.hero_analysis_engine.service.analysis.HeroAnalysisService;
import com.mlbbai.hero_analysis_engine.service.analysis.HeroAnalysisService.AnalysisLookup;
import com.mlbbai.hero_analysis_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api")
@Slf4j
public class AnalysisController {

    private final HeroQueryService heroQueryService;
    private final HeroAnalysisService heroAnalysisService;

    public AnalysisController(HeroQueryService heroQueryService, HeroAnalysisService heroAnalysisService) {
        this.heroQueryService = heroQueryService;
        this.heroAnalysisService = heroAnalysisService;
    }

    @GetMapping("/analyze/{name}")
    public Mono<ResponseEntity<Object>> analyzeHero(@PathVariable String name) {
        if (!ValidationUtils.hasText(name)) {
            return Mono.just(ErrorResponseUtils.error(HttpStatus.BAD_REQUEST, "Hero name is required"));
        }
        return Mono.fromCallable(() -> {
                Hero hero = heroQueryService.resolveForAnalysis(name);
                AnalysisLookup<HeroAnalysis> lookup = heroAnalysisService.analyzeHero(hero);
                return new HeroAnalysisResponse(source(lookup), HeroDtoMapper.fromHero(hero), lookup.result().report());
            })
            .subscribeOn(Schedulers.boundedElastic())
            .map(body -> ResponseEntity.<Object>ok(body))
            .onErrorResume(ex -> {
                log.error("Failed to analyze hero '{}': {}", name, ex.getMessage(), ex);
                return Mono.just(ErrorResponseUtils.error(HttpStatus.INTERNAL_SERVER_ERROR, "Analysis failed"));
            });
    }

    @GetMapping("/synergy/{name1}/{name2}")
    public Mono<ResponseEntity<Object>> analyzeSynergy(@PathVariable String name1, @PathVariable String name2) {
        if (!ValidationUtils.hasText(name1) || !ValidationUtils.hasText(name2)) {
            return Mono.just(ErrorResponseUtils.error(HttpStatus.BAD_REQUEST, "Two hero names are required"));
        }
        return Mono.fromCallable(() -> {
                Hero first = heroQueryService.resolveForAnalysis(name1);
                Hero second = heroQueryService.resolveForAnalysis(name2);
                // Names, slugs and ids of one hero all resolve to the same identity.
                if (first.identity().equals(second.identity())) {
                    return ErrorResponseUtils.error(HttpStatus.BAD_REQUEST, "Pick two different heroes");
                }
                AnalysisLookup<SynergyReport> lookup = heroAnalysisService.analyzeSynergy(first, second);
                return ResponseEntity.<Object>ok(new SynergyResponse(
                    source(lookup),
                    List.of(HeroDtoMapper.fromHero(first), HeroDtoMapper.fromHero(second)),
                    lookup.result().report()));
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(ex -> {
                log.error("Failed to analyze synergy '{}' + '{}': {}", name1, name2, ex.getMessage(), ex);
                return Mono.just(ErrorResponseUtils.error(HttpStatus.INTERNAL_SERVER_ERROR, "Synergy analysis failed"));
            });
    }

    private static String source(AnalysisLookup<?> lookup) {
        if (lookup.cached()) {
            return "cache";
        }
        return lookup.result().isFallback() ? "fallback" : "ai";
    }
}
