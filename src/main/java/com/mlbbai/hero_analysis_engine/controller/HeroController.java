/**
 * REST controller exposing hero statistics from the current snapshot.
 */
package com.mlbbai.hero_analysis_engine.controller;

import com.mlbbai.hero_analysis_engine.controller.dto.HeroApiResponses.HeroDetailResponse;
import com.mlbbai.hero_analysis_engine.controller.dto.HeroApiResponses.HeroListResponse;
import com.mlbbai.hero_analysis_engine.controller.dto.HeroApiResponses.LeaderboardResponse;
import com.mlbbai.hero_analysis_engine.controller.dto.HeroApiResponses.SearchResponse;
import com.mlbbai.hero_analysis_engine.controller.dto.HeroApiResponses.TierListResponse;
import com.mlbbai.hero_analysis_engine.controller.dto.HeroDto;
import com.mlbbai.hero_analysis_engine.controller.dto.HeroDtoMapper;
import com.mlbbai.hero_analysis_engine.controller.support.ErrorResponseUtils;
import com.mlbbai.hero_analysis_engine.model.LeaderboardEntry;
import com.mlbbai.hero_analysis_engine.model.StatsSnapshot;
import com.mlbbai.hero_analysis_engine.service.HeroQueryService;
import com.mlbbai.hero_analysis_engine.util.ReactiveControllerUtils;
import com.mlbbai.hero_analysis_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api")
@Slf4j
public class HeroController {

    private final HeroQueryService heroQueryService;

    public HeroController(HeroQueryService heroQueryService) {
        this.heroQueryService = heroQueryService;
    }

    @GetMapping("/heroes")
    public ResponseEntity<HeroListResponse> listHeroes(@RequestParam(required = false) String role,
                                                       @RequestParam(required = false) String tier,
                                                       @RequestParam(required = false) String sort,
                                                       @RequestParam(required = false) String search) {
        StatsSnapshot snapshot = heroQueryService.snapshot();
        List<HeroDto> heroes = HeroDtoMapper.fromHeroes(heroQueryService.listHeroes(role, tier, sort, search));
        return ResponseEntity.ok(new HeroListResponse(heroes.size(), snapshot.lastUpdated(), snapshot.status(), heroes));
    }

    @GetMapping("/search")
    public ResponseEntity<Object> search(@RequestParam(name = "q", required = false) String query) {
        if (!ValidationUtils.hasText(query)) {
            return ErrorResponseUtils.error(HttpStatus.BAD_REQUEST, "Query parameter 'q' is required");
        }
        List<HeroDto> results = HeroDtoMapper.fromHeroes(heroQueryService.search(query));
        return ResponseEntity.ok(new SearchResponse(query.trim(), results.size(), results));
    }

    @GetMapping("/heroes/{slug}")
    public Mono<ResponseEntity<Object>> getHero(@PathVariable String slug) {
        Mono<HeroDetailResponse> detail = heroQueryService.heroDetail(slug)
            .map(lookup -> new HeroDetailResponse(
                lookup.cached() ? "cache" : "live",
                HeroDtoMapper.fromHero(lookup.hero())));
        return ReactiveControllerUtils.withErrorHandling(
            detail,
            "Hero not found",
            String.format("Failed to fetch hero '%s'", slug)
        );
    }

    @GetMapping("/tier-list")
    public ResponseEntity<TierListResponse> tierList() {
        StatsSnapshot snapshot = heroQueryService.snapshot();
        return ResponseEntity.ok(new TierListResponse(snapshot.lastUpdated(), snapshot.tierList()));
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<LeaderboardResponse> leaderboard(@RequestParam(required = false) String category,
                                                           @RequestParam(required = false) String limit) {
        StatsSnapshot snapshot = heroQueryService.snapshot();
        List<LeaderboardEntry> entries = heroQueryService.leaderboard(category,
            ValidationUtils.parseIntOrDefault(limit, HeroQueryService.DEFAULT_LEADERBOARD_LIMIT));
        return ResponseEntity.ok(new LeaderboardResponse(snapshot.lastUpdated(), entries.size(), entries));
    }
}
