package com.mlbbai.hero_analysis_engine.controller;

import com.mlbbai.hero_analysis_engine.controller.dto.HeroApiResponses.ServiceStatusResponse;
import com.mlbbai.hero_analysis_engine.model.StatsSnapshot;
import com.mlbbai.hero_analysis_engine.service.HeroSnapshotStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Service banner: snapshot status and the available routes.
 */
@RestController
public class HomeController {

    static final String SERVICE_NAME = "MLBB Hero Analysis API";

    static final List<String> ENDPOINTS = List.of(
        "GET /api/heroes?role=&tier=&sort=winrate|banrate|pickrate&search=",
        "GET /api/search?q=",
        "GET /api/heroes/{slug}",
        "GET /api/tier-list",
        "GET /api/leaderboard?category=&limit=",
        "GET /api/analyze/{name}",
        "GET /api/synergy/{name1}/{name2}",
        "POST /api/scrape",
        "GET /actuator/health"
    );

    private final HeroSnapshotStore store;

    public HomeController(HeroSnapshotStore store) {
        this.store = store;
    }

    @GetMapping("/")
    public ResponseEntity<ServiceStatusResponse> home() {
        StatsSnapshot snapshot = store.current();
        return ResponseEntity.ok(new ServiceStatusResponse(
            SERVICE_NAME,
            snapshot.status(),
            snapshot.lastUpdated(),
            snapshot.heroCount(),
            snapshot.consecutiveFailures(),
            ENDPOINTS
        ));
    }
}
