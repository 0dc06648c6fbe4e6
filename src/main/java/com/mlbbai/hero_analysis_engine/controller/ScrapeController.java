package com.mlbbai.hero_analysis_engine.controller;

import com.mlbbai.hero_analysis_engine.config.HeroEngineProperties;
import com.mlbbai.hero_analysis_engine.controller.dto.HeroApiResponses.ScrapeResponse;
import com.mlbbai.hero_analysis_engine.controller.support.ErrorResponseUtils;
import com.mlbbai.hero_analysis_engine.scheduler.HeroStatsRefreshScheduler;
import com.mlbbai.hero_analysis_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Manual snapshot refresh, guarded by a shared secret header.
 * With no secret configured the route rejects every call.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class ScrapeController {

    static final String SECRET_HEADER = "x-scrape-secret";

    private final HeroStatsRefreshScheduler refreshScheduler;
    private final String scrapeSecret;

    public ScrapeController(HeroStatsRefreshScheduler refreshScheduler, HeroEngineProperties properties) {
        this.refreshScheduler = refreshScheduler;
        this.scrapeSecret = properties.getRefresh().getScrapeSecret();
    }

    @PostMapping("/scrape")
    public ResponseEntity<Object> triggerScrape(@RequestHeader(name = SECRET_HEADER, required = false) String secret) {
        if (!secretMatches(secret)) {
            log.warn("Rejected manual refresh with missing or invalid secret");
            return ErrorResponseUtils.error(HttpStatus.UNAUTHORIZED, "Unauthorized");
        }
        HeroStatsRefreshScheduler.TriggerResult result = refreshScheduler.triggerManualRefresh();
        if (result == HeroStatsRefreshScheduler.TriggerResult.ALREADY_RUNNING) {
            return ErrorResponseUtils.error(HttpStatus.CONFLICT, "Scrape already in progress");
        }
        log.info("Manual hero refresh started");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new ScrapeResponse("Scrape started"));
    }

    private boolean secretMatches(String provided) {
        if (!ValidationUtils.hasText(scrapeSecret) || provided == null) {
            return false;
        }
        return MessageDigest.isEqual(
            scrapeSecret.getBytes(StandardCharsets.UTF_8),
            provided.getBytes(StandardCharsets.UTF_8));
    }
}
