package com.mlbbai.hero_analysis_engine.util;

import org.slf4j.Logger;

/**
 * Centralized logging for calls to the statistics provider and the generative backend.
 *
 * These logs help debug the refresh flow:
 * - primary hero-rank source
 * - secondary hero-list source
 * - field-guessing fallback
 * - per-hero detail sub-fetches
 */
public class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    /**
     * Log HTTP request details
     */
    public static void logHttpRequest(Logger log, String apiName, String method, String url) {
        log.info("{} [{}] {} request to: {}", PREFIX, apiName, method, url);
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, String apiName, int statusCode, String url, int bodySize) {
        log.info("{} [{}] Response: status={}, url={}, bodySize={} bytes", PREFIX, apiName, statusCode, url, bodySize);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String target, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for '{}' - {}", PREFIX, apiName, operation, target, reason);
    }

    /**
     * Log a normalization strategy outcome
     */
    public static void logSourceResult(Logger log, String sourceName, int rowCount, int heroCount) {
        log.info("{} [HERO-SOURCE] {}: rows={}, heroes={}", PREFIX, sourceName, rowCount, heroCount);
    }

    /**
     * Log the start of a refresh cycle
     */
    public static void logRefreshStart(Logger log, String trigger) {
        log.info("{} [REFRESH] START: trigger={}", PREFIX, trigger);
    }

    /**
     * Log the completion of a refresh cycle
     */
    public static void logRefreshComplete(Logger log, String trigger, String status, int heroCount, long durationMs) {
        log.info("{} [REFRESH] COMPLETE: trigger={}, status={}, heroes={}, durationMs={}",
            PREFIX, trigger, status, heroCount, durationMs);
    }

    /**
     * Log a generative backend attempt
     */
    public static void logGenerationAttempt(Logger log, String cacheKey, int attempt) {
        log.debug("{} [GENERATIVE] ATTEMPT #{} for key='{}'", PREFIX, attempt, cacheKey);
    }

    /**
     * Log that a templated report replaced model output
     */
    public static void logGenerationFallback(Logger log, String cacheKey, String reason) {
        log.warn("{} [GENERATIVE] FALLBACK for key='{}' - {}", PREFIX, cacheKey, reason);
    }
}
