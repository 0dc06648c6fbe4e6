/**
 * Per-client request budget backed by Resilience4j rate limiters
 *
 * @author William Callahan
 *
 * Features:
 * - Each client gets its own limiter: app.rate-limit.max-requests per app.rate-limit.window
 * - Requests never wait for a permit; an exhausted budget is rejected with the time until refresh
 * - Limiters of idle clients are removed every app.rate-limit.sweep-interval
 */
package com.mlbbai.hero_analysis_engine.service;

import com.mlbbai.hero_analysis_engine.config.HeroEngineProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.internal.AtomicRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
public class ClientRequestRateLimiter {

    /**
     * @param allowed whether the request fits the client's budget
     * @param remaining requests left in the current window
     * @param retryAfterSeconds seconds until the budget refreshes, 0 when allowed
     */
    public record Decision(boolean allowed, int remaining, long retryAfterSeconds) {
    }

    private final RateLimiterRegistry registry;
    private final int maxRequests;
    private final Duration window;

    public ClientRequestRateLimiter(HeroEngineProperties properties) {
        this.maxRequests = Math.max(1, properties.getRateLimit().getMaxRequests());
        Duration configured = properties.getRateLimit().getWindow();
        this.window = configured == null || configured.isZero() || configured.isNegative()
            ? Duration.ofMinutes(15)
            : configured;
        this.registry = RateLimiterRegistry.of(RateLimiterConfig.custom()
            .limitForPeriod(maxRequests)
            .limitRefreshPeriod(window)
            .timeoutDuration(Duration.ZERO)
            .build());
    }

    public Decision tryAcquire(String clientKey) {
        RateLimiter limiter = registry.rateLimiter(clientKey);
        if (limiter.acquirePermission()) {
            return new Decision(true, Math.max(0, limiter.getMetrics().getAvailablePermissions()), 0);
        }
        return new Decision(false, 0, retryAfterSeconds(limiter));
    }

    /**
     * Drops limiters whose budget is fully restored, i.e. clients with no requests in the current window.
     */
    @Scheduled(fixedDelayString = "${app.rate-limit.sweep-interval:PT5M}")
    public void sweepIdleClients() {
        List<String> idle = registry.getAllRateLimiters().stream()
            .filter(limiter -> limiter.getMetrics().getAvailablePermissions() >= maxRequests)
            .map(RateLimiter::getName)
            .collect(Collectors.toList());
        idle.forEach(registry::remove);
        if (!idle.isEmpty()) {
            log.debug("Removed {} idle client rate limiters", idle.size());
        }
    }

    public int trackedClients() {
        return registry.getAllRateLimiters().size();
    }

    private long retryAfterSeconds(RateLimiter limiter) {
        long nanosToWait = limiter instanceof AtomicRateLimiter
            ? ((AtomicRateLimiter) limiter).getDetailedMetrics().getNanosToWait()
            : window.toNanos();
        return Math.max(1, (nanosToWait + 999_999_999L) / 1_000_000_000L);
    }
}
