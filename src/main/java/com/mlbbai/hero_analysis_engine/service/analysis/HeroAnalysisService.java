/**
 * Service producing single-hero analyses and two-hero synergy reports
 *
 * @author William Callahan
 *
 * Features:
 * - Cache-first: reports are reused for the cache TTL and dropped on every snapshot refresh
 * - Calls the generative backend through the analysis retry template
 * - Sanitizes and validates model output before accepting it
 * - Falls back to a templated report when the backend is disabled or every attempt fails
 * - Concurrent requests for the same key share one computation
 * - Synergy keys are order-independent, so (A, B) and (B, A) share one report
 */
package com.mlbbai.hero_analysis_engine.service.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlbbai.hero_analysis_engine.model.AnalysisResult;
import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.HeroAnalysis;
import com.mlbbai.hero_analysis_engine.model.SynergyReport;
import com.mlbbai.hero_analysis_engine.service.cache.ExpiringCache;
import com.mlbbai.hero_analysis_engine.util.ExternalApiLogger;
import com.mlbbai.hero_analysis_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

@Service
@Slf4j
public class HeroAnalysisService {

    public static final String HERO_KEY_PREFIX = "ai_analysis_";
    public static final String SYNERGY_KEY_PREFIX = "synergy_";

    /**
     * A report plus whether it was served without running a new computation.
     */
    public record AnalysisLookup<T>(AnalysisResult<T> result, boolean cached) {
    }

    private final GenerativeTextClient generativeTextClient;
    private final RetryTemplate retryTemplate;
    private final ExpiringCache<String, Object> responseCache;
    private final AnalysisOutputParser outputParser;
    private final Clock clock;

    private final ConcurrentHashMap<String, CompletableFuture<AnalysisResult<?>>> inFlight = new ConcurrentHashMap<>();

    public HeroAnalysisService(GenerativeTextClient generativeTextClient,
                               @Qualifier("analysisRetryTemplate") RetryTemplate retryTemplate,
                               ExpiringCache<String, Object> responseCache,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.generativeTextClient = generativeTextClient;
        this.retryTemplate = retryTemplate;
        this.responseCache = responseCache;
        this.outputParser = new AnalysisOutputParser(objectMapper);
        this.clock = clock;
    }

    public AnalysisLookup<HeroAnalysis> analyzeHero(Hero hero) {
        String key = heroCacheKey(hero.getName());
        return lookup(key, () -> generate(
            key,
            HeroAnalysisPrompts.buildHeroPrompt(hero),
            raw -> outputParser.parseHeroAnalysis(raw, HeroAnalysisTemplates.heroAnalysis(hero)),
            () -> HeroAnalysisTemplates.heroAnalysis(hero)));
    }

    public AnalysisLookup<SynergyReport> analyzeSynergy(Hero first, Hero second) {
        String key = synergyCacheKey(first.getName(), second.getName());
        return lookup(key, () -> generate(
            key,
            HeroAnalysisPrompts.buildSynergyPrompt(first, second),
            raw -> outputParser.parseSynergyReport(raw, HeroAnalysisTemplates.synergyReport(first, second)),
            () -> HeroAnalysisTemplates.synergyReport(first, second)));
    }

    public static String heroCacheKey(String name) {
        return HERO_KEY_PREFIX + ValidationUtils.normalizeKey(name);
    }

    /**
     * Builds {@code synergy_<a>_<b>} with the lower-cased names in ascending order.
     */
    public static String synergyCacheKey(String first, String second) {
        String a = ValidationUtils.normalizeKey(first);
        String b = ValidationUtils.normalizeKey(second);
        return a.compareTo(b) <= 0
            ? SYNERGY_KEY_PREFIX + a + "_" + b
            : SYNERGY_KEY_PREFIX + b + "_" + a;
    }

    @SuppressWarnings("unchecked")
    private <T> AnalysisLookup<T> lookup(String key, Supplier<AnalysisResult<T>> compute) {
        Optional<AnalysisResult<T>> cached = cachedResult(key);
        if (cached.isPresent()) {
            log.debug("Serving analysis {} from cache", key);
            return new AnalysisLookup<>(cached.get(), true);
        }

        CompletableFuture<AnalysisResult<?>> mine = new CompletableFuture<>();
        CompletableFuture<AnalysisResult<?>> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("Joining in-flight analysis {}", key);
            try {
                return new AnalysisLookup<>((AnalysisResult<T>) existing.join(), true);
            } catch (CompletionException e) {
                throw e.getCause() instanceof RuntimeException re ? re : e;
            }
        }

        try {
            Optional<AnalysisResult<T>> raced = cachedResult(key);
            if (raced.isPresent()) {
                mine.complete(raced.get());
                return new AnalysisLookup<>(raced.get(), true);
            }
            AnalysisResult<T> result = compute.get();
            responseCache.set(key, result);
            mine.complete(result);
            return new AnalysisLookup<>(result, false);
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> Optional<AnalysisResult<T>> cachedResult(String key) {
        return responseCache.get(key, AnalysisResult.class).map(result -> (AnalysisResult<T>) result);
    }

    private <T> AnalysisResult<T> generate(String key,
                                           String userPrompt,
                                           Function<String, T> parser,
                                           Supplier<T> fallback) {
        if (!generativeTextClient.isEnabled()) {
            log.debug("Generative backend disabled; templated report for {}", key);
            return AnalysisResult.fallback(fallback.get(), clock.instant());
        }
        String systemPrompt = HeroAnalysisPrompts.buildSystemPrompt();
        try {
            T report = retryTemplate.execute(context -> {
                ExternalApiLogger.logGenerationAttempt(log, key, context.getRetryCount() + 1);
                return parser.apply(generativeTextClient.generate(systemPrompt, userPrompt));
            });
            return AnalysisResult.fromModel(report, clock.instant());
        } catch (RuntimeException e) {
            ExternalApiLogger.logGenerationFallback(log, key, e.getMessage());
            return AnalysisResult.fallback(fallback.get(), clock.instant());
        }
    }
}
