/**
 * Configuration class for cache-related components and beans
 * It handles:
 * - Defining the shared response cache used for hero details and analyses
 * - Providing the time sources the cache and services read
 *
 * @author William Callahan
 */
package com.mlbbai.hero_analysis_engine.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.mlbbai.hero_analysis_engine.service.cache.ExpiringCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CacheComponentsConfig {

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    /**
     * Shared cache for detail lookups and generated reports.
     * Flushed as a whole after every successful snapshot refresh.
     */
    @Bean
    public ExpiringCache<String, Object> responseCache(HeroEngineProperties properties, Ticker cacheTicker) {
        HeroEngineProperties.Cache cache = properties.getCache();
        return new ExpiringCache<>(cache.getTtl(), cache.getMaximumSize(), cacheTicker);
    }
}
