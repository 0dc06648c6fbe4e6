/**
 * Main application configuration properties
 * Centralizes all app.* configuration properties for type safety and IDE support
 *
 * @author William Callahan
 */

package com.mlbbai.hero_analysis_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
public class HeroEngineProperties {

    @NestedConfigurationProperty
    private Provider provider = new Provider();

    @NestedConfigurationProperty
    private Refresh refresh = new Refresh();

    @NestedConfigurationProperty
    private Cache cache = new Cache();

    @NestedConfigurationProperty
    private Analysis analysis = new Analysis();

    @NestedConfigurationProperty
    private RateLimit rateLimit = new RateLimit();

    // Getters and setters
    public Provider getProvider() { return provider; }
    public void setProvider(Provider provider) { this.provider = provider; }

    public Refresh getRefresh() { return refresh; }
    public void setRefresh(Refresh refresh) { this.refresh = refresh; }

    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public Analysis getAnalysis() { return analysis; }
    public void setAnalysis(Analysis analysis) { this.analysis = analysis; }

    public RateLimit getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimit rateLimit) { this.rateLimit = rateLimit; }

    // Nested configuration classes
    public static class Provider {
        private String baseUrl = "https://mlbb-stats.ridwaanhall.com/api";
        private Duration timeout = Duration.ofSeconds(15);
        private String userAgent = "hero-analysis-engine/1.0";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
    }

    public static class Refresh {
        private String cron = "0 0 * * * *";
        private boolean runOnStartup = true;
        private String scrapeSecret = "";

        public String getCron() { return cron; }
        public void setCron(String cron) { this.cron = cron; }

        public boolean isRunOnStartup() { return runOnStartup; }
        public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }

        public String getScrapeSecret() { return scrapeSecret; }
        public void setScrapeSecret(String scrapeSecret) { this.scrapeSecret = scrapeSecret; }
    }

    public static class Cache {
        private Duration ttl = Duration.ofHours(1);
        private long maximumSize = 5_000;

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public long getMaximumSize() { return maximumSize; }
        public void setMaximumSize(long maximumSize) { this.maximumSize = maximumSize; }
    }

    public static class Analysis {
        private String apiKey = "";
        private String baseUrl = "https://api.openai.com";
        private String model = "gpt-4o-mini";
        private int maxTokens = 1024;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofSeconds(1);

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getBackoff() { return backoff; }
        public void setBackoff(Duration backoff) { this.backoff = backoff; }

        public boolean isEnabled() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    public static class RateLimit {
        private boolean enabled = true;
        private int maxRequests = 100;
        private Duration window = Duration.ofMinutes(15);
        private Duration sweepInterval = Duration.ofMinutes(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxRequests() { return maxRequests; }
        public void setMaxRequests(int maxRequests) { this.maxRequests = maxRequests; }

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }

        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    }
}
