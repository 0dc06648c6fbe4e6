/**
 * Configuration for retry mechanisms around the generative backend
 *
 * @author William Callahan
 *
 * Features:
 * - Bounded attempts from app.analysis.max-attempts
 * - Linear backoff: the n-th retry waits n times the base interval
 * - Retries every failure type; the caller decides what to do on exhaustion
 */

package com.mlbbai.hero_analysis_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

@Configuration
public class RetryConfig {

    /**
     * Linear backoff: waits {@code interval * n} before the n-th retry (1s, 2s, ... by default)
     */
    static class LinearBackOffPolicy implements BackOffPolicy {
        private static final Logger logger = LoggerFactory.getLogger(LinearBackOffPolicy.class);
        private final long intervalMillis;
        private final Sleeper sleeper;

        LinearBackOffPolicy(long intervalMillis, Sleeper sleeper) {
            this.intervalMillis = Math.max(0, intervalMillis);
            this.sleeper = sleeper;
        }

        private static class BackOffContextImpl implements BackOffContext {
            int retries;
        }

        @Override
        public BackOffContext start(RetryContext context) {
            return new BackOffContextImpl();
        }

        @Override
        public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
            BackOffContextImpl ctx = (BackOffContextImpl) backOffContext;
            ctx.retries++;
            long sleepTime = intervalMillis * ctx.retries;
            if (logger.isDebugEnabled()) {
                logger.debug("Backing off for {}ms before retry #{}", sleepTime, ctx.retries);
            }
            try {
                sleeper.sleep(sleepTime);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackOffInterruptedException("Thread interrupted while backing off", e);
            }
        }
    }

    /**
     * Creates the retry template used for generative analysis calls
     *
     * @param properties application properties
     * @return RetryTemplate for analysis generation
     */
    @Bean("analysisRetryTemplate")
    public RetryTemplate analysisRetryTemplate(HeroEngineProperties properties) {
        HeroEngineProperties.Analysis analysis = properties.getAnalysis();
        return buildAnalysisRetryTemplate(analysis.getMaxAttempts(), analysis.getBackoff().toMillis(), new ThreadWaitSleeper());
    }

    public static RetryTemplate buildAnalysisRetryTemplate(int maxAttempts, long backoffMillis, Sleeper sleeper) {
        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new SimpleRetryPolicy(Math.max(1, maxAttempts)));
        retryTemplate.setBackOffPolicy(new LinearBackOffPolicy(backoffMillis, sleeper));
        retryTemplate.setThrowLastExceptionOnExhausted(true);
        return retryTemplate;
    }
}
