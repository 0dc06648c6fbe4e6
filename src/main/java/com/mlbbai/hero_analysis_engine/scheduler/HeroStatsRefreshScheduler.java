/**
 * Scheduler that keeps the hero snapshot fresh
 * - Refreshes hourly (app.refresh.cron), once at startup and on manual request
 * - Single-flight: a trigger arriving mid-refresh is rejected, never queued
 * - Manual refreshes run on the dedicated refresh executor and return immediately
 * - Publishes {@link HeroSnapshotRefreshedEvent} after every successful commit
 *
 * @author William Callahan
 */
package com.mlbbai.hero_analysis_engine.scheduler;

import com.mlbbai.hero_analysis_engine.config.HeroEngineProperties;
import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.StatsSnapshot;
import com.mlbbai.hero_analysis_engine.service.HeroSnapshotStore;
import com.mlbbai.hero_analysis_engine.service.event.HeroSnapshotRefreshedEvent;
import com.mlbbai.hero_analysis_engine.service.provider.HeroStatsNormalizer;
import com.mlbbai.hero_analysis_engine.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
public class HeroStatsRefreshScheduler {

    private static final Logger logger = LoggerFactory.getLogger(HeroStatsRefreshScheduler.class);

    public enum TriggerResult {
        STARTED,
        ALREADY_RUNNING
    }

    private final HeroStatsNormalizer normalizer;
    private final HeroSnapshotStore store;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor refreshExecutor;
    private final Clock clock;
    private final boolean runOnStartup;
    private final Duration fetchDeadline;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public HeroStatsRefreshScheduler(HeroStatsNormalizer normalizer,
                                     HeroSnapshotStore store,
                                     ApplicationEventPublisher eventPublisher,
                                     @Qualifier("refreshTaskExecutor") Executor refreshExecutor,
                                     Clock clock,
                                     HeroEngineProperties properties) {
        this.normalizer = normalizer;
        this.store = store;
        this.eventPublisher = eventPublisher;
        this.refreshExecutor = refreshExecutor;
        this.clock = clock;
        this.runOnStartup = properties.getRefresh().isRunOnStartup();
        // Every source may need its own provider call.
        this.fetchDeadline = properties.getProvider().getTimeout().multipliedBy(4);
    }

    /**
     * Initial refresh once the server accepts connections; early readers see the initializing snapshot.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void refreshOnStartup() {
        if (!runOnStartup) {
            logger.info("Startup hero refresh disabled (app.refresh.run-on-startup=false)");
            return;
        }
        runGuarded("startup");
    }

    @Scheduled(cron = "${app.refresh.cron:0 0 * * * *}")
    public void scheduledRefresh() {
        if (!runGuarded("scheduled")) {
            logger.info("Skipping scheduled hero refresh: a refresh is already running");
        }
    }

    /**
     * Starts a refresh in the background.
     *
     * @return STARTED when submitted, ALREADY_RUNNING when a refresh is in progress
     */
    public TriggerResult triggerManualRefresh() {
        if (!running.compareAndSet(false, true)) {
            return TriggerResult.ALREADY_RUNNING;
        }
        try {
            refreshExecutor.execute(() -> {
                try {
                    refreshNow("manual");
                } finally {
                    running.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            running.set(false);
            throw new IllegalStateException("Refresh executor rejected manual refresh", e);
        }
        return TriggerResult.STARTED;
    }

    public boolean isRunning() {
        return running.get();
    }

    boolean runGuarded(String trigger) {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        try {
            refreshNow(trigger);
        } finally {
            running.set(false);
        }
        return true;
    }

    private StatsSnapshot refreshNow(String trigger) {
        long start = System.currentTimeMillis();
        ExternalApiLogger.logRefreshStart(logger, trigger);
        store.markScraping();
        StatsSnapshot result;
        List<Hero> heroes;
        try {
            heroes = normalizer.fetchAll().block(fetchDeadline);
        } catch (RuntimeException e) {
            logger.warn("Hero refresh ({}) fetch failed: {}", trigger, e.getMessage());
            heroes = List.of();
        }
        if (heroes == null || heroes.isEmpty()) {
            logger.warn("Hero refresh ({}) produced no heroes; recording a failed refresh", trigger);
            result = store.commitFailure();
        } else {
            result = store.commitSuccess(heroes, clock.instant());
            eventPublisher.publishEvent(new HeroSnapshotRefreshedEvent(result.heroCount(), result.lastUpdated(), trigger));
        }
        ExternalApiLogger.logRefreshComplete(logger, trigger, result.status().wireName(), result.heroCount(),
            System.currentTimeMillis() - start);
        return result;
    }
}
