/**
 * Health indicator for the hero snapshot
 *
 * @author William Callahan
 *
 * Reports snapshot status: ready and stale are UP (stale with a warning detail),
 * error is DOWN, and initializing or scraping without data is UNKNOWN
 */

package com.mlbbai.hero_analysis_engine.config;

import com.mlbbai.hero_analysis_engine.model.StatsSnapshot;
import com.mlbbai.hero_analysis_engine.service.HeroSnapshotStore;
import com.mlbbai.hero_analysis_engine.service.cache.CacheMaintenanceService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("heroSnapshotHealthIndicator")
public class HeroSnapshotHealthIndicator implements HealthIndicator {

    private final HeroSnapshotStore store;
    private final CacheMaintenanceService cacheMaintenanceService;

    public HeroSnapshotHealthIndicator(HeroSnapshotStore store, CacheMaintenanceService cacheMaintenanceService) {
        this.store = store;
        this.cacheMaintenanceService = cacheMaintenanceService;
    }

    @Override
    public Health health() {
        StatsSnapshot snapshot = store.current();
        Health.Builder builder = switch (snapshot.status()) {
            case READY -> Health.up();
            case STALE -> Health.up().withDetail("warning", "Serving data from the last successful refresh");
            case ERROR -> Health.down();
            case SCRAPING -> snapshot.heroes().isEmpty() ? Health.unknown() : Health.up();
            case INITIALIZING -> Health.unknown();
        };
        return builder
            .withDetail("snapshot_status", snapshot.status().wireName())
            .withDetail("hero_count", snapshot.heroCount())
            .withDetail("consecutive_failures", snapshot.consecutiveFailures())
            .withDetail("last_updated", snapshot.lastUpdated() == null ? "never" : snapshot.lastUpdated().toString())
            .withDetail("cached_entries", cacheMaintenanceService.cachedEntries())
            .build();
    }
}
