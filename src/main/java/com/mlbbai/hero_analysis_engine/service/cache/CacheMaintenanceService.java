/**
 * Service responsible for cache maintenance operations
 * It handles:
 * - Flushing the response cache once per successful snapshot refresh
 * - Reporting cache size for diagnostics
 *
 * @author William Callahan
 */
package com.mlbbai.hero_analysis_engine.service.cache;

import com.mlbbai.hero_analysis_engine.service.event.HeroSnapshotRefreshedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
public class CacheMaintenanceService {

    private static final Logger logger = LoggerFactory.getLogger(CacheMaintenanceService.class);

    private final ExpiringCache<String, Object> responseCache;

    public CacheMaintenanceService(ExpiringCache<String, Object> responseCache) {
        this.responseCache = responseCache;
    }

    @EventListener
    public void handleSnapshotRefreshed(HeroSnapshotRefreshedEvent event) {
        long flushed = responseCache.size();
        responseCache.flushAll();
        logger.info("Flushed {} cached responses after {} refresh ({} heroes).",
            flushed, event.getTrigger(), event.getHeroCount());
    }

    public long cachedEntries() {
        return responseCache.size();
    }
}
