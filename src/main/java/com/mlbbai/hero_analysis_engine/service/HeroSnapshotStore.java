/**
 * Holder of the current hero statistics snapshot
 *
 * @author William Callahan
 *
 * Features:
 * - One atomic reference to an immutable {@link StatsSnapshot}; readers never block
 * - Hero list, tier list and leaderboard are derived together and swapped as one unit
 * - Failed refreshes keep prior data (STALE) or clear it (ERROR) when there was none
 */
package com.mlbbai.hero_analysis_engine.service;

import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.SnapshotStatus;
import com.mlbbai.hero_analysis_engine.model.StatsSnapshot;
import com.mlbbai.hero_analysis_engine.model.TierList;
import com.mlbbai.hero_analysis_engine.util.HeroRankingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class HeroSnapshotStore {

    private static final Logger logger = LoggerFactory.getLogger(HeroSnapshotStore.class);

    private final AtomicReference<StatsSnapshot> current = new AtomicReference<>(StatsSnapshot.initial());

    public StatsSnapshot current() {
        return current.get();
    }

    public StatsSnapshot markScraping() {
        return current.updateAndGet(snapshot -> snapshot.withStatus(SnapshotStatus.SCRAPING));
    }

    /**
     * Commits a successful refresh. Callers must pass a non-empty hero list;
     * an empty list is recorded as a failure instead.
     */
    public StatsSnapshot commitSuccess(List<Hero> heroes, Instant now) {
        if (heroes == null || heroes.isEmpty()) {
            return commitFailure();
        }
        List<Hero> frozen = List.copyOf(heroes);
        TierList tierList = HeroRankingUtils.buildTierList(frozen);
        StatsSnapshot next = new StatsSnapshot(
            frozen,
            tierList,
            HeroRankingUtils.buildLeaderboard(frozen),
            now,
            SnapshotStatus.READY,
            0
        );
        current.set(next);
        logger.info("Committed hero snapshot: {} heroes, {} tiers", frozen.size(), tierList.labels().size());
        return next;
    }

    public StatsSnapshot commitFailure() {
        StatsSnapshot next = current.updateAndGet(prior -> {
            int failures = prior.consecutiveFailures() + 1;
            if (!prior.heroes().isEmpty()) {
                return new StatsSnapshot(prior.heroes(), prior.tierList(), prior.leaderboard(),
                    prior.lastUpdated(), SnapshotStatus.STALE, failures);
            }
            return new StatsSnapshot(List.of(), TierList.empty(), List.of(),
                prior.lastUpdated(), SnapshotStatus.ERROR, failures);
        });
        logger.warn("Hero refresh failed ({} consecutive); snapshot is now {}", next.consecutiveFailures(), next.status());
        return next;
    }
}
