package com.mlbbai.hero_analysis_engine.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of the last committed refresh. The hero list, tier list and
 * leaderboard are always derived from the same hero list and replaced together.
 *
 * @param heroes canonical heroes in provider order
 * @param tierList tier buckets derived from {@code heroes}
 * @param leaderboard ranked entries derived from {@code heroes}
 * @param lastUpdated time of the last successful refresh, null before the first one
 * @param status lifecycle status
 * @param consecutiveFailures failed refreshes since the last success
 */
public record StatsSnapshot(List<Hero> heroes,
                            TierList tierList,
                            List<LeaderboardEntry> leaderboard,
                            Instant lastUpdated,
                            SnapshotStatus status,
                            int consecutiveFailures) {

    public StatsSnapshot {
        heroes = heroes == null ? List.of() : List.copyOf(heroes);
        tierList = tierList == null ? TierList.empty() : tierList;
        leaderboard = leaderboard == null ? List.of() : List.copyOf(leaderboard);
        status = status == null ? SnapshotStatus.INITIALIZING : status;
    }

    public static StatsSnapshot initial() {
        return new StatsSnapshot(List.of(), TierList.empty(), List.of(), null, SnapshotStatus.INITIALIZING, 0);
    }

    public StatsSnapshot withStatus(SnapshotStatus newStatus) {
        return new StatsSnapshot(heroes, tierList, leaderboard, lastUpdated, newStatus, consecutiveFailures);
    }

    public int heroCount() {
        return heroes.size();
    }
}
