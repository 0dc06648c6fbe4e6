package com.mlbbai.hero_analysis_engine.service.event;

import java.time.Instant;

/**
 * Event published after a refresh committed a new hero snapshot.
 * Failed or stale refreshes never publish it.
 */
public class HeroSnapshotRefreshedEvent {
    private final int heroCount;
    private final Instant refreshedAt;
    private final String trigger;

    public HeroSnapshotRefreshedEvent(int heroCount, Instant refreshedAt, String trigger) {
        this.heroCount = heroCount;
        this.refreshedAt = refreshedAt;
        this.trigger = trigger;
    }

    public int getHeroCount() { return heroCount; }
    public Instant getRefreshedAt() { return refreshedAt; }
    public String getTrigger() { return trigger; }
}
