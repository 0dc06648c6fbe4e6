package com.mlbbai.hero_analysis_engine.service;

import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.LeaderboardEntry;
import com.mlbbai.hero_analysis_engine.model.SnapshotStatus;
import com.mlbbai.hero_analysis_engine.model.StatsSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static com.mlbbai.hero_analysis_engine.testutil.HeroFixtures.hero;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;

class HeroSnapshotStoreTest {

    private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

    private final HeroSnapshotStore store = new HeroSnapshotStore();

    @Test
    void startsInitializingWithNoData() {
        StatsSnapshot snapshot = store.current();

        assertThat(snapshot.status()).isEqualTo(SnapshotStatus.INITIALIZING);
        assertThat(snapshot.heroes()).isEmpty();
        assertThat(snapshot.lastUpdated()).isNull();
    }

    @Test
    void successDerivesTierListAndLeaderboardTogether() {
        List<Hero> heroes = List.of(
            hero("1", "HeroA", "Mage", 0.565, 0.2, 0.1),
            hero("2", "HeroB", "Tank", 0.45, 0.1, 0.2));

        StatsSnapshot snapshot = store.commitSuccess(heroes, NOW);

        assertThat(snapshot.status()).isEqualTo(SnapshotStatus.READY);
        assertThat(snapshot.lastUpdated()).isEqualTo(NOW);
        assertThat(snapshot.tierList().heroCount()).isEqualTo(2);
        assertThat(snapshot.leaderboard()).hasSize(6);
        assertThat(store.current()).isSameAs(snapshot);
    }

    @Test
    void tierListAndLeaderboardForTwoHeroes() {
        StatsSnapshot snapshot = store.commitSuccess(List.of(
            hero("1", "HeroA", "Mage", 0.58, 0.10, 0.10),
            hero("2", "HeroB", "Tank", 0.40, 0.10, 0.10)), NOW);

        assertThat(snapshot.tierList().asMap()).containsExactly(
            entry("S+", List.of("HeroA")),
            entry("C", List.of("HeroB")));
        assertThat(snapshot.leaderboard().subList(0, 2))
            .extracting(LeaderboardEntry::category, LeaderboardEntry::rank, LeaderboardEntry::name)
            .containsExactly(
                tuple("Top Win Rate", 1, "HeroA"),
                tuple("Top Win Rate", 2, "HeroB"));
    }

    @Test
    void failureWithoutPriorDataIsError() {
        StatsSnapshot snapshot = store.commitFailure();

        assertThat(snapshot.status()).isEqualTo(SnapshotStatus.ERROR);
        assertThat(snapshot.consecutiveFailures()).isEqualTo(1);
        assertThat(snapshot.heroes()).isEmpty();
    }

    @Test
    void failureAfterSuccessKeepsDataAsStale() {
        store.commitSuccess(List.of(hero("1", "HeroA", "Mage", 0.565, 0.2, 0.1)), NOW);
        store.markScraping();

        store.commitFailure();
        StatsSnapshot snapshot = store.commitFailure();

        assertThat(snapshot.status()).isEqualTo(SnapshotStatus.STALE);
        assertThat(snapshot.consecutiveFailures()).isEqualTo(2);
        assertThat(snapshot.heroes()).extracting(Hero::getName).containsExactly("HeroA");
        assertThat(snapshot.lastUpdated()).isEqualTo(NOW);
    }

    @Test
    void successResetsFailureCount() {
        store.commitFailure();

        StatsSnapshot snapshot = store.commitSuccess(List.of(hero("1", "HeroA", "Mage", 0.5, 0.2, 0.1)), NOW);

        assertThat(snapshot.consecutiveFailures()).isZero();
    }

    @Test
    void emptySuccessIsRecordedAsFailure() {
        StatsSnapshot snapshot = store.commitSuccess(List.of(), NOW);

        assertThat(snapshot.status()).isEqualTo(SnapshotStatus.ERROR);
    }

    @Test
    void markScrapingKeepsServingPriorData() {
        store.commitSuccess(List.of(hero("1", "HeroA", "Mage", 0.5, 0.2, 0.1)), NOW);

        StatsSnapshot snapshot = store.markScraping();

        assertThat(snapshot.status()).isEqualTo(SnapshotStatus.SCRAPING);
        assertThat(snapshot.heroCount()).isEqualTo(1);
    }

    @Test
    void readersNeverSeeTierListOrLeaderboardFromAnotherHeroSet() throws Exception {
        List<Hero> pair = List.of(
            hero("1", "HeroA", "Mage", 0.58, 0.10, 0.10),
            hero("2", "HeroB", "Tank", 0.40, 0.10, 0.10));
        List<Hero> trio = List.of(
            hero("3", "HeroC", "Marksman", 0.55, 0.20, 0.30),
            hero("4", "HeroD", "Support", 0.50, 0.05, 0.15),
            hero("5", "HeroE", "Fighter", 0.47, 0.01, 0.02));
        AtomicBoolean writing = new AtomicBoolean(true);
        ConcurrentLinkedQueue<String> mismatches = new ConcurrentLinkedQueue<>();

        Thread reader = new Thread(() -> {
            while (writing.get()) {
                StatsSnapshot snapshot = store.current();
                Set<String> names = snapshot.heroes().stream().map(Hero::getName).collect(Collectors.toSet());
                boolean leaderboardMatches = snapshot.leaderboard().stream()
                    .allMatch(entry -> names.contains(entry.name()));
                if (snapshot.tierList().heroCount() != names.size() || !leaderboardMatches) {
                    mismatches.add(snapshot.status() + " heroes=" + names);
                }
            }
        });
        reader.start();
        for (int i = 0; i < 2_000; i++) {
            store.markScraping();
            store.commitSuccess(i % 2 == 0 ? pair : trio, NOW);
        }
        writing.set(false);
        reader.join(5_000);

        assertThat(mismatches).isEmpty();
        assertThat(store.current().heroCount()).isEqualTo(3);
    }
}
