package com.mlbbai.hero_analysis_engine.service;

import com.github.benmanes.caffeine.cache.Ticker;
import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.HeroDetail;
import com.mlbbai.hero_analysis_engine.model.LeaderboardEntry;
import com.mlbbai.hero_analysis_engine.service.cache.ExpiringCache;
import com.mlbbai.hero_analysis_engine.service.provider.HeroStatsNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.mlbbai.hero_analysis_engine.testutil.HeroFixtures.hero;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class HeroQueryServiceTest {

    @Mock
    private HeroStatsNormalizer normalizer;

    private HeroSnapshotStore store;
    private ExpiringCache<String, Object> cache;
    private HeroQueryService service;

    @BeforeEach
    void setUp() {
        store = new HeroSnapshotStore();
        cache = new ExpiringCache<>(Duration.ofHours(1), 100, Ticker.systemTicker());
        service = new HeroQueryService(store, normalizer, cache);
        store.commitSuccess(List.of(
            hero("1", "Ling", "Assassin", 0.53, 0.40, 0.10),
            hero("2", "Tigreal", "Tank", 0.51, 0.05, 0.20),
            hero("3", "Yi Sun-shin", "Assassin/Marksman", 0.56, 0.10, 0.02),
            hero("4", "Miya", "Marksman", 0.47, 0.01, 0.15)
        ), Instant.parse("2026-10-19T10:00:00Z"));
    }

    @Test
    void listFiltersByRoleAndSortsByRate() {
        List<Hero> assassins = service.listHeroes("assassin", null, "winrate", null);

        assertThat(assassins).extracting(Hero::getName).containsExactly("Yi Sun-shin", "Ling");
    }

    @Test
    void listFiltersByTierAndName() {
        assertThat(service.listHeroes(null, "a", null, null)).extracting(Hero::getName).containsExactly("Tigreal");
        assertThat(service.listHeroes(null, null, null, "MI")).extracting(Hero::getName).containsExactly("Miya");
    }

    @Test
    void unknownSortKeepsProviderOrder() {
        assertThat(service.listHeroes(null, null, "alphabetical", null))
            .extracting(Hero::getName).containsExactly("Ling", "Tigreal", "Yi Sun-shin", "Miya");
        assertThat(service.listHeroes(null, null, "pickrate", null))
            .extracting(Hero::getName).containsExactly("Tigreal", "Miya", "Ling", "Yi Sun-shin");
    }

    @Test
    void searchMatchesNameOrRoleAndCapsResults() {
        List<Hero> many = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            many.add(hero(String.valueOf(i), "Fighter" + i, "Fighter", 0.5, 0.1, 0.1));
        }
        store.commitSuccess(many, Instant.now());

        assertThat(service.search("fighter")).hasSize(HeroQueryService.SEARCH_LIMIT);
    }

    @Test
    void searchMatchesRole() {
        assertThat(service.search("marks")).extracting(Hero::getName).containsExactly("Yi Sun-shin", "Miya");
    }

    @Test
    void findHeroAcceptsSlugNameAndId() {
        assertThat(service.findHero("yi-sun-shin")).map(Hero::getId).contains("3");
        assertThat(service.findHero("TIGREAL")).map(Hero::getId).contains("2");
        assertThat(service.findHero("4")).map(Hero::getName).contains("Miya");
        assertThat(service.findHero("nobody")).isEmpty();
    }

    @Test
    void heroDetailIsFetchedOnceThenServedFromCache() {
        HeroDetail detail = HeroDetail.builder().description("Lore").counters(List.of("Saber")).build();
        given(normalizer.fetchDetail(eq("1"), anyList())).willReturn(Mono.just(detail));

        StepVerifier.create(service.heroDetail("ling"))
            .assertNext(lookup -> {
                assertThat(lookup.cached()).isFalse();
                assertThat(lookup.hero().getDetail().getCounters()).containsExactly("Saber");
            })
            .verifyComplete();
        StepVerifier.create(service.heroDetail("Ling"))
            .assertNext(lookup -> assertThat(lookup.cached()).isTrue())
            .verifyComplete();

        verify(normalizer, times(1)).fetchDetail(eq("1"), anyList());
    }

    @Test
    void heroDetailForUnknownHeroIsEmpty() {
        StepVerifier.create(service.heroDetail("nobody")).verifyComplete();

        verifyNoInteractions(normalizer);
    }

    @Test
    void analysisSubjectUsesCachedDetailWhenPresent() {
        given(normalizer.fetchDetail(eq("1"), anyList()))
            .willReturn(Mono.just(HeroDetail.builder().itemBuild(List.of("Blade of Despair")).build()));
        service.heroDetail("ling").block();

        Hero subject = service.resolveForAnalysis("Ling");

        assertThat(subject.getDetail().getItemBuild()).containsExactly("Blade of Despair");
    }

    @Test
    void analysisSubjectForUnknownNameIsNameOnly() {
        Hero subject = service.resolveForAnalysis(" Zetian ");

        assertThat(subject.getName()).isEqualTo("Zetian");
        assertThat(subject.getWinRate().known()).isFalse();
    }

    @Test
    void leaderboardFiltersByCategoryAndLimits() {
        List<LeaderboardEntry> banned = service.leaderboard("banned", 2);

        assertThat(banned).extracting(LeaderboardEntry::name).containsExactly("Ling", "Yi Sun-shin");
        assertThat(banned).allMatch(entry -> entry.category().equals("Most Banned"));
    }

    @Test
    void leaderboardLimitBelowOneUsesDefault() {
        assertThat(service.leaderboard(null, 0)).hasSize(12);
        assertThat(service.leaderboard("", -5)).hasSize(12);
    }
}
