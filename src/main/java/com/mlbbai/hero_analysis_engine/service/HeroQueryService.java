/**
 * Read-side queries over the current hero snapshot
 *
 * @author William Callahan
 *
 * Features:
 * - Filtering by role, tier and name with stable descending sorts by rate
 * - Name/role search capped at ten results
 * - Leaderboard filtering by category label
 * - Cache-first hero detail assembly
 * - Resolves analysis subjects, attaching any cached detail
 */
package com.mlbbai.hero_analysis_engine.service;

import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.LeaderboardEntry;
import com.mlbbai.hero_analysis_engine.model.RateMetric;
import com.mlbbai.hero_analysis_engine.model.StatsSnapshot;
import com.mlbbai.hero_analysis_engine.service.cache.ExpiringCache;
import com.mlbbai.hero_analysis_engine.service.provider.HeroStatsNormalizer;
import com.mlbbai.hero_analysis_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

@Service
@Slf4j
public class HeroQueryService {

    public static final String DETAIL_KEY_PREFIX = "hero_detail_";
    public static final int SEARCH_LIMIT = 10;
    public static final int DEFAULT_LEADERBOARD_LIMIT = 50;

    /**
     * A hero with its detail attached, plus whether it came from the cache.
     */
    public record DetailLookup(Hero hero, boolean cached) {
    }

    private final HeroSnapshotStore store;
    private final HeroStatsNormalizer normalizer;
    private final ExpiringCache<String, Object> responseCache;

    public HeroQueryService(HeroSnapshotStore store,
                            HeroStatsNormalizer normalizer,
                            ExpiringCache<String, Object> responseCache) {
        this.store = store;
        this.normalizer = normalizer;
        this.responseCache = responseCache;
    }

    public StatsSnapshot snapshot() {
        return store.current();
    }

    /**
     * @param role case-insensitive substring of the role
     * @param tier exact tier label, case-insensitive
     * @param sort winrate, banrate or pickrate; anything else keeps provider order
     * @param search case-insensitive substring of the name
     */
    public List<Hero> listHeroes(String role, String tier, String sort, String search) {
        Stream<Hero> heroes = store.current().heroes().stream()
            .filter(hero -> ValidationUtils.containsIgnoreCase(hero.getRole(), role))
            .filter(hero -> !ValidationUtils.hasText(tier) || hero.getTier().equalsIgnoreCase(tier.trim()))
            .filter(hero -> ValidationUtils.containsIgnoreCase(hero.getName(), search));
        Function<Hero, RateMetric> metric = sortMetric(sort);
        if (metric != null) {
            heroes = heroes.sorted(Comparator.comparingDouble((Hero h) -> metric.apply(h).raw()).reversed());
        }
        return heroes.toList();
    }

    private static Function<Hero, RateMetric> sortMetric(String sort) {
        if (!ValidationUtils.hasText(sort)) {
            return null;
        }
        return switch (sort.trim().toLowerCase(Locale.ROOT)) {
            case "winrate" -> Hero::getWinRate;
            case "banrate" -> Hero::getBanRate;
            case "pickrate" -> Hero::getPickRate;
            default -> null;
        };
    }

    public List<Hero> search(String query) {
        String q = ValidationUtils.trimToEmpty(query);
        return store.current().heroes().stream()
            .filter(hero -> ValidationUtils.containsIgnoreCase(hero.getName(), q)
                || ValidationUtils.containsIgnoreCase(hero.getRole(), q))
            .limit(SEARCH_LIMIT)
            .toList();
    }

    public Optional<Hero> findHero(String nameOrSlug) {
        if (!ValidationUtils.hasText(nameOrSlug)) {
            return Optional.empty();
        }
        String candidate = nameOrSlug.trim();
        String key = ValidationUtils.normalizeKey(candidate);
        String slug = HeroStatsNormalizer.slugify(candidate);
        return store.current().heroes().stream()
            .filter(hero -> hero.normalizedName().equals(key)
                || candidate.equals(hero.getId())
                || HeroStatsNormalizer.slugify(hero.getName()).equals(slug))
            .findFirst();
    }

    /**
     * Cache-first detail lookup. Empty when the hero is not in the current snapshot.
     */
    public Mono<DetailLookup> heroDetail(String slug) {
        Optional<Hero> hero = findHero(slug);
        if (hero.isEmpty()) {
            return Mono.empty();
        }
        String key = detailCacheKey(hero.get().getName());
        Optional<Hero> cached = responseCache.get(key, Hero.class);
        if (cached.isPresent()) {
            return Mono.just(new DetailLookup(cached.get(), true));
        }
        Hero base = hero.get();
        String lookupKey = ValidationUtils.hasText(base.getId()) ? base.getId() : base.getName();
        return normalizer.fetchDetail(lookupKey, store.current().heroes())
            .map(detail -> {
                Hero merged = base.toBuilder()
                    .detail(detail)
                    .imageRef(ValidationUtils.hasText(base.getImageRef()) ? base.getImageRef() : detail.getImageRef())
                    .build();
                responseCache.set(key, merged);
                return new DetailLookup(merged, false);
            });
    }

    public static String detailCacheKey(String name) {
        return DETAIL_KEY_PREFIX + HeroStatsNormalizer.slugify(name);
    }

    /**
     * The analysis subject for a name: the snapshot hero with any cached detail,
     * or a name-only hero when the name is not in the snapshot.
     */
    public Hero resolveForAnalysis(String name) {
        Optional<Hero> hero = findHero(name);
        if (hero.isEmpty()) {
            return Hero.named(name.trim());
        }
        return responseCache.get(detailCacheKey(hero.get().getName()), Hero.class).orElse(hero.get());
    }

    /**
     * @param category case-insensitive substring of a category label; blank keeps all
     * @param limit maximum entries; values below 1 use {@value #DEFAULT_LEADERBOARD_LIMIT}
     */
    public List<LeaderboardEntry> leaderboard(String category, int limit) {
        int effectiveLimit = limit < 1 ? DEFAULT_LEADERBOARD_LIMIT : limit;
        return store.current().leaderboard().stream()
            .filter(entry -> ValidationUtils.containsIgnoreCase(entry.category(), category))
            .limit(effectiveLimit)
            .toList();
    }
}
