/**
 * Service that turns provider responses into canonical heroes
 *
 * @author William Callahan
 *
 * Features:
 * - Tries each {@link HeroListSource} in priority order and stops at the first one yielding heroes
 * - Requests each provider path at most once per run, even when several sources read it
 * - Skips rows that fail to adapt instead of failing the whole run
 * - Deduplicates by identity and by case-insensitive name, first seen wins
 * - Assembles hero details from four independent sub-fetches
 */
package com.mlbbai.hero_analysis_engine.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.mlbbai.hero_analysis_engine.model.Hero;
import com.mlbbai.hero_analysis_engine.model.HeroAbilityScores;
import com.mlbbai.hero_analysis_engine.model.HeroDetail;
import com.mlbbai.hero_analysis_engine.service.provider.source.HeroListSource;
import com.mlbbai.hero_analysis_engine.util.ExternalApiLogger;
import com.mlbbai.hero_analysis_engine.util.HeroJsonFields;
import com.mlbbai.hero_analysis_engine.util.ValidationUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

@Service
@Slf4j
public class HeroStatsNormalizer {

    private static final Pattern NUMERIC_ID = Pattern.compile("\\d+");
    private static final Pattern NON_SLUG_CHARS = Pattern.compile("[^a-z0-9]+");

    private final MlbbStatsApiFetcher fetcher;
    private final List<HeroListSource> sources;

    public HeroStatsNormalizer(MlbbStatsApiFetcher fetcher, List<HeroListSource> sources) {
        this.fetcher = fetcher;
        this.sources = List.copyOf(sources);
    }

    /**
     * Fetches the current hero roster.
     *
     * @return deduplicated heroes from the first source that produced any; an empty list when none did
     */
    public Mono<List<Hero>> fetchAll() {
        Map<String, Mono<JsonNode>> responses = new ConcurrentHashMap<>();
        return Flux.fromIterable(sources)
            .concatMap(source -> responseFor(source.path(), responses)
                .map(response -> adaptAll(source, response))
                .defaultIfEmpty(List.of()))
            .filter(heroes -> !heroes.isEmpty())
            .next()
            .defaultIfEmpty(List.of());
    }

    private Mono<JsonNode> responseFor(String path, Map<String, Mono<JsonNode>> responses) {
        return responses.computeIfAbsent(path, p -> fetcher.get(p)
            .onErrorResume(e -> {
                log.warn("Provider path {} unavailable for this run: {}", p, e.getMessage());
                return Mono.empty();
            })
            .cache());
    }

    List<Hero> adaptAll(HeroListSource source, JsonNode response) {
        List<JsonNode> rows;
        try {
            rows = source.extractRows(response);
        } catch (RuntimeException e) {
            log.warn("Source {} could not locate rows: {}", source.name(), e.getMessage());
            rows = List.of();
        }
        List<Hero> adapted = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            Optional<Hero> hero;
            try {
                hero = source.adapt(row);
            } catch (RuntimeException e) {
                log.debug("Source {} failed to adapt row: {}", source.name(), e.getMessage());
                hero = Optional.empty();
            }
            if (hero.isPresent()) {
                adapted.add(hero.get());
            } else {
                log.debug("Source {} skipped unreadable row", source.name());
            }
        }
        List<Hero> heroes = deduplicate(adapted);
        ExternalApiLogger.logSourceResult(log, source.name(), rows.size(), heroes.size());
        return heroes;
    }

    /**
     * Keeps the first hero per identity and per case-insensitive name.
     */
    public static List<Hero> deduplicate(List<Hero> heroes) {
        Map<String, Hero> byIdentity = new LinkedHashMap<>();
        Set<String> names = new HashSet<>();
        for (Hero hero : heroes) {
            if (!ValidationUtils.hasText(hero.getName())) {
                continue;
            }
            if (byIdentity.containsKey(hero.identity()) || !names.add(hero.normalizedName())) {
                log.debug("Dropping duplicate hero {}", hero.getName());
                continue;
            }
            byIdentity.put(hero.identity(), hero);
        }
        return List.copyOf(byIdentity.values());
    }

    /**
     * Fetches the extended record for one hero.
     *
     * @param identityOrId numeric provider id, or a hero name/slug resolved against {@code knownHeroes}
     * @param knownHeroes heroes of the current snapshot
     * @return detail with empty parts for every failed sub-fetch; fully empty when the hero cannot be resolved
     */
    public Mono<HeroDetail> fetchDetail(String identityOrId, List<Hero> knownHeroes) {
        Optional<String> heroId = resolveProviderId(identityOrId, knownHeroes);
        if (heroId.isEmpty()) {
            log.warn("No provider id found for hero '{}'", identityOrId);
            return Mono.just(HeroDetail.empty());
        }
        String id = heroId.get();
        return Mono.zip(
                subFetch("/hero-detail/" + id + "/"),
                subFetch("/hero-counter/" + id + "/"),
                subFetch("/hero-compatibility/" + id + "/"),
                subFetch("/academy/guide/" + id + "/builds/"))
            .map(parts -> {
                JsonNode profile = heroProfile(parts.getT1());
                return HeroDetail.builder()
                    .description(HeroJsonFields.firstText(profile, "story", "lore", "description").orElse(""))
                    .imageRef(HeroJsonFields.firstText(profile, "head_image", "image", "head", "avatar").orElse(""))
                    .abilityScores(new HeroAbilityScores(
                        HeroJsonFields.intOrZero(profile, "durability"),
                        HeroJsonFields.intOrZero(profile, "offense"),
                        HeroJsonFields.intOrZero(profile, "control"),
                        HeroJsonFields.intOrZero(profile, "mobility"),
                        HeroJsonFields.intOrZero(profile, "support")))
                    .counters(HeroJsonFields.names(
                        HeroJsonFields.firstArray(parts.getT2(), "/data", "/data/counters", "/counters", "/data/data"),
                        "name", "hero_name"))
                    .teammates(HeroJsonFields.names(
                        HeroJsonFields.firstArray(parts.getT3(), "/data", "/data/teammates", "/teammates", "/data/data"),
                        "name", "hero_name"))
                    .itemBuild(topBuild(parts.getT4()))
                    .build();
            });
    }

    Optional<String> resolveProviderId(String identityOrId, List<Hero> knownHeroes) {
        if (!ValidationUtils.hasText(identityOrId)) {
            return Optional.empty();
        }
        String candidate = identityOrId.trim();
        if (NUMERIC_ID.matcher(candidate).matches()) {
            return Optional.of(candidate);
        }
        String key = ValidationUtils.normalizeKey(candidate);
        String slug = slugify(candidate);
        return knownHeroes.stream()
            .filter(hero -> candidate.equals(hero.getId())
                || hero.normalizedName().equals(key)
                || slugify(hero.getName()).equals(slug))
            .findFirst()
            .map(Hero::getId)
            .filter(ValidationUtils::hasText);
    }

    /**
     * Lower-case slug with runs of non-alphanumerics collapsed to '-', e.g. "Yi Sun-shin" -> "yi-sun-shin".
     */
    public static String slugify(String name) {
        String slug = NON_SLUG_CHARS.matcher(ValidationUtils.normalizeKey(name)).replaceAll("-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }

    private Mono<JsonNode> subFetch(String path) {
        return fetcher.get(path)
            .onErrorResume(e -> {
                log.debug("Detail sub-fetch {} failed: {}", path, e.getMessage());
                return Mono.empty();
            })
            .defaultIfEmpty(MissingNode.getInstance());
    }

    private JsonNode heroProfile(JsonNode response) {
        JsonNode inner = HeroJsonFields.unwrapData(response, 3);
        List<JsonNode> records = HeroJsonFields.firstArray(inner, "/records");
        if (!records.isEmpty()) {
            inner = HeroJsonFields.unwrapData(records.get(0), 3);
        }
        JsonNode hero = inner == null ? null : inner.get("hero");
        if (hero != null && hero.isObject()) {
            inner = HeroJsonFields.unwrapData(hero, 2);
        }
        return inner;
    }

    private List<String> topBuild(JsonNode response) {
        List<JsonNode> builds = HeroJsonFields.firstArray(response, "/data", "/data/records");
        if (builds.isEmpty()) {
            return List.of();
        }
        JsonNode top = HeroJsonFields.unwrapData(builds.get(0), 2);
        List<JsonNode> items = HeroJsonFields.firstArray(top, "/items", "/equipment", "/equips");
        return HeroJsonFields.names(items, "name", "item_name", "equip_name");
    }
}
