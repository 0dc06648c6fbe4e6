package com.mlbbai.hero_analysis_engine.service.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class ExpiringCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private ExpiringCache<String, Object> cache;

    @BeforeEach
    void setUp() {
        cache = new ExpiringCache<>(Duration.ofHours(1), 100, nanos::get);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    @Test
    void entryExpiresAfterDefaultTtl() {
        cache.set("hero_detail_ling", "detail");

        advance(Duration.ofMinutes(59));
        assertThat(cache.get("hero_detail_ling")).contains("detail");

        advance(Duration.ofMinutes(2));
        assertThat(cache.get("hero_detail_ling")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void eachEntryKeepsItsOwnTtl() {
        cache.set("short", "a", Duration.ofSeconds(10));
        cache.set("long", "b");

        advance(Duration.ofSeconds(11));

        assertThat(cache.get("short")).isEmpty();
        assertThat(cache.get("long")).contains("b");
    }

    @Test
    void nonPositiveTtlUsesDefault() {
        cache.set("key", "value", Duration.ZERO);

        advance(Duration.ofMinutes(30));

        assertThat(cache.get("key")).contains("value");
    }

    @Test
    void readsDoNotExtendLifetime() {
        cache.set("key", "value", Duration.ofSeconds(10));

        advance(Duration.ofSeconds(6));
        assertThat(cache.get("key")).isPresent();
        advance(Duration.ofSeconds(6));

        assertThat(cache.get("key")).isEmpty();
    }

    @Test
    void typedGetIgnoresOtherTypes() {
        cache.set("key", 42);

        assertThat(cache.get("key", Integer.class)).contains(42);
        assertThat(cache.get("key", String.class)).isEmpty();
    }

    @Test
    void flushAllRemovesEverything() {
        cache.set("a", "1");
        cache.set("b", "2");

        cache.flushAll();

        assertThat(cache.size()).isZero();
        assertThat(cache.get("a")).isEmpty();
    }
}
