package com.reelhub.discovery.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.reelhub.discovery.MutableClock;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TtlCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void entriesExpireAfterTtl() {
        TtlCache<String> cache = new TtlCache<>(10, clock);
        cache.put("k", "v", 1_000);

        clock.advanceMillis(999);
        assertThat(cache.get("k")).isPresent();

        clock.advanceMillis(1);
        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void evictsOldestWhenFull() {
        TtlCache<String> cache = new TtlCache<>(2, clock);
        cache.put("a", "1", 10_000);
        cache.put("b", "2", 10_000);
        cache.put("a", "1b", 10_000);
        cache.put("c", "3", 10_000);

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).map(CacheEntry::getValue).contains("1b");
        assertThat(cache.get("c")).isPresent();
    }

    @Test
    void expiredKeyReinsertedIsNotEvictedBeforeOlderEntries() {
        TtlCache<String> cache = new TtlCache<>(2, clock);
        cache.put("a", "stale", 100);
        cache.put("b", "2", 10_000);

        clock.advanceMillis(200);
        assertThat(cache.get("a")).isEmpty();

        cache.put("a", "fresh", 10_000);
        cache.put("c", "3", 10_000);

        assertThat(cache.get("a")).map(CacheEntry::getValue).contains("fresh");
        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("c")).isPresent();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void removesByPrefix() {
        TtlCache<String> cache = new TtlCache<>(10, clock);
        cache.put("recs_user_42_home_x", "1", 10_000);
        cache.put("recs_user_42_item_movie_1_y", "2", 10_000);
        cache.put("recs_user_420_home_z", "3", 10_000);

        assertThat(cache.removeByPrefix("recs_user_42_")).isEqualTo(2);
        assertThat(cache.get("recs_user_420_home_z")).isPresent();
    }
}
