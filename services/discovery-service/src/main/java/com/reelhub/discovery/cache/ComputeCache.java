package com.reelhub.discovery.cache;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Compute-or-serve cache. A hit returns the stored value; a miss runs the producer, stores the
 * result for {@code ttlMs} and returns it. Concurrent misses for one key share a single producer
 * run. Failures are propagated and never stored.
 */
@Component
public class ComputeCache {
    private static final Logger logger = LoggerFactory.getLogger(ComputeCache.class);

    private final DiscoveryCacheProperties properties;
    private final TtlCache<Object> cache;
    private final ConcurrentHashMap<String, CompletableFuture<Object>> pending = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    @Autowired
    public ComputeCache(DiscoveryCacheProperties properties, MeterRegistry meterRegistry) {
        this(properties, meterRegistry, Clock.systemUTC());
    }

    public ComputeCache(DiscoveryCacheProperties properties, MeterRegistry meterRegistry, Clock clock) {
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.cache = new TtlCache<>(properties.getMaxEntries(), clock);
    }

    @SuppressWarnings("unchecked")
    public <V> CacheResult<V> get(String key, Supplier<V> producer, long ttlMs) {
        if (!properties.isEnabled() || key == null) {
            return CacheResult.miss(producer.get());
        }
        Optional<CacheEntry<Object>> cached = cache.get(key);
        if (cached.isPresent()) {
            meterRegistry.counter("discovery.cache.requests", "result", "hit").increment();
            logger.debug("cache_hit key={}", key);
            return CacheResult.hit((V) cached.get().getValue());
        }
        meterRegistry.counter("discovery.cache.requests", "result", "miss").increment();

        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> running = pending.putIfAbsent(key, mine);
        if (running != null) {
            logger.debug("cache_miss_joined key={}", key);
            return CacheResult.miss((V) await(running));
        }

        try {
            Optional<CacheEntry<Object>> stored = cache.get(key);
            if (stored.isPresent()) {
                mine.complete(stored.get().getValue());
                return CacheResult.hit((V) stored.get().getValue());
            }
            V value = producer.get();
            cache.put(key, value, ttlMs);
            mine.complete(value);
            logger.debug("cache_miss_stored key={} ttl_ms={}", key, ttlMs);
            return CacheResult.miss(value);
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            if (!mine.isDone()) {
                mine.completeExceptionally(new IllegalStateException("producer aborted for key " + key));
            }
            pending.remove(key, mine);
        }
    }

    @SuppressWarnings("unchecked")
    public <V> Optional<V> peek(String key) {
        return cache.get(key).map(entry -> (V) entry.getValue());
    }

    public void set(String key, Object value, long ttlMs) {
        if (!properties.isEnabled()) {
            return;
        }
        cache.put(key, value, ttlMs);
    }

    public boolean invalidate(String key) {
        return cache.remove(key);
    }

    public int invalidatePrefix(String prefix) {
        return cache.removeByPrefix(prefix);
    }

    public int size() {
        return cache.size();
    }

    private static Object await(CompletableFuture<Object> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw e;
        }
    }
}
