package com.reelhub.discovery.cache;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

public class TtlCache<V> {
    private final ConcurrentHashMap<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> order = new ConcurrentLinkedQueue<>();
    private final int maxEntries;
    private final Clock clock;

    public TtlCache(int maxEntries) {
        this(maxEntries, Clock.systemUTC());
    }

    public TtlCache(int maxEntries, Clock clock) {
        this.maxEntries = Math.max(1, maxEntries);
        this.clock = clock;
    }

    public Optional<CacheEntry<V>> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.millis())) {
            if (entries.remove(key, entry)) {
                order.remove(key);
            }
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void put(String key, V value, long ttlMs) {
        if (key == null || value == null || ttlMs <= 0) {
            return;
        }
        long now = clock.millis();
        CacheEntry<V> entry = new CacheEntry<>(key, value, now, now + ttlMs);
        entries.put(key, entry);
        order.remove(key);
        order.add(key);
        evictIfNeeded();
    }

    public boolean remove(String key) {
        if (key == null) {
            return false;
        }
        order.remove(key);
        return entries.remove(key) != null;
    }

    public int removeByPrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return 0;
        }
        int removed = 0;
        for (String key : entries.keySet()) {
            if (key.startsWith(prefix) && remove(key)) {
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    private void evictIfNeeded() {
        while (entries.size() > maxEntries) {
            String key = order.poll();
            if (key == null) {
                break;
            }
            entries.remove(key);
        }
    }
}
