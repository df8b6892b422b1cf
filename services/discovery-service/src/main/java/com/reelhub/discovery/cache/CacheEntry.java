package com.reelhub.discovery.cache;

public class CacheEntry<V> {
    private final String key;
    private final V value;
    private final long createdAt;
    private final long expiresAt;

    public CacheEntry(String key, V value, long createdAt, long expiresAt) {
        this.key = key;
        this.value = value;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(long nowMs) {
        return nowMs >= expiresAt;
    }
}
