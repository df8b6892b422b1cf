package com.reelhub.discovery.cache;

public record CacheResult<V>(V value, boolean fromCache) {

    public static <V> CacheResult<V> hit(V value) {
        return new CacheResult<>(value, true);
    }

    public static <V> CacheResult<V> miss(V value) {
        return new CacheResult<>(value, false);
    }
}
