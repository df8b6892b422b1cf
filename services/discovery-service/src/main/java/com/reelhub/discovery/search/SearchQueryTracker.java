package com.reelhub.discovery.search;

import com.reelhub.discovery.cache.CacheKeyUtil;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * In-memory counter of executed search queries. The trending snapshot is recomputed at most once
 * per refresh window, or earlier when it is empty. Once the number of distinct queries passes the
 * configured bound (plus a tenth of slack), the lowest-count queries are dropped.
 */
@Component
public class SearchQueryTracker {
    private final SearchProperties properties;
    private final Clock clock;
    private final ConcurrentHashMap<String, LongAdder> counts = new ConcurrentHashMap<>();
    private volatile Snapshot snapshot = new Snapshot(List.of(), 0L);

    @Autowired
    public SearchQueryTracker(SearchProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public SearchQueryTracker(SearchProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public void track(String query) {
        String normalized = CacheKeyUtil.normalizeQuery(query);
        if (normalized.isEmpty()) {
            return;
        }
        counts.computeIfAbsent(normalized, key -> new LongAdder()).increment();
        int max = maxTracked();
        if (counts.size() > max + max / 10) {
            prune(max);
        }
    }

    public List<TrendingQuery> trending() {
        long now = clock.millis();
        Snapshot current = snapshot;
        if (!current.queries.isEmpty() && now - current.builtAtMs < properties.getTrendingRefreshMs()) {
            return current.queries;
        }
        synchronized (this) {
            current = snapshot;
            if (current.queries.isEmpty() || now - current.builtAtMs >= properties.getTrendingRefreshMs()) {
                current = new Snapshot(compute(properties.getTrendingLimit()), now);
                snapshot = current;
            }
            return current.queries;
        }
    }

    public List<TrendingQuery> trending(int limit) {
        List<TrendingQuery> queries = trending();
        return queries.size() <= limit ? queries : queries.subList(0, Math.max(0, limit));
    }

    public synchronized void reset() {
        counts.clear();
        snapshot = new Snapshot(List.of(), 0L);
    }

    int trackedQueryCount() {
        return counts.size();
    }

    private synchronized void prune(int max) {
        List<Map.Entry<String, Long>> entries = ranked();
        for (Map.Entry<String, Long> entry : entries.subList(Math.min(max, entries.size()), entries.size())) {
            counts.remove(entry.getKey());
        }
    }

    private int maxTracked() {
        return Math.max(1, properties.getMaxTrackedQueries());
    }

    private List<Map.Entry<String, Long>> ranked() {
        List<Map.Entry<String, Long>> entries = new ArrayList<>();
        counts.forEach((query, adder) -> entries.add(Map.entry(query, adder.sum())));
        entries.sort(
            Map.Entry.<String, Long>comparingByValue().reversed()
                .thenComparing(Map.Entry.comparingByKey())
        );
        return entries;
    }

    private List<TrendingQuery> compute(int limit) {
        return ranked().stream()
            .limit(Math.max(0, limit))
            .map(entry -> new TrendingQuery(entry.getKey(), entry.getValue(), true))
            .collect(Collectors.toUnmodifiableList());
    }

    private static final class Snapshot {
        private final List<TrendingQuery> queries;
        private final long builtAtMs;

        private Snapshot(List<TrendingQuery> queries, long builtAtMs) {
            this.queries = queries;
            this.builtAtMs = builtAtMs;
        }
    }
}
