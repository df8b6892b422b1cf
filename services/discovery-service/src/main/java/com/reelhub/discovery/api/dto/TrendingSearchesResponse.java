package com.reelhub.discovery.api.dto;

import com.reelhub.discovery.search.TrendingQuery;
import java.time.Instant;
import java.util.List;

public class TrendingSearchesResponse {
    private List<TrendingQuery> trending = List.of();
    private Instant timestamp;

    public TrendingSearchesResponse() {
    }

    public TrendingSearchesResponse(List<TrendingQuery> trending, Instant timestamp) {
        this.trending = trending;
        this.timestamp = timestamp;
    }

    public List<TrendingQuery> getTrending() {
        return trending;
    }

    public void setTrending(List<TrendingQuery> trending) {
        this.trending = trending;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
}
