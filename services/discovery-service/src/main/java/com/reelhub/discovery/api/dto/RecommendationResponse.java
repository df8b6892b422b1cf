package com.reelhub.discovery.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.reelhub.discovery.model.CandidateItem;
import java.util.List;

public class RecommendationResponse {
    public static final String STRATEGY_PERSONALIZED = "personalized";
    public static final String STRATEGY_ITEM = "item";
    public static final String STRATEGY_TRENDING = "trending";
    public static final String STRATEGY_FALLBACK = "trending_fallback";

    private List<CandidateItem> results = List.of();
    private String strategy;

    @JsonProperty("from_cache")
    private boolean fromCache;

    public RecommendationResponse() {
    }

    public RecommendationResponse(List<CandidateItem> results, String strategy, boolean fromCache) {
        this.results = results;
        this.strategy = strategy;
        this.fromCache = fromCache;
    }

    public List<CandidateItem> getResults() {
        return results;
    }

    public void setResults(List<CandidateItem> results) {
        this.results = results;
    }

    public String getStrategy() {
        return strategy;
    }

    public void setStrategy(String strategy) {
        this.strategy = strategy;
    }

    public boolean isFromCache() {
        return fromCache;
    }

    public void setFromCache(boolean fromCache) {
        this.fromCache = fromCache;
    }

    @JsonIgnore
    public String cacheHeader() {
        return fromCache ? "HIT" : "MISS";
    }
}
