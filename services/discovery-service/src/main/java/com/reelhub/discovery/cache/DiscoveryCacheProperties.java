package com.reelhub.discovery.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "discovery.cache")
public class DiscoveryCacheProperties {
    private boolean enabled = true;
    private int maxEntries = 5000;
    private long trendingTtlMs = 86_400_000L;
    private long searchTtlMs = 900_000L;
    private long detailsTtlMs = 43_200_000L;
    private long suggestionsTtlMs = 3_600_000L;
    private long recommendationsTtlMs = 86_400_000L;
    private long proxyTtlMs = 300_000L;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    public long getTrendingTtlMs() {
        return trendingTtlMs;
    }

    public void setTrendingTtlMs(long trendingTtlMs) {
        this.trendingTtlMs = trendingTtlMs;
    }

    public long getSearchTtlMs() {
        return searchTtlMs;
    }

    public void setSearchTtlMs(long searchTtlMs) {
        this.searchTtlMs = searchTtlMs;
    }

    public long getDetailsTtlMs() {
        return detailsTtlMs;
    }

    public void setDetailsTtlMs(long detailsTtlMs) {
        this.detailsTtlMs = detailsTtlMs;
    }

    public long getSuggestionsTtlMs() {
        return suggestionsTtlMs;
    }

    public void setSuggestionsTtlMs(long suggestionsTtlMs) {
        this.suggestionsTtlMs = suggestionsTtlMs;
    }

    public long getRecommendationsTtlMs() {
        return recommendationsTtlMs;
    }

    public void setRecommendationsTtlMs(long recommendationsTtlMs) {
        this.recommendationsTtlMs = recommendationsTtlMs;
    }

    public long getProxyTtlMs() {
        return proxyTtlMs;
    }

    public void setProxyTtlMs(long proxyTtlMs) {
        this.proxyTtlMs = proxyTtlMs;
    }
}
