package com.reelhub.discovery.search;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "discovery.search")
public class SearchProperties {
    private int maxPages = 3;
    private int resultsPerUpstreamPage = 10;
    private int defaultPageSize = 20;
    private int maxPageSize = 50;
    private double minRelevance = 10.0;
    private double fuzzyThreshold = 0.7;
    private int suggestionLimit = 8;
    private int suggestionMinLength = 2;
    private int suggestionMinVotes = 5;
    private int trendingLimit = 10;
    private long trendingRefreshMs = 3_600_000L;
    private int earliestYear = 1900;
    private int maxTrackedQueries = 10_000;

    public int getMaxPages() {
        return maxPages;
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = maxPages;
    }

    public int getResultsPerUpstreamPage() {
        return resultsPerUpstreamPage;
    }

    public void setResultsPerUpstreamPage(int resultsPerUpstreamPage) {
        this.resultsPerUpstreamPage = resultsPerUpstreamPage;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public double getMinRelevance() {
        return minRelevance;
    }

    public void setMinRelevance(double minRelevance) {
        this.minRelevance = minRelevance;
    }

    public double getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public void setFuzzyThreshold(double fuzzyThreshold) {
        this.fuzzyThreshold = fuzzyThreshold;
    }

    public int getSuggestionLimit() {
        return suggestionLimit;
    }

    public void setSuggestionLimit(int suggestionLimit) {
        this.suggestionLimit = suggestionLimit;
    }

    public int getSuggestionMinLength() {
        return suggestionMinLength;
    }

    public void setSuggestionMinLength(int suggestionMinLength) {
        this.suggestionMinLength = suggestionMinLength;
    }

    public int getSuggestionMinVotes() {
        return suggestionMinVotes;
    }

    public void setSuggestionMinVotes(int suggestionMinVotes) {
        this.suggestionMinVotes = suggestionMinVotes;
    }

    public int getTrendingLimit() {
        return trendingLimit;
    }

    public void setTrendingLimit(int trendingLimit) {
        this.trendingLimit = trendingLimit;
    }

    public long getTrendingRefreshMs() {
        return trendingRefreshMs;
    }

    public void setTrendingRefreshMs(long trendingRefreshMs) {
        this.trendingRefreshMs = trendingRefreshMs;
    }

    public int getEarliestYear() {
        return earliestYear;
    }

    public void setEarliestYear(int earliestYear) {
        this.earliestYear = earliestYear;
    }

    public int getMaxTrackedQueries() {
        return maxTrackedQueries;
    }

    public void setMaxTrackedQueries(int maxTrackedQueries) {
        this.maxTrackedQueries = maxTrackedQueries;
    }
}
