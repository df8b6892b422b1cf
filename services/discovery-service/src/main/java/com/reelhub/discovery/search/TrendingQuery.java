package com.reelhub.discovery.search;

public record TrendingQuery(String query, long count, boolean trending) {
}
