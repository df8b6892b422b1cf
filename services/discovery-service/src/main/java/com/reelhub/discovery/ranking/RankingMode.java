package com.reelhub.discovery.ranking;

public enum RankingMode {
    HOME_FEED,
    ITEM_DETAIL
}
