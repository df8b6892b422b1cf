package com.reelhub.discovery.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "discovery.retrieval")
public class RetrievalProperties {
    private long secondaryTimeoutMs = 1500;
    private int recentItems = 3;
    private int listItems = 3;
    private int keywordLimit = 3;
    private int castLimit = 2;
    private int eraGenreLimit = 2;
    private int popularVoteFloor = 100;
    private int qualityVoteFloor = 300;
    private int eraVoteFloor = 100;

    public long getSecondaryTimeoutMs() {
        return secondaryTimeoutMs;
    }

    public void setSecondaryTimeoutMs(long secondaryTimeoutMs) {
        this.secondaryTimeoutMs = secondaryTimeoutMs;
    }

    public int getRecentItems() {
        return recentItems;
    }

    public void setRecentItems(int recentItems) {
        this.recentItems = recentItems;
    }

    public int getListItems() {
        return listItems;
    }

    public void setListItems(int listItems) {
        this.listItems = listItems;
    }

    public int getKeywordLimit() {
        return keywordLimit;
    }

    public void setKeywordLimit(int keywordLimit) {
        this.keywordLimit = keywordLimit;
    }

    public int getCastLimit() {
        return castLimit;
    }

    public void setCastLimit(int castLimit) {
        this.castLimit = castLimit;
    }

    public int getEraGenreLimit() {
        return eraGenreLimit;
    }

    public void setEraGenreLimit(int eraGenreLimit) {
        this.eraGenreLimit = eraGenreLimit;
    }

    public int getPopularVoteFloor() {
        return popularVoteFloor;
    }

    public void setPopularVoteFloor(int popularVoteFloor) {
        this.popularVoteFloor = popularVoteFloor;
    }

    public int getQualityVoteFloor() {
        return qualityVoteFloor;
    }

    public void setQualityVoteFloor(int qualityVoteFloor) {
        this.qualityVoteFloor = qualityVoteFloor;
    }

    public int getEraVoteFloor() {
        return eraVoteFloor;
    }

    public void setEraVoteFloor(int eraVoteFloor) {
        this.eraVoteFloor = eraVoteFloor;
    }
}
