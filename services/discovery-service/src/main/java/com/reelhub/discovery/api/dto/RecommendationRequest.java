package com.reelhub.discovery.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.reelhub.discovery.model.ListItem;
import com.reelhub.discovery.model.WatchHistoryItem;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RecommendationRequest {
    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("watch_history")
    private List<WatchHistoryItem> watchHistory = List.of();

    @JsonProperty("my_list")
    private List<ListItem> myList = List.of();

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public List<WatchHistoryItem> getWatchHistory() {
        return watchHistory;
    }

    public void setWatchHistory(List<WatchHistoryItem> watchHistory) {
        this.watchHistory = watchHistory == null ? List.of() : watchHistory;
    }

    public List<ListItem> getMyList() {
        return myList;
    }

    public void setMyList(List<ListItem> myList) {
        this.myList = myList == null ? List.of() : myList;
    }
}
