package com.reelhub.discovery.api.dto;

import java.util.List;

public class SuggestionsResponse {
    public static final String TYPE_TRENDING = "trending";
    public static final String TYPE_RESULTS = "results";
    public static final String TYPE_ERROR = "error";

    private List<String> suggestions = List.of();
    private String type;

    public SuggestionsResponse() {
    }

    public SuggestionsResponse(List<String> suggestions, String type) {
        this.suggestions = suggestions;
        this.type = type;
    }

    public List<String> getSuggestions() {
        return suggestions;
    }

    public void setSuggestions(List<String> suggestions) {
        this.suggestions = suggestions;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }
}
