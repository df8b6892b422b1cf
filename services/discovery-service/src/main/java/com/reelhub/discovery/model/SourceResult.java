package com.reelhub.discovery.model;

import java.util.List;

public record SourceResult(String source, List<CandidateItem> items) {
    public SourceResult {
        items = items == null ? List.of() : items;
    }

    public static SourceResult empty(String source) {
        return new SourceResult(source, List.of());
    }
}
