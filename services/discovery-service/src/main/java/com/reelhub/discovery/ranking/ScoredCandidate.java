package com.reelhub.discovery.ranking;

import com.reelhub.discovery.model.CandidateItem;
import java.util.List;

public record ScoredCandidate(CandidateItem item, double score, List<String> sources) {
    public ScoredCandidate {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
