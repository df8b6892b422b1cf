package com.reelhub.discovery.profile;

import com.reelhub.discovery.model.ItemDetail;
import com.reelhub.discovery.model.TasteProfile;
import java.util.List;

/**
 * A taste profile together with the details it was derived from, newest signal first.
 */
public record TasteAnalysis(TasteProfile profile, List<ItemDetail> details) {
    public TasteAnalysis {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static TasteAnalysis empty() {
        return new TasteAnalysis(TasteProfile.empty(), List.of());
    }
}
