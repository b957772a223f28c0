package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategorizedSuggestion {
    private ScoredSuggestion suggestion;
    private SuggestionCategory category;

    // Human-readable explanation, e.g. "High confidence (95% ≥ 80%)"
    private String reason;

    // Never true for REJECT
    private boolean canOverride;

    public double getAdjustedConfidence() {
        return suggestion.getAdjustedConfidence();
    }

    public String getValue() {
        return suggestion.getValue();
    }
}
