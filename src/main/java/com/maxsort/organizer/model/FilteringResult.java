package com.maxsort.organizer.model;

import java.util.List;

public record FilteringResult(List<CategorizedSuggestion> categorized,
                              ConfidenceStatistics statistics,
                              int totalProcessed,
                              long durationMs) {

    public List<CategorizedSuggestion> inCategory(SuggestionCategory category) {
        return categorized.stream()
                .filter(c -> c.getCategory() == category)
                .toList();
    }
}
