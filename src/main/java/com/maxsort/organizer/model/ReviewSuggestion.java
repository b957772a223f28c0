package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A MANUAL_REVIEW suggestion together with the file operation it would perform.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewSuggestion {
    private ScoredSuggestion suggestion;

    // Adjusted confidence, 0-100
    private double confidence;

    private OperationType operation;
    private long fileId;
    private String originalPath;
    private String suggestedPath;

    // Categorization reason from the confidence filter
    private String reason;
}
