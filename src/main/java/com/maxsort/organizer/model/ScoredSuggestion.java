package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScoredSuggestion {
    private String value;
    private double confidence;
    private String reasoning;
    private double originalConfidence;

    // Post-validation confidence, always within [0, 100]
    private double adjustedConfidence;

    // Composite reliability measure used for ranking, within [0, 100]
    private double qualityScore;

    @Builder.Default
    private Set<String> validationFlags = new LinkedHashSet<>();

    private boolean recommended;

    // 1-based position among the suggestions for the same file
    private int rank;

    // Path of the file this suggestion applies to, when known
    private String originalPath;

    public boolean hasFlag(String flag) {
        return validationFlags != null && validationFlags.contains(flag);
    }
}
