package com.maxsort.organizer.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Per-call filtering statistics. Built once, never modified.
 */
@Value
@Builder
public class ConfidenceStatistics {
    int totalSuggestions;
    int autoApproved;
    int manualReview;
    int rejected;

    // Mean adjusted confidence as a fraction (0.0 - 1.0), two decimals
    double averageConfidence;

    // Share of suggestions that did not need a human, in percent
    int filteringEffectiveness;

    // Ten buckets from "90-100%" down to "0-9%"
    List<ConfidenceBucket> confidenceDistribution;

    public static ConfidenceStatistics empty() {
        return ConfidenceStatistics.builder()
                .confidenceDistribution(List.of())
                .build();
    }
}
