package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AutoApprovalResult {
    private int totalProcessed;
    private int autoApprovedCount;
    private int queuedCount;
    private int rejectedCount;

    // MANUAL_REVIEW items, handed to the review queue by the caller
    @Builder.Default
    private List<CategorizedSuggestion> manualReview = new ArrayList<>();

    // Review queue ids assigned to the MANUAL_REVIEW items, when they were routed there
    @Builder.Default
    private List<String> reviewEntryIds = new ArrayList<>();

    // Set when this call triggered batch creation
    private String batchId;

    private long processingDurationMs;
    private ConfidenceStatistics statistics;
}
