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
public class ReviewQueueEntry {
    private String id;
    private ReviewSuggestion suggestion;
    private long addedAt;
    private ReviewStatus status;

    // 0-100, equal to the rounded suggestion confidence
    private int priority;

    private Long reviewedAt;
    private String reviewedBy;
    private ReviewDecision decision;
    private String notes;

    @Builder.Default
    private List<ReviewOverride> overrides = new ArrayList<>();

    /**
     * Copy handed to readers so they never observe later mutation.
     */
    public ReviewQueueEntry snapshot() {
        List<ReviewOverride> overrideCopies = new ArrayList<>();
        for (ReviewOverride o : overrides) {
            overrideCopies.add(o.toBuilder().build());
        }
        return ReviewQueueEntry.builder()
                .id(id)
                .suggestion(suggestion)
                .addedAt(addedAt)
                .status(status)
                .priority(priority)
                .reviewedAt(reviewedAt)
                .reviewedBy(reviewedBy)
                .decision(decision == null ? null : decision.toBuilder().build())
                .notes(notes)
                .overrides(overrideCopies)
                .build();
    }
}
