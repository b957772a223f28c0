package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An auto-approved suggestion waiting to be turned into a batch operation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueEntry {
    private String id;
    private CategorizedSuggestion suggestion;
    private FileMetadata fileMetadata;
    private long queuedAt;

    // Derived once from adjusted confidence at enqueue time
    private QueuePriority priority;

    private boolean safetyChecksCompleted;
}
