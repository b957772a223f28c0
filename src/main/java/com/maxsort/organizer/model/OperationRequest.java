package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller-supplied description of a single file action, before the scheduler assigns an id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationRequest {
    private OperationType type;
    private long fileId;
    private String originalPath;
    private String targetPath;

    // 0-100
    private double confidence;

    @Builder.Default
    private QueuePriority priority = QueuePriority.MEDIUM;

    // Id of the queue entry this operation came from, if any
    private String reference;
}
