package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BatchOperation {
    private String id;
    private OperationType type;
    private long fileId;
    private String originalPath;
    private String targetPath;
    private double confidence;
    private QueuePriority priority;

    // Id of the auto-approval or review entry that produced this operation
    private String reference;

    @Builder.Default
    private OperationStatus status = OperationStatus.PENDING;

    private long createdAt;
    private Long startedAt;
    private Long completedAt;
    private String error;
}
