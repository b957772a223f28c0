package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Durable log entry for an executed transaction or a finished batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationRecord {
    private String id;
    private RecordKind kind;

    // Transaction or batch id
    private String referenceId;

    private String status;
    private int operationCount;
    private int completedCount;

    // "RENAME:/a->/b" style summaries of the operations involved
    @Builder.Default
    private List<String> operations = new ArrayList<>();

    @Builder.Default
    private List<String> rollbackActions = new ArrayList<>();

    private String error;
    private long recordedAt;
}
