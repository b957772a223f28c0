package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A set of operations scheduled and executed together under one priority weight.
 * The scheduler mutates a group only while holding its monitor; readers get {@link #snapshot()} copies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchGroup {
    private String id;

    @Builder.Default
    private List<BatchOperation> operations = new ArrayList<>();

    private BatchType type;

    // Higher weight is dequeued first
    private int priority;

    @Builder.Default
    private BatchStatus status = BatchStatus.PENDING;

    private long createdAt;
    private Long startedAt;
    private Long completedAt;
    private BatchProgress progress;

    // Validation or execution errors reported for the whole batch
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public synchronized BatchGroup snapshot() {
        List<BatchOperation> operationCopies = new ArrayList<>(operations.size());
        for (BatchOperation op : operations) {
            operationCopies.add(op.toBuilder().build());
        }
        return BatchGroup.builder()
                .id(id)
                .operations(List.copyOf(operationCopies))
                .type(type)
                .priority(priority)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .progress(progress == null ? null : progress.toBuilder().build())
                .errors(List.copyOf(errors))
                .build();
    }
}
