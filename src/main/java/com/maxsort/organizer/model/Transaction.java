package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Unit of atomicity for the file executor. Backups created while it runs belong to it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction {
    private String id;

    @Builder.Default
    private List<FileOperation> operations = new ArrayList<>();

    @Builder.Default
    private TransactionStatus status = TransactionStatus.PENDING;

    private long createdAt;
    private Long completedAt;
    private String error;

    // Human-readable log of compensating steps taken, in execution order
    @Builder.Default
    private List<String> rollbackActions = new ArrayList<>();

    public synchronized Transaction snapshot() {
        List<FileOperation> operationCopies = new ArrayList<>(operations.size());
        for (FileOperation op : operations) {
            operationCopies.add(op.toBuilder().build());
        }
        return Transaction.builder()
                .id(id)
                .operations(List.copyOf(operationCopies))
                .status(status)
                .createdAt(createdAt)
                .completedAt(completedAt)
                .error(error)
                .rollbackActions(List.copyOf(rollbackActions))
                .build();
    }
}
