package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingItemsQuery {

    public enum SortField { PRIORITY, CONFIDENCE, ADDED_AT }

    public enum SortOrder { ASC, DESC }

    private Integer limit;

    @Builder.Default
    private SortField sortBy = SortField.PRIORITY;

    @Builder.Default
    private SortOrder sortOrder = SortOrder.DESC;

    // Confidence range on the 0-100 scale
    private Double minConfidence;
    private Double maxConfidence;

    private OperationType operationType;

    // Case-insensitive substring of the original path
    private String pathContains;

    public static PendingItemsQuery all() {
        return PendingItemsQuery.builder().build();
    }
}
