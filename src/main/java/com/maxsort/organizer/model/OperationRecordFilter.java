package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationRecordFilter {
    private RecordKind kind;
    private String referenceId;
    private String status;
    private Long fromTime;
    private Long toTime;

    @Builder.Default
    private int limit = 100;

    public static OperationRecordFilter all() {
        return OperationRecordFilter.builder().build();
    }

    public boolean matches(OperationRecord record) {
        if (kind != null && record.getKind() != kind) return false;
        if (referenceId != null && !referenceId.equals(record.getReferenceId())) return false;
        if (status != null && !status.equalsIgnoreCase(record.getStatus())) return false;
        if (fromTime != null && record.getRecordedAt() < fromTime) return false;
        if (toTime != null && record.getRecordedAt() > toTime) return false;
        return true;
    }
}
