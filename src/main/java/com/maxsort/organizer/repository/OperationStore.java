package com.maxsort.organizer.repository;

import com.maxsort.organizer.model.OperationRecord;
import com.maxsort.organizer.model.OperationRecordFilter;

import java.util.List;

/**
 * Durable log of executed operations, used for history and undo.
 */
public interface OperationStore {

    void recordOperation(OperationRecord record);

    /**
     * @return matching records, newest first, at most {@code filter.limit}
     */
    List<OperationRecord> getOperations(OperationRecordFilter filter);
}
