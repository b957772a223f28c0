package com.maxsort.organizer.service;

import com.maxsort.organizer.model.BatchOperation;
import com.maxsort.organizer.model.ExecutionResult;

/**
 * Executes one scheduled operation. Implementations report failures in the result
 * instead of throwing.
 */
public interface OperationHandler {

    ExecutionResult execute(BatchOperation operation);
}
