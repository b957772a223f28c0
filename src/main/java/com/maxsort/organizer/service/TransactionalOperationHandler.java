package com.maxsort.organizer.service;

import com.maxsort.organizer.model.AddOperationResult;
import com.maxsort.organizer.model.BatchOperation;
import com.maxsort.organizer.model.ExecutionResult;
import com.maxsort.organizer.model.FileOperation;
import com.maxsort.organizer.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs each scheduled operation as its own single-operation transaction.
 */
@Component
public class TransactionalOperationHandler implements OperationHandler {

    private static final Logger log = LoggerFactory.getLogger(TransactionalOperationHandler.class);

    private final TransactionalFileExecutor executor;

    public TransactionalOperationHandler(TransactionalFileExecutor executor) {
        this.executor = executor;
    }

    @Override
    public ExecutionResult execute(BatchOperation operation) {
        Transaction tx = executor.createTransaction();
        AddOperationResult added = executor.addOperation(tx.getId(), FileOperation.builder()
                .type(operation.getType())
                .source(operation.getOriginalPath())
                .target(operation.getTargetPath())
                .build());
        if (!added.success()) {
            log.warn("Operation not accepted by executor: operationId={}, transactionId={}, error={}",
                    operation.getId(), tx.getId(), added.error());
            executor.cancelTransaction(tx.getId());
            executor.discardTransaction(tx.getId());
            return ExecutionResult.failure(added.error());
        }
        // The batch keeps the outcome; the transaction is not addressed again
        ExecutionResult result = executor.executeTransaction(tx.getId());
        executor.discardTransaction(tx.getId());
        return result;
    }
}
