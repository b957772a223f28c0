package com.maxsort.organizer.service;

import com.maxsort.organizer.config.MetricsConfig;
import com.maxsort.organizer.config.TransactionConfig;
import com.maxsort.organizer.events.EventSink;
import com.maxsort.organizer.events.PipelineEvent;
import com.maxsort.organizer.events.PipelineEventType;
import com.maxsort.organizer.model.AddOperationResult;
import com.maxsort.organizer.model.ExecutionResult;
import com.maxsort.organizer.model.FileOperation;
import com.maxsort.organizer.model.OperationRecord;
import com.maxsort.organizer.model.OperationType;
import com.maxsort.organizer.model.RecordKind;
import com.maxsort.organizer.model.Transaction;
import com.maxsort.organizer.model.TransactionStatus;
import com.maxsort.organizer.repository.OperationStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Applies a list of file operations as one unit. Everything is checked before the first
 * change; afterwards operations run in order and the first failure undoes the already
 * applied ones in reverse order. Backups are kept only until the transaction completes.
 */
@Service
public class TransactionalFileExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransactionalFileExecutor.class);

    private static final String SOURCE = "transaction-executor";
    static final String CANCELLED_MESSAGE = "Transaction cancelled";

    private final TransactionConfig config;
    private final OperationStore operationStore;
    private final EventSink eventSink;
    private final Clock clock;
    private final MetricsConfig metricsConfig;

    private final Map<String, Transaction> transactions = new ConcurrentHashMap<>();
    // Applied steps of completed transactions, kept for undo
    private final Map<String, List<AppliedOperation>> completedSteps = new ConcurrentHashMap<>();
    private final Set<String> cancelRequested = ConcurrentHashMap.newKeySet();

    public TransactionalFileExecutor(TransactionConfig config,
                                     OperationStore operationStore,
                                     EventSink eventSink,
                                     Clock clock,
                                     MetricsConfig metricsConfig) {
        this.config = config;
        this.operationStore = operationStore;
        this.eventSink = eventSink;
        this.clock = clock;
        this.metricsConfig = metricsConfig;
    }

    public Transaction createTransaction() {
        Transaction tx = Transaction.builder()
                .id("tx-" + UUID.randomUUID())
                .createdAt(clock.millis())
                .build();
        transactions.put(tx.getId(), tx);
        log.info("Transaction created: transactionId={}", tx.getId());
        return tx.snapshot();
    }

    /**
     * Append an operation after checking it against the current filesystem.
     * Nothing is added when the check fails.
     */
    public AddOperationResult addOperation(String transactionId, FileOperation operation) {
        Transaction tx = transactions.get(transactionId);
        if (tx == null) {
            return AddOperationResult.rejected("Transaction not found: " + transactionId);
        }

        String error = checkOperation(operation, true);
        if (error != null) {
            log.warn("Operation rejected for transaction: transactionId={}, type={}, source={}, error={}",
                    transactionId, operation.getType(), operation.getSource(), error);
            return AddOperationResult.rejected(error);
        }

        FileOperation added = operation.toBuilder()
                .id("op-" + UUID.randomUUID())
                .completed(false)
                .error(null)
                .backupPath(null)
                .build();
        synchronized (tx) {
            if (tx.getStatus() != TransactionStatus.PENDING) {
                return AddOperationResult.rejected("Transaction is not pending: " + tx.getStatus());
            }
            tx.getOperations().add(added);
        }
        log.debug("Operation added to transaction: transactionId={}, operationId={}, type={}",
                transactionId, added.getId(), added.getType());
        return AddOperationResult.added(tx.snapshot());
    }

    public Transaction getTransactionStatus(String transactionId) {
        Transaction tx = transactions.get(transactionId);
        return tx != null ? tx.snapshot() : null;
    }

    @Observed(name = "transaction.execute", contextualName = "execute-transaction")
    public ExecutionResult executeTransaction(String transactionId) {
        Transaction tx = transactions.get(transactionId);
        if (tx == null) {
            return ExecutionResult.failure("Transaction not found: " + transactionId);
        }

        List<FileOperation> operations;
        synchronized (tx) {
            if (tx.getStatus() != TransactionStatus.PENDING) {
                return ExecutionResult.failure("Transaction is not pending: " + tx.getStatus());
            }
            tx.setStatus(TransactionStatus.EXECUTING);
            operations = List.copyOf(tx.getOperations());
        }
        log.info("Executing transaction: transactionId={}, operationCount={}", transactionId, operations.size());
        publish(PipelineEventType.TRANSACTION_STARTED,
                "transactionId", transactionId, "operationCount", operations.size());

        // Pre-flight: nothing is touched unless every operation can run
        List<String> errors = new ArrayList<>();
        for (FileOperation op : operations) {
            String error = checkOperation(op, false);
            if (error != null) {
                errors.add(error);
                log.error("Operation validation failed: transactionId={}, operationId={}, type={}, error={}",
                        transactionId, op.getId(), op.getType(), error);
            }
        }
        if (!errors.isEmpty()) {
            finishFailed(tx, errors, List.of(), 0);
            return new ExecutionResult(false, 0, List.copyOf(errors), List.of());
        }

        List<AppliedOperation> applied = new ArrayList<>();
        for (FileOperation op : operations) {
            if (cancelRequested.contains(transactionId)) {
                errors.add(CANCELLED_MESSAGE);
                log.info("Transaction cancelled between operations: transactionId={}, applied={}",
                        transactionId, applied.size());
                break;
            }
            try {
                applied.add(apply(op));
                synchronized (tx) {
                    op.setCompleted(true);
                }
            } catch (IOException | RuntimeException e) {
                String message = describe(op, e);
                synchronized (tx) {
                    op.setError(message);
                }
                errors.add(message);
                log.error("Operation failed: transactionId={}, operationId={}, type={}, error={}",
                        transactionId, op.getId(), op.getType(), message);
                break;
            }
        }
        cancelRequested.remove(transactionId);

        if (errors.isEmpty()) {
            List<String> backups = deleteBackups(applied);
            completedSteps.put(transactionId, applied);
            synchronized (tx) {
                tx.setStatus(TransactionStatus.COMPLETED);
                tx.setCompletedAt(clock.millis());
            }
            metricsConfig.recordTransaction("completed");
            record(tx, RecordKind.TRANSACTION, applied.size());
            publish(PipelineEventType.TRANSACTION_COMPLETED,
                    "transactionId", transactionId, "completedOperations", applied.size());
            log.info("Transaction completed: transactionId={}, completedOperations={}, backupsRemoved={}",
                    transactionId, applied.size(), backups.size());
            return new ExecutionResult(true, applied.size(), List.of(), List.of());
        }

        List<String> rollbackActions = new ArrayList<>();
        if (!applied.isEmpty()) {
            List<String> rollbackErrors = rollback(applied, rollbackActions);
            errors.addAll(rollbackErrors);
            metricsConfig.recordRollback(rollbackActions.size(), rollbackErrors.size());
            if (rollbackErrors.isEmpty()) {
                deleteBackups(applied);
            }
            publish(PipelineEventType.TRANSACTION_ROLLED_BACK, "transactionId", transactionId,
                    "rollbackActions", rollbackActions.size(), "rollbackErrors", rollbackErrors.size());
        }
        finishFailed(tx, errors, rollbackActions, applied.size());
        return new ExecutionResult(false, 0, List.copyOf(errors), List.copyOf(rollbackActions));
    }

    /**
     * Request cancellation. A pending transaction fails immediately; an executing one stops
     * after its current operation and rolls back.
     *
     * @return false when the transaction is unknown or already finished
     */
    public boolean cancelTransaction(String transactionId) {
        Transaction tx = transactions.get(transactionId);
        if (tx == null) {
            return false;
        }
        synchronized (tx) {
            if (tx.getStatus() == TransactionStatus.PENDING) {
                tx.setStatus(TransactionStatus.FAILED);
                tx.setError(CANCELLED_MESSAGE);
                tx.setCompletedAt(clock.millis());
            } else if (tx.getStatus() == TransactionStatus.EXECUTING) {
                cancelRequested.add(transactionId);
            } else {
                return false;
            }
        }
        log.info("Transaction cancellation requested: transactionId={}", transactionId);
        return true;
    }

    /**
     * Forget a finished transaction together with its undo steps.
     *
     * @return false when the transaction is unknown, pending or executing
     */
    public boolean discardTransaction(String transactionId) {
        Transaction tx = transactions.get(transactionId);
        if (tx == null) {
            return false;
        }
        synchronized (tx) {
            if (!isFinished(tx.getStatus())) {
                return false;
            }
            transactions.remove(transactionId);
            completedSteps.remove(transactionId);
        }
        log.debug("Transaction discarded: transactionId={}", transactionId);
        return true;
    }

    /**
     * Drop finished transactions that completed longer than the retention period ago.
     *
     * @return number of transactions removed
     */
    public int cleanupFinishedTransactions() {
        long cutoff = clock.millis() - TimeUnit.MINUTES.toMillis(config.getFinishedRetentionMinutes());
        int removed = 0;
        for (Transaction tx : transactions.values()) {
            boolean expired;
            synchronized (tx) {
                expired = isFinished(tx.getStatus()) && tx.getCompletedAt() != null && tx.getCompletedAt() < cutoff;
            }
            if (expired && discardTransaction(tx.getId())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Finished transactions cleaned up: removed={}, remaining={}", removed, transactions.size());
        }
        return removed;
    }

    int retainedTransactionCount() {
        return transactions.size();
    }

    @Scheduled(fixedRateString = "${organizer.executor.cleanup-interval-minutes:10}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "${organizer.executor.cleanup-interval-minutes:10}")
    public void scheduledCleanup() {
        try {
            cleanupFinishedTransactions();
        } catch (Exception e) {
            log.error("Transaction cleanup failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Undo a completed transaction in reverse order. Deleted files cannot be restored
     * because their backups are removed on completion; those steps are reported as errors.
     */
    public ExecutionResult rollbackTransaction(String transactionId) {
        Transaction tx = transactions.get(transactionId);
        if (tx == null) {
            return ExecutionResult.failure("Transaction not found: " + transactionId);
        }
        List<AppliedOperation> applied;
        synchronized (tx) {
            if (tx.getStatus() != TransactionStatus.COMPLETED) {
                return ExecutionResult.failure("Only completed transactions can be rolled back: " + tx.getStatus());
            }
            applied = completedSteps.remove(transactionId);
            tx.setStatus(TransactionStatus.EXECUTING);
        }
        if (applied == null) {
            applied = List.of();
        }

        List<String> actions = new ArrayList<>();
        List<String> errors = rollback(applied, actions);
        synchronized (tx) {
            tx.setStatus(TransactionStatus.ROLLED_BACK);
            tx.setCompletedAt(clock.millis());
            tx.getRollbackActions().addAll(actions);
            if (!errors.isEmpty()) {
                tx.setError(String.join("; ", errors));
            }
        }
        metricsConfig.recordRollback(actions.size(), errors.size());
        metricsConfig.recordTransaction("rolled_back");
        record(tx, RecordKind.ROLLBACK, actions.size());
        publish(PipelineEventType.TRANSACTION_ROLLED_BACK, "transactionId", transactionId,
                "rollbackActions", actions.size(), "rollbackErrors", errors.size());
        log.info("Transaction rolled back: transactionId={}, actions={}, errors={}",
                transactionId, actions.size(), errors.size());
        return new ExecutionResult(errors.isEmpty(), actions.size(), List.copyOf(errors), List.copyOf(actions));
    }

    /**
     * @param strict also reject an existing target; the pre-flight pass leaves that to the
     *               atomic no-replace move so a target that appears later still triggers rollback
     * @return the first problem found, or null
     */
    private String checkOperation(FileOperation op, boolean strict) {
        if (op.getType() == null) {
            return "Unsupported operation type: null";
        }
        if (op.getSource() == null || op.getSource().isBlank()) {
            return "Source path is required";
        }
        if (op.getType().requiresTarget() && (op.getTarget() == null || op.getTarget().isBlank())) {
            return "Target path required for " + op.getType().name().toLowerCase(Locale.ROOT) + " operation";
        }

        Path source;
        Path target;
        try {
            source = Paths.get(op.getSource());
            target = op.getType().requiresTarget() ? Paths.get(op.getTarget()) : null;
        } catch (InvalidPathException e) {
            return "Invalid path: " + e.getMessage();
        }

        if (!Files.exists(source)) {
            return "File not found: " + op.getSource();
        }
        if (!Files.isReadable(source) || !Files.isWritable(source)) {
            return "Source file is not writable: " + op.getSource();
        }
        if (target == null) {
            return null;
        }
        if (strict && !op.isForce() && Files.exists(target)) {
            return "Target file already exists: " + op.getTarget();
        }
        Path targetDir = target.toAbsolutePath().getParent();
        if (targetDir == null || !Files.isDirectory(targetDir) || !Files.isWritable(targetDir)) {
            return "Target directory is not writable: " + targetDir;
        }
        return null;
    }

    private AppliedOperation apply(FileOperation op) throws IOException {
        Path source = Paths.get(op.getSource());
        long timestamp = clock.millis();

        Path backup = null;
        if (op.getType() != OperationType.COPY && shouldBackUp(op)) {
            String marker = op.getType() == OperationType.DELETE ? "deleted" : "backup";
            backup = backupDirectoryFor(source).resolve(
                    source.getFileName() + "." + marker + "." + op.getId() + "." + timestamp);
            Files.copy(source, backup, StandardCopyOption.COPY_ATTRIBUTES);
            op.setBackupPath(backup.toString());
            log.debug("Backup created: operationId={}, original={}, backup={}", op.getId(), source, backup);
        }

        Path target = op.getType().requiresTarget() ? Paths.get(op.getTarget()) : null;
        Path displaced = null;
        if (target != null && op.isForce() && Files.exists(target)) {
            displaced = backupDirectoryFor(target).resolve(
                    target.getFileName() + ".overwritten." + op.getId() + "." + timestamp);
            Files.move(target, displaced);
        }

        try {
            switch (op.getType()) {
                case RENAME, MOVE -> Files.move(source, target);
                case COPY -> Files.copy(source, target);
                case DELETE -> Files.delete(source);
                default -> throw new IllegalArgumentException("Unsupported operation type: " + op.getType());
            }
        } catch (IOException | RuntimeException e) {
            // Put a displaced target back before reporting the failure
            if (displaced != null) {
                Files.move(displaced, target);
            }
            if (backup != null) {
                Files.deleteIfExists(backup);
                op.setBackupPath(null);
            }
            throw e;
        }

        log.debug("Operation applied: operationId={}, type={}, source={}, target={}",
                op.getId(), op.getType(), op.getSource(), op.getTarget());
        return new AppliedOperation(op, source, target, backup, displaced);
    }

    private boolean shouldBackUp(FileOperation op) {
        if (op.getCreateBackup() != null) {
            return op.getCreateBackup();
        }
        return op.getType() == OperationType.DELETE || config.isBackupBeforeRename();
    }

    private Path backupDirectoryFor(Path file) throws IOException {
        Path configured = Paths.get(config.getBackupDirectory());
        Path dir = configured.isAbsolute()
                ? configured
                : file.toAbsolutePath().getParent().resolve(configured);
        Files.createDirectories(dir);
        return dir;
    }

    /**
     * Undo applied operations newest first. Every step is attempted; failures are collected.
     */
    private List<String> rollback(List<AppliedOperation> applied, List<String> actions) {
        List<String> errors = new ArrayList<>();
        List<AppliedOperation> reversed = new ArrayList<>(applied);
        Collections.reverse(reversed);

        log.info("Rolling back operations: operationCount={}", reversed.size());
        for (AppliedOperation step : reversed) {
            try {
                actions.add(undo(step));
                if (step.displaced() != null) {
                    Files.move(step.displaced(), step.target());
                    actions.add("Restored overwritten file " + step.target());
                }
            } catch (IOException | RuntimeException e) {
                String message = "Rollback failed: " + describe(step.operation(), e);
                errors.add(message);
                log.error("Rollback step failed: operationId={}, type={}, error={}",
                        step.operation().getId(), step.operation().getType(), message);
            }
        }
        return errors;
    }

    private String undo(AppliedOperation step) throws IOException {
        switch (step.operation().getType()) {
            case RENAME, MOVE -> {
                Files.move(step.target(), step.source());
                return "Moved " + step.target() + " back to " + step.source();
            }
            case COPY -> {
                Files.delete(step.target());
                return "Deleted copy " + step.target();
            }
            case DELETE -> {
                if (step.backup() == null || !Files.exists(step.backup())) {
                    throw new IOException("No backup available to restore " + step.source());
                }
                Files.copy(step.backup(), step.source(), StandardCopyOption.COPY_ATTRIBUTES);
                return "Restored " + step.source() + " from backup";
            }
            default -> throw new IllegalArgumentException("Unsupported operation type: " + step.operation().getType());
        }
    }

    private List<String> deleteBackups(List<AppliedOperation> applied) {
        List<String> removed = new ArrayList<>();
        for (AppliedOperation step : applied) {
            for (Path path : new Path[]{step.backup(), step.displaced()}) {
                if (path == null) continue;
                try {
                    if (Files.deleteIfExists(path)) {
                        removed.add(path.toString());
                    }
                } catch (IOException e) {
                    log.warn("Failed to remove backup: path={}, error={}", path, e.getMessage());
                }
            }
        }
        return removed;
    }

    private void finishFailed(Transaction tx, List<String> errors, List<String> rollbackActions, int applied) {
        synchronized (tx) {
            tx.setStatus(TransactionStatus.FAILED);
            tx.setError(String.join("; ", errors));
            tx.setCompletedAt(clock.millis());
            tx.getRollbackActions().addAll(rollbackActions);
        }
        metricsConfig.recordTransaction("failed");
        record(tx, RecordKind.TRANSACTION, 0);
        publish(PipelineEventType.TRANSACTION_FAILED, "transactionId", tx.getId(),
                "error", errors.isEmpty() ? null : errors.get(0), "appliedBeforeFailure", applied,
                "rollbackActions", rollbackActions.size());
        log.warn("Transaction failed: transactionId={}, errors={}, rollbackActions={}",
                tx.getId(), errors.size(), rollbackActions.size());
    }

    private void record(Transaction tx, RecordKind kind, int completedCount) {
        Transaction snapshot = tx.snapshot();
        try {
            List<String> summaries = new ArrayList<>();
            for (FileOperation op : snapshot.getOperations()) {
                summaries.add(op.getType() + ":" + op.getSource() + (op.getTarget() != null ? "->" + op.getTarget() : ""));
            }
            operationStore.recordOperation(OperationRecord.builder()
                    .kind(kind)
                    .referenceId(snapshot.getId())
                    .status(snapshot.getStatus().name())
                    .operationCount(snapshot.getOperations().size())
                    .completedCount(completedCount)
                    .operations(summaries)
                    .rollbackActions(new ArrayList<>(snapshot.getRollbackActions()))
                    .error(snapshot.getError())
                    .recordedAt(clock.millis())
                    .build());
        } catch (Exception e) {
            log.error("Failed to record transaction outcome: transactionId={}, status={}",
                    snapshot.getId(), snapshot.getStatus(), e);
        }
    }

    private static boolean isFinished(TransactionStatus status) {
        return status == TransactionStatus.COMPLETED
                || status == TransactionStatus.FAILED
                || status == TransactionStatus.ROLLED_BACK;
    }

    private static String describe(FileOperation op, Exception e) {
        if (e instanceof FileAlreadyExistsException) {
            return "Target file already exists: " + e.getMessage();
        }
        if (e instanceof NoSuchFileException) {
            return "no such file or directory: " + e.getMessage();
        }
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return op.getType() != null
                ? op.getType().name().toLowerCase(Locale.ROOT) + " failed: " + message
                : message;
    }

    private void publish(PipelineEventType type, Object... keyValues) {
        eventSink.publish(PipelineEvent.of(type, SOURCE, clock, keyValues));
    }

    private record AppliedOperation(FileOperation operation, Path source, Path target, Path backup, Path displaced) {}
}
