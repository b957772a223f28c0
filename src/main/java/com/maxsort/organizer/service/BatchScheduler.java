package com.maxsort.organizer.service;

import com.maxsort.organizer.config.BatchSchedulerConfig;
import com.maxsort.organizer.config.MetricsConfig;
import com.maxsort.organizer.events.EventSink;
import com.maxsort.organizer.events.PipelineEvent;
import com.maxsort.organizer.events.PipelineEventType;
import com.maxsort.organizer.model.BatchGroup;
import com.maxsort.organizer.model.BatchOperation;
import com.maxsort.organizer.model.BatchProgress;
import com.maxsort.organizer.model.BatchQueueStats;
import com.maxsort.organizer.model.BatchStatus;
import com.maxsort.organizer.model.BatchType;
import com.maxsort.organizer.model.ExecutionResult;
import com.maxsort.organizer.model.OperationRecord;
import com.maxsort.organizer.model.OperationRequest;
import com.maxsort.organizer.model.OperationStatus;
import com.maxsort.organizer.model.QueuePriority;
import com.maxsort.organizer.model.RecordKind;
import com.maxsort.organizer.model.ValidationResult;
import com.maxsort.organizer.monitor.ResourceMonitor;
import com.maxsort.organizer.repository.OperationStore;
import com.maxsort.organizer.scheduling.Cancellable;
import com.maxsort.organizer.scheduling.Ticker;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Priority queue of batch groups with bounded execution.
 *
 * <p>A single loop thread dequeues the highest-weight batch (FIFO among equal weights)
 * whenever fewer than {@code maxConcurrentOperations} batches are active. Each batch is
 * validated as a whole, then its operations run on a shared worker pool with a per-batch
 * limit of {@code min(batchSize, ceil(maxConcurrent / activeBatches))}; completions arrive
 * through an {@link ExecutorCompletionService}.
 *
 * <p>Cancellation is advisory: a cancelled batch starts no further operations, but
 * operations already running finish and are recorded.
 */
@Service
public class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private static final String SOURCE = "batch-scheduler";
    private static final long LOOP_POLL_MS = 100;

    private final BatchSchedulerConfig config;
    private final OperationValidator validator;
    private final OperationHandler operationHandler;
    private final EventSink eventSink;
    private final Ticker ticker;
    private final Clock clock;
    private final MetricsConfig metricsConfig;
    private final ResourceMonitor resourceMonitor;
    private final OperationStore operationStore;

    // Insertion order is batching order
    private final Map<String, BatchOperation> pendingOperations = new LinkedHashMap<>();
    private final Object pendingLock = new Object();

    private final PriorityBlockingQueue<QueuedBatch> batchQueue = new PriorityBlockingQueue<>(16,
            Comparator.comparingInt(QueuedBatch::priority).reversed()
                    .thenComparingLong(QueuedBatch::sequence));
    private final AtomicLong sequence = new AtomicLong();

    // Every batch ever created, for status queries
    private final Map<String, BatchGroup> batches = new ConcurrentHashMap<>();
    private final Map<String, BatchGroup> activeBatches = new ConcurrentHashMap<>();
    private final Object slotMonitor = new Object();

    private final ExecutorService batchRunner;
    private final ExecutorService operationWorkers;

    private final Object lifecycleLock = new Object();
    private volatile boolean running;
    private Thread loopThread;
    private Cancellable sweepTimer;

    public BatchScheduler(BatchSchedulerConfig config,
                          OperationValidator validator,
                          OperationHandler operationHandler,
                          EventSink eventSink,
                          Ticker ticker,
                          Clock clock,
                          MetricsConfig metricsConfig,
                          ResourceMonitor resourceMonitor,
                          OperationStore operationStore) {
        config.validate();
        this.config = config;
        this.validator = validator;
        this.operationHandler = operationHandler;
        this.eventSink = eventSink;
        this.ticker = ticker;
        this.clock = clock;
        this.metricsConfig = metricsConfig;
        this.resourceMonitor = resourceMonitor;
        this.operationStore = operationStore;
        this.batchRunner = Executors.newCachedThreadPool(namedThreads("batch-runner-"));
        this.operationWorkers = Executors.newFixedThreadPool(config.getMaxConcurrentOperations(),
                namedThreads("batch-worker-"));

        log.info("Batch scheduler initialized: maxBatchSize={}, batchTimeoutMs={}, maxConcurrentOperations={}, operationTimeoutMs={}",
                config.getMaxBatchSize(), config.getBatchTimeoutMs(),
                config.getMaxConcurrentOperations(), config.getOperationTimeoutMs());
    }

    @PostConstruct
    public void init() {
        if (config.isAutoStart()) {
            startProcessing();
        }
    }

    /**
     * Register a single operation. A HIGH priority operation batches everything pending right away.
     *
     * @return the operation id
     */
    public String addOperation(OperationRequest request) {
        BatchOperation op = toOperation(request);
        synchronized (pendingLock) {
            pendingOperations.put(op.getId(), op);
        }
        log.debug("Operation added: operationId={}, type={}, priority={}", op.getId(), op.getType(), op.getPriority());

        if (op.getPriority() == QueuePriority.HIGH) {
            batchPendingOperations(true);
        }
        return op.getId();
    }

    /**
     * Batch previously added operations. Unknown ids are skipped.
     *
     * @return id of the first batch created
     * @throws IllegalArgumentException when none of the ids is pending
     */
    @Observed(name = "batch.create", contextualName = "create-batch")
    public String createBatch(List<String> operationIds, BatchType type) {
        List<BatchOperation> operations = new ArrayList<>();
        synchronized (pendingLock) {
            for (String id : operationIds) {
                BatchOperation op = pendingOperations.remove(id);
                if (op != null) {
                    operations.add(op);
                } else {
                    log.warn("Ignoring unknown operation for batch creation: operationId={}", id);
                }
            }
        }
        if (operations.isEmpty()) {
            throw new IllegalArgumentException("No valid operations found for batch creation");
        }
        return enqueuePartitioned(operations, type).get(0);
    }

    /**
     * Register operations and batch them in one step, bypassing the pending pool.
     *
     * @return ids of the batches created, in submission order
     */
    public List<String> submitBatch(List<OperationRequest> requests, BatchType type) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("No valid operations found for batch creation");
        }
        List<BatchOperation> operations = new ArrayList<>(requests.size());
        for (OperationRequest request : requests) {
            operations.add(toOperation(request));
        }
        return enqueuePartitioned(operations, type);
    }

    public void startProcessing() {
        synchronized (lifecycleLock) {
            if (running) {
                return;
            }
            running = true;
            loopThread = new Thread(this::runLoop, "batch-scheduler-loop");
            loopThread.setDaemon(true);
            loopThread.start();
            sweepTimer = ticker.schedule(this::onTick, Duration.ofMillis(config.getBatchTimeoutMs()));
        }
        log.info("Batch processing started: queuedBatches={}", batchQueue.size());
    }

    /**
     * Stop dequeuing. Batches already running finish on their own.
     */
    public void stopProcessing() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            if (sweepTimer != null) {
                sweepTimer.cancel();
                sweepTimer = null;
            }
            if (loopThread != null) {
                loopThread.interrupt();
                loopThread = null;
            }
        }
        synchronized (slotMonitor) {
            slotMonitor.notifyAll();
        }
        log.info("Batch processing stopped: queuedBatches={}, activeBatches={}", batchQueue.size(), activeBatches.size());
    }

    public boolean isProcessing() {
        return running;
    }

    /**
     * @return false when the batch is unknown or already finished
     */
    public boolean cancelBatch(String batchId) {
        BatchGroup group = batches.get(batchId);
        if (group == null) {
            return false;
        }
        boolean wasQueued;
        synchronized (group) {
            if (group.getStatus().isTerminal()) {
                return false;
            }
            wasQueued = group.getStatus() == BatchStatus.PENDING;
            group.setStatus(BatchStatus.CANCELLED);
            if (wasQueued) {
                group.setCompletedAt(clock.millis());
            }
        }

        if (wasQueued) {
            batchQueue.removeIf(q -> q.group() == group);
            metricsConfig.recordBatchFinished(BatchStatus.CANCELLED.name());
            record(group);
        }
        publish(PipelineEventType.BATCH_CANCELLED, "batchId", batchId, "finished", wasQueued);
        log.info("Batch cancelled: batchId={}, wasRunning={}", batchId, !wasQueued);
        return true;
    }

    public BatchGroup getBatchStatus(String batchId) {
        BatchGroup group = batches.get(batchId);
        return group != null ? group.snapshot() : null;
    }

    public List<BatchGroup> getActiveBatches() {
        List<BatchGroup> result = new ArrayList<>();
        for (BatchGroup group : activeBatches.values()) {
            result.add(group.snapshot());
        }
        return result;
    }

    public BatchQueueStats getQueueStats() {
        int pending;
        synchronized (pendingLock) {
            pending = pendingOperations.size();
        }
        return new BatchQueueStats(pending, batchQueue.size(), activeBatches.size(),
                config.getMaxConcurrentOperations(), running);
    }

    /**
     * Run the pre-flight checks for a known batch without executing it.
     *
     * @return the validation outcome, or null when the batch is unknown
     */
    public ValidationResult validateBatch(String batchId) {
        BatchGroup group = batches.get(batchId);
        if (group == null) {
            return null;
        }
        return validator.validateBatch(group.snapshot().getOperations());
    }

    @PreDestroy
    public void shutdown() {
        stopProcessing();
        batchRunner.shutdown();
        operationWorkers.shutdown();
        log.info("Batch scheduler shut down: activeBatches={}", activeBatches.size());
    }

    /**
     * Timer entry point: HIGH priority operations become interactive batches, the rest
     * wait until a full batch has accumulated.
     */
    void onTick() {
        try {
            batchPendingOperations(false);
        } catch (Exception e) {
            log.error("Pending operation sweep failed: {}", e.getMessage(), e);
        }
    }

    private void batchPendingOperations(boolean immediate) {
        List<BatchOperation> interactive = new ArrayList<>();
        List<BatchOperation> background = new ArrayList<>();
        synchronized (pendingLock) {
            for (BatchOperation op : pendingOperations.values()) {
                if (op.getPriority() == QueuePriority.HIGH) {
                    interactive.add(op);
                } else {
                    background.add(op);
                }
            }
            interactive.forEach(op -> pendingOperations.remove(op.getId()));
            if (immediate || background.size() >= config.getMaxBatchSize()) {
                background.forEach(op -> pendingOperations.remove(op.getId()));
            } else {
                background.clear();
            }
        }

        if (!interactive.isEmpty()) {
            enqueuePartitioned(interactive, BatchType.INTERACTIVE);
        }
        if (!background.isEmpty()) {
            enqueuePartitioned(background, BatchType.BACKGROUND);
        }
    }

    private List<String> enqueuePartitioned(List<BatchOperation> operations, BatchType type) {
        List<String> batchIds = new ArrayList<>();
        for (int i = 0; i < operations.size(); i += config.getMaxBatchSize()) {
            List<BatchOperation> chunk = operations.subList(i, Math.min(i + config.getMaxBatchSize(), operations.size()));
            BatchGroup group = BatchGroup.builder()
                    .id("batch-" + UUID.randomUUID())
                    .operations(new ArrayList<>(chunk))
                    .type(type)
                    .priority(config.priorityFor(type))
                    .createdAt(clock.millis())
                    .progress(BatchProgress.of(chunk.size()))
                    .build();
            batches.put(group.getId(), group);
            batchQueue.offer(new QueuedBatch(group, group.getPriority(), sequence.incrementAndGet()));
            batchIds.add(group.getId());

            publish(PipelineEventType.BATCH_QUEUED, "batchId", group.getId(), "type", type.name(),
                    "priority", group.getPriority(), "operationCount", chunk.size());
            log.info("Batch queued: batchId={}, type={}, priority={}, operationCount={}, queuedBatches={}",
                    group.getId(), type, group.getPriority(), chunk.size(), batchQueue.size());
        }
        return batchIds;
    }

    private void runLoop() {
        log.debug("Batch scheduler loop running");
        while (running) {
            try {
                if (activeBatches.size() >= concurrencyCeiling()) {
                    synchronized (slotMonitor) {
                        if (running && activeBatches.size() >= concurrencyCeiling()) {
                            slotMonitor.wait(LOOP_POLL_MS);
                        }
                    }
                    continue;
                }
                QueuedBatch next = batchQueue.poll(LOOP_POLL_MS, TimeUnit.MILLISECONDS);
                if (next == null) {
                    continue;
                }
                BatchGroup group = next.group();
                synchronized (group) {
                    if (group.getStatus() != BatchStatus.PENDING) {
                        continue;
                    }
                    group.setStatus(BatchStatus.PROCESSING);
                    group.setStartedAt(clock.millis());
                }
                activeBatches.put(group.getId(), group);
                batchRunner.execute(() -> processBatch(group));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Batch scheduler loop error: {}", e.getMessage(), e);
            }
        }
        log.debug("Batch scheduler loop exited");
    }

    void processBatch(BatchGroup group) {
        String batchId = group.getId();
        List<BatchOperation> operations;
        synchronized (group) {
            operations = new ArrayList<>(group.getOperations());
        }
        publish(PipelineEventType.BATCH_STARTED, "batchId", batchId,
                "operationCount", operations.size(), "activeBatches", activeBatches.size());
        log.info("Batch started: batchId={}, type={}, operationCount={}, activeBatches={}",
                batchId, group.getType(), operations.size(), activeBatches.size());

        try {
            ValidationResult validation = validator.validateBatch(group.snapshot().getOperations());
            if (!validation.isValid()) {
                failValidation(group, operations, validation);
                return;
            }
            if (!validation.warnings().isEmpty()) {
                log.warn("Batch validation warnings: batchId={}, warnings={}", batchId, validation.warnings().size());
            }

            runOperations(group, operations);

            synchronized (group) {
                if (group.getStatus() != BatchStatus.CANCELLED) {
                    group.setStatus(group.getProgress().getFailed() == 0 ? BatchStatus.COMPLETED : BatchStatus.FAILED);
                }
                group.setCompletedAt(clock.millis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markFailed(group, "Batch interrupted");
            log.warn("Batch interrupted: batchId={}", batchId);
        } catch (Exception e) {
            markFailed(group, "Batch processing failed: " + e.getMessage());
            log.error("Batch processing failed: batchId={}", batchId, e);
        } finally {
            finishBatch(group);
        }
    }

    private void runOperations(BatchGroup group, List<BatchOperation> operations) throws InterruptedException {
        ExecutorCompletionService<ExecutionResult> completions = new ExecutorCompletionService<>(operationWorkers);
        Map<Future<ExecutionResult>, BatchOperation> inFlight = new HashMap<>();
        Map<Future<ExecutionResult>, Long> deadlines = new HashMap<>();
        long timeoutMs = config.getOperationTimeoutMs();
        Iterator<BatchOperation> remaining = operations.iterator();

        while (true) {
            while (remaining.hasNext() && inFlight.size() < perBatchLimit(operations.size()) && !isCancelled(group)) {
                BatchOperation op = remaining.next();
                Future<ExecutionResult> future = completions.submit(() -> runOperation(group, op));
                inFlight.put(future, op);
                if (timeoutMs > 0) {
                    deadlines.put(future, clock.millis() + timeoutMs);
                }
            }
            if (inFlight.isEmpty()) {
                break;
            }

            Future<ExecutionResult> done = timeoutMs > 0
                    ? pollWithDeadlines(completions, group, inFlight, deadlines)
                    : completions.take();
            if (done == null) {
                continue;
            }
            BatchOperation op = inFlight.remove(done);
            deadlines.remove(done);
            if (op == null) {
                // Late completion of an operation already failed by timeout
                continue;
            }
            recordOutcome(group, op, resultOf(done));
        }
    }

    private Future<ExecutionResult> pollWithDeadlines(ExecutorCompletionService<ExecutionResult> completions,
                                                      BatchGroup group,
                                                      Map<Future<ExecutionResult>, BatchOperation> inFlight,
                                                      Map<Future<ExecutionResult>, Long> deadlines)
            throws InterruptedException {
        long earliest = deadlines.values().stream().mapToLong(Long::longValue).min().orElse(clock.millis());
        long wait = Math.max(1, earliest - clock.millis());
        Future<ExecutionResult> done = completions.poll(wait, TimeUnit.MILLISECONDS);
        if (done != null) {
            return done;
        }

        long now = clock.millis();
        Iterator<Map.Entry<Future<ExecutionResult>, Long>> it = deadlines.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Future<ExecutionResult>, Long> entry = it.next();
            if (entry.getValue() > now) continue;
            Future<ExecutionResult> expired = entry.getKey();
            it.remove();
            BatchOperation op = inFlight.remove(expired);
            // The file operation itself is not interrupted; only its slot is released
            expired.cancel(false);
            if (op != null) {
                log.warn("Operation timed out: batchId={}, operationId={}, timeoutMs={}",
                        group.getId(), op.getId(), config.getOperationTimeoutMs());
                recordOutcome(group, op, ExecutionResult.failure(
                        "Operation timed out after " + config.getOperationTimeoutMs() + "ms"));
            }
        }
        return null;
    }

    private ExecutionResult runOperation(BatchGroup group, BatchOperation op) {
        synchronized (group) {
            op.setStatus(OperationStatus.PROCESSING);
            op.setStartedAt(clock.millis());
        }
        publish(PipelineEventType.OPERATION_STARTED, "batchId", group.getId(), "operationId", op.getId(),
                "type", op.getType() != null ? op.getType().name() : null);
        try {
            return operationHandler.execute(op);
        } catch (RuntimeException e) {
            log.error("Operation handler threw: batchId={}, operationId={}", group.getId(), op.getId(), e);
            return ExecutionResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private ExecutionResult resultOf(Future<ExecutionResult> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ExecutionResult.failure(String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failure("Interrupted while collecting result");
        } catch (CancellationException e) {
            return ExecutionResult.failure("Operation cancelled");
        }
    }

    private void recordOutcome(BatchGroup group, BatchOperation op, ExecutionResult result) {
        BatchProgress progress;
        synchronized (group) {
            op.setCompletedAt(clock.millis());
            if (result.success()) {
                op.setStatus(OperationStatus.COMPLETED);
                group.getProgress().recordCompleted();
            } else {
                op.setStatus(OperationStatus.FAILED);
                op.setError(String.join("; ", result.errors()));
                group.getProgress().recordFailed();
            }
            progress = group.getProgress().toBuilder().build();
        }

        metricsConfig.recordOperation(op.getStatus().name());
        if (result.success()) {
            publish(PipelineEventType.OPERATION_COMPLETED, "batchId", group.getId(), "operationId", op.getId());
        } else {
            publish(PipelineEventType.OPERATION_FAILED, "batchId", group.getId(), "operationId", op.getId(),
                    "error", op.getError());
            log.warn("Operation failed: batchId={}, operationId={}, error={}", group.getId(), op.getId(), op.getError());
        }
        publish(PipelineEventType.BATCH_PROGRESS, "batchId", group.getId(), "total", progress.getTotal(),
                "completed", progress.getCompleted(), "failed", progress.getFailed(),
                "successRate", progress.getSuccessRate());
    }

    private void failValidation(BatchGroup group, List<BatchOperation> operations, ValidationResult validation) {
        List<String> messages = validation.errorMessages();
        String error = "Batch validation failed: " + String.join("; ", messages);
        synchronized (group) {
            long now = clock.millis();
            for (BatchOperation op : operations) {
                op.setStatus(OperationStatus.FAILED);
                op.setError(error);
                op.setCompletedAt(now);
                group.getProgress().recordFailed();
            }
            group.getErrors().addAll(messages);
            group.setStatus(BatchStatus.FAILED);
            group.setCompletedAt(now);
        }
        log.warn("Batch validation failed: batchId={}, errors={}", group.getId(), messages);
    }

    private void markFailed(BatchGroup group, String error) {
        synchronized (group) {
            group.getErrors().add(error);
            if (group.getStatus() != BatchStatus.CANCELLED) {
                group.setStatus(BatchStatus.FAILED);
            }
            group.setCompletedAt(clock.millis());
        }
    }

    private void finishBatch(BatchGroup group) {
        activeBatches.remove(group.getId());
        synchronized (slotMonitor) {
            slotMonitor.notifyAll();
        }

        BatchGroup snapshot = group.snapshot();
        metricsConfig.recordBatchFinished(snapshot.getStatus().name());
        record(group);

        BatchProgress progress = snapshot.getProgress();
        if (snapshot.getStatus() == BatchStatus.COMPLETED) {
            publish(PipelineEventType.BATCH_COMPLETED, "batchId", snapshot.getId(),
                    "completed", progress.getCompleted(), "successRate", progress.getSuccessRate());
        } else if (snapshot.getStatus() == BatchStatus.FAILED) {
            publish(PipelineEventType.BATCH_FAILED, "batchId", snapshot.getId(),
                    "completed", progress.getCompleted(), "failed", progress.getFailed(),
                    "errors", snapshot.getErrors());
        } else if (snapshot.getStatus() == BatchStatus.CANCELLED) {
            publish(PipelineEventType.BATCH_CANCELLED, "batchId", snapshot.getId(), "finished", true,
                    "completed", progress.getCompleted(), "failed", progress.getFailed());
        }
        log.info("Batch finished: batchId={}, status={}, completed={}, failed={}, successRate={}",
                snapshot.getId(), snapshot.getStatus(), progress.getCompleted(), progress.getFailed(),
                progress.getSuccessRate());
    }

    private void record(BatchGroup group) {
        BatchGroup snapshot = group.snapshot();
        try {
            List<String> summaries = new ArrayList<>();
            for (BatchOperation op : snapshot.getOperations()) {
                summaries.add(op.getType() + ":" + op.getOriginalPath()
                        + (op.getTargetPath() != null ? "->" + op.getTargetPath() : "") + ":" + op.getStatus());
            }
            operationStore.recordOperation(OperationRecord.builder()
                    .kind(RecordKind.BATCH)
                    .referenceId(snapshot.getId())
                    .status(snapshot.getStatus().name())
                    .operationCount(snapshot.getOperations().size())
                    .completedCount(snapshot.getProgress() != null ? snapshot.getProgress().getCompleted() : 0)
                    .operations(summaries)
                    .error(snapshot.getErrors().isEmpty() ? null : String.join("; ", snapshot.getErrors()))
                    .recordedAt(clock.millis())
                    .build());
        } catch (Exception e) {
            log.error("Failed to record batch outcome: batchId={}, status={}", snapshot.getId(), snapshot.getStatus(), e);
        }
    }

    private boolean isCancelled(BatchGroup group) {
        synchronized (group) {
            return group.getStatus() == BatchStatus.CANCELLED;
        }
    }

    private int concurrencyCeiling() {
        int max = config.getMaxConcurrentOperations();
        OptionalInt hint = resourceMonitor.concurrencyHint();
        if (hint.isPresent() && hint.getAsInt() > 0) {
            return Math.min(max, hint.getAsInt());
        }
        return max;
    }

    private int perBatchLimit(int batchSize) {
        int active = Math.max(1, activeBatches.size());
        int share = (int) Math.ceil((double) concurrencyCeiling() / active);
        return Math.max(1, Math.min(batchSize, share));
    }

    private BatchOperation toOperation(OperationRequest request) {
        if (request == null || request.getType() == null) {
            throw new IllegalArgumentException("Operation type is required");
        }
        return BatchOperation.builder()
                .id("op-" + UUID.randomUUID())
                .type(request.getType())
                .fileId(request.getFileId())
                .originalPath(request.getOriginalPath())
                .targetPath(request.getTargetPath())
                .confidence(request.getConfidence())
                .priority(request.getPriority() != null ? request.getPriority() : QueuePriority.MEDIUM)
                .reference(request.getReference())
                .createdAt(clock.millis())
                .build();
    }

    private void publish(PipelineEventType type, Object... keyValues) {
        eventSink.publish(PipelineEvent.of(type, SOURCE, clock, keyValues));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record QueuedBatch(BatchGroup group, int priority, long sequence) {}
}
