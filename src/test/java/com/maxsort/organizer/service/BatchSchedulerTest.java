package com.maxsort.organizer.service;

import com.maxsort.organizer.config.BatchSchedulerConfig;
import com.maxsort.organizer.config.MetricsConfig;
import com.maxsort.organizer.events.InMemoryEventChannel;
import com.maxsort.organizer.events.PipelineEvent;
import com.maxsort.organizer.events.PipelineEventType;
import com.maxsort.organizer.model.BatchGroup;
import com.maxsort.organizer.model.BatchOperation;
import com.maxsort.organizer.model.BatchQueueStats;
import com.maxsort.organizer.model.BatchStatus;
import com.maxsort.organizer.model.BatchType;
import com.maxsort.organizer.model.ExecutionResult;
import com.maxsort.organizer.model.OperationRecord;
import com.maxsort.organizer.model.OperationRequest;
import com.maxsort.organizer.model.OperationStatus;
import com.maxsort.organizer.model.OperationType;
import com.maxsort.organizer.model.QueuePriority;
import com.maxsort.organizer.model.RecordKind;
import com.maxsort.organizer.model.ValidationResult;
import com.maxsort.organizer.repository.OperationStore;
import com.maxsort.organizer.testutil.ManualTicker;
import com.maxsort.organizer.testutil.TestDataFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BatchSchedulerTest {

    private static final long AWAIT_MS = 5000;

    @Mock private OperationStore operationStore;
    @Mock private MetricsConfig metricsConfig;

    @TempDir Path dir;

    private final InMemoryEventChannel events = new InMemoryEventChannel();
    private final List<PipelineEvent> published = new CopyOnWriteArrayList<>();
    private final List<String> executed = new CopyOnWriteArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger maxRunning = new AtomicInteger();
    private ManualTicker ticker;
    private OptionalInt hint = OptionalInt.empty();
    private BatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        events.subscribe(published::add);
        ticker = new ManualTicker();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    private BatchScheduler scheduler(int maxConcurrent, int maxBatchSize, long operationTimeoutMs) {
        BatchSchedulerConfig config = new BatchSchedulerConfig();
        config.setAutoStart(false);
        config.setMaxConcurrentOperations(maxConcurrent);
        config.setMaxBatchSize(maxBatchSize);
        config.setBatchTimeoutMs(60000);
        config.setOperationTimeoutMs(operationTimeoutMs);
        scheduler = new BatchScheduler(config, new OperationValidator(), this::handle, events, ticker,
                Clock.systemUTC(), metricsConfig, () -> hint, operationStore);
        return scheduler;
    }

    // Stand-in for the file executor: "fail" targets fail, "slow" targets take a second
    private ExecutionResult handle(BatchOperation op) {
        int now = running.incrementAndGet();
        maxRunning.accumulateAndGet(now, Math::max);
        try {
            executed.add(op.getReference() != null ? op.getReference() : op.getId());
            String target = op.getTargetPath() != null ? op.getTargetPath() : "";
            if (target.contains("slow")) {
                Thread.sleep(1000);
            } else {
                Thread.sleep(30);
            }
            if (target.contains("fail")) {
                return ExecutionResult.failure("boom");
            }
            return new ExecutionResult(true, 1, List.of(), List.of());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failure("interrupted");
        } finally {
            running.decrementAndGet();
        }
    }

    private OperationRequest rename(String name, String target, String reference) throws IOException {
        Path source = dir.resolve(name);
        if (!Files.exists(source)) {
            Files.writeString(source, name);
        }
        OperationRequest request = TestDataFactory.createOperationRequest(OperationType.RENAME,
                source.toString(), dir.resolve(target).toString(), QueuePriority.MEDIUM);
        request.setReference(reference);
        return request;
    }

    private BatchGroup awaitFinished(String batchId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + AWAIT_MS;
        BatchGroup group = scheduler.getBatchStatus(batchId);
        while (!group.getStatus().isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            group = scheduler.getBatchStatus(batchId);
        }
        return group;
    }

    private PipelineEvent awaitEvent(PipelineEventType type, String batchId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + AWAIT_MS;
        while (System.currentTimeMillis() < deadline) {
            for (PipelineEvent event : published) {
                if (event.type() == type && batchId.equals(event.get("batchId"))) {
                    return event;
                }
            }
            Thread.sleep(20);
        }
        return null;
    }

    @Test
    void addOperation_registersPendingOperation() throws IOException {
        scheduler(2, 10, 0);

        String id = scheduler.addOperation(rename("a.txt", "a2.txt", null));

        assertThat(id).startsWith("op-");
        assertThat(scheduler.getQueueStats().pendingOperations()).isEqualTo(1);
        assertThat(scheduler.isProcessing()).isFalse();
    }

    @Test
    void addOperation_highPriority_batchesAllPendingImmediately() throws IOException {
        scheduler(2, 10, 0);
        scheduler.addOperation(rename("a.txt", "a2.txt", null));
        OperationRequest urgent = rename("b.txt", "b2.txt", null);
        urgent.setPriority(QueuePriority.HIGH);

        scheduler.addOperation(urgent);

        BatchQueueStats stats = scheduler.getQueueStats();
        assertThat(stats.pendingOperations()).isZero();
        assertThat(stats.queuedBatches()).isEqualTo(2);
    }

    @Test
    void createBatch_skipsUnknownIdsAndRejectsEmpty() throws IOException {
        scheduler(2, 10, 0);
        String id = scheduler.addOperation(rename("a.txt", "a2.txt", null));

        String batchId = scheduler.createBatch(List.of("op-unknown", id), BatchType.INTERACTIVE);

        BatchGroup group = scheduler.getBatchStatus(batchId);
        assertThat(group.getOperations()).extracting(BatchOperation::getId).containsExactly(id);
        assertThat(group.getStatus()).isEqualTo(BatchStatus.PENDING);
        assertThat(group.getPriority()).isEqualTo(100);
        assertThatThrownBy(() -> scheduler.createBatch(List.of("op-unknown"), BatchType.BACKGROUND))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No valid operations found for batch creation");
    }

    @Test
    void submitBatch_partitionsByMaxBatchSize() throws IOException {
        scheduler(2, 3, 0);
        List<OperationRequest> requests = List.of(
                rename("a.txt", "a2.txt", null), rename("b.txt", "b2.txt", null), rename("c.txt", "c2.txt", null),
                rename("d.txt", "d2.txt", null), rename("e.txt", "e2.txt", null));

        List<String> batchIds = scheduler.submitBatch(requests, BatchType.BACKGROUND);

        assertThat(batchIds).hasSize(2);
        assertThat(scheduler.getBatchStatus(batchIds.get(0)).getOperations()).hasSize(3);
        assertThat(scheduler.getBatchStatus(batchIds.get(1)).getOperations()).hasSize(2);
        assertThat(scheduler.getBatchStatus(batchIds.get(1)).getPriority()).isEqualTo(50);
        assertThat(scheduler.getQueueStats().queuedBatches()).isEqualTo(2);
    }

    @Test
    void processing_completesBatchAndRecordsOutcome() throws Exception {
        scheduler(2, 10, 0);
        String batchId = scheduler.submitBatch(List.of(
                rename("a.txt", "a2.txt", "ref-a"), rename("b.txt", "b2.txt", "ref-b")), BatchType.INTERACTIVE).get(0);

        scheduler.startProcessing();
        BatchGroup group = awaitFinished(batchId);

        assertThat(group.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(group.getProgress().getCompleted()).isEqualTo(2);
        assertThat(group.getProgress().getSuccessRate()).isEqualTo(100.0);
        assertThat(group.getOperations()).allSatisfy(op -> assertThat(op.getStatus()).isEqualTo(OperationStatus.COMPLETED));
        assertThat(group.getOperations()).extracting(BatchOperation::getReference).containsExactly("ref-a", "ref-b");
        assertThat(awaitEvent(PipelineEventType.BATCH_COMPLETED, batchId)).isNotNull();
        assertThat(awaitEvent(PipelineEventType.BATCH_STARTED, batchId)).isNotNull();
        verify(operationStore, timeout(AWAIT_MS)).recordOperation(argThat((OperationRecord r) ->
                r.getKind() == RecordKind.BATCH && batchId.equals(r.getReferenceId())
                        && "COMPLETED".equals(r.getStatus())));
    }

    @Test
    void processing_failedOperation_failsBatch() throws Exception {
        scheduler(2, 10, 0);
        String batchId = scheduler.submitBatch(List.of(
                rename("a.txt", "a2.txt", null), rename("b.txt", "b-fail.txt", null)), BatchType.INTERACTIVE).get(0);

        scheduler.startProcessing();
        BatchGroup group = awaitFinished(batchId);

        assertThat(group.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(group.getProgress().getCompleted()).isEqualTo(1);
        assertThat(group.getProgress().getFailed()).isEqualTo(1);
        assertThat(group.getProgress().getSuccessRate()).isEqualTo(50.0);
        assertThat(group.getOperations().get(1).getError()).isEqualTo("boom");
        assertThat(awaitEvent(PipelineEventType.BATCH_FAILED, batchId)).isNotNull();
    }

    @Test
    void processing_invalidBatch_failsEveryOperationWithoutRunning() throws Exception {
        scheduler(2, 10, 0);
        OperationRequest missing = TestDataFactory.createOperationRequest(OperationType.RENAME,
                dir.resolve("ghost.txt").toString(), dir.resolve("ghost2.txt").toString(), QueuePriority.MEDIUM);
        String batchId = scheduler.submitBatch(List.of(rename("a.txt", "a2.txt", null), missing),
                BatchType.INTERACTIVE).get(0);

        scheduler.startProcessing();
        BatchGroup group = awaitFinished(batchId);

        assertThat(group.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(group.getOperations()).allSatisfy(op -> {
            assertThat(op.getStatus()).isEqualTo(OperationStatus.FAILED);
            assertThat(op.getError()).startsWith("Batch validation failed: Source file does not exist");
        });
        assertThat(group.getErrors()).isNotEmpty();
        assertThat(executed).isEmpty();
    }

    @Test
    void processing_interactiveBatchRunsBeforeEarlierBackgroundBatch() throws Exception {
        scheduler(1, 10, 0);
        String background = scheduler.submitBatch(List.of(rename("a.txt", "a2.txt", "background")),
                BatchType.BACKGROUND).get(0);
        String interactive = scheduler.submitBatch(List.of(rename("b.txt", "b2.txt", "interactive")),
                BatchType.INTERACTIVE).get(0);

        scheduler.startProcessing();
        awaitFinished(interactive);
        awaitFinished(background);

        assertThat(executed).containsExactly("interactive", "background");
    }

    @Test
    void processing_resourceHintLowersConcurrency() throws Exception {
        hint = OptionalInt.of(1);
        scheduler(4, 10, 0);
        String batchId = scheduler.submitBatch(List.of(
                rename("a.txt", "a2.txt", null), rename("b.txt", "b2.txt", null),
                rename("c.txt", "c2.txt", null), rename("d.txt", "d2.txt", null)), BatchType.INTERACTIVE).get(0);

        scheduler.startProcessing();
        BatchGroup group = awaitFinished(batchId);

        assertThat(group.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(maxRunning.get()).isEqualTo(1);
    }

    @Test
    void processing_operationTimeout_failsSlowOperation() throws Exception {
        scheduler(2, 10, 100);
        String batchId = scheduler.submitBatch(List.of(rename("a.txt", "a-slow.txt", null)),
                BatchType.INTERACTIVE).get(0);

        scheduler.startProcessing();
        BatchGroup group = awaitFinished(batchId);

        assertThat(group.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(group.getOperations().get(0).getError()).isEqualTo("Operation timed out after 100ms");
    }

    @Test
    void cancelBatch_queuedBatch_neverRuns() throws Exception {
        scheduler(2, 10, 0);
        String batchId = scheduler.submitBatch(List.of(rename("a.txt", "a2.txt", null)), BatchType.BACKGROUND).get(0);

        assertThat(scheduler.cancelBatch(batchId)).isTrue();
        assertThat(scheduler.cancelBatch(batchId)).isFalse();
        assertThat(scheduler.cancelBatch("batch-unknown")).isFalse();

        scheduler.startProcessing();
        Thread.sleep(200);

        assertThat(scheduler.getBatchStatus(batchId).getStatus()).isEqualTo(BatchStatus.CANCELLED);
        assertThat(executed).isEmpty();
        PipelineEvent cancelled = awaitEvent(PipelineEventType.BATCH_CANCELLED, batchId);
        assertThat(cancelled.get("finished")).isEqualTo(true);
    }

    @Test
    void cancelBatch_runningBatch_finishesInFlightAndStartsNothingNew() throws Exception {
        scheduler(1, 10, 0);
        List<OperationRequest> requests = List.of(
                rename("a.txt", "a-slow.txt", "entry-a"), rename("b.txt", "b-slow.txt", "entry-b"),
                rename("c.txt", "c-slow.txt", "entry-c"), rename("d.txt", "d-slow.txt", "entry-d"));
        String batchId = scheduler.submitBatch(requests, BatchType.INTERACTIVE).get(0);

        scheduler.startProcessing();
        long deadline = System.currentTimeMillis() + AWAIT_MS;
        while (executed.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(scheduler.cancelBatch(batchId)).isTrue();

        PipelineEvent finished = null;
        deadline = System.currentTimeMillis() + AWAIT_MS;
        while (finished == null && System.currentTimeMillis() < deadline) {
            for (PipelineEvent event : published) {
                if (event.type() == PipelineEventType.BATCH_CANCELLED && batchId.equals(event.get("batchId"))
                        && Boolean.TRUE.equals(event.get("finished"))) {
                    finished = event;
                }
            }
            Thread.sleep(20);
        }

        assertThat(finished).isNotNull();
        assertThat(finished.get("completed")).isEqualTo(1);
        assertThat(executed).containsExactly("entry-a");
        BatchGroup group = scheduler.getBatchStatus(batchId);
        assertThat(group.getStatus()).isEqualTo(BatchStatus.CANCELLED);
        assertThat(group.getProgress().getCompleted()).isEqualTo(1);
        assertThat(group.getOperations()).filteredOn(op -> op.getStatus() == OperationStatus.PENDING).hasSize(3);
        assertThat(published).filteredOn(e -> e.type() == PipelineEventType.BATCH_CANCELLED)
                .extracting(e -> e.get("finished")).containsExactly(false, true);
    }

    @Test
    void startAndStopProcessing_manageSweepTimer() {
        scheduler(2, 10, 0);

        scheduler.startProcessing();
        scheduler.startProcessing();
        assertThat(scheduler.isProcessing()).isTrue();
        assertThat(ticker.activeCount()).isEqualTo(1);

        scheduler.stopProcessing();
        assertThat(scheduler.isProcessing()).isFalse();
        assertThat(ticker.activeCount()).isZero();
    }

    @Test
    void onTick_batchesBackgroundOnlyOnceFull() throws IOException {
        scheduler(2, 2, 0);
        scheduler.addOperation(rename("a.txt", "a2.txt", null));

        scheduler.onTick();
        assertThat(scheduler.getQueueStats().pendingOperations()).isEqualTo(1);

        scheduler.addOperation(rename("b.txt", "b2.txt", null));
        scheduler.onTick();
        assertThat(scheduler.getQueueStats().pendingOperations()).isZero();
        assertThat(scheduler.getQueueStats().queuedBatches()).isEqualTo(1);
    }

    @Test
    void validateBatch_reportsIssuesWithoutExecuting() throws IOException {
        scheduler(2, 10, 0);
        OperationRequest missing = TestDataFactory.createOperationRequest(OperationType.DELETE,
                dir.resolve("ghost.txt").toString(), null, QueuePriority.MEDIUM);
        String batchId = scheduler.submitBatch(List.of(missing), BatchType.INTERACTIVE).get(0);

        ValidationResult result = scheduler.validateBatch(batchId);

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).extracting(i -> i.code()).contains("SOURCE_NOT_FOUND");
        assertThat(scheduler.validateBatch("batch-unknown")).isNull();
        assertThat(scheduler.getBatchStatus(batchId).getStatus()).isEqualTo(BatchStatus.PENDING);
    }
}
