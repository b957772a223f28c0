package com.maxsort.organizer.service;

import com.maxsort.organizer.engine.ScoringContext;
import com.maxsort.organizer.engine.SuggestionScorer;
import com.maxsort.organizer.events.EventSink;
import com.maxsort.organizer.events.PipelineEvent;
import com.maxsort.organizer.events.PipelineEventListener;
import com.maxsort.organizer.events.PipelineEventType;
import com.maxsort.organizer.model.AutoApprovalResult;
import com.maxsort.organizer.model.BatchGroup;
import com.maxsort.organizer.model.BatchOperation;
import com.maxsort.organizer.model.BatchType;
import com.maxsort.organizer.model.CategorizedSuggestion;
import com.maxsort.organizer.model.ExecutionResult;
import com.maxsort.organizer.model.FileMetadata;
import com.maxsort.organizer.model.OperationRecord;
import com.maxsort.organizer.model.OperationRecordFilter;
import com.maxsort.organizer.model.OperationRequest;
import com.maxsort.organizer.model.OperationStatus;
import com.maxsort.organizer.model.OperationType;
import com.maxsort.organizer.model.PendingItemsQuery;
import com.maxsort.organizer.model.QueuePriority;
import com.maxsort.organizer.model.RawSuggestion;
import com.maxsort.organizer.model.ReviewAction;
import com.maxsort.organizer.model.ReviewQueueEntry;
import com.maxsort.organizer.model.ReviewSuggestion;
import com.maxsort.organizer.model.ScoredSuggestion;
import com.maxsort.organizer.repository.OperationStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for the boundary layer. Wires the pipeline stages together:
 * scoring, categorization and auto-approval, routing of undecided items to manual review,
 * and hand-off of approved reviews to the batch scheduler.
 */
@Service
public class OrganizerService {

    private static final Logger log = LoggerFactory.getLogger(OrganizerService.class);

    private final SuggestionScorer suggestionScorer;
    private final AutoApprovalOrchestrator autoApprovalOrchestrator;
    private final ManualReviewQueue manualReviewQueue;
    private final BatchScheduler batchScheduler;
    private final TransactionalFileExecutor fileExecutor;
    private final OperationStore operationStore;
    private final EventSink eventSink;

    // Review entries currently owned by a running batch, keyed by batch id
    private final Map<String, List<String>> handedOffEntries = new ConcurrentHashMap<>();
    private final Set<String> entriesInFlight = ConcurrentHashMap.newKeySet();
    private final PipelineEventListener batchOutcomeListener = this::onBatchEvent;

    public OrganizerService(SuggestionScorer suggestionScorer,
                            AutoApprovalOrchestrator autoApprovalOrchestrator,
                            ManualReviewQueue manualReviewQueue,
                            BatchScheduler batchScheduler,
                            TransactionalFileExecutor fileExecutor,
                            OperationStore operationStore,
                            EventSink eventSink) {
        this.suggestionScorer = suggestionScorer;
        this.autoApprovalOrchestrator = autoApprovalOrchestrator;
        this.manualReviewQueue = manualReviewQueue;
        this.batchScheduler = batchScheduler;
        this.fileExecutor = fileExecutor;
        this.operationStore = operationStore;
        this.eventSink = eventSink;
        eventSink.subscribe(batchOutcomeListener);
    }

    /**
     * Categorize scored suggestions, queue the auto-approvable ones and send the
     * undecided ones to manual review.
     *
     * @param fileMetadataMap file metadata keyed by suggestion value
     */
    public AutoApprovalResult processSuggestions(List<ScoredSuggestion> suggestions,
                                                 Map<String, FileMetadata> fileMetadataMap) {
        Map<String, FileMetadata> metadata = fileMetadataMap != null ? fileMetadataMap : Map.of();
        AutoApprovalResult result = autoApprovalOrchestrator.processSuggestions(suggestions, metadata);

        if (!result.getManualReview().isEmpty()) {
            List<ReviewSuggestion> forReview = new ArrayList<>();
            for (CategorizedSuggestion item : result.getManualReview()) {
                forReview.add(toReviewSuggestion(item, metadata.get(item.getValue())));
            }
            result.setReviewEntryIds(manualReviewQueue.addSuggestions(forReview));
            log.info("Routed suggestions to manual review: count={}", forReview.size());
        }
        return result;
    }

    /**
     * Full pipeline for one file: score the raw suggestions, then process them.
     */
    public AutoApprovalResult scoreAndProcess(List<RawSuggestion> rawSuggestions,
                                              ScoringContext context,
                                              Map<String, FileMetadata> fileMetadataMap) {
        List<ScoredSuggestion> scored = suggestionScorer.scoreFilenameSuggestions(rawSuggestions, context);
        log.info("Scored suggestions: file={}, input={}, retained={}",
                context != null ? context.getOriginalFilename() : null,
                rawSuggestions != null ? rawSuggestions.size() : 0, scored.size());
        return processSuggestions(scored, fileMetadataMap);
    }

    public String createBatch(List<String> operationIds, BatchType type) {
        return batchScheduler.createBatch(operationIds, type);
    }

    public BatchGroup getBatchStatus(String batchId) {
        return batchScheduler.getBatchStatus(batchId);
    }

    public ExecutionResult executeTransaction(String transactionId) {
        return fileExecutor.executeTransaction(transactionId);
    }

    public List<ReviewQueueEntry> getPendingItems(PendingItemsQuery query) {
        return manualReviewQueue.getPendingItems(query != null ? query : PendingItemsQuery.all());
    }

    public ReviewQueueEntry applyOverride(String entryId, ReviewAction decision, String reason, String actor) {
        return manualReviewQueue.applyOverride(entryId, decision, reason, actor);
    }

    /**
     * Schedule every approved review entry not already handed off as interactive batches.
     * Entries whose operation completes are removed from the review queue when their batch
     * finishes; the others become eligible again.
     *
     * @return ids of the batches created, empty when nothing was approved
     */
    public List<String> submitApprovedReviews() {
        List<ReviewQueueEntry> approved = new ArrayList<>();
        for (ReviewQueueEntry entry : manualReviewQueue.getApprovedEntries()) {
            if (entriesInFlight.add(entry.getId())) {
                approved.add(entry);
            }
        }
        if (approved.isEmpty()) {
            return List.of();
        }

        List<OperationRequest> requests = new ArrayList<>(approved.size());
        List<String> entryIds = new ArrayList<>(approved.size());
        for (ReviewQueueEntry entry : approved) {
            ReviewSuggestion suggestion = entry.getSuggestion();
            requests.add(OperationRequest.builder()
                    .type(suggestion.getOperation() != null ? suggestion.getOperation() : OperationType.RENAME)
                    .fileId(suggestion.getFileId())
                    .originalPath(suggestion.getOriginalPath())
                    .targetPath(suggestion.getSuggestedPath())
                    .confidence(suggestion.getConfidence())
                    .priority(QueuePriority.fromConfidence(suggestion.getConfidence()))
                    .reference(entry.getId())
                    .build());
            entryIds.add(entry.getId());
        }

        List<String> batchIds;
        try {
            batchIds = batchScheduler.submitBatch(requests, BatchType.INTERACTIVE);
        } catch (RuntimeException e) {
            entryIds.forEach(entriesInFlight::remove);
            throw e;
        }
        for (String batchId : batchIds) {
            List<String> owned = new ArrayList<>();
            BatchGroup batch = batchScheduler.getBatchStatus(batchId);
            if (batch != null) {
                for (BatchOperation op : batch.getOperations()) {
                    if (op.getReference() != null) owned.add(op.getReference());
                }
            }
            handedOffEntries.put(batchId, owned);
            // The batch may have finished before it was registered here
            BatchGroup current = batchScheduler.getBatchStatus(batchId);
            if (current != null && current.getStatus().isTerminal()) {
                releaseEntries(batchId);
            }
        }
        log.info("Approved reviews submitted: entries={}, batches={}", entryIds.size(), batchIds.size());
        return batchIds;
    }

    public List<OperationRecord> getOperationHistory(OperationRecordFilter filter) {
        return operationStore.getOperations(filter != null ? filter : OperationRecordFilter.all());
    }

    @PreDestroy
    public void shutdown() {
        eventSink.unsubscribe(batchOutcomeListener);
    }

    private void onBatchEvent(PipelineEvent event) {
        boolean terminal = event.type() == PipelineEventType.BATCH_COMPLETED
                || event.type() == PipelineEventType.BATCH_FAILED
                || (event.type() == PipelineEventType.BATCH_CANCELLED && Boolean.TRUE.equals(event.get("finished")));
        if (!terminal) {
            return;
        }
        Object batchId = event.get("batchId");
        if (batchId != null) {
            releaseEntries(batchId.toString());
        }
    }

    private void releaseEntries(String batchId) {
        List<String> owned = handedOffEntries.remove(batchId);
        if (owned == null) {
            return;
        }
        BatchGroup batch = batchScheduler.getBatchStatus(batchId);
        List<String> completed = new ArrayList<>();
        if (batch != null) {
            for (BatchOperation op : batch.getOperations()) {
                if (op.getStatus() == OperationStatus.COMPLETED && op.getReference() != null) {
                    completed.add(op.getReference());
                }
            }
        }
        if (!completed.isEmpty()) {
            manualReviewQueue.removeProcessedEntries(completed);
        }
        owned.forEach(entriesInFlight::remove);
        log.info("Review hand-off finished: batchId={}, removedEntries={}, releasedEntries={}",
                batchId, completed.size(), owned.size() - completed.size());
    }

    private static ReviewSuggestion toReviewSuggestion(CategorizedSuggestion item, FileMetadata meta) {
        ScoredSuggestion scored = item.getSuggestion();
        String originalPath = meta != null && meta.getOriginalPath() != null
                ? meta.getOriginalPath()
                : scored.getOriginalPath();
        String suggestedPath = meta != null && meta.getTargetPath() != null
                ? meta.getTargetPath()
                : siblingPath(originalPath, item.getValue());

        return ReviewSuggestion.builder()
                .suggestion(scored)
                .confidence(item.getAdjustedConfidence())
                .operation(meta != null ? meta.getOperationType() : OperationType.RENAME)
                .fileId(meta != null ? meta.getFileId() : 0L)
                .originalPath(originalPath)
                .suggestedPath(suggestedPath)
                .reason(item.getReason())
                .build();
    }

    private static String siblingPath(String originalPath, String newName) {
        if (originalPath == null) {
            return newName;
        }
        int slash = originalPath.lastIndexOf('/');
        return slash >= 0 ? originalPath.substring(0, slash + 1) + newName : newName;
    }
}
