package com.maxsort.organizer.service;

import com.maxsort.organizer.config.AutoApprovalConfig;
import com.maxsort.organizer.config.MetricsConfig;
import com.maxsort.organizer.engine.ConfidenceFilter;
import com.maxsort.organizer.events.EventSink;
import com.maxsort.organizer.events.PipelineEvent;
import com.maxsort.organizer.events.PipelineEventType;
import com.maxsort.organizer.model.AutoApprovalQueueStatus;
import com.maxsort.organizer.model.AutoApprovalResult;
import com.maxsort.organizer.model.BatchType;
import com.maxsort.organizer.model.CategorizedSuggestion;
import com.maxsort.organizer.model.FileMetadata;
import com.maxsort.organizer.model.FilterOptions;
import com.maxsort.organizer.model.FilteringResult;
import com.maxsort.organizer.model.OperationRequest;
import com.maxsort.organizer.model.OperationType;
import com.maxsort.organizer.model.QueueEntry;
import com.maxsort.organizer.model.QueuePriority;
import com.maxsort.organizer.model.ScoredSuggestion;
import com.maxsort.organizer.model.SuggestionCategory;
import com.maxsort.organizer.scheduling.Cancellable;
import com.maxsort.organizer.scheduling.Ticker;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Second safety net between the confidence filter and the batch scheduler. AUTO_APPROVE
 * suggestions that pass its gates wait in a bounded queue until a timer tick or a size
 * threshold turns them into one background batch.
 */
@Service
public class AutoApprovalOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AutoApprovalOrchestrator.class);

    private static final String SOURCE = "auto-approval";
    private static final double IMMEDIATE_TRIGGER_QUEUE_RATIO = 0.8;
    private static final List<String> SYSTEM_DIRECTORIES = List.of("/System", "/usr", "/Library", "/Applications");
    private static final List<String> CONFIG_EXTENSIONS = List.of(".config", ".conf", ".cfg", ".ini", ".env", ".plist");

    private final ConfidenceFilter confidenceFilter;
    private final BatchScheduler batchScheduler;
    private final EventSink eventSink;
    private final Ticker ticker;
    private final Clock clock;
    private final MetricsConfig metricsConfig;

    // Insertion order is dequeue order
    private final LinkedHashMap<String, QueueEntry> queue = new LinkedHashMap<>();
    private final Object queueLock = new Object();
    private final Object timerLock = new Object();
    private final AtomicBoolean processing = new AtomicBoolean(false);

    private volatile AutoApprovalConfig config;
    private volatile List<CompiledPattern> dangerousPatterns;
    private Cancellable timer;

    public AutoApprovalOrchestrator(ConfidenceFilter confidenceFilter,
                                    BatchScheduler batchScheduler,
                                    EventSink eventSink,
                                    Ticker ticker,
                                    Clock clock,
                                    MetricsConfig metricsConfig,
                                    AutoApprovalConfig config) {
        config.validate();
        this.confidenceFilter = confidenceFilter;
        this.batchScheduler = batchScheduler;
        this.eventSink = eventSink;
        this.ticker = ticker;
        this.clock = clock;
        this.metricsConfig = metricsConfig;
        this.config = config.copy();
        this.dangerousPatterns = compile(config.getDangerousPathPatterns());

        startTimer();
        log.info("Auto-approval orchestrator initialized: maxQueueSize={}, maxPerBatch={}, intervalMs={}, safetyChecks={}",
                config.getMaxQueueSize(), config.getMaxAutoApprovalsPerBatch(),
                config.getBatchProcessingIntervalMs(), config.isEnableSafetyChecks());
    }

    /**
     * Filter scored suggestions and queue the ones that clear every auto-approval gate.
     *
     * @param suggestions     scored suggestions
     * @param fileMetadataMap file metadata keyed by suggestion value
     */
    @Observed(name = "auto_approval.process", contextualName = "process-suggestions")
    public AutoApprovalResult processSuggestions(List<ScoredSuggestion> suggestions,
                                                 Map<String, FileMetadata> fileMetadataMap) {
        long start = clock.millis();
        AutoApprovalConfig cfg = this.config;
        Map<String, FileMetadata> metadata = fileMetadataMap != null ? fileMetadataMap : Map.of();

        FilteringResult filtering = confidenceFilter.filter(suggestions, FilterOptions.builder()
                .enableSafetyChecks(cfg.isEnableSafetyChecks())
                .maxAutoApproveCount(cfg.getMaxAutoApprovalsPerBatch())
                .includeReasoning(true)
                .build());

        int queued = 0;
        int rejected = 0;
        List<CategorizedSuggestion> manualReview = new ArrayList<>();

        for (CategorizedSuggestion item : filtering.categorized()) {
            if (item.getCategory() == SuggestionCategory.MANUAL_REVIEW) {
                manualReview.add(item);
                continue;
            }
            if (item.getCategory() == SuggestionCategory.REJECT) {
                rejected++;
                publish(PipelineEventType.SUGGESTION_REJECTED, "value", item.getValue(), "reason", item.getReason());
                continue;
            }

            FileMetadata meta = metadata.get(item.getValue());
            if (meta == null) {
                log.warn("No file metadata for auto-approved suggestion: value={}", item.getValue());
                reject(item, "missing-metadata", "No file metadata for suggestion");
                rejected++;
                continue;
            }

            Optional<String> gateFailure = checkGates(item, meta, cfg);
            if (gateFailure.isPresent()) {
                reject(item, "safety-gate", gateFailure.get());
                rejected++;
                continue;
            }

            if (enqueue(item, meta, cfg)) {
                queued++;
            } else {
                reject(item, "queue-full", "Auto-approval queue is full");
                publish(PipelineEventType.QUEUE_FULL, "rejectedCount", 1, "maxQueueSize", cfg.getMaxQueueSize());
                rejected++;
            }
        }

        String batchId = null;
        int batched = 0;
        if (shouldTriggerImmediately(cfg)) {
            BatchCreation creation = createBatchFromQueue();
            if (creation != null) {
                batchId = creation.batchId();
                batched = creation.operationCount();
            }
        }

        AutoApprovalResult result = AutoApprovalResult.builder()
                .totalProcessed(suggestions == null ? 0 : suggestions.size())
                .autoApprovedCount(batched)
                .queuedCount(queued)
                .rejectedCount(rejected)
                .manualReview(manualReview)
                .batchId(batchId)
                .processingDurationMs(clock.millis() - start)
                .statistics(filtering.statistics())
                .build();

        log.info("Auto-approval pass complete: total={}, queued={}, batched={}, rejected={}, manualReview={}, queueSize={}",
                result.getTotalProcessed(), queued, batched, rejected, manualReview.size(), queueSize());
        return result;
    }

    /**
     * Turn queued entries into a batch now, regardless of the timer.
     *
     * @return the new batch id, or null when nothing was queued or a batch is already being created
     */
    public String forceProcessQueue() {
        BatchCreation creation = createBatchFromQueue();
        return creation != null ? creation.batchId() : null;
    }

    public int clearQueue() {
        int cleared;
        synchronized (queueLock) {
            cleared = queue.size();
            queue.clear();
        }
        metricsConfig.updateAutoApprovalQueueSize(0);
        publish(PipelineEventType.QUEUE_CLEARED, "clearedCount", cleared);
        log.info("Auto-approval queue cleared: clearedCount={}", cleared);
        return cleared;
    }

    public AutoApprovalQueueStatus getQueueStatus() {
        List<QueueEntry> entries;
        synchronized (queueLock) {
            entries = List.copyOf(queue.values());
        }
        return new AutoApprovalQueueStatus(entries.size(), config.getMaxQueueSize(), entries, processing.get());
    }

    public AutoApprovalConfig getConfig() {
        return config.copy();
    }

    /**
     * Swap in a new configuration. The timer restarts when the interval changes.
     *
     * @throws IllegalArgumentException when the configuration is invalid; nothing changes in that case
     */
    public void updateConfig(AutoApprovalConfig newConfig) {
        newConfig.validate();
        List<CompiledPattern> patterns = compile(newConfig.getDangerousPathPatterns());
        AutoApprovalConfig previous = this.config;

        synchronized (timerLock) {
            this.dangerousPatterns = patterns;
            this.config = newConfig.copy();
            if (previous.getBatchProcessingIntervalMs() != newConfig.getBatchProcessingIntervalMs()) {
                stopTimer();
                startTimer();
            }
        }
        log.info("Auto-approval config updated: maxQueueSize={}, maxPerBatch={}, intervalMs={}, minConfidence={}",
                newConfig.getMaxQueueSize(), newConfig.getMaxAutoApprovalsPerBatch(),
                newConfig.getBatchProcessingIntervalMs(), newConfig.getRequireMinimumConfidence());
    }

    @PreDestroy
    public void shutdown() {
        synchronized (timerLock) {
            stopTimer();
        }
        clearQueue();
        log.info("Auto-approval orchestrator shut down");
    }

    /**
     * Timer entry point.
     */
    void onTick() {
        try {
            createBatchFromQueue();
        } catch (Exception e) {
            log.error("Auto-approval timer tick failed: {}", e.getMessage(), e);
        }
    }

    private Optional<String> checkGates(CategorizedSuggestion item, FileMetadata meta, AutoApprovalConfig cfg) {
        double confidence = item.getAdjustedConfidence() / 100;
        if (confidence < cfg.getRequireMinimumConfidence()) {
            return Optional.of(String.format("Confidence %d%% below required %d%%",
                    Math.round(confidence * 100), Math.round(cfg.getRequireMinimumConfidence() * 100)));
        }

        if (meta.getOperationType() == OperationType.DELETE) {
            return Optional.of("Operation type 'delete' is never auto-approved");
        }

        String originalPath = meta.getOriginalPath() != null ? meta.getOriginalPath() : "";
        String targetPath = meta.getTargetPath() != null ? meta.getTargetPath() : "";

        for (CompiledPattern pattern : dangerousPatterns) {
            if (pattern.regex().matcher(originalPath).find() || pattern.regex().matcher(targetPath).find()) {
                return Optional.of("Path matches dangerous pattern: " + pattern.glob());
            }
        }

        for (String dir : SYSTEM_DIRECTORIES) {
            if (originalPath.startsWith(dir) || targetPath.startsWith(dir)) {
                return Optional.of("Operation involves system directories");
            }
        }

        for (String ext : CONFIG_EXTENSIONS) {
            if (originalPath.endsWith(ext) || targetPath.endsWith(ext)) {
                return Optional.of("Operation involves configuration files");
            }
        }
        return Optional.empty();
    }

    private boolean enqueue(CategorizedSuggestion item, FileMetadata meta, AutoApprovalConfig cfg) {
        QueueEntry entry = QueueEntry.builder()
                .id("auto-approval-" + UUID.randomUUID())
                .suggestion(item)
                .fileMetadata(meta)
                .queuedAt(clock.millis())
                .priority(QueuePriority.fromConfidence(item.getAdjustedConfidence()))
                .safetyChecksCompleted(true)
                .build();

        int size;
        synchronized (queueLock) {
            if (queue.size() >= cfg.getMaxQueueSize()) {
                log.warn("Auto-approval queue is full, rejecting suggestion: value={}, maxQueueSize={}",
                        item.getValue(), cfg.getMaxQueueSize());
                return false;
            }
            queue.put(entry.getId(), entry);
            size = queue.size();
        }
        metricsConfig.updateAutoApprovalQueueSize(size);
        publish(PipelineEventType.SUGGESTION_QUEUED,
                "entryId", entry.getId(), "value", item.getValue(), "priority", entry.getPriority().name());
        if (cfg.isEnableAuditLogging()) {
            log.info("Suggestion queued for auto-approval: entryId={}, value={}, confidence={}, priority={}",
                    entry.getId(), item.getValue(), item.getAdjustedConfidence(), entry.getPriority());
        }
        return true;
    }

    private void reject(CategorizedSuggestion item, String metricReason, String reason) {
        metricsConfig.recordAutoApprovalRejected(metricReason);
        publish(PipelineEventType.SUGGESTION_REJECTED, "value", item.getValue(), "reason", reason);
        if (config.isEnableAuditLogging()) {
            log.info("Auto-approval rejected: value={}, reason={}", item.getValue(), reason);
        }
    }

    private boolean shouldTriggerImmediately(AutoApprovalConfig cfg) {
        int size = queueSize();
        return size >= cfg.getMaxAutoApprovalsPerBatch()
                || size >= cfg.getMaxQueueSize() * IMMEDIATE_TRIGGER_QUEUE_RATIO;
    }

    private BatchCreation createBatchFromQueue() {
        if (!processing.compareAndSet(false, true)) {
            return null;
        }
        try {
            AutoApprovalConfig cfg = this.config;
            List<QueueEntry> entries = new ArrayList<>();
            synchronized (queueLock) {
                for (QueueEntry entry : queue.values()) {
                    if (entries.size() >= cfg.getMaxAutoApprovalsPerBatch()) break;
                    entries.add(entry);
                }
            }
            if (entries.isEmpty()) {
                return null;
            }

            List<OperationRequest> requests = new ArrayList<>(entries.size());
            for (QueueEntry entry : entries) {
                FileMetadata meta = entry.getFileMetadata();
                requests.add(OperationRequest.builder()
                        .type(OperationType.RENAME)
                        .fileId(meta.getFileId())
                        .originalPath(meta.getOriginalPath())
                        .targetPath(meta.getTargetPath())
                        .confidence(entry.getSuggestion().getAdjustedConfidence())
                        .priority(entry.getPriority())
                        .reference(entry.getId())
                        .build());
            }
            String batchId = batchScheduler.submitBatch(requests, BatchType.BACKGROUND).get(0);

            int remaining;
            synchronized (queueLock) {
                entries.forEach(e -> queue.remove(e.getId()));
                remaining = queue.size();
            }
            metricsConfig.updateAutoApprovalQueueSize(remaining);
            publish(PipelineEventType.AUTO_APPROVAL_BATCH_CREATED,
                    "batchId", batchId, "operationCount", entries.size());
            log.info("Created auto-approval batch: batchId={}, operationCount={}, remainingQueueSize={}",
                    batchId, entries.size(), remaining);
            return new BatchCreation(batchId, entries.size());
        } catch (Exception e) {
            log.error("Failed to create auto-approval batch: queueSize={}", queueSize(), e);
            return null;
        } finally {
            processing.set(false);
        }
    }

    private int queueSize() {
        synchronized (queueLock) {
            return queue.size();
        }
    }

    private void startTimer() {
        timer = ticker.schedule(this::onTick, Duration.ofMillis(config.getBatchProcessingIntervalMs()));
    }

    private void stopTimer() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
    }

    private void publish(PipelineEventType type, Object... keyValues) {
        eventSink.publish(PipelineEvent.of(type, SOURCE, clock, keyValues));
    }

    /**
     * Compile glob patterns: {@code **} matches anything, {@code *} anything except '/'.
     * Matching is case-insensitive and unanchored.
     */
    static List<CompiledPattern> compile(List<String> globs) {
        List<CompiledPattern> compiled = new ArrayList<>();
        if (globs == null) return compiled;
        for (String glob : globs) {
            StringBuilder regex = new StringBuilder();
            int i = 0;
            while (i < glob.length()) {
                char c = glob.charAt(i);
                if (c == '*') {
                    if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                        regex.append(".*");
                        i += 2;
                        continue;
                    }
                    regex.append("[^/]*");
                } else if ("\\.[]{}()+-?^$|".indexOf(c) >= 0) {
                    regex.append('\\').append(c);
                } else {
                    regex.append(c);
                }
                i++;
            }
            compiled.add(new CompiledPattern(glob, Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE)));
        }
        return compiled;
    }

    record CompiledPattern(String glob, Pattern regex) {}

    private record BatchCreation(String batchId, int operationCount) {}
}
