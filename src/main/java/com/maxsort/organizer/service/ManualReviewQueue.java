package com.maxsort.organizer.service;

import com.maxsort.organizer.config.MetricsConfig;
import com.maxsort.organizer.config.ReviewQueueConfig;
import com.maxsort.organizer.events.EventSink;
import com.maxsort.organizer.events.PipelineEvent;
import com.maxsort.organizer.events.PipelineEventType;
import com.maxsort.organizer.model.BatchReviewResult;
import com.maxsort.organizer.model.PendingItemsQuery;
import com.maxsort.organizer.model.ReviewAction;
import com.maxsort.organizer.model.ReviewDecision;
import com.maxsort.organizer.model.ReviewDecisionRequest;
import com.maxsort.organizer.model.ReviewOverride;
import com.maxsort.organizer.model.ReviewQueueEntry;
import com.maxsort.organizer.model.ReviewQueueStats;
import com.maxsort.organizer.model.ReviewStatus;
import com.maxsort.organizer.model.ReviewSuggestion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Holds MANUAL_REVIEW suggestions until a person approves or rejects them.
 *
 * Writers hold the queue lock; every read hands out {@link ReviewQueueEntry#snapshot()} copies.
 */
@Service
public class ManualReviewQueue {

    private static final Logger log = LoggerFactory.getLogger(ManualReviewQueue.class);

    private static final String SOURCE = "manual-review";
    static final String ORIGINAL_CATEGORY = "manual-review";

    private final ReviewQueueConfig config;
    private final EventSink eventSink;
    private final Clock clock;
    private final MetricsConfig metricsConfig;

    // Insertion order doubles as the arrival-order tie-breaker
    private final Map<String, ReviewQueueEntry> queue = new LinkedHashMap<>();
    private final Object lock = new Object();

    public ManualReviewQueue(ReviewQueueConfig config, EventSink eventSink, Clock clock, MetricsConfig metricsConfig) {
        config.validate();
        this.config = config;
        this.eventSink = eventSink;
        this.clock = clock;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Queue suggestions for review, then evict down to the size limit.
     *
     * @return ids of the new entries, in input order
     */
    public List<String> addSuggestions(List<ReviewSuggestion> suggestions) {
        List<String> ids = new ArrayList<>();
        if (suggestions == null || suggestions.isEmpty()) {
            return ids;
        }
        int evicted;
        int size;
        synchronized (lock) {
            long now = clock.millis();
            for (ReviewSuggestion suggestion : suggestions) {
                ReviewQueueEntry entry = ReviewQueueEntry.builder()
                        .id("review-" + UUID.randomUUID())
                        .suggestion(suggestion)
                        .addedAt(now)
                        .status(ReviewStatus.PENDING)
                        .priority((int) Math.round(suggestion.getConfidence()))
                        .build();
                queue.put(entry.getId(), entry);
                ids.add(entry.getId());
            }
            evicted = enforceQueueLimit();
            size = queue.size();
        }
        metricsConfig.updateReviewQueueSize(size);
        if (evicted > 0) {
            publish(PipelineEventType.REVIEW_ITEMS_EVICTED, "count", evicted);
        }
        publish(PipelineEventType.REVIEW_ITEMS_ADDED, "count", ids.size(), "queueSize", size);
        log.info("Added suggestions to manual review: added={}, evicted={}, queueSize={}", ids.size(), evicted, size);
        return ids;
    }

    public List<ReviewQueueEntry> getPendingItems(PendingItemsQuery query) {
        PendingItemsQuery q = query != null ? query : PendingItemsQuery.all();
        List<ReviewQueueEntry> items = new ArrayList<>();
        synchronized (lock) {
            for (ReviewQueueEntry entry : queue.values()) {
                if (entry.getStatus() == ReviewStatus.PENDING && matches(entry, q)) {
                    items.add(entry.snapshot());
                }
            }
        }

        Comparator<ReviewQueueEntry> comparator = switch (q.getSortBy()) {
            case PRIORITY -> Comparator.comparingInt(ReviewQueueEntry::getPriority);
            case CONFIDENCE -> Comparator.comparingDouble(e -> e.getSuggestion().getConfidence());
            case ADDED_AT -> Comparator.comparingLong(ReviewQueueEntry::getAddedAt);
        };
        if (q.getSortOrder() == PendingItemsQuery.SortOrder.DESC) {
            comparator = comparator.reversed();
        }
        items.sort(comparator);

        if (q.getLimit() != null && q.getLimit() > 0 && items.size() > q.getLimit()) {
            return new ArrayList<>(items.subList(0, q.getLimit()));
        }
        return items;
    }

    /**
     * Highest-priority pending entries, sized by configuration unless {@code batchSize} is given.
     */
    public List<ReviewQueueEntry> getReviewBatch(Integer batchSize) {
        int size = batchSize != null && batchSize > 0 ? batchSize : config.getBatchSize();
        return getPendingItems(PendingItemsQuery.builder()
                .limit(size)
                .sortBy(PendingItemsQuery.SortField.PRIORITY)
                .sortOrder(PendingItemsQuery.SortOrder.DESC)
                .build());
    }

    /**
     * Record the first decision for a pending entry.
     *
     * @throws IllegalArgumentException when the entry does not exist or the decision has no reason
     * @throws IllegalStateException    when the entry was already reviewed
     */
    public ReviewQueueEntry processReviewDecision(String entryId, ReviewDecision decision,
                                                  String reviewer, String notes) {
        validateDecision(decision);
        ReviewQueueEntry snapshot;
        synchronized (lock) {
            ReviewQueueEntry entry = queue.get(entryId);
            if (entry == null) {
                throw new IllegalArgumentException("Queue entry not found: " + entryId);
            }
            if (entry.getStatus() != ReviewStatus.PENDING) {
                throw new IllegalStateException(
                        "Entry " + entryId + " is not in pending status: " + entry.getStatus());
            }
            long now = clock.millis();
            entry.setStatus(ReviewStatus.REVIEWED);
            entry.setDecision(decision.toBuilder().appliedAt(now).build());
            entry.setReviewedAt(now);
            entry.setReviewedBy(reviewer);
            entry.setNotes(notes);
            snapshot = entry.snapshot();
        }
        metricsConfig.recordReviewDecision(decision.getAction().getLabel());
        publish(PipelineEventType.REVIEW_DECISION,
                "entryId", entryId, "action", decision.getAction().getLabel(), "reviewedBy", reviewer);
        log.info("Review decision recorded: entryId={}, action={}, reviewedBy={}",
                entryId, decision.getAction(), reviewer);
        return snapshot;
    }

    /**
     * Apply many decisions; a failing entry is reported and the rest still run.
     */
    public BatchReviewResult processBatchReview(List<ReviewDecisionRequest> decisions, String reviewer) {
        BatchReviewResult result = new BatchReviewResult();
        for (ReviewDecisionRequest request : decisions) {
            try {
                processReviewDecision(request.entryId(), request.decision(), reviewer, request.notes());
                result.setTotalProcessed(result.getTotalProcessed() + 1);
                if (request.decision().getAction() == ReviewAction.APPROVE) {
                    result.setApproved(result.getApproved() + 1);
                } else {
                    result.setRejected(result.getRejected() + 1);
                }
            } catch (RuntimeException e) {
                log.warn("Batch review entry failed: entryId={}, error={}", request.entryId(), e.getMessage());
                result.getErrors().add(new BatchReviewResult.EntryError(request.entryId(), e.getMessage()));
            }
        }
        log.info("Batch review completed: processed={}, approved={}, rejected={}, errors={}",
                result.getTotalProcessed(), result.getApproved(), result.getRejected(), result.getErrors().size());
        return result;
    }

    /**
     * Change the disposition of an entry, pending or already reviewed, and keep an audit record.
     *
     * @throws IllegalArgumentException when the entry does not exist or the reason is blank
     */
    public ReviewQueueEntry applyOverride(String entryId, ReviewAction newDecision, String reason, String actor) {
        if (newDecision == null) {
            throw new IllegalArgumentException("Override decision must be approve or reject");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Override must include a reason");
        }
        ReviewQueueEntry snapshot;
        String originalDecision;
        synchronized (lock) {
            ReviewQueueEntry entry = queue.get(entryId);
            if (entry == null) {
                throw new IllegalArgumentException("Queue entry not found: " + entryId);
            }
            long now = clock.millis();
            originalDecision = entry.getDecision() != null
                    ? entry.getDecision().getAction().getLabel()
                    : ORIGINAL_CATEGORY;

            entry.getOverrides().add(ReviewOverride.builder()
                    .entryId(entryId)
                    .originalDecision(originalDecision)
                    .newDecision(newDecision)
                    .reason(reason)
                    .overriddenBy(actor)
                    .overriddenAt(now)
                    .build());
            entry.setDecision(ReviewDecision.builder().action(newDecision).reason(reason).appliedAt(now).build());
            entry.setStatus(ReviewStatus.REVIEWED);
            entry.setReviewedAt(now);
            entry.setReviewedBy(actor);
            snapshot = entry.snapshot();
        }
        publish(PipelineEventType.REVIEW_OVERRIDE, "entryId", entryId,
                "originalDecision", originalDecision, "newDecision", newDecision.getLabel(), "overriddenBy", actor);
        log.info("Override applied: entryId={}, {} -> {}, by={}", entryId, originalDecision, newDecision.getLabel(), actor);
        return snapshot;
    }

    public List<ReviewQueueEntry> getApprovedEntries() {
        List<ReviewQueueEntry> approved = new ArrayList<>();
        synchronized (lock) {
            for (ReviewQueueEntry entry : queue.values()) {
                if (entry.getStatus() == ReviewStatus.REVIEWED && entry.getDecision() != null
                        && entry.getDecision().getAction() == ReviewAction.APPROVE) {
                    approved.add(entry.snapshot());
                }
            }
        }
        return approved;
    }

    public int removeProcessedEntries(List<String> entryIds) {
        int removed = 0;
        int size;
        synchronized (lock) {
            for (String id : entryIds) {
                if (queue.remove(id) != null) removed++;
            }
            size = queue.size();
        }
        metricsConfig.updateReviewQueueSize(size);
        publish(PipelineEventType.REVIEW_ITEMS_REMOVED, "count", removed, "queueSize", size);
        log.info("Removed processed review entries: removed={}, queueSize={}", removed, size);
        return removed;
    }

    /**
     * Drop reviewed entries older than the retention window.
     */
    public int cleanupOldEntries() {
        long cutoff = clock.millis() - Duration.ofDays(config.getAutoCleanupDays()).toMillis();
        int removed = 0;
        int size;
        synchronized (lock) {
            Iterator<ReviewQueueEntry> it = queue.values().iterator();
            while (it.hasNext()) {
                ReviewQueueEntry entry = it.next();
                if (entry.getStatus() == ReviewStatus.REVIEWED && entry.getAddedAt() < cutoff) {
                    it.remove();
                    removed++;
                }
            }
            size = queue.size();
        }
        metricsConfig.updateReviewQueueSize(size);
        log.info("Cleaned up old review entries: removed={}, retentionDays={}", removed, config.getAutoCleanupDays());
        return removed;
    }

    public ReviewQueueEntry getEntry(String entryId) {
        synchronized (lock) {
            ReviewQueueEntry entry = queue.get(entryId);
            return entry != null ? entry.snapshot() : null;
        }
    }

    public ReviewQueueStats getQueueStats() {
        synchronized (lock) {
            int pending = 0;
            int reviewed = 0;
            int approved = 0;
            int rejected = 0;
            double confidenceSum = 0;
            long oldest = Long.MAX_VALUE;
            for (ReviewQueueEntry entry : queue.values()) {
                if (entry.getStatus() == ReviewStatus.PENDING) {
                    pending++;
                } else {
                    reviewed++;
                    if (entry.getDecision() != null) {
                        if (entry.getDecision().getAction() == ReviewAction.APPROVE) approved++;
                        else rejected++;
                    }
                }
                confidenceSum += entry.getSuggestion().getConfidence();
                oldest = Math.min(oldest, entry.getAddedAt());
            }
            int total = queue.size();
            return new ReviewQueueStats(total, pending, reviewed, approved, rejected,
                    total > 0 ? confidenceSum / total : 0,
                    total > 0 ? clock.millis() - oldest : 0);
        }
    }

    // Caller holds the lock
    private int enforceQueueLimit() {
        int toRemove = queue.size() - config.getMaxQueueSize();
        if (toRemove <= 0) {
            return 0;
        }
        Comparator<ReviewQueueEntry> oldestFirst = Comparator.comparingLong(ReviewQueueEntry::getAddedAt);
        List<ReviewQueueEntry> reviewed = queue.values().stream()
                .filter(e -> e.getStatus() == ReviewStatus.REVIEWED)
                .sorted(oldestFirst)
                .toList();
        List<ReviewQueueEntry> pending = queue.values().stream()
                .filter(e -> e.getStatus() == ReviewStatus.PENDING)
                .sorted(oldestFirst)
                .toList();

        int removed = 0;
        for (ReviewQueueEntry entry : reviewed) {
            if (removed >= toRemove) break;
            queue.remove(entry.getId());
            removed++;
        }
        for (ReviewQueueEntry entry : pending) {
            if (removed >= toRemove) break;
            queue.remove(entry.getId());
            removed++;
        }
        log.warn("Review queue over capacity, evicted {} entries (reviewed first): maxQueueSize={}",
                removed, config.getMaxQueueSize());
        return removed;
    }

    private static boolean matches(ReviewQueueEntry entry, PendingItemsQuery q) {
        ReviewSuggestion s = entry.getSuggestion();
        if (q.getMinConfidence() != null && s.getConfidence() < q.getMinConfidence()) return false;
        if (q.getMaxConfidence() != null && s.getConfidence() > q.getMaxConfidence()) return false;
        if (q.getOperationType() != null && s.getOperation() != q.getOperationType()) return false;
        if (q.getPathContains() != null && !q.getPathContains().isEmpty()) {
            String path = s.getOriginalPath() != null ? s.getOriginalPath().toLowerCase(Locale.ROOT) : "";
            if (!path.contains(q.getPathContains().toLowerCase(Locale.ROOT))) return false;
        }
        return true;
    }

    private static void validateDecision(ReviewDecision decision) {
        if (decision == null || decision.getAction() == null) {
            throw new IllegalArgumentException("Review decision must be approve or reject");
        }
        if (decision.getReason() == null || decision.getReason().isBlank()) {
            throw new IllegalArgumentException("Review decision must include a reason");
        }
    }

    private void publish(PipelineEventType type, Object... keyValues) {
        eventSink.publish(PipelineEvent.of(type, SOURCE, clock, keyValues));
    }
}
