package com.maxsort.organizer.service;

import com.maxsort.organizer.config.MetricsConfig;
import com.maxsort.organizer.config.ReviewQueueConfig;
import com.maxsort.organizer.events.InMemoryEventChannel;
import com.maxsort.organizer.events.PipelineEvent;
import com.maxsort.organizer.events.PipelineEventType;
import com.maxsort.organizer.model.BatchReviewResult;
import com.maxsort.organizer.model.OperationType;
import com.maxsort.organizer.model.PendingItemsQuery;
import com.maxsort.organizer.model.ReviewAction;
import com.maxsort.organizer.model.ReviewDecision;
import com.maxsort.organizer.model.ReviewDecisionRequest;
import com.maxsort.organizer.model.ReviewQueueEntry;
import com.maxsort.organizer.model.ReviewQueueStats;
import com.maxsort.organizer.model.ReviewStatus;
import com.maxsort.organizer.testutil.MutableClock;
import com.maxsort.organizer.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ManualReviewQueueTest {

    @Mock private MetricsConfig metricsConfig;

    private final InMemoryEventChannel events = new InMemoryEventChannel();
    private final List<PipelineEvent> published = new ArrayList<>();
    private MutableClock clock;
    private ReviewQueueConfig config;
    private ManualReviewQueue queue;

    @BeforeEach
    void setUp() {
        events.subscribe(published::add);
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        config = new ReviewQueueConfig();
        queue = new ManualReviewQueue(config, events, clock, metricsConfig);
    }

    private String addOne(String value, double confidence) {
        return queue.addSuggestions(List.of(
                TestDataFactory.createReviewSuggestion(value, confidence, OperationType.RENAME))).get(0);
    }

    @Test
    void addSuggestions_assignsPendingEntriesWithRoundedPriority() {
        String id = addOne("invoice.pdf", 72.6);

        ReviewQueueEntry entry = queue.getEntry(id);
        assertThat(entry.getStatus()).isEqualTo(ReviewStatus.PENDING);
        assertThat(entry.getPriority()).isEqualTo(73);
        assertThat(entry.getAddedAt()).isEqualTo(clock.millis());
        assertThat(published).extracting(PipelineEvent::type).contains(PipelineEventType.REVIEW_ITEMS_ADDED);
        verify(metricsConfig).updateReviewQueueSize(1);
    }

    @Test
    void addSuggestions_emptyInput_returnsNoIds() {
        assertThat(queue.addSuggestions(List.of())).isEmpty();
        assertThat(queue.addSuggestions(null)).isEmpty();
    }

    @Test
    void addSuggestions_overCapacity_evictsReviewedBeforePending() {
        config.setMaxQueueSize(2);
        queue = new ManualReviewQueue(config, events, clock, metricsConfig);
        String reviewed = addOne("a.pdf", 60);
        clock.advance(Duration.ofSeconds(1));
        String pending = addOne("b.pdf", 60);
        queue.processReviewDecision(reviewed, ReviewDecision.approve("looks right"), "alice", null);
        clock.advance(Duration.ofSeconds(1));

        String newest = addOne("c.pdf", 60);

        assertThat(queue.getEntry(reviewed)).isNull();
        assertThat(queue.getEntry(pending)).isNotNull();
        assertThat(queue.getEntry(newest)).isNotNull();
        assertThat(published).extracting(PipelineEvent::type).contains(PipelineEventType.REVIEW_ITEMS_EVICTED);
    }

    @Test
    void addSuggestions_evictionListenerCanReadQueueFromAnotherThread() throws Exception {
        config.setMaxQueueSize(1);
        queue = new ManualReviewQueue(config, events, clock, metricsConfig);
        ExecutorService reader = Executors.newSingleThreadExecutor();
        List<Integer> observedSizes = new ArrayList<>();
        events.subscribe(event -> {
            if (event.type() != PipelineEventType.REVIEW_ITEMS_EVICTED) return;
            try {
                observedSizes.add(reader.submit(() -> queue.getQueueStats().totalItems()).get(2, TimeUnit.SECONDS));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        try {
            addOne("a.pdf", 60);
            addOne("b.pdf", 60);
        } finally {
            reader.shutdownNow();
        }

        assertThat(observedSizes).containsExactly(1);
        assertThat(published).filteredOn(e -> e.type() == PipelineEventType.REVIEW_ITEMS_EVICTED)
                .singleElement().satisfies(e -> assertThat(e.get("count")).isEqualTo(1));
    }

    @Test
    void getPendingItems_filtersAndSorts() {
        addOne("low.pdf", 40);
        addOne("high.pdf", 78);
        queue.addSuggestions(List.of(TestDataFactory.createReviewSuggestion("gone.txt", 65, OperationType.DELETE)));

        List<ReviewQueueEntry> byPriority = queue.getPendingItems(PendingItemsQuery.all());
        assertThat(byPriority).extracting(e -> e.getSuggestion().getSuggestion().getValue())
                .containsExactly("high.pdf", "gone.txt", "low.pdf");

        List<ReviewQueueEntry> deletes = queue.getPendingItems(PendingItemsQuery.builder()
                .operationType(OperationType.DELETE).build());
        assertThat(deletes).hasSize(1);

        List<ReviewQueueEntry> ranged = queue.getPendingItems(PendingItemsQuery.builder()
                .minConfidence(50.0).maxConfidence(70.0).build());
        assertThat(ranged).extracting(e -> e.getSuggestion().getConfidence()).containsExactly(65.0);

        List<ReviewQueueEntry> byPath = queue.getPendingItems(PendingItemsQuery.builder()
                .pathContains("ORIGINAL-LOW").build());
        assertThat(byPath).hasSize(1);

        List<ReviewQueueEntry> limited = queue.getPendingItems(PendingItemsQuery.builder()
                .limit(1).sortBy(PendingItemsQuery.SortField.CONFIDENCE)
                .sortOrder(PendingItemsQuery.SortOrder.ASC).build());
        assertThat(limited).extracting(e -> e.getSuggestion().getConfidence()).containsExactly(40.0);
    }

    @Test
    void getPendingItems_returnsSnapshots() {
        String id = addOne("report.pdf", 60);

        queue.getPendingItems(null).get(0).setStatus(ReviewStatus.REVIEWED);

        assertThat(queue.getEntry(id).getStatus()).isEqualTo(ReviewStatus.PENDING);
    }

    @Test
    void getReviewBatch_usesConfiguredSizeByDefault() {
        config.setBatchSize(2);
        queue = new ManualReviewQueue(config, events, clock, metricsConfig);
        addOne("a.pdf", 40);
        addOne("b.pdf", 50);
        addOne("c.pdf", 60);

        assertThat(queue.getReviewBatch(null)).hasSize(2);
        assertThat(queue.getReviewBatch(3)).hasSize(3);
    }

    @Test
    void processReviewDecision_recordsReviewer() {
        String id = addOne("report.pdf", 60);

        ReviewQueueEntry entry = queue.processReviewDecision(id, ReviewDecision.approve("correct name"), "alice", "ok");

        assertThat(entry.getStatus()).isEqualTo(ReviewStatus.REVIEWED);
        assertThat(entry.getReviewedBy()).isEqualTo("alice");
        assertThat(entry.getDecision().getAction()).isEqualTo(ReviewAction.APPROVE);
        assertThat(entry.getDecision().getAppliedAt()).isEqualTo(clock.millis());
        assertThat(queue.getApprovedEntries()).extracting(ReviewQueueEntry::getId).containsExactly(id);
        verify(metricsConfig).recordReviewDecision("approve");
    }

    @Test
    void processReviewDecision_secondDecision_throws() {
        String id = addOne("report.pdf", 60);
        queue.processReviewDecision(id, ReviewDecision.reject("wrong"), "alice", null);

        assertThatThrownBy(() -> queue.processReviewDecision(id, ReviewDecision.approve("changed mind"), "bob", null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not in pending status");
    }

    @Test
    void processReviewDecision_unknownEntryOrBlankReason_throws() {
        String id = addOne("report.pdf", 60);

        assertThatThrownBy(() -> queue.processReviewDecision("review-missing", ReviewDecision.approve("x"), "a", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Queue entry not found");
        assertThatThrownBy(() -> queue.processReviewDecision(id, ReviewDecision.approve("  "), "a", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("reason");
    }

    @Test
    void processBatchReview_reportsFailuresAndContinues() {
        String first = addOne("a.pdf", 60);
        String second = addOne("b.pdf", 60);

        BatchReviewResult result = queue.processBatchReview(List.of(
                new ReviewDecisionRequest(first, ReviewDecision.approve("good"), null),
                new ReviewDecisionRequest("review-missing", ReviewDecision.approve("good"), null),
                new ReviewDecisionRequest(second, ReviewDecision.reject("bad"), null)), "carol");

        assertThat(result.getTotalProcessed()).isEqualTo(2);
        assertThat(result.getApproved()).isEqualTo(1);
        assertThat(result.getRejected()).isEqualTo(1);
        assertThat(result.getErrors()).singleElement()
                .satisfies(e -> assertThat(e.entryId()).isEqualTo("review-missing"));
    }

    @Test
    void applyOverride_recordsAuditTrail() {
        String id = addOne("report.pdf", 60);
        queue.processReviewDecision(id, ReviewDecision.reject("unclear"), "alice", null);

        ReviewQueueEntry entry = queue.applyOverride(id, ReviewAction.APPROVE, "verified with owner", "bob");

        assertThat(entry.getDecision().getAction()).isEqualTo(ReviewAction.APPROVE);
        assertThat(entry.getOverrides()).singleElement().satisfies(o -> {
            assertThat(o.getOriginalDecision()).isEqualTo("reject");
            assertThat(o.getNewDecision()).isEqualTo(ReviewAction.APPROVE);
            assertThat(o.getOverriddenBy()).isEqualTo("bob");
        });
    }

    @Test
    void applyOverride_pendingEntry_originalIsManualReview() {
        String id = addOne("report.pdf", 60);

        ReviewQueueEntry entry = queue.applyOverride(id, ReviewAction.REJECT, "duplicate", "bob");

        assertThat(entry.getStatus()).isEqualTo(ReviewStatus.REVIEWED);
        assertThat(entry.getOverrides().get(0).getOriginalDecision()).isEqualTo("manual-review");
    }

    @Test
    void applyOverride_blankReason_throws() {
        String id = addOne("report.pdf", 60);

        assertThatThrownBy(() -> queue.applyOverride(id, ReviewAction.APPROVE, "", "bob"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeProcessedEntries_dropsOnlyKnownIds() {
        String id = addOne("report.pdf", 60);

        assertThat(queue.removeProcessedEntries(List.of(id, "review-missing"))).isEqualTo(1);
        assertThat(queue.getEntry(id)).isNull();
    }

    @Test
    void cleanupOldEntries_removesOnlyOldReviewedEntries() {
        String reviewed = addOne("a.pdf", 60);
        String pending = addOne("b.pdf", 60);
        queue.processReviewDecision(reviewed, ReviewDecision.approve("fine"), "alice", null);
        clock.advance(Duration.ofDays(31));

        assertThat(queue.cleanupOldEntries()).isEqualTo(1);
        assertThat(queue.getEntry(reviewed)).isNull();
        assertThat(queue.getEntry(pending)).isNotNull();
    }

    @Test
    void getQueueStats_summarizesEntries() {
        String a = addOne("a.pdf", 40);
        String b = addOne("b.pdf", 60);
        addOne("c.pdf", 80);
        queue.processReviewDecision(a, ReviewDecision.approve("ok"), "alice", null);
        queue.processReviewDecision(b, ReviewDecision.reject("no"), "alice", null);
        clock.advance(Duration.ofMinutes(5));

        ReviewQueueStats stats = queue.getQueueStats();

        assertThat(stats.totalItems()).isEqualTo(3);
        assertThat(stats.pendingItems()).isEqualTo(1);
        assertThat(stats.reviewedItems()).isEqualTo(2);
        assertThat(stats.approvedItems()).isEqualTo(1);
        assertThat(stats.rejectedItems()).isEqualTo(1);
        assertThat(stats.averageConfidence()).isEqualTo(60.0);
        assertThat(stats.oldestEntryAgeMs()).isEqualTo(Duration.ofMinutes(5).toMillis());
    }
}
