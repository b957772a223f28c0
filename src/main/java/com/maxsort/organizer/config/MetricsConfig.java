package com.maxsort.organizer.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger autoApprovalQueueSize;
    private final AtomicInteger reviewQueueSize;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.autoApprovalQueueSize = registry.gauge("organizer.auto_approval.queue.size", new AtomicInteger(0));
        this.reviewQueueSize = registry.gauge("organizer.review.queue.size", new AtomicInteger(0));
    }

    public void recordSuggestionScored(double qualityScore) {
        DistributionSummary.builder("organizer.suggestion.quality_score")
                .register(registry)
                .record(qualityScore);
    }

    public void recordCategorized(String category) {
        Counter.builder("organizer.suggestion.categorized.count")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void recordSafetyDowngrade(String riskLevel) {
        Counter.builder("organizer.suggestion.safety_downgrade.count")
                .tag("risk_level", riskLevel)
                .register(registry)
                .increment();
    }

    public void recordAutoApprovalRejected(String reason) {
        Counter.builder("organizer.auto_approval.rejected.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordReviewDecision(String action) {
        Counter.builder("organizer.review.decision.count")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordBatchFinished(String status) {
        Counter.builder("organizer.batch.finished.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordOperation(String status) {
        Counter.builder("organizer.operation.count")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTransaction(String outcome) {
        Counter.builder("organizer.transaction.count")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRollback(int actions, int errors) {
        Counter.builder("organizer.transaction.rollback.count")
                .tag("clean", String.valueOf(errors == 0))
                .register(registry)
                .increment();
        DistributionSummary.builder("organizer.transaction.rollback.actions")
                .register(registry)
                .record(actions);
    }

    public void updateAutoApprovalQueueSize(int size) {
        autoApprovalQueueSize.set(size);
    }

    public void updateReviewQueueSize(int size) {
        reviewQueueSize.set(size);
    }
}
