package com.maxsort.organizer.events;

public enum PipelineEventType {
    // auto-approval queue
    SUGGESTION_QUEUED("suggestion-queued"),
    SUGGESTION_REJECTED("suggestion-rejected"),
    QUEUE_FULL("queue-full"),
    AUTO_APPROVAL_BATCH_CREATED("auto-approval-batch-created"),
    QUEUE_CLEARED("queue-cleared"),

    // manual review
    REVIEW_ITEMS_ADDED("review-items-added"),
    REVIEW_DECISION("review-decision"),
    REVIEW_OVERRIDE("review-override"),
    REVIEW_ITEMS_EVICTED("review-items-evicted"),
    REVIEW_ITEMS_REMOVED("review-items-removed"),

    // batch scheduler
    BATCH_QUEUED("batch-queued"),
    BATCH_STARTED("batch-started"),
    BATCH_PROGRESS("batch-progress"),
    BATCH_COMPLETED("batch-completed"),
    BATCH_FAILED("batch-failed"),
    BATCH_CANCELLED("batch-cancelled"),
    OPERATION_STARTED("operation-started"),
    OPERATION_COMPLETED("operation-completed"),
    OPERATION_FAILED("operation-failed"),

    // transactional executor
    TRANSACTION_STARTED("transaction-started"),
    TRANSACTION_COMPLETED("transaction-completed"),
    TRANSACTION_FAILED("transaction-failed"),
    TRANSACTION_ROLLED_BACK("transaction-rolled-back");

    private final String wireName;

    PipelineEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
