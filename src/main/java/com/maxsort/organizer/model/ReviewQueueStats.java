package com.maxsort.organizer.model;

public record ReviewQueueStats(int totalItems,
                               int pendingItems,
                               int reviewedItems,
                               int approvedItems,
                               int rejectedItems,
                               double averageConfidence,
                               long oldestEntryAgeMs) {}
