package com.maxsort.organizer.model;

public record BatchQueueStats(int pendingOperations,
                              int queuedBatches,
                              int activeBatches,
                              int maxConcurrentOperations,
                              boolean processing) {}
