package com.maxsort.organizer.model;

import java.util.List;

public record AutoApprovalQueueStatus(int queueSize,
                                      int maxQueueSize,
                                      List<QueueEntry> queuedEntries,
                                      boolean processing) {}
