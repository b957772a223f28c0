package com.maxsort.organizer.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

@Service
public class ReviewQueueCleanupService {

    private static final Logger log = LoggerFactory.getLogger(ReviewQueueCleanupService.class);

    private final ManualReviewQueue reviewQueue;

    public ReviewQueueCleanupService(ManualReviewQueue reviewQueue) {
        this.reviewQueue = reviewQueue;
    }

    @Scheduled(fixedRateString = "${organizer.review.cleanup-check-interval-minutes:60}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "${organizer.review.cleanup-check-interval-minutes:60}")
    public void cleanupReviewedEntries() {
        try {
            int removed = reviewQueue.cleanupOldEntries();
            if (removed > 0) {
                log.info("Review retention cleanup removed {} entries", removed);
            }
        } catch (Exception e) {
            log.error("Review retention cleanup failed: {}", e.getMessage(), e);
        }
    }
}
