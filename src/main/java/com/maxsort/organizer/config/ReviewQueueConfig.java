package com.maxsort.organizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "organizer.review")
public class ReviewQueueConfig {

    private int maxQueueSize = 1000;

    // Default size of getReviewBatch
    private int batchSize = 50;

    // Reviewed entries older than this are removed by the cleanup job
    private int autoCleanupDays = 30;

    private int cleanupCheckIntervalMinutes = 60;

    public void validate() {
        if (maxQueueSize < 1) {
            throw new IllegalArgumentException("Review maxQueueSize must be at least 1");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("Review batchSize must be at least 1");
        }
        if (autoCleanupDays < 0) {
            throw new IllegalArgumentException("autoCleanupDays must not be negative");
        }
    }
}
