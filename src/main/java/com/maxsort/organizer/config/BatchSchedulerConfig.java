package com.maxsort.organizer.config;

import com.maxsort.organizer.model.BatchType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "organizer.batch")
public class BatchSchedulerConfig {

    private int maxBatchSize = 100;

    // Pending operations are batched this often
    private long batchTimeoutMs = 5000;

    // Ceiling for active batches and for operations in flight across them
    private int maxConcurrentOperations = 15;

    private int interactivePriority = 100;
    private int backgroundPriority = 50;

    // 0 disables the per-operation timeout
    private long operationTimeoutMs = 0;

    // Start the scheduling loop once the context is up
    private boolean autoStart = true;

    public int priorityFor(BatchType type) {
        return type == BatchType.INTERACTIVE ? interactivePriority : backgroundPriority;
    }

    public void validate() {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be at least 1");
        }
        if (batchTimeoutMs < 1) {
            throw new IllegalArgumentException("batchTimeoutMs must be positive");
        }
        if (maxConcurrentOperations < 1) {
            throw new IllegalArgumentException("maxConcurrentOperations must be at least 1");
        }
        if (operationTimeoutMs < 0) {
            throw new IllegalArgumentException("operationTimeoutMs must not be negative");
        }
    }
}
