package com.maxsort.organizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "organizer.auto-approval")
public class AutoApprovalConfig {

    private int maxQueueSize = 100;

    // Entries dequeued into one batch; reaching this many queued entries also triggers a batch
    private int maxAutoApprovalsPerBatch = 25;

    // Timer interval for batch creation
    private long batchProcessingIntervalMs = 2000;

    private boolean enableSafetyChecks = true;

    // Fraction in [0, 1]; deliberately stricter than the filter profiles
    private double requireMinimumConfidence = 0.85;

    private boolean enableAuditLogging = true;

    // Glob patterns: ** matches anything, * anything but '/'
    private List<String> dangerousPathPatterns = new ArrayList<>(List.of(
            "/System/**",
            "/usr/bin/**",
            "/Library/**",
            "*.app/**",
            "**/node_modules/**",
            "**/.git/**",
            "*.config.*",
            "*.env*",
            "package.json",
            "package-lock.json"));

    public void validate() {
        if (maxQueueSize < 1) {
            throw new IllegalArgumentException("maxQueueSize must be at least 1");
        }
        if (maxAutoApprovalsPerBatch < 1) {
            throw new IllegalArgumentException("maxAutoApprovalsPerBatch must be at least 1");
        }
        if (batchProcessingIntervalMs < 1) {
            throw new IllegalArgumentException("batchProcessingIntervalMs must be positive");
        }
        if (requireMinimumConfidence < 0 || requireMinimumConfidence > 1) {
            throw new IllegalArgumentException("requireMinimumConfidence must be within [0, 1]");
        }
    }

    public AutoApprovalConfig copy() {
        AutoApprovalConfig copy = new AutoApprovalConfig();
        copy.setMaxQueueSize(maxQueueSize);
        copy.setMaxAutoApprovalsPerBatch(maxAutoApprovalsPerBatch);
        copy.setBatchProcessingIntervalMs(batchProcessingIntervalMs);
        copy.setEnableSafetyChecks(enableSafetyChecks);
        copy.setRequireMinimumConfidence(requireMinimumConfidence);
        copy.setEnableAuditLogging(enableAuditLogging);
        copy.setDangerousPathPatterns(new ArrayList<>(dangerousPathPatterns));
        return copy;
    }
}
