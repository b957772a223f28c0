package com.maxsort.organizer.config;

import com.maxsort.organizer.model.ThresholdProfile;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "organizer.threshold")
public class ConfidenceThresholdConfig {

    public static final double MIN_CUSTOM_THRESHOLD = 0.10;
    public static final double MAX_CUSTOM_THRESHOLD = 1.00;

    private ThresholdProfile profile = ThresholdProfile.BALANCED;

    // Only used with the CUSTOM profile, fraction in [0.10, 1.00]
    private Double customThreshold;

    // When false nothing is auto-approved, confident items go to manual review
    private boolean autoApprove = true;

    // Whether non-rejected items may be overridden by a reviewer
    private boolean enableManualOverride = true;

    private boolean enableSafetyChecks = true;

    // Cap on AUTO_APPROVE items per filter call, null for unlimited
    // Null or 0 means no cap
    private Integer maxAutoApproveCount;

    public double effectiveThreshold() {
        if (profile.isCustom() && customThreshold != null) {
            return customThreshold;
        }
        return profile.getThreshold();
    }

    public void validate() {
        if (profile == null) {
            throw new IllegalArgumentException("Threshold profile must be set");
        }
        if (profile.isCustom()) {
            if (customThreshold == null) {
                throw new IllegalArgumentException("Custom profile requires customThreshold");
            }
            if (customThreshold < MIN_CUSTOM_THRESHOLD || customThreshold > MAX_CUSTOM_THRESHOLD) {
                throw new IllegalArgumentException(String.format(
                        "Custom threshold must be between %.2f and %.2f, got %s",
                        MIN_CUSTOM_THRESHOLD, MAX_CUSTOM_THRESHOLD, customThreshold));
            }
        }
        if (maxAutoApproveCount != null && maxAutoApproveCount < 0) {
            throw new IllegalArgumentException("maxAutoApproveCount must not be negative");
        }
    }

    public ConfidenceThresholdConfig copy() {
        ConfidenceThresholdConfig copy = new ConfidenceThresholdConfig();
        copy.setProfile(profile);
        copy.setCustomThreshold(customThreshold);
        copy.setAutoApprove(autoApprove);
        copy.setEnableManualOverride(enableManualOverride);
        copy.setEnableSafetyChecks(enableSafetyChecks);
        copy.setMaxAutoApproveCount(maxAutoApproveCount);
        return copy;
    }
}
