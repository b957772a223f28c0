package com.maxsort.organizer.model;

/**
 * Predefined auto-approval thresholds. CUSTOM takes its threshold from configuration.
 */
public enum ThresholdProfile {
    CONSERVATIVE("Conservative", 0.90, "Only highest confidence suggestions (90%+) are auto-approved"),
    BALANCED("Balanced", 0.80, "Good confidence suggestions (80%+) are auto-approved"),
    AGGRESSIVE("Aggressive", 0.70, "Moderate confidence suggestions (70%+) are auto-approved"),
    CUSTOM("Custom", 0.80, "User-defined threshold between 10% and 100%");

    private final String displayName;
    private final double threshold;
    private final String description;

    ThresholdProfile(String displayName, double threshold, String description) {
        this.displayName = displayName;
        this.threshold = threshold;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getThreshold() {
        return threshold;
    }

    public String getDescription() {
        return description;
    }

    public boolean isCustom() {
        return this == CUSTOM;
    }
}
