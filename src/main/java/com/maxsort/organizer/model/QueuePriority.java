package com.maxsort.organizer.model;

public enum QueuePriority {
    HIGH,
    MEDIUM,
    LOW;

    public static QueuePriority fromConfidence(double adjustedConfidence) {
        if (adjustedConfidence >= 95) return HIGH;
        if (adjustedConfidence >= 85) return MEDIUM;
        return LOW;
    }
}
