package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A suggestion as produced by the AI analysis step, before any scoring.
 */
@Value
@Builder
@AllArgsConstructor
public class RawSuggestion {

    // Suggested filename (or classification) text
    String value;

    // AI-provided confidence, expected in [0, 100]
    double confidence;

    // Optional AI reasoning used for the consistency check
    String reasoning;

    double originalConfidence;

    public static RawSuggestion of(String value, double confidence) {
        return new RawSuggestion(value, confidence, null, confidence);
    }

    public static RawSuggestion of(String value, double confidence, String reasoning) {
        return new RawSuggestion(value, confidence, reasoning, confidence);
    }
}
