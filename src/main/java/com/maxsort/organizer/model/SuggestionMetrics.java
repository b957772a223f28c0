package com.maxsort.organizer.model;

import java.util.List;

public record SuggestionMetrics(int totalSuggestions,
                                int validSuggestions,
                                int highQualitySuggestions,
                                long averageConfidence,
                                long averageQualityScore,
                                List<String> commonIssues) {}
