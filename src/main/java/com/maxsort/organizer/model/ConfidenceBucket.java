package com.maxsort.organizer.model;

public record ConfidenceBucket(String range, int count) {}
