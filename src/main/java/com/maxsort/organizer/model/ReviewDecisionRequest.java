package com.maxsort.organizer.model;

public record ReviewDecisionRequest(String entryId, ReviewDecision decision, String notes) {}
