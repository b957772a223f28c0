package com.maxsort.organizer.model;

public record ValidationIssue(String operationId, Severity severity, String code, String message) {}
