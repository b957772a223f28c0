package com.maxsort.organizer.model;

public enum OperationStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
