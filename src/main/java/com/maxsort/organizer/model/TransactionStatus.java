package com.maxsort.organizer.model;

public enum TransactionStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED,
    ROLLED_BACK
}
