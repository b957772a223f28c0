package com.maxsort.organizer.model;

public enum RecordKind {
    TRANSACTION,
    BATCH,
    ROLLBACK
}
