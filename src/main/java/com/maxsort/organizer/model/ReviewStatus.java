package com.maxsort.organizer.model;

public enum ReviewStatus {
    PENDING,
    REVIEWED
}
