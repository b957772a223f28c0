package com.maxsort.organizer.model;

public enum Severity {
    CRITICAL,
    ERROR,
    WARNING;

    public boolean isBlocking() {
        return this != WARNING;
    }
}
