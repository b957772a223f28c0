package com.maxsort.organizer.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
