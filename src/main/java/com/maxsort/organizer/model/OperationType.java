package com.maxsort.organizer.model;

import java.util.Locale;

public enum OperationType {
    RENAME,
    MOVE,
    DELETE,
    COPY;

    public static OperationType fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Operation type must not be blank");
        }
        return OperationType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean requiresTarget() {
        return this != DELETE;
    }
}
