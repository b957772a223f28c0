package com.maxsort.organizer.model;

import java.util.List;

public record ExecutionResult(boolean success,
                              int completedOperations,
                              List<String> errors,
                              List<String> rollbackActions) {

    public static ExecutionResult failure(String error) {
        return new ExecutionResult(false, 0, List.of(error), List.of());
    }
}
