package com.maxsort.organizer.model;

import java.util.List;

/**
 * Outcome of checking a set of operations before execution. Valid iff no blocking issue was found.
 */
public record ValidationResult(List<ValidationIssue> issues) {

    public boolean isValid() {
        return issues.stream().noneMatch(i -> i.severity().isBlocking());
    }

    public List<ValidationIssue> errors() {
        return issues.stream().filter(i -> i.severity().isBlocking()).toList();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> !i.severity().isBlocking()).toList();
    }

    public List<String> errorMessages() {
        return errors().stream().map(ValidationIssue::message).toList();
    }
}
