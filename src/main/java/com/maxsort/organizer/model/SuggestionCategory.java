package com.maxsort.organizer.model;

public enum SuggestionCategory {
    AUTO_APPROVE("auto-approve"),
    MANUAL_REVIEW("manual-review"),
    REJECT("reject");

    private final String label;

    SuggestionCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
