package com.maxsort.organizer.model;

public enum ReviewAction {
    APPROVE("approve"),
    REJECT("reject");

    private final String label;

    ReviewAction(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
