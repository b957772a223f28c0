package com.maxsort.organizer.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class BatchReviewResult {

    public record EntryError(String entryId, String error) {}

    private int totalProcessed;
    private int approved;
    private int rejected;
    private List<EntryError> errors = new ArrayList<>();
}
