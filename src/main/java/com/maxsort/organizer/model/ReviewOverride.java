package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audit record of a reviewer changing the disposition of a queue entry.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReviewOverride {
    private String entryId;

    // "manual-review" for a first decision, otherwise the previous decision ("approve" / "reject")
    private String originalDecision;

    private ReviewAction newDecision;
    private String reason;
    private String overriddenBy;
    private long overriddenAt;
}
