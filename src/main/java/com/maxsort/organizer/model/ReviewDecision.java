package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ReviewDecision {
    private ReviewAction action;

    // Mandatory, must not be blank
    private String reason;

    private long appliedAt;

    public static ReviewDecision approve(String reason) {
        return ReviewDecision.builder().action(ReviewAction.APPROVE).reason(reason).build();
    }

    public static ReviewDecision reject(String reason) {
        return ReviewDecision.builder().action(ReviewAction.REJECT).reason(reason).build();
    }
}
