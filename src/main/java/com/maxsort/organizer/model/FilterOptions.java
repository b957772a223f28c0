package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterOptions {
    @Builder.Default
    private boolean preserveOriginalOrder = false;
    @Builder.Default
    private boolean includeReasoning = true;
    @Builder.Default
    private boolean enableSafetyChecks = true;

    // Null means unlimited
    // Null or 0 means no cap
    private Integer maxAutoApproveCount;

    public static FilterOptions defaults() {
        return FilterOptions.builder().build();
    }
}
