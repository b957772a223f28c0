package com.maxsort.organizer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BatchProgress {
    private int total;
    private int completed;
    private int failed;

    // completed / (completed + failed) * 100, or 0 before anything finished
    private double successRate;

    public static BatchProgress of(int total) {
        return BatchProgress.builder().total(total).build();
    }

    public void recordCompleted() {
        completed++;
        recalculate();
    }

    public void recordFailed() {
        failed++;
        recalculate();
    }

    public int getFinished() {
        return completed + failed;
    }

    private void recalculate() {
        int finished = completed + failed;
        successRate = finished > 0 ? (completed * 100.0) / finished : 0.0;
    }
}
