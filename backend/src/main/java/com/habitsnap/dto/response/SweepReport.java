package com.habitsnap.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Summary of one penalty sweep over all active habits for one day.
 *
 * {@code habitsProcessed = penalized + skipped}; habits that threw are counted
 * in {@code failed} and do not stop the sweep.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SweepReport {

    private LocalDate date;

    private int habitsProcessed;

    /**
     * Habits charged a penalty by this run.
     */
    private int penalized;

    /**
     * Habits completed that day, or already charged by an earlier run.
     */
    private int skipped;

    private int failed;

    private long durationMs;
}
