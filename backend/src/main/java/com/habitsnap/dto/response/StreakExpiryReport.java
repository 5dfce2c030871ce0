package com.habitsnap.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Summary of one pass over expired pair streaks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreakExpiryReport {

    private Instant asOf;

    private int reset;

    private int failed;
}
