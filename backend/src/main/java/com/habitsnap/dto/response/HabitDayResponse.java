package com.habitsnap.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * One row of the habit ledger, as shown in a user's recent activity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HabitDayResponse {

    private UUID habitId;

    private LocalDate date;

    private boolean completed;

    private int snapCount;

    private int penaltyApplied;
}
