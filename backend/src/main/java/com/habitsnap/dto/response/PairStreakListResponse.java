package com.habitsnap.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * All pair streaks of one user, best first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PairStreakListResponse {

    private List<PairStreakResponse> streaks;

    private int total;

    /**
     * Streaks with a current count above zero.
     */
    private int active;
}
