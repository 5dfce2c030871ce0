package com.habitsnap.dto.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Streak between the viewer and one friend; {@code streak} is null until the
 * pair's first snap.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PairStreakLookupResponse {

    private PairStreakResponse streak;

    private String message;
}
