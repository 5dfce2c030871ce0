package com.habitsnap.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Scoring statistics for a user's profile screen.
 *
 * {@code completedDays} and {@code totalDays} count ledger rows of all the
 * user's habits over the last 30 days; {@code successRate} is the rounded
 * percentage of completed rows (0 when there are none).
 *
 * Example JSON:
 * <pre>
 * {
 *   "userId": "550e8400-e29b-41d4-a716-446655440000",
 *   "score": 150,
 *   "currentStreak": 7,
 *   "longestStreak": 15,
 *   "successRate": 67,
 *   "completedDays": 20,
 *   "totalDays": 30,
 *   "recentActivity": [ ... up to 7 rows ... ]
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoringStatsResponse {

    private UUID userId;

    private int score;

    private int currentStreak;

    private int longestStreak;

    private int successRate;

    private int completedDays;

    private int totalDays;

    private List<HabitDayResponse> recentActivity;
}
