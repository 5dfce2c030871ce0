package com.habitsnap.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Score change produced by an approval or a missed day.
 *
 * Example JSON for an approval on day 14 of a habit streak:
 * <pre>
 * {
 *   "userId": "550e8400-e29b-41d4-a716-446655440000",
 *   "habitId": "987fcdeb-51a2-43f1-a456-426614174999",
 *   "date": "2024-03-01",
 *   "type": "APPROVAL",
 *   "scoreChange": 3,
 *   "bonus": 2,
 *   "penalty": 0,
 *   "previousStreak": 13,
 *   "newStreak": 14,
 *   "newScore": 212,
 *   "applied": true
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreDelta {

    private UUID userId;

    private UUID habitId;

    private LocalDate date;

    private Type type;

    /**
     * Signed change requested for the score (+1 plus bonus, or minus the penalty).
     * The stored score is clamped at zero, so the observed change may be smaller.
     */
    private int scoreChange;

    private int bonus;

    private int penalty;

    /**
     * Consecutive missed days before {@code date}; only set for misses.
     */
    private int consecutiveMisses;

    private int previousStreak;

    private int newStreak;

    private int newScore;

    /**
     * False when a miss had already been charged (or the day was completed),
     * in which case the profile was left untouched.
     */
    private boolean applied;

    public enum Type {
        APPROVAL,
        MISS
    }
}
