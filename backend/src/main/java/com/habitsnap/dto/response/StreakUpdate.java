package com.habitsnap.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of one snap sent from one friend to another.
 *
 * Returned by {@code StreakEngine.recordAction}; the numbers are the ones
 * that were actually committed, never an optimistic guess.
 *
 * Example JSON:
 * <pre>
 * {
 *   "currentStreak": 4,
 *   "longestStreak": 9,
 *   "increased": true,
 *   "outcome": "INCREASED",
 *   "streakExpiresAt": "2024-03-02T18:04:11Z"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreakUpdate {

    private int currentStreak;

    private int longestStreak;

    /**
     * True only when this action completed a cycle (both sides acted in the window).
     */
    private boolean increased;

    private Outcome outcome;

    private Instant streakExpiresAt;

    /**
     * What the action did to the pair.
     */
    public enum Outcome {
        /**
         * Sender's action recorded, waiting for the other side.
         */
        WAITING,

        /**
         * Both sides acted within the window; the streak grew by one.
         */
        INCREASED,

        /**
         * The previous deadline had passed; the streak was reset and a new cycle opened.
         */
        EXPIRED_RESET
    }
}
