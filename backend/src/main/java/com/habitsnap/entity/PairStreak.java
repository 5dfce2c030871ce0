package com.habitsnap.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Mutual streak between two friends.
 *
 * Exactly one row exists per unordered pair of users. The pair is stored in
 * canonical order ({@code userLowId < userHighId}), so a snap from A to B and a
 * snap from B to A address the same row. Rows are created lazily on the first
 * action between a pair and are never deleted: an expired streak is reset to
 * zero in place so that {@code longestStreak} survives.
 *
 * Updates go through optimistic concurrency on {@code version}.
 *
 * Database Table: pair_streaks
 *
 * @see com.habitsnap.service.StreakEngine
 */
@Entity
@Table(name = "pair_streaks",
        uniqueConstraints = {
            @UniqueConstraint(name = "uk_pair_streak_users", columnNames = {"user_low_id", "user_high_id"})
        },
        indexes = {
            @Index(name = "idx_pair_streak_low", columnList = "user_low_id"),
            @Index(name = "idx_pair_streak_high", columnList = "user_high_id"),
            @Index(name = "idx_pair_streak_expires", columnList = "streak_expires_at")
        })
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PairStreak {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Lower user of the canonical pair.
     */
    @Column(name = "user_low_id", nullable = false, updatable = false)
    private UUID userLowId;

    /**
     * Higher user of the canonical pair.
     */
    @Column(name = "user_high_id", nullable = false, updatable = false)
    private UUID userHighId;

    /**
     * Completed cycles in which both sides acted within the window.
     */
    @Builder.Default
    @Column(name = "current_streak", nullable = false)
    private Integer currentStreak = 0;

    /**
     * Best streak this pair ever reached. Never below {@code currentStreak}.
     */
    @Builder.Default
    @Column(name = "longest_streak", nullable = false)
    private Integer longestStreak = 0;

    /**
     * Last time the low side acted toward the high side in the open cycle.
     */
    @Column(name = "last_action_low_at")
    private Instant lastActionLow;

    /**
     * Last time the high side acted toward the low side in the open cycle.
     */
    @Column(name = "last_action_high_at")
    private Instant lastActionHigh;

    /**
     * Set on the first increment, cleared when the streak falls back to zero.
     */
    @Column(name = "streak_started_at")
    private Instant streakStartedAt;

    /**
     * Deadline by which the other side must act to keep the cycle alive.
     */
    @Column(name = "streak_expires_at")
    private Instant streakExpiresAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Zero state for a pair that has never interacted.
     *
     * @param userLowId lower user of the canonical pair
     * @param userHighId higher user of the canonical pair
     * @return a new, unsaved record
     */
    public static PairStreak zero(UUID userLowId, UUID userHighId) {
        return PairStreak.builder()
                .userLowId(userLowId)
                .userHighId(userHighId)
                .currentStreak(0)
                .longestStreak(0)
                .build();
    }

    /**
     * Last action of one side of the pair.
     *
     * @param lowSide true for the low side, false for the high side
     * @return the timestamp, or null if that side has not acted in the open cycle
     */
    public Instant lastActionOf(boolean lowSide) {
        return lowSide ? lastActionLow : lastActionHigh;
    }

    /**
     * Whether the cycle deadline has passed at {@code now}.
     *
     * @param now the instant to check against
     * @return true if an expiry deadline is set and lies strictly before {@code now}
     */
    public boolean isExpiredAt(Instant now) {
        return streakExpiresAt != null && now.isAfter(streakExpiresAt);
    }

    /**
     * Returns the id of the other member of the pair.
     *
     * @param userId one member of the pair
     * @return the other member
     * @throws IllegalArgumentException if {@code userId} is not part of this pair
     */
    public UUID otherUser(UUID userId) {
        if (userLowId.equals(userId)) {
            return userHighId;
        }
        if (userHighId.equals(userId)) {
            return userLowId;
        }
        throw new IllegalArgumentException("User " + userId + " is not part of pair " + id);
    }
}
