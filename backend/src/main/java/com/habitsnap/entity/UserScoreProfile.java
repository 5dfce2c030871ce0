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
 * Score and habit streak summary for one user.
 *
 * The profile row is created by the account flow of the surrounding
 * application; this service only mutates the scoring columns, and only through
 * {@link com.habitsnap.service.ScoringEngine}. Leaderboards and profile screens
 * read it but never write it.
 *
 * Invariants: {@code score >= 0}, {@code longestStreak >= currentStreak >= 0}.
 *
 * Database Table: user_score_profiles
 */
@Entity
@Table(name = "user_score_profiles", indexes = {
    @Index(name = "idx_score_profile_score", columnList = "score")
})
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserScoreProfile {

    @Id
    @Column(name = "user_id", updatable = false, nullable = false)
    private UUID userId;

    @Builder.Default
    @Column(name = "score", nullable = false)
    private Integer score = 0;

    @Builder.Default
    @Column(name = "current_streak", nullable = false)
    private Integer currentStreak = 0;

    @Builder.Default
    @Column(name = "longest_streak", nullable = false)
    private Integer longestStreak = 0;

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
     * Fresh profile with zero score, as created at sign-up.
     *
     * @param userId the owning user
     * @return a new, unsaved profile
     */
    public static UserScoreProfile forUser(UUID userId) {
        return UserScoreProfile.builder().userId(userId).build();
    }
}
