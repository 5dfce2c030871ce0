package com.habitsnap.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One calendar day of one user's habit.
 *
 * The ledger only holds explicit rows: a row is written on the first approved
 * snap of the day (completed) or by the nightly penalty sweep (missed). A day
 * with no row is treated as not completed when streaks are counted.
 *
 * Database Table: habit_days, unique on (user_id, habit_id, habit_date)
 *
 * @see com.habitsnap.service.HabitStreakTracker
 */
@Entity
@Table(name = "habit_days",
        uniqueConstraints = {
            @UniqueConstraint(name = "uk_habit_day", columnNames = {"user_id", "habit_id", "habit_date"})
        },
        indexes = {
            @Index(name = "idx_habit_day_user_date", columnList = "user_id, habit_date")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HabitDay {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "habit_id", nullable = false, updatable = false)
    private UUID habitId;

    @Column(name = "habit_date", nullable = false, updatable = false)
    private LocalDate day;

    @Builder.Default
    @Column(name = "completed", nullable = false)
    private Boolean completed = false;

    /**
     * Approved snaps booked on this day. Informational only.
     */
    @Builder.Default
    @Column(name = "snap_count", nullable = false)
    private Integer snapCount = 0;

    /**
     * Points charged for missing this day, 0 until the sweep charges it.
     */
    @Builder.Default
    @Column(name = "penalty_applied", nullable = false)
    private Integer penaltyApplied = 0;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static HabitDay completed(UUID userId, UUID habitId, LocalDate day) {
        return HabitDay.builder()
                .userId(userId)
                .habitId(habitId)
                .day(day)
                .completed(true)
                .snapCount(1)
                .build();
    }

    public static HabitDay missed(UUID userId, UUID habitId, LocalDate day) {
        return HabitDay.builder()
                .userId(userId)
                .habitId(habitId)
                .day(day)
                .completed(false)
                .build();
    }

    public boolean isCompleted() {
        return Boolean.TRUE.equals(completed);
    }
}
