package com.habitsnap.repository;

import com.habitsnap.entity.HabitDay;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for the daily habit ledger.
 *
 * The conditional updates below are single statements, so each one is atomic
 * in the database: two concurrent callers can never both see the
 * pre-update state of the same row.
 */
@Repository
public interface HabitDayRepository extends JpaRepository<HabitDay, UUID> {

    Optional<HabitDay> findByUserIdAndHabitIdAndDay(UUID userId, UUID habitId, LocalDate day);

    boolean existsByUserIdAndHabitIdAndDayAndCompletedTrue(UUID userId, UUID habitId, LocalDate day);

    /**
     * Rows of one habit within a date range, most recent first.
     *
     * @param userId the user
     * @param habitId the habit
     * @param from first day of the range (inclusive)
     * @param to last day of the range (inclusive)
     * @return rows ordered by day descending
     */
    List<HabitDay> findByUserIdAndHabitIdAndDayBetweenOrderByDayDesc(
            UUID userId, UUID habitId, LocalDate from, LocalDate to);

    /**
     * Rows of all of a user's habits within a date range, most recent first.
     *
     * @param userId the user
     * @param from first day of the range (inclusive)
     * @param to last day of the range (inclusive)
     * @return rows ordered by day descending
     */
    List<HabitDay> findByUserIdAndDayBetweenOrderByDayDesc(UUID userId, LocalDate from, LocalDate to);

    /**
     * Marks an existing day as completed and counts the snap.
     *
     * @return number of rows updated (0 if the day has no row yet)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE HabitDay d SET d.completed = true, d.snapCount = d.snapCount + 1 " +
           "WHERE d.userId = :userId AND d.habitId = :habitId AND d.day = :day")
    int markCompleted(@Param("userId") UUID userId,
                      @Param("habitId") UUID habitId,
                      @Param("day") LocalDate day);

    /**
     * Records the penalty for a missed day, once.
     *
     * Succeeds only while the day is still missed and uncharged, which makes
     * the charge idempotent across repeated or concurrent sweeps.
     *
     * @return 1 if this call claimed the penalty, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE HabitDay d SET d.penaltyApplied = :penalty " +
           "WHERE d.userId = :userId AND d.habitId = :habitId AND d.day = :day " +
           "AND d.completed = false AND d.penaltyApplied = 0")
    int claimPenalty(@Param("userId") UUID userId,
                     @Param("habitId") UUID habitId,
                     @Param("day") LocalDate day,
                     @Param("penalty") int penalty);

    /**
     * Gives back a claim whose profile charge did not go through.
     *
     * @return number of rows updated
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE HabitDay d SET d.penaltyApplied = 0 " +
           "WHERE d.userId = :userId AND d.habitId = :habitId AND d.day = :day " +
           "AND d.penaltyApplied = :penalty")
    int releasePenalty(@Param("userId") UUID userId,
                       @Param("habitId") UUID habitId,
                       @Param("day") LocalDate day,
                       @Param("penalty") int penalty);
}
