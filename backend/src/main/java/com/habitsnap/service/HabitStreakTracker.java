package com.habitsnap.service;

import com.habitsnap.entity.HabitDay;
import com.habitsnap.exception.StorageException;
import com.habitsnap.repository.HabitDayRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Daily habit ledger and the streak counts derived from it.
 *
 * Both writes are idempotent upserts on (user, habit, day). The unique
 * constraint on the table decides concurrent first writes; the loser falls
 * back to updating the row the winner inserted.
 *
 * Only explicit rows exist. When streaks are counted, a day without a row is
 * treated like a missed day and ends the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HabitStreakTracker {

    private static final String STORE = "habit_days";

    private final HabitDayRepository habitDayRepository;

    @Value("${app.scoring.streak-lookback-days:30}")
    private int streakLookbackDays;

    @Value("${app.scoring.miss-lookback-days:7}")
    private int missLookbackDays;

    /**
     * Marks a day as completed and returns the habit's streak as of that day.
     *
     * Calling it again for the same day bumps the snap count but yields the
     * same streak.
     *
     * @param userId the user
     * @param habitId the habit
     * @param date the completed day
     * @return consecutive completed days ending at the most recent row on or before {@code date}
     */
    public int recordCompletion(UUID userId, UUID habitId, LocalDate date) {
        requireKey(userId, habitId, date);
        try {
            if (habitDayRepository.markCompleted(userId, habitId, date) == 0) {
                try {
                    habitDayRepository.saveAndFlush(HabitDay.completed(userId, habitId, date));
                } catch (DataIntegrityViolationException e) {
                    log.debug("Habit day inserted concurrently, updating instead: userId={}, habitId={}, date={}",
                            userId, habitId, date);
                    habitDayRepository.markCompleted(userId, habitId, date);
                }
            }
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "recordCompletion", e);
        }

        int streak = currentStreak(userId, habitId, date);
        log.debug("Habit completion recorded: userId={}, habitId={}, date={}, streak={}",
                userId, habitId, date, streak);
        return streak;
    }

    /**
     * Marks a day as missed, unless a row for it already exists, and counts the
     * missed days right before it.
     *
     * A completed day is never turned back into a miss.
     *
     * @param userId the user
     * @param habitId the habit
     * @param date the missed day
     * @return consecutive missed days before {@code date}, at most the miss lookback
     */
    public int recordMiss(UUID userId, UUID habitId, LocalDate date) {
        requireKey(userId, habitId, date);
        try {
            if (habitDayRepository.findByUserIdAndHabitIdAndDay(userId, habitId, date).isEmpty()) {
                try {
                    habitDayRepository.saveAndFlush(HabitDay.missed(userId, habitId, date));
                } catch (DataIntegrityViolationException e) {
                    log.debug("Habit day inserted concurrently, keeping existing row: userId={}, habitId={}, date={}",
                            userId, habitId, date);
                }
            }

            List<HabitDay> previous = habitDayRepository.findByUserIdAndHabitIdAndDayBetweenOrderByDayDesc(
                    userId, habitId, date.minusDays(missLookbackDays), date.minusDays(1));
            return countConsecutiveMisses(previous, date.minusDays(1), missLookbackDays);
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "recordMiss", e);
        }
    }

    /**
     * Current streak of a habit as of {@code asOf}.
     *
     * Counts from the most recent row on or before {@code asOf}, going back
     * one calendar day at a time while rows are completed.
     */
    public int currentStreak(UUID userId, UUID habitId, LocalDate asOf) {
        try {
            List<HabitDay> days = habitDayRepository.findByUserIdAndHabitIdAndDayBetweenOrderByDayDesc(
                    userId, habitId, asOf.minusDays(streakLookbackDays - 1L), asOf);
            return countConsecutiveCompletions(days);
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "currentStreak", e);
        }
    }

    public boolean isCompleted(UUID userId, UUID habitId, LocalDate date) {
        try {
            return habitDayRepository.existsByUserIdAndHabitIdAndDayAndCompletedTrue(userId, habitId, date);
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "isCompleted", e);
        }
    }

    /**
     * Claims the penalty of a missed day.
     *
     * @return true if this call claimed it; false if the day was completed or already charged
     */
    public boolean claimPenalty(UUID userId, UUID habitId, LocalDate date, int penalty) {
        try {
            return habitDayRepository.claimPenalty(userId, habitId, date, penalty) == 1;
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "claimPenalty", e);
        }
    }

    public void releasePenalty(UUID userId, UUID habitId, LocalDate date, int penalty) {
        try {
            habitDayRepository.releasePenalty(userId, habitId, date, penalty);
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "releasePenalty", e);
        }
    }

    /**
     * Ledger rows of all of a user's habits between two days, most recent first.
     */
    public List<HabitDay> recentDays(UUID userId, LocalDate from, LocalDate to) {
        try {
            return habitDayRepository.findByUserIdAndDayBetweenOrderByDayDesc(userId, from, to);
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "recentDays", e);
        }
    }

    /**
     * Counts completed rows on consecutive calendar days, starting at the first row.
     *
     * @param daysDesc rows of one habit, most recent first
     * @return the length of the run; 0 if the first row is not completed
     */
    static int countConsecutiveCompletions(List<HabitDay> daysDesc) {
        int streak = 0;
        LocalDate expected = null;
        for (HabitDay day : daysDesc) {
            if (expected != null && !day.getDay().equals(expected)) {
                break; // gap
            }
            if (!day.isCompleted()) {
                break;
            }
            streak++;
            expected = day.getDay().minusDays(1);
        }
        return streak;
    }

    /**
     * Counts missed rows on consecutive days going back from {@code start}.
     *
     * @param daysDesc rows of one habit on or before {@code start}, most recent first
     * @param start the first day expected to be a miss
     * @param limit maximum count
     * @return the number of consecutive missed days; a day without a row stops the count
     */
    static int countConsecutiveMisses(List<HabitDay> daysDesc, LocalDate start, int limit) {
        int misses = 0;
        LocalDate expected = start;
        for (HabitDay day : daysDesc) {
            if (misses >= limit || !day.getDay().equals(expected) || day.isCompleted()) {
                break;
            }
            misses++;
            expected = expected.minusDays(1);
        }
        return misses;
    }

    private static void requireKey(UUID userId, UUID habitId, LocalDate date) {
        if (userId == null || habitId == null || date == null) {
            throw new IllegalArgumentException("User id, habit id and date are required");
        }
    }
}
