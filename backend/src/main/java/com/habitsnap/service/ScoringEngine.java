package com.habitsnap.service;

import com.habitsnap.dto.response.HabitDayResponse;
import com.habitsnap.dto.response.ScoreDelta;
import com.habitsnap.dto.response.ScoringStatsResponse;
import com.habitsnap.entity.HabitDay;
import com.habitsnap.entity.UserScoreProfile;
import com.habitsnap.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Sole writer of user scores.
 *
 * Approvals add one point plus the streak bonus; misses deduct a progressive
 * penalty and lower the profile streak. Profile writes use the same
 * read-compute-CAS loop as pair streaks, so two habits of one user being
 * scored at the same time cannot overwrite each other.
 *
 * A missed day is charged at most once. The penalty is first claimed on the
 * ledger row with a conditional update; only the caller that claimed it
 * charges the profile, and the claim is given back if that charge fails.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScoringEngine {

    private static final String RESOURCE = "score profile";
    private static final int STATS_WINDOW_DAYS = 30;
    private static final int RECENT_ACTIVITY_LIMIT = 7;

    private final UserScoreProfileStore userScoreProfileStore;
    private final HabitStreakTracker habitStreakTracker;
    private final ScorePolicy scorePolicy;
    private final Clock clock;

    @Value("${app.streak.max-cas-retries:5}")
    private int maxRetries;

    @Value("${app.streak.default-timeout-ms:2000}")
    private long defaultTimeoutMs;

    public ScoreDelta onApproval(UUID userId, UUID habitId, LocalDate date) {
        return onApproval(userId, habitId, date, defaultDeadline());
    }

    /**
     * Books an approved snap for a habit day and credits the user.
     *
     * @param userId the user whose snap was approved
     * @param habitId the habit the snap belongs to
     * @param date the habit day
     * @param deadline latest instant at which another CAS attempt may start
     * @return the committed change
     * @throws ResourceNotFoundException if the user has no score profile
     */
    public ScoreDelta onApproval(UUID userId, UUID habitId, LocalDate date, Instant deadline) {
        requireProfile(userId);

        int habitStreak = habitStreakTracker.recordCompletion(userId, habitId, date);
        int bonus = scorePolicy.streakBonus(habitStreak);
        int change = 1 + bonus;

        ScoreDelta delta = OptimisticRetry.run(RESOURCE, userId, "onApproval", maxRetries, deadline, clock, () -> {
            UserScoreProfile current = requireProfile(userId);
            UserScoreProfile next = current.toBuilder()
                    .score(Math.max(0, current.getScore() + change))
                    .currentStreak(habitStreak)
                    .longestStreak(Math.max(current.getLongestStreak(), habitStreak))
                    .build();
            if (!userScoreProfileStore.compareAndSwap(current, next)) {
                return Optional.empty();
            }
            return Optional.of(ScoreDelta.builder()
                    .userId(userId)
                    .habitId(habitId)
                    .date(date)
                    .type(ScoreDelta.Type.APPROVAL)
                    .scoreChange(change)
                    .bonus(bonus)
                    .previousStreak(current.getCurrentStreak())
                    .newStreak(next.getCurrentStreak())
                    .newScore(next.getScore())
                    .applied(true)
                    .build());
        });

        log.info("Approval scored: userId={}, habitId={}, date={}, change={}, bonus={}, newScore={}, streak={}",
                userId, habitId, date, change, bonus, delta.getNewScore(), delta.getNewStreak());
        return delta;
    }

    public ScoreDelta onMiss(UUID userId, UUID habitId, LocalDate date) {
        return onMiss(userId, habitId, date, defaultDeadline());
    }

    /**
     * Records a missed habit day and charges the progressive penalty once.
     *
     * @param userId the user
     * @param habitId the habit that was missed
     * @param date the missed day
     * @param deadline latest instant at which another CAS attempt may start
     * @return the change; {@code applied} is false if nothing was charged
     * @throws ResourceNotFoundException if the user has no score profile
     */
    public ScoreDelta onMiss(UUID userId, UUID habitId, LocalDate date, Instant deadline) {
        UserScoreProfile before = requireProfile(userId);

        int misses = habitStreakTracker.recordMiss(userId, habitId, date);
        int penalty = scorePolicy.penaltyFor(misses);

        if (!habitStreakTracker.claimPenalty(userId, habitId, date, penalty)) {
            log.debug("Miss already charged or day completed, skipping: userId={}, habitId={}, date={}",
                    userId, habitId, date);
            return ScoreDelta.builder()
                    .userId(userId)
                    .habitId(habitId)
                    .date(date)
                    .type(ScoreDelta.Type.MISS)
                    .consecutiveMisses(misses)
                    .previousStreak(before.getCurrentStreak())
                    .newStreak(before.getCurrentStreak())
                    .newScore(before.getScore())
                    .applied(false)
                    .build();
        }

        ScoreDelta delta;
        try {
            delta = OptimisticRetry.run(RESOURCE, userId, "onMiss", maxRetries, deadline, clock, () -> {
                UserScoreProfile current = requireProfile(userId);
                UserScoreProfile next = current.toBuilder()
                        .score(Math.max(0, current.getScore() - penalty))
                        .currentStreak(Math.max(0, current.getCurrentStreak() - scorePolicy.streakDecrement()))
                        .build();
                if (!userScoreProfileStore.compareAndSwap(current, next)) {
                    return Optional.empty();
                }
                return Optional.of(ScoreDelta.builder()
                        .userId(userId)
                        .habitId(habitId)
                        .date(date)
                        .type(ScoreDelta.Type.MISS)
                        .scoreChange(-penalty)
                        .penalty(penalty)
                        .consecutiveMisses(misses)
                        .previousStreak(current.getCurrentStreak())
                        .newStreak(next.getCurrentStreak())
                        .newScore(next.getScore())
                        .applied(true)
                        .build());
            });
        } catch (RuntimeException e) {
            releaseClaim(userId, habitId, date, penalty, e);
            throw e;
        }

        log.info("Miss penalized: userId={}, habitId={}, date={}, priorMisses={}, penalty={}, newScore={}, streak={}",
                userId, habitId, date, misses, penalty, delta.getNewScore(), delta.getNewStreak());
        return delta;
    }

    /**
     * @throws ResourceNotFoundException if the user has no score profile
     */
    public UserScoreProfile getProfile(UUID userId) {
        return requireProfile(userId);
    }

    /**
     * Score statistics over the 30 days ending at {@code asOf}.
     */
    public ScoringStatsResponse getStats(UUID userId, LocalDate asOf) {
        UserScoreProfile profile = requireProfile(userId);
        List<HabitDay> days = habitStreakTracker.recentDays(userId, asOf.minusDays(STATS_WINDOW_DAYS - 1L), asOf);

        int completed = (int) days.stream().filter(HabitDay::isCompleted).count();
        int total = days.size();
        int successRate = total > 0 ? (int) Math.round(completed * 100.0 / total) : 0;

        List<HabitDayResponse> recent = days.stream()
                .limit(RECENT_ACTIVITY_LIMIT)
                .map(day -> HabitDayResponse.builder()
                        .habitId(day.getHabitId())
                        .date(day.getDay())
                        .completed(day.isCompleted())
                        .snapCount(day.getSnapCount())
                        .penaltyApplied(day.getPenaltyApplied())
                        .build())
                .collect(Collectors.toList());

        return ScoringStatsResponse.builder()
                .userId(userId)
                .score(profile.getScore())
                .currentStreak(profile.getCurrentStreak())
                .longestStreak(profile.getLongestStreak())
                .completedDays(completed)
                .totalDays(total)
                .successRate(successRate)
                .recentActivity(recent)
                .build();
    }

    private void releaseClaim(UUID userId, UUID habitId, LocalDate date, int penalty, RuntimeException cause) {
        try {
            habitStreakTracker.releasePenalty(userId, habitId, date, penalty);
            log.warn("Penalty charge failed, claim released: userId={}, habitId={}, date={}, error={}",
                    userId, habitId, date, cause.getMessage());
        } catch (RuntimeException releaseError) {
            log.error("Penalty charge failed and claim could not be released: userId={}, habitId={}, date={}",
                    userId, habitId, date, releaseError);
            cause.addSuppressed(releaseError);
        }
    }

    private UserScoreProfile requireProfile(UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("User id is required");
        }
        return userScoreProfileStore.find(userId)
                .orElseThrow(() -> ResourceNotFoundException.profile(userId));
    }

    private Instant defaultDeadline() {
        return clock.instant().plusMillis(defaultTimeoutMs);
    }
}
