package com.habitsnap.service;

import com.habitsnap.dto.response.StreakExpiryReport;
import com.habitsnap.dto.response.StreakUpdate;
import com.habitsnap.entity.PairStreak;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Mutual streak state machine for pairs of friends.
 *
 * A pair moves through four conceptual states:
 * <ul>
 *   <li>Idle: no action in the open cycle</li>
 *   <li>One-sided: one member acted and the deadline has not passed</li>
 *   <li>Both acted: the other member answered within the rolling window, the
 *       streak grows by one and a fresh cycle opens</li>
 *   <li>Expired: the deadline passed; the next action resets the streak to zero
 *       and {@code longestStreak} is kept</li>
 * </ul>
 *
 * Every write is a compare-and-swap on the pair's version, retried a bounded
 * number of times with a fresh read. No lock is held between the read and the
 * write, so A→B and B→A at the same instant cannot deadlock; the loser of the
 * race recomputes against the winner's state.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StreakEngine {

    private static final String RESOURCE = "pair streak";
    private static final int EXPIRY_BATCH_SIZE = 100;

    private final PairStreakStore pairStreakStore;
    private final Clock clock;

    @Value("${app.streak.window-hours:24}")
    private long windowHours;

    @Value("${app.streak.max-cas-retries:5}")
    private int maxRetries;

    @Value("${app.streak.default-timeout-ms:2000}")
    private long defaultTimeoutMs;

    /**
     * Records an action from {@code senderId} toward {@code receiverId} using the
     * default deadline.
     *
     * @see #recordAction(UUID, UUID, Instant, Instant)
     */
    public StreakUpdate recordAction(UUID senderId, UUID receiverId, Instant now) {
        return recordAction(senderId, receiverId, now, defaultDeadline());
    }

    /**
     * Records an action from {@code senderId} toward {@code receiverId}.
     *
     * @param senderId the user who acted
     * @param receiverId the friend the action was directed at
     * @param now the time of the action
     * @param deadline latest instant at which another CAS attempt may start
     * @return the committed streak numbers
     * @throws com.habitsnap.exception.InvalidPairException if both ids are the same user
     * @throws com.habitsnap.exception.ConcurrentUpdateException if every attempt lost its swap
     * @throws com.habitsnap.exception.OperationTimeoutException if the deadline passed first
     * @throws com.habitsnap.exception.StorageException if the store is unavailable
     */
    public StreakUpdate recordAction(UUID senderId, UUID receiverId, Instant now, Instant deadline) {
        if (now == null) {
            throw new IllegalArgumentException("Action time is required");
        }
        PairKey key = PairKey.canonicalize(senderId, receiverId);

        StreakUpdate update = OptimisticRetry.run(RESOURCE, key, "recordAction", maxRetries, deadline, clock, () -> {
            PairStreak current = pairStreakStore.getOrCreate(key.getLow(), key.getHigh());
            Transition transition = apply(current, key.isLowSide(), now);
            return pairStreakStore.compareAndSwap(current, transition.next)
                    ? Optional.of(transition.toUpdate())
                    : Optional.empty();
        });

        if (update.getOutcome() == StreakUpdate.Outcome.INCREASED) {
            log.info("Pair streak increased: sender={}, receiver={}, currentStreak={}, longestStreak={}",
                    senderId, receiverId, update.getCurrentStreak(), update.getLongestStreak());
        } else if (update.getOutcome() == StreakUpdate.Outcome.EXPIRED_RESET) {
            log.info("Pair streak expired and reset: sender={}, receiver={}, longestStreak={}",
                    senderId, receiverId, update.getLongestStreak());
        } else {
            log.debug("Pair action recorded, waiting for other side: sender={}, receiver={}, expiresAt={}",
                    senderId, receiverId, update.getStreakExpiresAt());
        }
        return update;
    }

    /**
     * Returns the streak between two users, in canonical form.
     *
     * @param userA one user
     * @param userB the other user
     * @return the record, or empty if the pair never interacted
     */
    public Optional<PairStreak> getPairStreak(UUID userA, UUID userB) {
        PairKey key = PairKey.canonicalize(userA, userB);
        return pairStreakStore.find(key.getLow(), key.getHigh());
    }

    public List<PairStreak> listStreaks(UUID userId) {
        if (userId == null) {
            throw new IllegalArgumentException("User id is required");
        }
        return pairStreakStore.findAllByUser(userId);
    }

    /**
     * Resets every streak whose deadline passed before {@code now}.
     *
     * Each record goes through the same CAS path as a live action. When a
     * live action wins the race the record is re-read, and it is left alone if
     * it is no longer expired. A record that fails is logged, counted once and
     * not retried in the same pass; the pass continues with the rest.
     *
     * @param now the reference instant
     * @return how many records were reset and how many failed
     */
    public StreakExpiryReport expireStale(Instant now) {
        int reset = 0;
        Set<String> failedKeys = new HashSet<>();

        while (true) {
            List<PairStreak> batch = pairStreakStore.findExpiredWithActiveStreak(now, EXPIRY_BATCH_SIZE);
            if (batch.isEmpty()) {
                break;
            }

            int resetInBatch = 0;
            for (PairStreak candidate : batch) {
                String key = candidate.getUserLowId() + ":" + candidate.getUserHighId();
                if (failedKeys.contains(key)) {
                    continue;
                }
                try {
                    if (expireOne(candidate.getUserLowId(), candidate.getUserHighId(), now)) {
                        resetInBatch++;
                    }
                } catch (RuntimeException e) {
                    failedKeys.add(key);
                    log.warn("Failed to expire pair streak: low={}, high={}, error={}",
                            candidate.getUserLowId(), candidate.getUserHighId(), e.getMessage());
                }
            }
            reset += resetInBatch;

            // Records that failed stay in the result set; stop instead of re-reading them forever.
            if (resetInBatch == 0 || batch.size() < EXPIRY_BATCH_SIZE) {
                break;
            }
        }

        int failed = failedKeys.size();
        if (reset > 0 || failed > 0) {
            log.info("Expired pair streaks: asOf={}, reset={}, failed={}", now, reset, failed);
        }
        return StreakExpiryReport.builder()
                .asOf(now)
                .reset(reset)
                .failed(failed)
                .build();
    }

    private boolean expireOne(UUID low, UUID high, Instant now) {
        String key = low + ":" + high;
        return OptimisticRetry.run(RESOURCE, key, "expireStale", maxRetries, defaultDeadline(), clock, () -> {
            Optional<PairStreak> found = pairStreakStore.find(low, high);
            if (found.isEmpty()) {
                return Optional.of(false);
            }
            PairStreak current = found.get();
            if (!current.isExpiredAt(now) || current.getCurrentStreak() == 0) {
                return Optional.of(false);
            }
            PairStreak next = current.toBuilder()
                    .currentStreak(0)
                    .lastActionLow(null)
                    .lastActionHigh(null)
                    .streakStartedAt(null)
                    .build();
            return pairStreakStore.compareAndSwap(current, next) ? Optional.of(true) : Optional.empty();
        });
    }

    /**
     * Computes the state after {@code actorIsLow}'s side acted at {@code now}.
     * Pure function of its inputs; {@code current} is not modified.
     */
    Transition apply(PairStreak current, boolean actorIsLow, Instant now) {
        Duration window = Duration.ofHours(windowHours);
        Instant expiresAt = now.plus(window);
        PairStreak.PairStreakBuilder next = current.toBuilder().streakExpiresAt(expiresAt);

        if (current.isExpiredAt(now)) {
            next.currentStreak(0)
                    .lastActionLow(null)
                    .lastActionHigh(null)
                    .streakStartedAt(null);
            setSide(next, actorIsLow, now);
            return new Transition(next.build(), StreakUpdate.Outcome.EXPIRED_RESET);
        }

        Instant otherSide = current.lastActionOf(!actorIsLow);
        if (otherSide != null && otherSide.isAfter(now.minus(window))) {
            int streak = current.getCurrentStreak() + 1;
            // An older action applied after a newer one must not pull the deadline back.
            if (current.getStreakExpiresAt() != null && current.getStreakExpiresAt().isAfter(expiresAt)) {
                next.streakExpiresAt(current.getStreakExpiresAt());
            }
            next.currentStreak(streak)
                    .longestStreak(Math.max(current.getLongestStreak(), streak))
                    .lastActionLow(null)
                    .lastActionHigh(null);
            if (current.getStreakStartedAt() == null) {
                next.streakStartedAt(now);
            }
            return new Transition(next.build(), StreakUpdate.Outcome.INCREASED);
        }

        setSide(next, actorIsLow, now);
        return new Transition(next.build(), StreakUpdate.Outcome.WAITING);
    }

    private static void setSide(PairStreak.PairStreakBuilder builder, boolean lowSide, Instant at) {
        if (lowSide) {
            builder.lastActionLow(at);
        } else {
            builder.lastActionHigh(at);
        }
    }

    private Instant defaultDeadline() {
        return clock.instant().plusMillis(defaultTimeoutMs);
    }

    static final class Transition {
        final PairStreak next;
        final StreakUpdate.Outcome outcome;

        Transition(PairStreak next, StreakUpdate.Outcome outcome) {
            this.next = next;
            this.outcome = outcome;
        }

        StreakUpdate toUpdate() {
            return StreakUpdate.builder()
                    .currentStreak(next.getCurrentStreak())
                    .longestStreak(next.getLongestStreak())
                    .increased(outcome == StreakUpdate.Outcome.INCREASED)
                    .outcome(outcome)
                    .streakExpiresAt(next.getStreakExpiresAt())
                    .build();
        }
    }
}
