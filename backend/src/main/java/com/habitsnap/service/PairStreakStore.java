package com.habitsnap.service;

import com.habitsnap.entity.PairStreak;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for pair streak records, one per canonical pair.
 *
 * All writes go through {@link #compareAndSwap}; there is no unconditional
 * update. Implementations report store outages as
 * {@link com.habitsnap.exception.StorageException}.
 */
public interface PairStreakStore {

    /**
     * Returns the record of a pair, creating the zero-state record on first access.
     *
     * Two concurrent callers for the same new pair get the same single record.
     *
     * @param low lower user of the canonical pair
     * @param high higher user of the canonical pair
     * @return the stored record
     */
    PairStreak getOrCreate(UUID low, UUID high);

    /**
     * Replaces {@code expected} with {@code updated} if the stored version still
     * matches {@code expected}'s version.
     *
     * @param expected the record as read
     * @param updated the new state, derived from {@code expected}
     * @return true if the swap happened, false if another writer got there first
     */
    boolean compareAndSwap(PairStreak expected, PairStreak updated);

    Optional<PairStreak> find(UUID low, UUID high);

    List<PairStreak> findAllByUser(UUID userId);

    /**
     * Records whose deadline passed before {@code now} and that still show a streak.
     *
     * @param now the reference instant
     * @param limit maximum number of records to return
     * @return expired records, oldest deadline first
     */
    List<PairStreak> findExpiredWithActiveStreak(Instant now, int limit);
}
