package com.habitsnap.service;

import com.habitsnap.entity.UserScoreProfile;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for user score profiles with the same compare-and-swap
 * contract as {@link PairStreakStore}.
 */
public interface UserScoreProfileStore {

    Optional<UserScoreProfile> find(UUID userId);

    /**
     * Replaces {@code expected} with {@code updated} if the stored version
     * still matches.
     *
     * @param expected the profile as read
     * @param updated the new state
     * @return true if the swap happened
     */
    boolean compareAndSwap(UserScoreProfile expected, UserScoreProfile updated);
}
