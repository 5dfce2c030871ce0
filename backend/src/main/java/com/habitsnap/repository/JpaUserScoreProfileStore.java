package com.habitsnap.repository;

import com.habitsnap.entity.UserScoreProfile;
import com.habitsnap.exception.StorageException;
import com.habitsnap.service.UserScoreProfileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link UserScoreProfileStore} backed by the user_score_profiles table.
 *
 * Same version-guarded write as {@link JpaPairStreakStore}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JpaUserScoreProfileStore implements UserScoreProfileStore {

    private static final String STORE = "user_score_profiles";

    private final UserScoreProfileRepository userScoreProfileRepository;

    @Override
    public Optional<UserScoreProfile> find(UUID userId) {
        try {
            return userScoreProfileRepository.findById(userId);
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "find", e);
        }
    }

    @Override
    public boolean compareAndSwap(UserScoreProfile expected, UserScoreProfile updated) {
        if (!Objects.equals(expected.getUserId(), updated.getUserId())
                || !Objects.equals(expected.getVersion(), updated.getVersion())) {
            throw new IllegalArgumentException("Updated profile must carry the id and version it was read with");
        }
        try {
            userScoreProfileRepository.saveAndFlush(updated);
            return true;
        } catch (OptimisticLockingFailureException e) {
            log.debug("Score profile swap lost: userId={}, expectedVersion={}",
                    expected.getUserId(), expected.getVersion());
            return false;
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "compareAndSwap", e);
        }
    }
}
