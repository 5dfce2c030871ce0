package com.habitsnap.repository;

import com.habitsnap.entity.PairStreak;
import com.habitsnap.exception.StorageException;
import com.habitsnap.service.PairStreakStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link PairStreakStore} backed by the pair_streaks table.
 *
 * Each method runs in its own short repository transaction; nothing here
 * joins a caller's transaction, so a retry after a lost swap always reads
 * committed state.
 *
 * Compare-and-swap rides on the entity's {@code @Version}: merging a record
 * whose version is behind the row fails with an optimistic locking error,
 * and so does the guarded {@code UPDATE ... WHERE version = ?} if another
 * writer commits in between.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JpaPairStreakStore implements PairStreakStore {

    private static final String STORE = "pair_streaks";

    private final PairStreakRepository pairStreakRepository;

    @Override
    public PairStreak getOrCreate(UUID low, UUID high) {
        try {
            Optional<PairStreak> existing = pairStreakRepository.findByUserLowIdAndUserHighId(low, high);
            if (existing.isPresent()) {
                return existing.get();
            }

            try {
                PairStreak created = pairStreakRepository.saveAndFlush(PairStreak.zero(low, high));
                log.debug("Created pair streak record: low={}, high={}", low, high);
                return created;
            } catch (DataIntegrityViolationException e) {
                // Another writer inserted the pair first; the unique key makes theirs the record.
                log.debug("Pair streak created concurrently, fetching existing record: low={}, high={}", low, high);
                return pairStreakRepository.findByUserLowIdAndUserHighId(low, high)
                        .orElseThrow(() -> StorageException.of(STORE, "getOrCreate", e));
            }
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "getOrCreate", e);
        }
    }

    @Override
    public boolean compareAndSwap(PairStreak expected, PairStreak updated) {
        if (!Objects.equals(expected.getId(), updated.getId())
                || !Objects.equals(expected.getVersion(), updated.getVersion())) {
            throw new IllegalArgumentException("Updated pair streak must carry the id and version it was read with");
        }
        try {
            pairStreakRepository.saveAndFlush(updated);
            return true;
        } catch (OptimisticLockingFailureException e) {
            log.debug("Pair streak swap lost: id={}, expectedVersion={}", expected.getId(), expected.getVersion());
            return false;
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "compareAndSwap", e);
        }
    }

    @Override
    public Optional<PairStreak> find(UUID low, UUID high) {
        try {
            return pairStreakRepository.findByUserLowIdAndUserHighId(low, high);
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "find", e);
        }
    }

    @Override
    public List<PairStreak> findAllByUser(UUID userId) {
        try {
            return pairStreakRepository.findAllByUser(userId);
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "findAllByUser", e);
        }
    }

    @Override
    public List<PairStreak> findExpiredWithActiveStreak(Instant now, int limit) {
        try {
            return pairStreakRepository.findExpiredWithActiveStreak(now, PageRequest.of(0, limit));
        } catch (DataAccessException e) {
            throw StorageException.of(STORE, "findExpiredWithActiveStreak", e);
        }
    }
}
