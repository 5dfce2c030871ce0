package com.habitsnap.repository;

import com.habitsnap.entity.PairStreak;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for PairStreak entity operations.
 *
 * Lookups always use the canonical (low, high) order. Writes are plain
 * {@code save} calls; the entity's {@code @Version} column turns them into a
 * compare-and-swap.
 */
@Repository
public interface PairStreakRepository extends JpaRepository<PairStreak, UUID> {

    Optional<PairStreak> findByUserLowIdAndUserHighId(UUID userLowId, UUID userHighId);

    /**
     * All pairs a user belongs to, best streak first.
     *
     * @param userId the user on either side of the pair
     * @return the user's pair streaks ordered by current streak descending
     */
    @Query("SELECT p FROM PairStreak p " +
           "WHERE p.userLowId = :userId OR p.userHighId = :userId " +
           "ORDER BY p.currentStreak DESC, p.longestStreak DESC")
    List<PairStreak> findAllByUser(@Param("userId") UUID userId);

    /**
     * Pairs whose cycle deadline has passed while a streak is still showing.
     *
     * @param now the instant to compare deadlines against
     * @param pageable batch size
     * @return expired pairs with a non-zero current streak
     */
    @Query("SELECT p FROM PairStreak p " +
           "WHERE p.streakExpiresAt < :now AND p.currentStreak > 0 " +
           "ORDER BY p.streakExpiresAt ASC")
    List<PairStreak> findExpiredWithActiveStreak(@Param("now") Instant now, Pageable pageable);
}
