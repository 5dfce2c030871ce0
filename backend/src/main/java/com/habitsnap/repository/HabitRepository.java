package com.habitsnap.repository;

import com.habitsnap.entity.Habit;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Read access to habit metadata.
 */
@Repository
public interface HabitRepository extends JpaRepository<Habit, UUID> {

    /**
     * Active habits, one page at a time, for the penalty sweep.
     *
     * @param pageable page request (the sweep sorts by id for a stable walk)
     * @return a page of active habits
     */
    Page<Habit> findByIsActiveTrue(Pageable pageable);

    List<Habit> findByUserId(UUID userId);
}
