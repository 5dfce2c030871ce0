package com.habitsnap.repository;

import com.habitsnap.entity.UserScoreProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository interface for UserScoreProfile entity operations.
 *
 * Spring Data JPA will automatically implement this interface at runtime.
 */
@Repository
public interface UserScoreProfileRepository extends JpaRepository<UserScoreProfile, UUID> {
}
