package com.habitsnap.dto.response;

import com.habitsnap.entity.UserScoreProfile;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a user's score profile.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserScoreProfileResponse {

    private UUID userId;

    private int score;

    private int currentStreak;

    private int longestStreak;

    private Instant updatedAt;

    public static UserScoreProfileResponse from(UserScoreProfile profile) {
        return UserScoreProfileResponse.builder()
                .userId(profile.getUserId())
                .score(profile.getScore())
                .currentStreak(profile.getCurrentStreak())
                .longestStreak(profile.getLongestStreak())
                .updatedAt(profile.getUpdatedAt())
                .build();
    }
}
