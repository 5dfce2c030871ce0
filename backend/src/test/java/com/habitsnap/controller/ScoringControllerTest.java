package com.habitsnap.controller;

import com.habitsnap.config.ClockConfig;
import com.habitsnap.dto.response.ScoringStatsResponse;
import com.habitsnap.entity.UserScoreProfile;
import com.habitsnap.exception.ResourceNotFoundException;
import com.habitsnap.service.ScorePolicy;
import com.habitsnap.service.ScoringEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = ScoringController.class)
@Import({ClockConfig.class, ScorePolicy.class})
@DisplayName("ScoringController Web Tests")
class ScoringControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ScoringEngine scoringEngine;

    private static final UUID USER = UUID.fromString("11111111-1111-1111-1111-111111111111");

    @Test
    @DisplayName("GET /api/profiles/{userId}/score should return the profile")
    void testGetScore() throws Exception {
        when(scoringEngine.getProfile(USER)).thenReturn(UserScoreProfile.forUser(USER).toBuilder()
                .score(42).currentStreak(3).longestStreak(9).build());

        mvc.perform(get("/api/profiles/{userId}/score", USER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.score").value(42))
                .andExpect(jsonPath("$.longestStreak").value(9));
    }

    @Test
    @DisplayName("GET /api/profiles/{userId}/score should be a 404 problem for unknown users")
    void testGetScore_NotFound() throws Exception {
        when(scoringEngine.getProfile(USER)).thenThrow(ResourceNotFoundException.profile(USER));

        mvc.perform(get("/api/profiles/{userId}/score", USER))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    @DisplayName("GET /api/profiles/{userId}/stats should pass the requested day")
    void testGetStats() throws Exception {
        LocalDate asOf = LocalDate.of(2024, 3, 10);
        when(scoringEngine.getStats(USER, asOf)).thenReturn(ScoringStatsResponse.builder()
                .userId(USER).successRate(60).completedDays(6).totalDays(10).recentActivity(List.of()).build());

        mvc.perform(get("/api/profiles/{userId}/stats", USER).param("asOf", "2024-03-10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.successRate").value(60))
                .andExpect(jsonPath("$.totalDays").value(10));
    }

    @Test
    @DisplayName("GET /api/scoring/penalty-policy should describe the default rules")
    void testGetPenaltyPolicy() throws Exception {
        mvc.perform(get("/api/scoring/penalty-policy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.basePenalty").value(1))
                .andExpect(jsonPath("$.maxPenalty").value(3))
                .andExpect(jsonPath("$.bonusBlockDays").value(7));
    }
}
