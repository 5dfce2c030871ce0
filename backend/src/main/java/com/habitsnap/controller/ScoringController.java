package com.habitsnap.controller;

import com.habitsnap.dto.response.PenaltyPolicyResponse;
import com.habitsnap.dto.response.ScoringStatsResponse;
import com.habitsnap.dto.response.UserScoreProfileResponse;
import com.habitsnap.service.ScorePolicy;
import com.habitsnap.service.ScoringEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Read-only REST endpoints for scores.
 *
 * Endpoints:
 * - GET /api/profiles/{userId}/score: score and habit streak of a user
 * - GET /api/profiles/{userId}/stats?asOf=YYYY-MM-DD: 30-day statistics (asOf defaults to today)
 * - GET /api/scoring/penalty-policy: current bonus and penalty rules
 *
 * Error Responses:
 * - 404 Not Found: the user has no score profile
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ScoringController {

    private final ScoringEngine scoringEngine;
    private final ScorePolicy scorePolicy;
    private final Clock clock;

    @GetMapping("/profiles/{userId}/score")
    public ResponseEntity<UserScoreProfileResponse> getScore(@PathVariable UUID userId) {
        log.info("Score requested: userId={}", userId);
        return ResponseEntity.ok(UserScoreProfileResponse.from(scoringEngine.getProfile(userId)));
    }

    @GetMapping("/profiles/{userId}/stats")
    public ResponseEntity<ScoringStatsResponse> getStats(
            @PathVariable UUID userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        LocalDate day = asOf != null ? asOf : LocalDate.now(clock);
        log.info("Scoring stats requested: userId={}, asOf={}", userId, day);
        return ResponseEntity.ok(scoringEngine.getStats(userId, day));
    }

    @GetMapping("/scoring/penalty-policy")
    public ResponseEntity<PenaltyPolicyResponse> getPenaltyPolicy() {
        return ResponseEntity.ok(scorePolicy.describe());
    }
}
