package com.habitsnap.controller;

import com.habitsnap.dto.response.PairStreakListResponse;
import com.habitsnap.dto.response.PairStreakLookupResponse;
import com.habitsnap.dto.response.PairStreakResponse;
import com.habitsnap.service.StreakEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read-only REST endpoints for pair streaks.
 *
 * Streaks change only through snap events; these endpoints show them from
 * the requesting user's side.
 *
 * Endpoints:
 * - GET /api/streaks/{userId}: all of the user's streaks, best first
 * - GET /api/streaks/{userId}/{friendId}: the streak with one friend
 *
 * Error Responses:
 * - 400 Bad Request: malformed id, or userId equals friendId
 * - 503 Service Unavailable: database connection issues
 */
@RestController
@RequestMapping("/api/streaks")
@RequiredArgsConstructor
@Slf4j
public class StreakController {

    private final StreakEngine streakEngine;

    @GetMapping("/{userId}")
    public ResponseEntity<PairStreakListResponse> listStreaks(@PathVariable UUID userId) {
        log.info("Streaks requested: userId={}", userId);

        List<PairStreakResponse> streaks = streakEngine.listStreaks(userId).stream()
                .map(streak -> PairStreakResponse.forViewer(streak, userId))
                .collect(Collectors.toList());
        int active = (int) streaks.stream().filter(PairStreakResponse::isActive).count();

        return ResponseEntity.ok(PairStreakListResponse.builder()
                .streaks(streaks)
                .total(streaks.size())
                .active(active)
                .build());
    }

    @GetMapping("/{userId}/{friendId}")
    public ResponseEntity<PairStreakLookupResponse> getStreak(@PathVariable UUID userId,
                                                              @PathVariable UUID friendId) {
        log.info("Streak requested: userId={}, friendId={}", userId, friendId);

        return ResponseEntity.ok(streakEngine.getPairStreak(userId, friendId)
                .map(streak -> new PairStreakLookupResponse(
                        PairStreakResponse.forViewer(streak, userId), "Streak found"))
                .orElseGet(() -> new PairStreakLookupResponse(null, "No streak yet with this friend")));
    }
}
