package com.habitsnap.controller;

import com.habitsnap.dto.response.StreakExpiryReport;
import com.habitsnap.dto.response.SweepReport;
import com.habitsnap.service.PenaltySweep;
import com.habitsnap.service.StreakEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Manual triggers for the batch jobs, for operators and backfills.
 *
 * Both jobs are idempotent, so these endpoints skip the run-once guard the
 * scheduled triggers use.
 *
 * Endpoints:
 * - POST /api/admin/penalty-sweep?date=YYYY-MM-DD (date defaults to yesterday)
 * - POST /api/admin/streak-expiry
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminJobController {

    private final PenaltySweep penaltySweep;
    private final StreakEngine streakEngine;
    private final Clock clock;

    @PostMapping("/penalty-sweep")
    public ResponseEntity<SweepReport> runPenaltySweep(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate day = date != null ? date : LocalDate.now(clock).minusDays(1);
        log.info("Manual penalty sweep requested: date={}", day);
        return ResponseEntity.ok(penaltySweep.run(day));
    }

    @PostMapping("/streak-expiry")
    public ResponseEntity<StreakExpiryReport> runStreakExpiry() {
        log.info("Manual streak expiry requested");
        return ResponseEntity.ok(streakEngine.expireStale(clock.instant()));
    }
}
