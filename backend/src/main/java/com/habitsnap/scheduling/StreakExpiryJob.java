package com.habitsnap.scheduling;

import com.habitsnap.service.StreakEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Hourly reset of pair streaks whose deadline passed without an action.
 *
 * Streaks also reset lazily on the next action; this job keeps the stored
 * numbers honest for pairs that stopped interacting.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StreakExpiryJob {

    static final String JOB_NAME = "streak-expiry";

    private final StreakEngine streakEngine;
    private final JobRunGuard jobRunGuard;
    private final Clock clock;

    @Scheduled(cron = "${app.jobs.streak-expiry.cron:0 0 * * * *}", zone = "${app.scoring.zone:UTC}")
    public void expireStaleStreaks() {
        Instant now = clock.instant();
        String period = now.truncatedTo(ChronoUnit.HOURS).toString();

        if (!jobRunGuard.tryAcquire(JOB_NAME, period)) {
            return;
        }
        try {
            streakEngine.expireStale(now);
        } catch (RuntimeException e) {
            log.error("Streak expiry aborted: asOf={}", now, e);
            jobRunGuard.release(JOB_NAME, period);
        }
    }
}
