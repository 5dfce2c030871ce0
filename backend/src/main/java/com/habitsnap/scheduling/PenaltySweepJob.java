package com.habitsnap.scheduling;

import com.habitsnap.service.PenaltySweep;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Nightly trigger of the penalty sweep for yesterday.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PenaltySweepJob {

    static final String JOB_NAME = "penalty-sweep";

    private final PenaltySweep penaltySweep;
    private final JobRunGuard jobRunGuard;
    private final Clock clock;

    @Scheduled(cron = "${app.jobs.penalty-sweep.cron:0 0 1 * * *}", zone = "${app.scoring.zone:UTC}")
    public void sweepYesterday() {
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        String period = yesterday.toString();

        if (!jobRunGuard.tryAcquire(JOB_NAME, period)) {
            return;
        }
        try {
            penaltySweep.run(yesterday);
        } catch (RuntimeException e) {
            log.error("Penalty sweep aborted: date={}", yesterday, e);
            jobRunGuard.release(JOB_NAME, period);
        }
    }
}
