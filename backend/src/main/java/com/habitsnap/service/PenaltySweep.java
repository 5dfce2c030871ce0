package com.habitsnap.service;

import com.habitsnap.dto.response.ScoreDelta;
import com.habitsnap.dto.response.SweepReport;
import com.habitsnap.entity.Habit;
import com.habitsnap.exception.StorageException;
import com.habitsnap.repository.HabitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Charges the missed-day penalty for every active habit not completed on a day.
 *
 * Goes through the same {@link ScoringEngine#onMiss} entry point as any other
 * caller, so running it twice for one day charges nothing the second time.
 * Habits are independent and are processed in parallel, one page at a time.
 * A failing habit is logged and counted; the sweep goes on with the rest.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PenaltySweep {

    private final HabitRepository habitRepository;
    private final HabitStreakTracker habitStreakTracker;
    private final ScoringEngine scoringEngine;
    private final Clock clock;

    @Value("${app.jobs.penalty-sweep.parallelism:4}")
    private int parallelism;

    @Value("${app.jobs.penalty-sweep.page-size:200}")
    private int pageSize;

    /**
     * Sweeps all active habits for {@code day}.
     *
     * @param day the habit day to evaluate; the nightly job passes yesterday
     * @return counts of penalized, skipped and failed habits
     * @throws StorageException if the list of habits cannot be read
     */
    public SweepReport run(LocalDate day) {
        if (day == null) {
            throw new IllegalArgumentException("Sweep date is required");
        }
        long started = clock.millis();
        log.info("Penalty sweep started: date={}", day);

        AtomicInteger penalized = new AtomicInteger();
        AtomicInteger skipped = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, parallelism));
        try {
            int pageNo = 0;
            Page<Habit> page;
            do {
                page = loadPage(pageNo++);
                List<CompletableFuture<Void>> futures = new ArrayList<>();
                for (Habit habit : page.getContent()) {
                    futures.add(CompletableFuture.runAsync(
                            () -> sweepHabit(habit, day, penalized, skipped, failed), executor));
                }
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            } while (page.hasNext());
        } finally {
            executor.shutdown();
        }

        SweepReport report = SweepReport.builder()
                .date(day)
                .habitsProcessed(penalized.get() + skipped.get())
                .penalized(penalized.get())
                .skipped(skipped.get())
                .failed(failed.get())
                .durationMs(clock.millis() - started)
                .build();

        if (report.getFailed() > 0) {
            log.warn("Penalty sweep finished with failures: date={}, processed={}, penalized={}, failed={}",
                    day, report.getHabitsProcessed(), report.getPenalized(), report.getFailed());
        } else {
            log.info("Penalty sweep finished: date={}, processed={}, penalized={}, skipped={}, durationMs={}",
                    day, report.getHabitsProcessed(), report.getPenalized(), report.getSkipped(),
                    report.getDurationMs());
        }
        return report;
    }

    private void sweepHabit(Habit habit,
                            LocalDate day,
                            AtomicInteger penalized,
                            AtomicInteger skipped,
                            AtomicInteger failed) {
        try {
            if (habitStreakTracker.isCompleted(habit.getUserId(), habit.getId(), day)) {
                skipped.incrementAndGet();
                return;
            }
            ScoreDelta delta = scoringEngine.onMiss(habit.getUserId(), habit.getId(), day);
            if (delta.isApplied()) {
                penalized.incrementAndGet();
            } else {
                skipped.incrementAndGet();
            }
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.warn("Penalty sweep failed for habit: habitId={}, userId={}, date={}, error={}",
                    habit.getId(), habit.getUserId(), day, e.getMessage());
        }
    }

    private Page<Habit> loadPage(int pageNo) {
        try {
            return habitRepository.findByIsActiveTrue(PageRequest.of(pageNo, pageSize, Sort.by("id")));
        } catch (DataAccessException e) {
            throw StorageException.of("habits", "findByIsActiveTrue", e);
        }
    }
}
