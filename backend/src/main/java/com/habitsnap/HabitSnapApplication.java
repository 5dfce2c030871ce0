package com.habitsnap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the HabitSnap streak and scoring backend.
 *
 * This Spring Boot application owns the state behind HabitSnap's retention numbers:
 * - Mutual streaks between friends, advanced by snaps sent in both directions
 * - Per-habit daily completion ledger and habit streaks
 * - User score with streak bonuses and progressive penalties for missed days
 * - Nightly penalty sweep and hourly expiry of lapsed pair streaks
 *
 * Snap events arrive over RabbitMQ, state lives in PostgreSQL, and Redis guards
 * the scheduled jobs so that each period runs on one instance only.
 */
@SpringBootApplication
@EnableScheduling
public class HabitSnapApplication {

    public static void main(String[] args) {
        SpringApplication.run(HabitSnapApplication.class, args);
    }
}
