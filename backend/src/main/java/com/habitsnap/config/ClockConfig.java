package com.habitsnap.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Time source for the streak and scoring engine.
 *
 * Every "now" and every "today" in the service is read from this clock. The
 * clock's zone is the scoring zone, so {@code LocalDate.now(clock)} gives the
 * calendar day that habit completions and penalties are booked against.
 */
@Configuration
@Slf4j
public class ClockConfig {

    @Value("${app.scoring.zone:UTC}")
    private String scoringZone;

    @Bean
    public Clock clock() {
        ZoneId zone = ZoneId.of(scoringZone);
        log.info("Configuring system clock in scoring zone {}", zone);
        return Clock.system(zone);
    }
}
