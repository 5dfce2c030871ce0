package com.habitsnap.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.util.concurrent.TimeUnit;

/**
 * Lets exactly one instance run a scheduled job per period.
 *
 * A run is claimed with a Redis {@code SET NX} on {@code jobs:<job>:<period>}
 * that expires after {@code app.jobs.lock-ttl-hours}. If Redis cannot be
 * reached the claim fails and the period is skipped rather than run twice.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobRunGuard {

    private static final String JOB_KEY_PREFIX = "jobs:";

    private final RedisTemplate<String, String> redisStringTemplate;

    @Value("${app.jobs.lock-ttl-hours:23}")
    private long lockTtlHours;

    /**
     * Claims the run of {@code job} for {@code period}.
     *
     * @param job job name, e.g. {@code penalty-sweep}
     * @param period period the run covers, e.g. a date or an hour
     * @return true if this instance owns the run
     */
    public boolean tryAcquire(String job, String period) {
        String key = key(job, period);
        try {
            Boolean acquired = redisStringTemplate.opsForValue()
                    .setIfAbsent(key, instanceId(), lockTtlHours, TimeUnit.HOURS);
            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Job run claimed: key={}", key);
                return true;
            }
            log.info("Job run already claimed by another instance, skipping: key={}", key);
            return false;
        } catch (DataAccessException e) {
            log.warn("Could not claim job run, skipping this period: key={}, error={}", key, e.getMessage());
            return false;
        }
    }

    /**
     * Gives up a claimed run so that another instance (or a later trigger) can retry it.
     */
    public void release(String job, String period) {
        String key = key(job, period);
        try {
            redisStringTemplate.delete(key);
            log.debug("Job run released: key={}", key);
        } catch (DataAccessException e) {
            log.warn("Could not release job run, it expires on its own: key={}, error={}", key, e.getMessage());
        }
    }

    static String key(String job, String period) {
        return JOB_KEY_PREFIX + job + ":" + period;
    }

    private static String instanceId() {
        return ManagementFactory.getRuntimeMXBean().getName();
    }
}
