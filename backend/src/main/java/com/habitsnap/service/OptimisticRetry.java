package com.habitsnap.service;

import com.habitsnap.exception.ConcurrentUpdateException;
import com.habitsnap.exception.OperationTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Read-modify-CAS loop shared by the engines.
 *
 * Each attempt re-reads the record, derives the new state and tries one swap.
 * An attempt that loses the swap returns an empty result and is retried with
 * fresh data. The deadline is checked before every attempt.
 */
@Slf4j
final class OptimisticRetry {

    private OptimisticRetry() {
    }

    /**
     * Runs {@code attempt} until it returns a value.
     *
     * @param resource name of the record type, for errors and logs
     * @param key identifier of the contended record
     * @param operation name of the calling operation
     * @param maxAttempts upper bound on attempts
     * @param deadline latest instant at which a new attempt may start
     * @param clock clock the deadline is checked against
     * @param attempt one read-modify-swap; empty if the swap was lost
     * @return the value of the first successful attempt
     * @throws OperationTimeoutException if the deadline passes before a swap succeeds
     * @throws ConcurrentUpdateException if every attempt lost its swap
     */
    static <T> T run(String resource,
                     Object key,
                     String operation,
                     int maxAttempts,
                     Instant deadline,
                     Clock clock,
                     Supplier<Optional<T>> attempt) {
        for (int attemptNo = 1; attemptNo <= maxAttempts; attemptNo++) {
            if (deadline != null && clock.instant().isAfter(deadline)) {
                throw OperationTimeoutException.deadlineExceeded(operation, deadline, attemptNo - 1);
            }

            Optional<T> result = attempt.get();
            if (result.isPresent()) {
                if (attemptNo > 1) {
                    log.debug("{} on {} {} succeeded after {} attempts", operation, resource, key, attemptNo);
                }
                return result.get();
            }

            log.debug("{} on {} {} lost its swap (attempt {}/{})", operation, resource, key, attemptNo, maxAttempts);
        }

        log.warn("{} on {} {} gave up after {} contended attempts", operation, resource, key, maxAttempts);
        throw ConcurrentUpdateException.retriesExhausted(resource, key, maxAttempts);
    }
}
