package com.habitsnap.exception;

/**
 * Exception thrown when an optimistic update keeps losing to concurrent writers.
 *
 * Every mutation of a pair streak or a score profile is read, compute,
 * compare-and-swap. When the swap fails the operation re-reads and tries
 * again, up to a bounded number of attempts. This exception reports that
 * the bound was exhausted; nothing was written by the failed attempts.
 *
 * The caller may retry the whole user action once at a higher level but must
 * not drop it. GlobalExceptionHandler maps this to HTTP 409 Conflict.
 */
public class ConcurrentUpdateException extends RuntimeException {

    private final String resource;
    private final int attempts;

    public ConcurrentUpdateException(String resource, int attempts, String message) {
        super(message);
        this.resource = resource;
        this.attempts = attempts;
    }

    public String getResource() {
        return resource;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * Constructs a ConcurrentUpdateException after the retry bound is spent.
     *
     * @param resource the kind of record being updated (e.g. "pair-streak")
     * @param key the record's key, for the message
     * @param attempts how many compare-and-swap attempts were made
     * @return a ConcurrentUpdateException with a formatted message
     */
    public static ConcurrentUpdateException retriesExhausted(String resource, Object key, int attempts) {
        return new ConcurrentUpdateException(
                resource,
                attempts,
                String.format("Update of %s '%s' lost to concurrent writers %d times in a row. Please retry.",
                        resource, key, attempts)
        );
    }
}
