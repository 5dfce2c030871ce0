package com.habitsnap.exception;

import java.time.Instant;

/**
 * Exception thrown when a caller's deadline passes inside a retry loop.
 *
 * The record is left exactly as the last successful write produced it:
 * each attempt is a single atomic compare-and-swap, so no partial state exists.
 *
 * GlobalExceptionHandler maps this to HTTP 503 Service Unavailable.
 */
public class OperationTimeoutException extends RuntimeException {

    private final String operation;
    private final Instant deadline;

    public OperationTimeoutException(String operation, Instant deadline, String message) {
        super(message);
        this.operation = operation;
        this.deadline = deadline;
    }

    public String getOperation() {
        return operation;
    }

    public Instant getDeadline() {
        return deadline;
    }

    /**
     * Constructs an OperationTimeoutException for an expired deadline.
     *
     * @param operation the operation that ran out of time (e.g. "recordAction")
     * @param deadline the caller-supplied deadline
     * @param attempts attempts made before the deadline passed
     * @return an OperationTimeoutException with a formatted message
     */
    public static OperationTimeoutException deadlineExceeded(String operation, Instant deadline, int attempts) {
        return new OperationTimeoutException(
                operation,
                deadline,
                String.format("Operation %s exceeded its deadline %s after %d attempt(s).",
                        operation, deadline, attempts)
        );
    }
}
