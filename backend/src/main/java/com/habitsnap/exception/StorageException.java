package com.habitsnap.exception;

/**
 * Exception thrown when the underlying store cannot serve a request.
 *
 * Wraps Spring's {@code DataAccessException} for failures that are not part of
 * the optimistic concurrency protocol (connection loss, timeouts, bad SQL).
 * This service does not retry them; retry policy belongs to the caller.
 *
 * GlobalExceptionHandler maps this to HTTP 503 Service Unavailable.
 */
public class StorageException extends RuntimeException {

    private final String store;
    private final String operation;

    public StorageException(String store, String operation, String message, Throwable cause) {
        super(message, cause);
        this.store = store;
        this.operation = operation;
    }

    public String getStore() {
        return store;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * Constructs a StorageException for a failed store operation.
     *
     * @param store the table or store that failed (e.g. "pair_streaks")
     * @param operation the operation being performed
     * @param cause the underlying data access failure
     * @return a StorageException with a formatted message
     */
    public static StorageException of(String store, String operation, Throwable cause) {
        return new StorageException(
                store,
                operation,
                String.format("Store '%s' failed during %s: %s", store, operation,
                        cause != null ? cause.getMessage() : "unknown error"),
                cause
        );
    }
}
