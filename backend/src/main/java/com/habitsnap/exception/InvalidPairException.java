package com.habitsnap.exception;

import java.util.UUID;

/**
 * Exception thrown when a streak action names the same user on both sides.
 *
 * A user cannot hold a streak with themself. The action is rejected before
 * any storage access and is never retried.
 *
 * GlobalExceptionHandler maps this to HTTP 400 Bad Request.
 *
 * @see com.habitsnap.service.PairKey
 */
public class InvalidPairException extends RuntimeException {

    private final UUID userId;

    public InvalidPairException(String message, UUID userId) {
        super(message);
        this.userId = userId;
    }

    public UUID getUserId() {
        return userId;
    }

    /**
     * Constructs an InvalidPairException for a self-pair.
     *
     * @param userId the user that appeared on both sides
     * @return an InvalidPairException with a formatted message
     */
    public static InvalidPairException selfPair(UUID userId) {
        return new InvalidPairException(
                String.format("User '%s' cannot hold a streak with themself.", userId),
                userId
        );
    }
}
