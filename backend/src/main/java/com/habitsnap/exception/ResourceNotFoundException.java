package com.habitsnap.exception;

/**
 * Exception thrown when a referenced profile or habit does not exist.
 *
 * Surfaced to the caller, never retried. GlobalExceptionHandler maps this to
 * HTTP 404 Not Found.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId, String message) {
        super(message);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    /**
     * Constructs a ResourceNotFoundException for a missing score profile.
     *
     * @param userId the user whose profile is missing
     * @return a ResourceNotFoundException with a formatted message
     */
    public static ResourceNotFoundException profile(Object userId) {
        return new ResourceNotFoundException(
                "profile",
                String.valueOf(userId),
                String.format("Score profile for user '%s' does not exist.", userId)
        );
    }

    /**
     * Constructs a ResourceNotFoundException for a missing habit.
     *
     * @param habitId the habit that is missing
     * @return a ResourceNotFoundException with a formatted message
     */
    public static ResourceNotFoundException habit(Object habitId) {
        return new ResourceNotFoundException(
                "habit",
                String.valueOf(habitId),
                String.format("Habit '%s' does not exist.", habitId)
        );
    }
}
