package com.habitsnap.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Global exception handler for REST API endpoints.
 *
 * Converts engine and request errors into RFC 7807 problem details:
 * <pre>
 * {
 *   "type": "https://api.habitsnap.app/errors/concurrent-update",
 *   "title": "Concurrent Update",
 *   "status": 409,
 *   "detail": "Update of pair-streak '...' lost to concurrent writers 5 times in a row. Please retry.",
 *   "instance": "/api/admin/penalty-sweep",
 *   "timestamp": "2024-02-26T10:30:00"
 * }
 * </pre>
 *
 * <p>Mapping:
 * <ul>
 *   <li>400: self-pair actions, malformed parameters or bodies</li>
 *   <li>404: unknown profile or habit</li>
 *   <li>409: optimistic retries exhausted</li>
 *   <li>503: store unavailable, deadline exceeded</li>
 *   <li>500: anything else</li>
 * </ul>
 *
 * A failed engine call is always reported as an error; the API never answers
 * with stale streak or score numbers.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String BASE_ERROR_URI = "https://api.habitsnap.app/errors";
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;

    @ExceptionHandler(InvalidPairException.class)
    public ResponseEntity<ProblemDetail> handleInvalidPairException(
            InvalidPairException ex,
            WebRequest request
    ) {
        log.warn("Invalid pair rejected: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Pair",
                ex.getMessage(),
                request,
                "invalid-pair"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            WebRequest request
    ) {
        log.warn("Resource not found: type={}, id={}", ex.getResourceType(), ex.getResourceId());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.NOT_FOUND,
                "Resource Not Found",
                ex.getMessage(),
                request,
                "resource-not-found"
        );
        problemDetail.setProperty("resourceType", ex.getResourceType());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    /**
     * Handles ConcurrentUpdateException - optimistic retries exhausted.
     *
     * Mapped to HTTP 409 Conflict so clients know the action can be retried.
     */
    @ExceptionHandler(ConcurrentUpdateException.class)
    public ResponseEntity<ProblemDetail> handleConcurrentUpdateException(
            ConcurrentUpdateException ex,
            WebRequest request
    ) {
        log.warn("Concurrent update conflict: resource={}, attempts={}", ex.getResource(), ex.getAttempts());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.CONFLICT,
                "Concurrent Update",
                ex.getMessage(),
                request,
                "concurrent-update"
        );
        problemDetail.setProperty("errorCode", "CONCURRENT_UPDATE");
        problemDetail.setProperty("attempts", ex.getAttempts());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(problemDetail);
    }

    @ExceptionHandler(OperationTimeoutException.class)
    public ResponseEntity<ProblemDetail> handleOperationTimeoutException(
            OperationTimeoutException ex,
            WebRequest request
    ) {
        log.warn("Operation timed out: operation={}, deadline={}", ex.getOperation(), ex.getDeadline());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Operation Timed Out",
                ex.getMessage(),
                request,
                "operation-timeout"
        );
        problemDetail.setProperty("errorCode", "TIMEOUT");

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problemDetail);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ProblemDetail> handleStorageException(
            StorageException ex,
            WebRequest request
    ) {
        log.error("Storage failure: store={}, operation={}", ex.getStore(), ex.getOperation(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Storage Unavailable",
                "The score store is temporarily unavailable. Please try again later.",
                request,
                "storage-unavailable"
        );
        problemDetail.setProperty("errorCode", "STORAGE_UNAVAILABLE");

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problemDetail);
    }

    /**
     * Handles MethodArgumentTypeMismatchException - e.g. a path variable that is not a UUID.
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex,
            WebRequest request
    ) {
        log.warn("Request parameter type mismatch: name={}, value={}", ex.getName(), ex.getValue());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Parameter",
                String.format("Parameter '%s' has an invalid value '%s'.", ex.getName(), ex.getValue()),
                request,
                "invalid-parameter"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.warn("Request body parsing failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Request Body",
                "The request body is malformed or contains invalid JSON. Please check your request format.",
                request,
                "invalid-request-body"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(
            IllegalArgumentException ex,
            WebRequest request
    ) {
        log.warn("Invalid argument: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                ex.getMessage(),
                request,
                "invalid-argument"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Fallback handler for all unhandled exceptions. Logs the full stack trace.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnhandledException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later or contact support if the issue persists.",
                request,
                "internal-error"
        );
        problemDetail.setProperty("errorId", generateErrorId());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    private ProblemDetail createProblemDetail(
            HttpStatus status,
            String title,
            String detail,
            WebRequest request,
            String errorType
    ) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);

        problemDetail.setType(URI.create(String.format("%s/%s", BASE_ERROR_URI, errorType)));
        problemDetail.setTitle(title);
        problemDetail.setStatus(status.value());

        String description = request.getDescription(false);
        if (description != null && description.startsWith("uri=")) {
            problemDetail.setInstance(URI.create(description.substring(4)));
        }

        problemDetail.setProperty("timestamp", LocalDateTime.now().format(TIMESTAMP_FORMATTER));

        return problemDetail;
    }

    private String generateErrorId() {
        return String.format("ERR-%d", System.currentTimeMillis());
    }
}
