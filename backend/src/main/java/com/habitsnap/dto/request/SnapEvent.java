package com.habitsnap.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Snap event published by the snaps module and consumed from RabbitMQ.
 *
 * SENT events carry {@code receiverId} and feed the pair streak between
 * sender and receiver. APPROVED events carry {@code habitId} and feed the
 * sender's habit ledger and score.
 *
 * Example JSON:
 * <pre>
 * {
 *   "eventId": "3f1c0a52-7a0e-4d7e-9a43-8c2f0e0b1d11",
 *   "type": "SENT",
 *   "userId": "550e8400-e29b-41d4-a716-446655440000",
 *   "receiverId": "987fcdeb-51a2-43f1-a456-426614174999",
 *   "occurredAt": "2024-03-01T09:12:00Z"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapEvent {

    /**
     * Publisher-assigned id, used for log correlation.
     */
    private UUID eventId;

    @NotNull(message = "Event type is required")
    private Type type;

    /**
     * The user who sent (or whose snap was approved).
     */
    @NotNull(message = "User id is required")
    private UUID userId;

    private UUID receiverId;

    private UUID habitId;

    private Instant occurredAt;

    public enum Type {
        SENT,
        APPROVED
    }
}
