package com.habitsnap.messaging;

import com.habitsnap.dto.request.SnapEvent;
import com.habitsnap.dto.response.ScoreDelta;
import com.habitsnap.dto.response.StreakUpdate;
import com.habitsnap.exception.InvalidPairException;
import com.habitsnap.exception.ResourceNotFoundException;
import com.habitsnap.service.ScoringEngine;
import com.habitsnap.service.StreakEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Consumer for snap events published by the snaps module.
 *
 * This is the inbound adapter of the engine: every snap that is sent to a
 * friend or approved for a habit arrives here and is routed to the engine
 * that owns the state it changes.
 *
 * Routing:
 * - SENT: {@link StreakEngine#recordAction} for (userId → receiverId), timed at {@code occurredAt}
 * - APPROVED: {@link ScoringEngine#onApproval} for (userId, habitId) on the day of {@code occurredAt}
 *
 * Both paths use the publisher's {@code occurredAt}, never later than now, so a
 * backlog or a DLQ replay does not move an action into a different window.
 *
 * Error Handling:
 * - Payloads failing bean validation are acknowledged by {@link SnapEventErrorHandler}
 * - Self-pairs and unknown profiles can never succeed: logged and acknowledged
 * - Conflicts, timeouts and storage failures are transient: re-thrown, so the
 *   listener retries the message and finally dead-letters it to snap.events.dlq
 *
 * The "+1 per sent snap" counter of the snaps module is not applied here;
 * only approvals change the score.
 *
 * Queue Configuration:
 * - Queue: snap.events.queue (from RabbitMQConfig)
 * - Retry: spring.rabbitmq.listener.simple.retry (application.yml)
 *
 * @see com.habitsnap.config.RabbitMQConfig
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SnapEventConsumer {

    private final StreakEngine streakEngine;
    private final ScoringEngine scoringEngine;
    private final Clock clock;

    /**
     * Handles one snap event from the queue.
     *
     * @param event the deserialized and validated event
     * @throws RuntimeException for transient failures (retried, then dead-lettered)
     */
    @RabbitListener(
            queues = "${app.rabbitmq.queue.snap-events:snap.events.queue}",
            errorHandler = "snapEventErrorHandler"
    )
    public void onSnapEvent(@Valid @Payload SnapEvent event) {
        log.info("Received snap event: eventId={}, type={}, userId={}",
                event.getEventId(), event.getType(), event.getUserId());

        try {
            if (event.getType() == SnapEvent.Type.SENT) {
                handleSent(event);
            } else {
                handleApproved(event);
            }
        } catch (InvalidPairException | ResourceNotFoundException | IllegalArgumentException e) {
            log.warn("Discarding snap event that cannot be applied: eventId={}, type={}, error={}",
                    event.getEventId(), event.getType(), e.getMessage());
        }
    }

    private void handleSent(SnapEvent event) {
        if (event.getReceiverId() == null) {
            throw new IllegalArgumentException("SENT event without receiverId");
        }
        StreakUpdate update = streakEngine.recordAction(event.getUserId(), event.getReceiverId(), occurredAt(event));
        log.debug("Snap sent applied: eventId={}, currentStreak={}, increased={}",
                event.getEventId(), update.getCurrentStreak(), update.isIncreased());
    }

    private void handleApproved(SnapEvent event) {
        if (event.getHabitId() == null) {
            throw new IllegalArgumentException("APPROVED event without habitId");
        }
        LocalDate day = LocalDate.ofInstant(occurredAt(event), clock.getZone());

        ScoreDelta delta = scoringEngine.onApproval(event.getUserId(), event.getHabitId(), day);
        log.debug("Snap approval applied: eventId={}, newScore={}, newStreak={}",
                event.getEventId(), delta.getNewScore(), delta.getNewStreak());
    }

    /**
     * The publisher's timestamp, capped at now. Events without one are timed at arrival.
     */
    private Instant occurredAt(SnapEvent event) {
        Instant now = clock.instant();
        Instant occurredAt = event.getOccurredAt();
        if (occurredAt == null || occurredAt.isAfter(now)) {
            return now;
        }
        return occurredAt;
    }
}
