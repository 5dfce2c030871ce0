package com.habitsnap.messaging;

import com.habitsnap.dto.request.SnapEvent;
import com.habitsnap.dto.response.ScoreDelta;
import com.habitsnap.dto.response.StreakUpdate;
import com.habitsnap.entity.PairStreak;
import com.habitsnap.exception.ConcurrentUpdateException;
import com.habitsnap.exception.InvalidPairException;
import com.habitsnap.exception.ResourceNotFoundException;
import com.habitsnap.service.InMemoryPairStreakStore;
import com.habitsnap.service.ScoringEngine;
import com.habitsnap.service.StreakEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SnapEventConsumer.
 *
 * Tests the inbound adapter including:
 * - Routing SENT events to the streak engine at the time they were sent
 * - Routing APPROVED events to the scoring engine
 * - Acknowledging events that can never succeed
 * - Re-throwing transient failures for redelivery
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SnapEventConsumer Unit Tests")
class SnapEventConsumerTest {

    @Mock
    private StreakEngine streakEngine;

    @Mock
    private ScoringEngine scoringEngine;

    private SnapEventConsumer snapEventConsumer;

    private static final Instant NOW = Instant.parse("2024-03-11T00:30:00Z");
    private static final UUID SENDER = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID RECEIVER = UUID.fromString("22222222-2222-2222-2222-222222222222");
    private static final UUID HABIT = UUID.fromString("aaaaaaaa-aaaa-aaaa-aaaa-aaaaaaaaaaaa");

    @BeforeEach
    void setUp() {
        snapEventConsumer = new SnapEventConsumer(streakEngine, scoringEngine, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static SnapEvent sent() {
        return SnapEvent.builder()
                .eventId(UUID.randomUUID())
                .type(SnapEvent.Type.SENT)
                .userId(SENDER)
                .receiverId(RECEIVER)
                .build();
    }

    @Test
    @DisplayName("SENT event without a timestamp should record a pair action at arrival time")
    void testOnSnapEvent_Sent() {
        // Arrange
        when(streakEngine.recordAction(SENDER, RECEIVER, NOW))
                .thenReturn(StreakUpdate.builder().currentStreak(1).increased(true).build());

        // Act
        snapEventConsumer.onSnapEvent(sent());

        // Assert
        verify(streakEngine).recordAction(SENDER, RECEIVER, NOW);
        verifyNoInteractions(scoringEngine);
    }

    @Test
    @DisplayName("SENT event should record the pair action at the time it occurred")
    void testOnSnapEvent_SentUsesOccurredAt() {
        // Arrange
        Instant sentAt = NOW.minus(Duration.ofHours(3));
        SnapEvent event = sent();
        event.setOccurredAt(sentAt);
        when(streakEngine.recordAction(SENDER, RECEIVER, sentAt))
                .thenReturn(StreakUpdate.builder().build());

        // Act
        snapEventConsumer.onSnapEvent(event);

        // Assert
        verify(streakEngine).recordAction(SENDER, RECEIVER, sentAt);
    }

    @Test
    @DisplayName("SENT event stamped in the future should be capped at now")
    void testOnSnapEvent_SentFutureTimestampCapped() {
        // Arrange
        SnapEvent event = sent();
        event.setOccurredAt(NOW.plus(Duration.ofHours(2)));
        when(streakEngine.recordAction(SENDER, RECEIVER, NOW))
                .thenReturn(StreakUpdate.builder().build());

        // Act
        snapEventConsumer.onSnapEvent(event);

        // Assert
        verify(streakEngine).recordAction(SENDER, RECEIVER, NOW);
    }

    @Test
    @DisplayName("a reply delivered late but sent after the window should reset, not increase, the streak")
    void testOnSnapEvent_LateDeliveryJudgedBySendTime() {
        // Arrange: both events reach the consumer 26 hours after the first snap was sent
        Instant firstSentAt = Instant.parse("2024-03-01T10:00:00Z");
        Clock lateClock = Clock.fixed(firstSentAt.plus(Duration.ofHours(26)), ZoneOffset.UTC);
        StreakEngine realEngine = new StreakEngine(new InMemoryPairStreakStore(), lateClock);
        ReflectionTestUtils.setField(realEngine, "windowHours", 24L);
        ReflectionTestUtils.setField(realEngine, "maxRetries", 5);
        ReflectionTestUtils.setField(realEngine, "defaultTimeoutMs", 2000L);
        SnapEventConsumer lateConsumer = new SnapEventConsumer(realEngine, scoringEngine, lateClock);

        SnapEvent first = sent();
        first.setOccurredAt(firstSentAt);
        SnapEvent reply = SnapEvent.builder()
                .eventId(UUID.randomUUID())
                .type(SnapEvent.Type.SENT)
                .userId(RECEIVER)
                .receiverId(SENDER)
                .occurredAt(firstSentAt.plus(Duration.ofHours(25)))
                .build();

        // Act
        lateConsumer.onSnapEvent(first);
        lateConsumer.onSnapEvent(reply);

        // Assert
        PairStreak streak = realEngine.getPairStreak(SENDER, RECEIVER).orElseThrow();
        assertEquals(0, streak.getCurrentStreak());
        assertEquals(0, streak.getLongestStreak());
        assertEquals(firstSentAt.plus(Duration.ofHours(49)), streak.getStreakExpiresAt());
    }

    @Test
    @DisplayName("APPROVED event should score the habit on the day it occurred")
    void testOnSnapEvent_Approved() {
        // Arrange
        SnapEvent event = SnapEvent.builder()
                .eventId(UUID.randomUUID())
                .type(SnapEvent.Type.APPROVED)
                .userId(SENDER)
                .habitId(HABIT)
                .occurredAt(Instant.parse("2024-03-10T23:59:00Z"))
                .build();
        when(scoringEngine.onApproval(SENDER, HABIT, LocalDate.of(2024, 3, 10)))
                .thenReturn(ScoreDelta.builder().newScore(5).applied(true).build());

        // Act
        snapEventConsumer.onSnapEvent(event);

        // Assert
        verify(scoringEngine).onApproval(SENDER, HABIT, LocalDate.of(2024, 3, 10));
        verifyNoInteractions(streakEngine);
    }

    @Test
    @DisplayName("APPROVED event without a timestamp should use today")
    void testOnSnapEvent_ApprovedWithoutTimestamp() {
        // Arrange
        SnapEvent event = SnapEvent.builder().type(SnapEvent.Type.APPROVED).userId(SENDER).habitId(HABIT).build();
        when(scoringEngine.onApproval(SENDER, HABIT, LocalDate.of(2024, 3, 11)))
                .thenReturn(ScoreDelta.builder().applied(true).build());

        // Act
        snapEventConsumer.onSnapEvent(event);

        // Assert
        verify(scoringEngine).onApproval(SENDER, HABIT, LocalDate.of(2024, 3, 11));
    }

    @Test
    @DisplayName("events missing the id their type needs should be acknowledged without engine calls")
    void testOnSnapEvent_MissingTargetId() {
        // Act
        snapEventConsumer.onSnapEvent(SnapEvent.builder().type(SnapEvent.Type.SENT).userId(SENDER).build());
        snapEventConsumer.onSnapEvent(SnapEvent.builder().type(SnapEvent.Type.APPROVED).userId(SENDER).build());

        // Assert
        verifyNoInteractions(streakEngine, scoringEngine);
    }

    @Test
    @DisplayName("self-pair and unknown profile errors should not be re-thrown")
    void testOnSnapEvent_NonRetryableErrors() {
        // Arrange
        when(streakEngine.recordAction(any(), any(), any(Instant.class)))
                .thenThrow(InvalidPairException.selfPair(SENDER));
        when(scoringEngine.onApproval(any(), any(), any(LocalDate.class)))
                .thenThrow(ResourceNotFoundException.profile(SENDER));
        SnapEvent approved = SnapEvent.builder().type(SnapEvent.Type.APPROVED).userId(SENDER).habitId(HABIT).build();

        // Act & Assert
        assertDoesNotThrow(() -> snapEventConsumer.onSnapEvent(sent()));
        assertDoesNotThrow(() -> snapEventConsumer.onSnapEvent(approved));
    }

    @Test
    @DisplayName("conflicts should be re-thrown so the broker redelivers")
    void testOnSnapEvent_ConflictRethrown() {
        // Arrange
        when(streakEngine.recordAction(any(), any(), any(Instant.class)))
                .thenThrow(ConcurrentUpdateException.retriesExhausted("pair streak", "a:b", 5));

        // Act & Assert
        assertThrows(ConcurrentUpdateException.class, () -> snapEventConsumer.onSnapEvent(sent()));
    }
}
