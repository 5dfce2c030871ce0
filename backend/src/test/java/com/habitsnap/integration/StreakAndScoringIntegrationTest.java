package com.habitsnap.integration;

import com.habitsnap.dto.request.SnapEvent;
import com.habitsnap.dto.response.ScoreDelta;
import com.habitsnap.dto.response.StreakUpdate;
import com.habitsnap.dto.response.SweepReport;
import com.habitsnap.entity.Habit;
import com.habitsnap.entity.PairStreak;
import com.habitsnap.entity.UserScoreProfile;
import com.habitsnap.repository.HabitDayRepository;
import com.habitsnap.repository.HabitRepository;
import com.habitsnap.repository.PairStreakRepository;
import com.habitsnap.repository.UserScoreProfileRepository;
import com.habitsnap.service.PenaltySweep;
import com.habitsnap.service.ScoringEngine;
import com.habitsnap.service.StreakEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the streak and scoring engines.
 *
 * Runs the engines against PostgreSQL, Redis and RabbitMQ containers:
 * - Pair streak scenario through the JPA store
 * - Opposite-direction actions racing on one row
 * - Approval, miss and sweep idempotence on the real ledger
 * - Snap events delivered through the broker
 *
 * Skipped when Docker is not available.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Streak and Scoring Integration Tests")
class StreakAndScoringIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgresContainer = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("habitsnap_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    @SuppressWarnings("rawtypes")
    static GenericContainer redisContainer = new GenericContainer("redis:7-alpine")
            .withExposedPorts(6379);

    @Container
    static RabbitMQContainer rabbitMQContainer = new RabbitMQContainer(
            DockerImageName.parse("rabbitmq:3.13-management-alpine"));

    @Autowired
    private StreakEngine streakEngine;

    @Autowired
    private ScoringEngine scoringEngine;

    @Autowired
    private PenaltySweep penaltySweep;

    @Autowired
    private PairStreakRepository pairStreakRepository;

    @Autowired
    private UserScoreProfileRepository userScoreProfileRepository;

    @Autowired
    private HabitRepository habitRepository;

    @Autowired
    private HabitDayRepository habitDayRepository;

    @Autowired
    private RabbitTemplate rabbitTemplate;

    @Value("${app.rabbitmq.exchange.snap-events}")
    private String snapEventsExchange;

    @Value("${app.rabbitmq.routing-key.snap-events}")
    private String snapEventsRoutingKey;

    @Value("${app.rabbitmq.queue.snap-events-dlq}")
    private String snapEventsDlq;

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2024, 3, 10);

    private UUID alice;
    private UUID bob;

    /**
     * Configure dynamic properties for TestContainers.
     */
    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgresContainer::getJdbcUrl);
        registry.add("spring.datasource.username", postgresContainer::getUsername);
        registry.add("spring.datasource.password", postgresContainer::getPassword);
        registry.add("spring.data.redis.host", redisContainer::getHost);
        registry.add("spring.data.redis.port", () -> redisContainer.getMappedPort(6379));
        registry.add("spring.rabbitmq.host", rabbitMQContainer::getHost);
        registry.add("spring.rabbitmq.port", rabbitMQContainer::getAmqpPort);
    }

    @BeforeEach
    void setUp() {
        habitDayRepository.deleteAll();
        habitRepository.deleteAll();
        pairStreakRepository.deleteAll();
        userScoreProfileRepository.deleteAll();

        alice = UUID.randomUUID();
        bob = UUID.randomUUID();
        userScoreProfileRepository.save(UserScoreProfile.forUser(alice));
        userScoreProfileRepository.save(UserScoreProfile.forUser(bob));
    }

    @Test
    @DisplayName("act, answer within a day, then lapse should increase then reset the pair streak")
    void testPairStreakScenario() {
        // Act & Assert
        StreakUpdate first = streakEngine.recordAction(alice, bob, T0);
        assertFalse(first.isIncreased());
        assertEquals(0, first.getCurrentStreak());

        StreakUpdate second = streakEngine.recordAction(bob, alice, T0.plus(Duration.ofHours(1)));
        assertTrue(second.isIncreased());
        assertEquals(1, second.getCurrentStreak());

        StreakUpdate third = streakEngine.recordAction(alice, bob, T0.plus(Duration.ofHours(26)));
        assertFalse(third.isIncreased());
        assertEquals(0, third.getCurrentStreak());
        assertEquals(1, third.getLongestStreak());

        assertEquals(1, pairStreakRepository.count());
    }

    @Test
    @DisplayName("opposite-direction actions at the same time should increment the stored streak exactly once")
    void testConcurrentOppositeActions() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            // Act
            List<Future<StreakUpdate>> results = new ArrayList<>();
            results.add(executor.submit(() -> {
                start.await();
                return streakEngine.recordAction(alice, bob, T0);
            }));
            results.add(executor.submit(() -> {
                start.await();
                return streakEngine.recordAction(bob, alice, T0.plusMillis(10));
            }));
            start.countDown();

            int increments = 0;
            for (Future<StreakUpdate> result : results) {
                if (result.get(30, TimeUnit.SECONDS).isIncreased()) {
                    increments++;
                }
            }

            // Assert
            assertEquals(1, increments);
            PairStreak stored = streakEngine.getPairStreak(alice, bob).orElseThrow();
            assertEquals(1, stored.getCurrentStreak());
            assertNull(stored.getLastActionLow());
            assertNull(stored.getLastActionHigh());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("sweeping the same day twice should charge the miss once")
    void testPenaltySweepIdempotent() {
        // Arrange
        UUID habitId = UUID.randomUUID();
        habitRepository.save(new Habit(habitId, alice, "Read 10 pages", true));
        scoringEngine.onApproval(alice, habitId, DAY.minusDays(2));
        scoringEngine.onApproval(alice, habitId, DAY.minusDays(1));

        // Act
        SweepReport first = penaltySweep.run(DAY);
        SweepReport second = penaltySweep.run(DAY);

        // Assert
        assertEquals(1, first.getPenalized());
        assertEquals(0, second.getPenalized());
        assertEquals(1, second.getSkipped());

        UserScoreProfile profile = userScoreProfileRepository.findById(alice).orElseThrow();
        assertEquals(1, profile.getScore());
        assertEquals(1, profile.getCurrentStreak());
        assertEquals(2, profile.getLongestStreak());
        assertEquals(1, habitDayRepository.findByUserIdAndHabitIdAndDay(alice, habitId, DAY)
                .orElseThrow().getPenaltyApplied());
    }

    @Test
    @DisplayName("consecutive misses should cost 1, 2, then 3 points")
    void testProgressivePenalty() {
        // Arrange
        UUID habitId = UUID.randomUUID();
        userScoreProfileRepository.save(userScoreProfileRepository.findById(alice).orElseThrow()
                .toBuilder().score(20).build());

        // Act
        ScoreDelta first = scoringEngine.onMiss(alice, habitId, DAY);
        ScoreDelta second = scoringEngine.onMiss(alice, habitId, DAY.plusDays(1));
        ScoreDelta third = scoringEngine.onMiss(alice, habitId, DAY.plusDays(2));
        ScoreDelta fourth = scoringEngine.onMiss(alice, habitId, DAY.plusDays(3));

        // Assert
        assertEquals(1, first.getPenalty());
        assertEquals(2, second.getPenalty());
        assertEquals(3, third.getPenalty());
        assertEquals(3, fourth.getPenalty());
        assertEquals(11, fourth.getNewScore());
    }

    @Test
    @DisplayName("snap events published to the broker should update the pair streak")
    void testSnapEventsThroughBroker() throws Exception {
        // Act
        rabbitTemplate.convertAndSend(snapEventsExchange, snapEventsRoutingKey, SnapEvent.builder()
                .eventId(UUID.randomUUID())
                .type(SnapEvent.Type.SENT)
                .userId(alice)
                .receiverId(bob)
                .build());
        rabbitTemplate.convertAndSend(snapEventsExchange, snapEventsRoutingKey, SnapEvent.builder()
                .eventId(UUID.randomUUID())
                .type(SnapEvent.Type.SENT)
                .userId(bob)
                .receiverId(alice)
                .build());

        // Assert
        int streak = 0;
        for (int i = 0; i < 50 && streak == 0; i++) {
            Thread.sleep(200);
            streak = streakEngine.getPairStreak(alice, bob).map(PairStreak::getCurrentStreak).orElse(0);
        }
        assertEquals(1, streak);
    }

    @Test
    @DisplayName("an event failing validation should be acknowledged and not dead-lettered")
    void testInvalidSnapEventDiscarded() throws Exception {
        // Act: the invalid event is queued ahead of a valid pair
        rabbitTemplate.convertAndSend(snapEventsExchange, snapEventsRoutingKey, SnapEvent.builder()
                .eventId(UUID.randomUUID())
                .type(SnapEvent.Type.SENT)
                .receiverId(bob)
                .build());
        rabbitTemplate.convertAndSend(snapEventsExchange, snapEventsRoutingKey, SnapEvent.builder()
                .type(SnapEvent.Type.SENT)
                .userId(alice)
                .receiverId(bob)
                .build());
        rabbitTemplate.convertAndSend(snapEventsExchange, snapEventsRoutingKey, SnapEvent.builder()
                .type(SnapEvent.Type.SENT)
                .userId(bob)
                .receiverId(alice)
                .build());

        // Assert
        int streak = 0;
        for (int i = 0; i < 50 && streak == 0; i++) {
            Thread.sleep(200);
            streak = streakEngine.getPairStreak(alice, bob).map(PairStreak::getCurrentStreak).orElse(0);
        }
        assertEquals(1, streak);
        assertNull(rabbitTemplate.receive(snapEventsDlq));
    }
}
