package com.habitsnap.service;

import com.habitsnap.dto.response.PenaltyPolicyResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScorePolicy Unit Tests")
class ScorePolicyTest {

    private ScorePolicy scorePolicy;

    @BeforeEach
    void setUp() {
        scorePolicy = new ScorePolicy();
        ReflectionTestUtils.setField(scorePolicy, "basePenalty", 1);
        ReflectionTestUtils.setField(scorePolicy, "maxPenalty", 3);
        ReflectionTestUtils.setField(scorePolicy, "bonusBlockDays", 7);
    }

    @Test
    @DisplayName("streak bonus should be one point per full 7-day block")
    void testStreakBonus() {
        assertEquals(0, scorePolicy.streakBonus(0));
        assertEquals(0, scorePolicy.streakBonus(6));
        assertEquals(1, scorePolicy.streakBonus(7));
        assertEquals(1, scorePolicy.streakBonus(13));
        assertEquals(2, scorePolicy.streakBonus(14));
        assertEquals(3, scorePolicy.streakBonus(21));
    }

    @Test
    @DisplayName("penalty should grow with prior misses and cap at 3")
    void testPenaltyFor() {
        assertEquals(1, scorePolicy.penaltyFor(0));
        assertEquals(2, scorePolicy.penaltyFor(1));
        assertEquals(3, scorePolicy.penaltyFor(2));
        assertEquals(3, scorePolicy.penaltyFor(5));
    }

    @Test
    @DisplayName("describe should report the configured rules")
    void testDescribe() {
        // Act
        PenaltyPolicyResponse policy = scorePolicy.describe();

        // Assert
        assertEquals(1, policy.getBasePenalty());
        assertEquals(3, policy.getMaxPenalty());
        assertEquals(1, policy.getStreakDecrement());
        assertEquals(7, policy.getBonusBlockDays());
        assertEquals("-2 point(s)", policy.getDescription().get("secondMiss"));
    }
}
