package com.habitsnap.service;

import com.habitsnap.dto.response.PenaltyPolicyResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point rules for approvals and misses.
 *
 * Streak bonus: one point per full block of {@code bonusBlockDays} in the
 * habit streak (7 → 1, 14 → 2). Penalty: grows by one with every prior
 * consecutive miss, starting at {@code basePenalty} and capped at
 * {@code maxPenalty}.
 */
@Component
public class ScorePolicy {

    static final int STREAK_DECREMENT = 1;

    @Value("${app.scoring.base-penalty:1}")
    private int basePenalty;

    @Value("${app.scoring.max-penalty:3}")
    private int maxPenalty;

    @Value("${app.scoring.bonus-block-days:7}")
    private int bonusBlockDays;

    public int streakBonus(int habitStreak) {
        return habitStreak >= bonusBlockDays ? habitStreak / bonusBlockDays : 0;
    }

    /**
     * @param priorConsecutiveMisses missed days right before the one being charged
     * @return points to deduct
     */
    public int penaltyFor(int priorConsecutiveMisses) {
        return Math.min(Math.max(priorConsecutiveMisses, 0) + basePenalty, maxPenalty);
    }

    public int streakDecrement() {
        return STREAK_DECREMENT;
    }

    public PenaltyPolicyResponse describe() {
        Map<String, String> description = new LinkedHashMap<>();
        description.put("approval", "+1 point per approved day, plus 1 bonus point per full "
                + bonusBlockDays + "-day streak block");
        description.put("firstMiss", "-" + penaltyFor(0) + " point(s)");
        description.put("secondMiss", "-" + penaltyFor(1) + " point(s)");
        description.put("furtherMisses", "-" + maxPenalty + " point(s), the maximum");
        description.put("streak", "each missed day lowers the profile streak by " + STREAK_DECREMENT);
        description.put("floor", "the score never drops below 0");

        return PenaltyPolicyResponse.builder()
                .basePenalty(basePenalty)
                .maxPenalty(maxPenalty)
                .streakDecrement(STREAK_DECREMENT)
                .bonusBlockDays(bonusBlockDays)
                .description(description)
                .build();
    }
}
