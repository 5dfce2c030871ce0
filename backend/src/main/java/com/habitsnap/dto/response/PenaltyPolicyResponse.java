package com.habitsnap.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Current bonus and penalty rules, for display in the client.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PenaltyPolicyResponse {

    private int basePenalty;

    private int maxPenalty;

    private int streakDecrement;

    private int bonusBlockDays;

    private Map<String, String> description;
}
