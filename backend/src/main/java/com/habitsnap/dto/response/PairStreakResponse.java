package com.habitsnap.dto.response;

import com.habitsnap.entity.PairStreak;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A pair streak seen from one member's side.
 *
 * The stored record is ordered by user id; this view swaps the sides so that
 * "my" fields always belong to the viewer.
 *
 * Example JSON:
 * <pre>
 * {
 *   "id": "0c6f...",
 *   "friendId": "987fcdeb-51a2-43f1-a456-426614174999",
 *   "currentStreak": 3,
 *   "longestStreak": 12,
 *   "myLastActionAt": null,
 *   "friendLastActionAt": "2024-03-01T09:12:00Z",
 *   "streakStartedAt": "2024-02-27T20:00:00Z",
 *   "streakExpiresAt": "2024-03-02T09:12:00Z",
 *   "active": true,
 *   "needsMyAction": true,
 *   "needsFriendAction": false
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PairStreakResponse {

    private UUID id;

    private UUID friendId;

    private int currentStreak;

    private int longestStreak;

    private Instant myLastActionAt;

    private Instant friendLastActionAt;

    private Instant streakStartedAt;

    private Instant streakExpiresAt;

    private boolean active;

    /**
     * The friend has acted in the open cycle and the viewer has not.
     */
    private boolean needsMyAction;

    /**
     * The viewer has acted in the open cycle and the friend has not.
     */
    private boolean needsFriendAction;

    /**
     * Builds the view of {@code streak} for {@code viewerId}.
     *
     * @param streak the stored record
     * @param viewerId one member of the pair
     * @return the record from the viewer's side
     */
    public static PairStreakResponse forViewer(PairStreak streak, UUID viewerId) {
        boolean viewerIsLow = streak.getUserLowId().equals(viewerId);
        Instant mine = streak.lastActionOf(viewerIsLow);
        Instant friends = streak.lastActionOf(!viewerIsLow);

        return PairStreakResponse.builder()
                .id(streak.getId())
                .friendId(streak.otherUser(viewerId))
                .currentStreak(streak.getCurrentStreak())
                .longestStreak(streak.getLongestStreak())
                .myLastActionAt(mine)
                .friendLastActionAt(friends)
                .streakStartedAt(streak.getStreakStartedAt())
                .streakExpiresAt(streak.getStreakExpiresAt())
                .active(streak.getCurrentStreak() > 0)
                .needsMyAction(mine == null && friends != null)
                .needsFriendAction(mine != null && friends == null)
                .build();
    }
}
