package com.habitsnap.service;

import com.habitsnap.exception.InvalidPairException;
import lombok.Value;

import java.util.UUID;

/**
 * Canonical key of an unordered pair of users.
 *
 * Both directions of an interaction map to the same key: {@code low} is the
 * smaller id, {@code high} the larger one. {@code lowSide} remembers which
 * side the acting user is on.
 *
 * Ids are ordered by their canonical lowercase string form. That is the order
 * PostgreSQL uses for {@code uuid} columns; {@link UUID#compareTo} compares
 * signed longs and would disagree with it for about half of all ids.
 */
@Value
public class PairKey {

    UUID low;
    UUID high;
    boolean lowSide;

    /**
     * Orders a pair of users.
     *
     * @param actorId the user performing the action
     * @param otherId the user the action is directed at
     * @return the canonical key, with {@code lowSide} describing {@code actorId}
     * @throws InvalidPairException if both ids are the same user
     * @throws IllegalArgumentException if either id is null
     */
    public static PairKey canonicalize(UUID actorId, UUID otherId) {
        if (actorId == null || otherId == null) {
            throw new IllegalArgumentException("Both user ids of a pair are required");
        }
        if (actorId.equals(otherId)) {
            throw InvalidPairException.selfPair(actorId);
        }
        return compare(actorId, otherId) < 0
                ? new PairKey(actorId, otherId, true)
                : new PairKey(otherId, actorId, false);
    }

    static int compare(UUID a, UUID b) {
        return a.toString().compareTo(b.toString());
    }
}
