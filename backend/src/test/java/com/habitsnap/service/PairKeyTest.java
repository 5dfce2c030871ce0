package com.habitsnap.service;

import com.habitsnap.exception.InvalidPairException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PairKey.
 */
@DisplayName("PairKey Unit Tests")
class PairKeyTest {

    private static final UUID LOW = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID HIGH = UUID.fromString("22222222-2222-2222-2222-222222222222");

    @Test
    @DisplayName("canonicalize should give the same pair for both directions")
    void testCanonicalize_BothDirections() {
        // Act
        PairKey forward = PairKey.canonicalize(LOW, HIGH);
        PairKey backward = PairKey.canonicalize(HIGH, LOW);

        // Assert
        assertEquals(LOW, forward.getLow());
        assertEquals(HIGH, forward.getHigh());
        assertEquals(forward.getLow(), backward.getLow());
        assertEquals(forward.getHigh(), backward.getHigh());
        assertTrue(forward.isLowSide());
        assertFalse(backward.isLowSide());
    }

    @Test
    @DisplayName("canonicalize should order ids by their string form, not by UUID.compareTo")
    void testCanonicalize_StringOrder() {
        // Arrange: the most significant bits of the first id are negative as a signed long
        UUID a = UUID.fromString("90000000-0000-0000-0000-000000000000");
        UUID b = UUID.fromString("10000000-0000-0000-0000-000000000000");
        assertTrue(a.compareTo(b) < 0, "precondition: signed compare puts a first");

        // Act
        PairKey key = PairKey.canonicalize(a, b);

        // Assert
        assertEquals(b, key.getLow());
        assertEquals(a, key.getHigh());
        assertFalse(key.isLowSide());
    }

    @Test
    @DisplayName("canonicalize should reject a self-pair")
    void testCanonicalize_SelfPair() {
        // Act & Assert
        InvalidPairException exception = assertThrows(InvalidPairException.class,
                () -> PairKey.canonicalize(LOW, LOW));
        assertEquals(LOW, exception.getUserId());
    }

    @Test
    @DisplayName("canonicalize should reject null ids")
    void testCanonicalize_NullIds() {
        assertThrows(IllegalArgumentException.class, () -> PairKey.canonicalize(null, HIGH));
        assertThrows(IllegalArgumentException.class, () -> PairKey.canonicalize(LOW, null));
    }
}
