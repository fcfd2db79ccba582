package com.ryuqq.registry.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ticket record 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class TicketTest {

    private static final TicketId ID = TicketId.of("t-1");

    @Test
    void positional_ResolvedValueIsPosition() {
        // When
        Ticket<String> ticket = Ticket.positional(ID, 3);

        // Then
        assertTrue(ticket.valueIsPosition());
        assertNull(ticket.value());
        assertEquals(3, ticket.resolvedValue());
    }

    @Test
    void valued_ResolvedValueIsValue() {
        // When
        Ticket<String> ticket = Ticket.valued(ID, 3, "three");

        // Then
        assertFalse(ticket.valueIsPosition());
        assertEquals("three", ticket.resolvedValue());
    }

    @Test
    void valued_NullValue_ResolvesToNull() {
        Ticket<String> ticket = Ticket.valued(ID, 0, null);

        assertFalse(ticket.valueIsPosition());
        assertNull(ticket.resolvedValue());
    }

    @Test
    void constructor_NullId_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Ticket.positional(null, 0));
    }

    @Test
    void constructor_NegativePosition_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Ticket.positional(ID, -1)
        );
        assertTrue(exception.getMessage().contains("-1"));
    }

    @Test
    void constructor_PositionalWithValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Ticket<>(ID, 0, "x", true));
    }

    @Test
    void withPosition_SamePosition_ReturnsSameInstance() {
        Ticket<String> ticket = Ticket.valued(ID, 2, "x");

        assertSame(ticket, ticket.withPosition(2));
    }

    @Test
    void withPosition_Positional_MovesResolvedValue() {
        // Given
        Ticket<String> ticket = Ticket.positional(ID, 2);

        // When
        Ticket<String> moved = ticket.withPosition(0);

        // Then
        assertEquals(0, moved.position());
        assertEquals(0, moved.resolvedValue());
        assertEquals(2, ticket.position(), "original snapshot is unchanged");
    }

    @Test
    void equals_ComparesIdOnly() {
        // Given
        Ticket<String> a = Ticket.valued(ID, 0, "x");
        Ticket<String> b = Ticket.positional(ID, 5);

        // Then
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, Ticket.valued(TicketId.of("t-2"), 0, "x"));
    }
}
