package com.ryuqq.registry.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TicketId Value Object 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class TicketIdTest {

    @Test
    void of_ValidValue_CreatesTicketId() {
        // Given
        String value = "ticket-12345";

        // When
        TicketId id = TicketId.of(value);

        // Then
        assertNotNull(id);
        assertEquals(value, id.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> TicketId.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> TicketId.of("   ")
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_TooLongValue_ThrowsException() {
        // Given
        String value = "a".repeat(256);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> TicketId.of(value)
        );
        assertTrue(exception.getMessage().contains("255"));
    }

    @Test
    void of_MaxLengthValue_CreatesTicketId() {
        assertEquals(255, TicketId.of("a".repeat(255)).getValue().length());
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        TicketId id1 = TicketId.of("ticket-1");
        TicketId id2 = TicketId.of("ticket-1");

        // Then
        assertEquals(id1, id2);
        assertEquals(id1.hashCode(), id2.hashCode());
    }

    @Test
    void equals_DifferentValue_ReturnsFalse() {
        assertNotEquals(TicketId.of("ticket-1"), TicketId.of("ticket-2"));
    }

    @Test
    void toString_ContainsValue() {
        assertEquals("TicketId{ticket-1}", TicketId.of("ticket-1").toString());
    }
}
