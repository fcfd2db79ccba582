package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.model.TicketId;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TicketIdGenerator 기본 구현 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class TicketIdGeneratorTest {

    @Test
    void sequential_CountsFromOne() {
        // Given
        TicketIdGenerator generator = TicketIdGenerator.sequential("t");

        // Then
        assertEquals(TicketId.of("t-1"), generator.next());
        assertEquals(TicketId.of("t-2"), generator.next());
    }

    @Test
    void sequential_Instances_AreIndependent() {
        TicketIdGenerator first = TicketIdGenerator.sequential("x");
        first.next();

        assertEquals(TicketId.of("x-1"), TicketIdGenerator.sequential("x").next());
    }

    @Test
    void sequential_BlankPrefix_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> TicketIdGenerator.sequential(" "));
    }

    @Test
    void uuid_GeneratesDistinctIds() {
        // Given
        TicketIdGenerator generator = TicketIdGenerator.uuid();
        Set<TicketId> ids = new HashSet<>();

        // When
        for (int i = 0; i < 1000; i++) {
            ids.add(generator.next());
        }

        // Then
        assertEquals(1000, ids.size());
    }
}
