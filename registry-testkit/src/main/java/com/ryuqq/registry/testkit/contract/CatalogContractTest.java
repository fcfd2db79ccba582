package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.core.model.CatalogMatch;
import com.ryuqq.registry.core.model.TicketPatch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: reverse lookup by value.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>One ticket per value → {@link CatalogMatch.Single}</li>
 *   <li>Shared value → {@link CatalogMatch.Many} in insertion order</li>
 *   <li>Removing down to one ticket collapses back to Single</li>
 *   <li>Position-derived values follow reindexing</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public abstract class CatalogContractTest extends AbstractRegistryContractTest {

    @Test
    void browse_SharedValue_ReturnsAllIdsInInsertionOrder() {
        // Given
        registerAll("a");
        registerValued("b", "x");
        registerValued("c", "x");

        // When
        CatalogMatch match = registry.browse("x");

        // Then
        assertInstanceOf(CatalogMatch.Many.class, match);
        assertEquals(List.of(id("b"), id("c")), match.ids());
        assertEquals(3, registry.size());
    }

    @Test
    void browse_UniqueValue_ReturnsSingle() {
        // Given
        registerValued("a", "apple");

        // When
        CatalogMatch match = registry.browse("apple");

        // Then
        assertEquals(new CatalogMatch.Single(id("a")), match);
    }

    @Test
    void browse_UnknownValue_ReturnsNull() {
        registerValued("a", "apple");

        assertNull(registry.browse("pear"));
    }

    @Test
    void browse_AfterRemovingOneOfTwo_CollapsesToSingle() {
        // Given
        registerValued("b", "x");
        registerValued("c", "x");

        // When
        registry.unregister("b");

        // Then
        CatalogMatch match = registry.browse("x");
        assertInstanceOf(CatalogMatch.Single.class, match);
        assertEquals(List.of(id("c")), match.ids());
    }

    @Test
    void browse_AfterRemovingLastCarrier_ReturnsNull() {
        // Given
        registerValued("b", "x");
        registry.upsert("c", TicketPatch.set("x"));

        // When
        registry.offboard(List.of(id("b"), id("c")));

        // Then
        assertNull(registry.browse("x"));
    }

    @Test
    void browse_PositionDerivedValues_FollowReindex() {
        // Given
        registerAll("a", "b", "c");

        // When
        registry.unregister("a");

        // Then
        assertEquals(new CatalogMatch.Single(id("b")), registry.browse(0));
        assertEquals(new CatalogMatch.Single(id("c")), registry.browse(1));
        assertNull(registry.browse(2));
        assertInvariants();
    }

    @Test
    void browse_PositionDerivedAfterOffboard_SettlesLazily() {
        // Given
        registerAll("a", "b", "c", "d");

        // When
        registry.offboard(List.of(id("a"), id("c")));

        // Then
        assertEquals(new CatalogMatch.Single(id("b")), registry.browse(0));
        assertEquals(new CatalogMatch.Single(id("d")), registry.browse(1));
        assertInvariants();
    }
}
