package com.ryuqq.registry.adapter.inmemory.reindex;

import com.ryuqq.registry.adapter.inmemory.index.PositionDirectory;
import com.ryuqq.registry.adapter.inmemory.index.ValueCatalog;
import com.ryuqq.registry.adapter.inmemory.store.TicketArena;
import com.ryuqq.registry.core.model.Ticket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Restores position contiguity and catalog consistency after removals, on demand.
 *
 * <p>Removals only lower a "minimum dirty position" watermark. The O(n) pass runs when an
 * ordered read needs it ({@link #settle()}) or when asked explicitly ({@link #reindexAll()}),
 * so k removals cost one pass instead of k.</p>
 *
 * <p><strong>Pass:</strong></p>
 * <ol>
 *   <li>drop directory entries at or above the start position</li>
 *   <li>walk tickets in store order; tickets ranked below the start are left untouched</li>
 *   <li>renumber the rest to their rank, re-catalog those whose value is position-derived</li>
 *   <li>reset the watermark</li>
 * </ol>
 *
 * <p>A caller-seeded position that breaks store-order numbering forces the next pass to start
 * at 0, because the watermark only bounds positions made stale by removal.</p>
 *
 * @param <V> value type
 * @author Registry Team
 * @since 1.0.0
 */
public final class LazyReindexer<V> {

    private static final Logger log = LoggerFactory.getLogger(LazyReindexer.class);

    private static final int NONE = -1;

    private final TicketArena<V> arena;
    private final PositionDirectory directory;
    private final ValueCatalog catalog;

    private int watermark = NONE;
    private boolean fullPassRequired;

    public LazyReindexer(TicketArena<V> arena, PositionDirectory directory, ValueCatalog catalog) {
        if (arena == null || directory == null || catalog == null) {
            throw new IllegalArgumentException("arena, directory and catalog cannot be null");
        }
        this.arena = arena;
        this.directory = directory;
        this.catalog = catalog;
    }

    /**
     * Records that the ticket at {@code position} was removed.
     *
     * @param position position of the removed ticket
     */
    public void markDirty(int position) {
        watermark = watermark == NONE ? position : Math.min(watermark, position);
    }

    /**
     * Records that a ticket was registered at a caller-seeded position.
     */
    public void markIrregular() {
        fullPassRequired = true;
    }

    public boolean isDirty() {
        return watermark != NONE;
    }

    /**
     * @return true if a seeded position forces the next pass to start at 0
     */
    public boolean isFullPassRequired() {
        return fullPassRequired;
    }

    /**
     * @return the minimum dirty position, or -1 when clean
     */
    public int watermark() {
        return watermark;
    }

    /**
     * Runs the pass if a removal left the store dirty.
     *
     * @return true if a pass ran
     */
    public boolean settle() {
        if (!isDirty()) {
            return false;
        }
        pass(fullPassRequired ? 0 : watermark);
        return true;
    }

    /**
     * Renumbers every ticket from position 0 regardless of dirty state.
     */
    public void reindexAll() {
        pass(0);
    }

    /**
     * Forgets dirty state without touching the indices (used when everything is cleared).
     */
    public void reset() {
        watermark = NONE;
        fullPassRequired = false;
    }

    private void pass(int from) {
        directory.purgeFrom(from);
        int[] renumbered = {0};

        arena.replaceEach((ordinal, ticket) -> {
            if (ordinal < from) {
                return ticket;
            }
            Ticket<V> current = ticket;
            if (ticket.position() != ordinal) {
                current = ticket.withPosition(ordinal);
                if (ticket.valueIsPosition()) {
                    catalog.unassign(ticket.resolvedValue(), ticket.id());
                    catalog.assign(current.resolvedValue(), current.id());
                }
                renumbered[0]++;
            }
            directory.put(ordinal, current.id());
            return current;
        });

        log.debug("Reindexed from position {}: {} of {} tickets renumbered", from, renumbered[0], arena.size());
        reset();
    }
}
