package com.ryuqq.registry.adapter.inmemory.index;

import com.ryuqq.registry.core.model.TicketId;

import java.util.HashMap;
import java.util.Map;

/**
 * Position index: ordinal position → ticket id.
 *
 * <p>Answers "the Nth ticket" without scanning. Entries may be stale while a lazy reindex is
 * pending; {@link #purgeFrom(int)} drops everything at or above the dirty watermark before the
 * reindex pass writes fresh entries.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class PositionDirectory {

    private final Map<Integer, TicketId> directory = new HashMap<>();

    public void put(int position, TicketId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        directory.put(position, id);
    }

    /**
     * @param position the position
     * @return the id at that position, or null
     */
    public TicketId get(int position) {
        return directory.get(position);
    }

    public boolean isOccupied(int position) {
        return directory.containsKey(position);
    }

    /**
     * Removes the mapping only if it still points at {@code id}.
     *
     * @param position the position
     * @param id the expected id
     * @return true if removed
     */
    public boolean remove(int position, TicketId id) {
        return directory.remove(position, id);
    }

    /**
     * Removes every mapping at or above {@code from}.
     *
     * @param from the lowest position to drop
     */
    public void purgeFrom(int from) {
        if (from <= 0) {
            directory.clear();
            return;
        }
        directory.keySet().removeIf(position -> position >= from);
    }

    public int size() {
        return directory.size();
    }

    public void clear() {
        directory.clear();
    }
}
