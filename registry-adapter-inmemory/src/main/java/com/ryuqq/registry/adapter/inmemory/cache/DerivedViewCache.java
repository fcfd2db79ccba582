package com.ryuqq.registry.adapter.inmemory.cache;

import com.ryuqq.registry.adapter.inmemory.store.TicketArena;
import com.ryuqq.registry.core.model.Ticket;
import com.ryuqq.registry.core.model.TicketId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Memoized snapshots of the primary store: ids, tickets and (id, ticket) entries.
 *
 * <p>Each slot is rebuilt from the {@link TicketArena} on first access after {@link #invalidate()}
 * (O(n)) and returned as the same unmodifiable instance until the next invalidation (O(1)).
 * The three slots are independent: reading {@link #keys()} does not build {@link #values()}.</p>
 *
 * @param <V> value type
 * @author Registry Team
 * @since 1.0.0
 */
public final class DerivedViewCache<V> {

    private final TicketArena<V> source;

    private List<TicketId> keys;
    private List<Ticket<V>> values;
    private List<Map.Entry<TicketId, Ticket<V>>> entries;

    public DerivedViewCache(TicketArena<V> source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        this.source = source;
    }

    public List<TicketId> keys() {
        if (keys == null) {
            List<TicketId> built = new ArrayList<>(source.size());
            source.forEach(ticket -> built.add(ticket.id()));
            keys = Collections.unmodifiableList(built);
        }
        return keys;
    }

    public List<Ticket<V>> values() {
        if (values == null) {
            values = Collections.unmodifiableList(source.toList());
        }
        return values;
    }

    public List<Map.Entry<TicketId, Ticket<V>>> entries() {
        if (entries == null) {
            List<Map.Entry<TicketId, Ticket<V>>> built = new ArrayList<>(source.size());
            source.forEach(ticket -> built.add(Map.entry(ticket.id(), ticket)));
            entries = Collections.unmodifiableList(built);
        }
        return entries;
    }

    /**
     * Drops all three snapshots.
     */
    public void invalidate() {
        keys = null;
        values = null;
        entries = null;
    }

    /**
     * @return true if no slot currently holds a snapshot
     */
    public boolean isCold() {
        return keys == null && values == null && entries == null;
    }
}
