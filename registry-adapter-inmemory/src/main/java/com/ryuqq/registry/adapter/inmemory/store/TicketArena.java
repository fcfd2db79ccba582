package com.ryuqq.registry.adapter.inmemory.store;

import com.ryuqq.registry.core.model.Ticket;
import com.ryuqq.registry.core.model.TicketId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Primary store: tickets kept in insertion order, addressed by a dense integer handle.
 *
 * <p>Removal leaves a tombstone in the slot so handles of surviving tickets stay valid;
 * slots are compacted once tombstones outnumber live tickets.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>slots:</strong> ArrayList&lt;Ticket&gt; - store order, null marks a removed ticket</li>
 *   <li><strong>handles:</strong> HashMap&lt;TicketId, Integer&gt; - id → slot handle (O(1) access)</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>append / get / replace / remove:</strong> O(1) (remove amortized, compaction is O(n))</li>
 *   <li><strong>iteration:</strong> O(n + tombstones)</li>
 * </ul>
 *
 * <p>Not thread-safe.</p>
 *
 * @param <V> value type
 * @author Registry Team
 * @since 1.0.0
 */
public final class TicketArena<V> {

    /**
     * Tombstone count below which compaction is never attempted.
     */
    static final int COMPACTION_THRESHOLD = 32;

    private final List<Ticket<V>> slots;
    private final Map<TicketId, Integer> handles;
    private int live;

    public TicketArena() {
        this.slots = new ArrayList<>();
        this.handles = new HashMap<>();
    }

    /**
     * Appends a ticket at the end of store order.
     *
     * @param ticket the ticket
     * @return the slot handle
     * @throws IllegalArgumentException if ticket is null
     * @throws IllegalStateException if a ticket with the same id is already stored
     */
    public int append(Ticket<V> ticket) {
        if (ticket == null) {
            throw new IllegalArgumentException("ticket cannot be null");
        }
        if (handles.containsKey(ticket.id())) {
            throw new IllegalStateException("Ticket already stored: " + ticket.id());
        }
        int handle = slots.size();
        slots.add(ticket);
        handles.put(ticket.id(), handle);
        live++;
        return handle;
    }

    public boolean contains(TicketId id) {
        return id != null && handles.containsKey(id);
    }

    /**
     * @param id the ticket id
     * @return the stored ticket, or null if absent
     */
    public Ticket<V> get(TicketId id) {
        if (id == null) {
            return null;
        }
        Integer handle = handles.get(id);
        return handle == null ? null : slots.get(handle);
    }

    /**
     * Replaces the stored snapshot of an existing ticket, keeping its slot.
     *
     * @param ticket the new snapshot
     * @throws IllegalStateException if no ticket with that id is stored
     */
    public void replace(Ticket<V> ticket) {
        if (ticket == null) {
            throw new IllegalArgumentException("ticket cannot be null");
        }
        Integer handle = handles.get(ticket.id());
        if (handle == null) {
            throw new IllegalStateException("No ticket stored for id: " + ticket.id());
        }
        slots.set(handle, ticket);
    }

    /**
     * Removes a ticket.
     *
     * @param id the ticket id
     * @return the removed ticket, or null if absent
     */
    public Ticket<V> remove(TicketId id) {
        if (id == null) {
            return null;
        }
        Integer handle = handles.remove(id);
        if (handle == null) {
            return null;
        }
        Ticket<V> removed = slots.set(handle, null);
        live--;
        if (tombstones() >= COMPACTION_THRESHOLD && tombstones() > live) {
            compact();
        }
        return removed;
    }

    public int size() {
        return live;
    }

    /**
     * @return number of slots holding a removed ticket
     */
    public int tombstones() {
        return slots.size() - live;
    }

    public void clear() {
        slots.clear();
        handles.clear();
        live = 0;
    }

    /**
     * Visits live tickets in store order.
     *
     * @param action the visitor
     */
    public void forEach(Consumer<Ticket<V>> action) {
        for (Ticket<V> ticket : slots) {
            if (ticket != null) {
                action.accept(ticket);
            }
        }
    }

    /**
     * @return live tickets in store order (a new mutable list)
     */
    public List<Ticket<V>> toList() {
        List<Ticket<V>> tickets = new ArrayList<>(live);
        forEach(tickets::add);
        return tickets;
    }

    /**
     * Walks live tickets in store order with their ordinal and stores whatever the
     * renumbering returns in the same slot.
     *
     * @param renumbering maps (ordinal, ticket) to the snapshot to keep
     */
    public void replaceEach(Renumbering<V> renumbering) {
        int ordinal = 0;
        for (int handle = 0; handle < slots.size(); handle++) {
            Ticket<V> ticket = slots.get(handle);
            if (ticket == null) {
                continue;
            }
            Ticket<V> replacement = renumbering.apply(ordinal, ticket);
            if (replacement != ticket) {
                if (replacement == null || !replacement.id().equals(ticket.id())) {
                    throw new IllegalStateException("Renumbering must keep ticket identity: " + ticket.id());
                }
                slots.set(handle, replacement);
            }
            ordinal++;
        }
    }

    /**
     * Drops tombstones and reassigns handles.
     */
    void compact() {
        int next = 0;
        for (int handle = 0; handle < slots.size(); handle++) {
            Ticket<V> ticket = slots.get(handle);
            if (ticket == null) {
                continue;
            }
            if (next != handle) {
                slots.set(next, ticket);
                handles.put(ticket.id(), next);
            }
            next++;
        }
        slots.subList(next, slots.size()).clear();
    }

    /**
     * Renumbering callback for {@link #replaceEach(Renumbering)}.
     *
     * @param <V> value type
     */
    @FunctionalInterface
    public interface Renumbering<V> {

        /**
         * @param ordinal zero-based rank of the ticket in store order
         * @param ticket the current snapshot
         * @return the snapshot to keep (the same instance when unchanged)
         */
        Ticket<V> apply(int ordinal, Ticket<V> ticket);
    }
}
