package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.event.EventKind;
import com.ryuqq.registry.core.event.RegistryListener;
import com.ryuqq.registry.core.model.CatalogMatch;
import com.ryuqq.registry.core.model.Registration;
import com.ryuqq.registry.core.model.SeekDirection;
import com.ryuqq.registry.core.model.Ticket;
import com.ryuqq.registry.core.model.TicketId;
import com.ryuqq.registry.core.model.TicketPatch;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Indexed registry SPI.
 *
 * <p>An ordered collection of uniquely identified {@link Ticket}s supporting O(1) lookup by id,
 * reverse lookup by value, lookup by ordinal position, lazy reordering after removal,
 * cached derived views and an optional synchronous event channel.</p>
 *
 * <p><strong>Indices:</strong></p>
 * <ul>
 *   <li><strong>Primary store:</strong> id → ticket, the single source of truth for existence and content</li>
 *   <li><strong>Position directory:</strong> position → id, contiguous {@code 0..size-1} once reindexed</li>
 *   <li><strong>Value catalog:</strong> resolved value → one or many ids</li>
 * </ul>
 *
 * <p><strong>Error Model:</strong></p>
 * <ul>
 *   <li>Duplicate id on {@link #register(Registration)}: WARN diagnostic, existing ticket returned</li>
 *   <li>Listener subscription with events disabled: WARN diagnostic, no-op</li>
 *   <li>Unknown id on {@link #unregister(TicketId)} / {@link #offboard(Collection)}: silent no-op</li>
 *   <li>Absent results ({@link #get}, {@link #lookup}, {@link #browse}, {@link #seek}): {@code null}</li>
 *   <li>Null arguments to mutators: {@link IllegalArgumentException}</li>
 * </ul>
 *
 * <p><strong>Threading:</strong> implementations are single-writer, single-reader and do not
 * synchronize. Wrap an instance in a synchronizing decorator when it is shared across threads.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Registry&lt;String&gt; registry = new InMemoryRegistry&lt;&gt;(RegistryConfig.defaults().withEventsEnabled(true));
 *
 * registry.on(EventKind.TICKET_REGISTERED, event -&gt; audit(event.ticketOrNull()));
 *
 * registry.register(Registration.of("a", "apple"));
 * registry.register(Registration.of("b", "banana"));
 *
 * TicketId first = registry.lookup(0);          // a
 * CatalogMatch match = registry.browse("apple"); // Single(a)
 * </pre>
 *
 * @param <V> value type carried by tickets
 * @author Registry Team
 * @since 1.0.0
 */
public interface Registry<V> {

    /**
     * Checks whether a ticket with the given id exists.
     *
     * @param id the ticket id (null answers false)
     * @return true if registered
     */
    boolean has(TicketId id);

    default boolean has(String id) {
        return id != null && has(TicketId.of(id));
    }

    /**
     * Returns the current snapshot of the ticket with the given id.
     *
     * <p>Position may be stale while a lazy reindex is pending; ordered reads
     * ({@link #lookup}, {@link #seek}) settle it first.</p>
     *
     * @param id the ticket id (null answers null)
     * @return the ticket, or null if absent
     */
    Ticket<V> get(TicketId id);

    default Ticket<V> get(String id) {
        return id == null ? null : get(TicketId.of(id));
    }

    /**
     * Returns all ids in store order.
     *
     * <p>The list is cached: repeated calls return the same instance until the next
     * structural mutation (or the end of the enclosing batch).</p>
     *
     * @return unmodifiable list of ids
     */
    List<TicketId> keys();

    /**
     * Returns all tickets in store order. Cached like {@link #keys()}.
     *
     * @return unmodifiable list of tickets
     */
    List<Ticket<V>> values();

    /**
     * Returns all (id, ticket) pairs in store order. Cached like {@link #keys()}.
     *
     * @return unmodifiable list of entries
     */
    List<Map.Entry<TicketId, Ticket<V>>> entries();

    /**
     * Returns the id at the given ordinal position.
     *
     * <p>Settles a pending lazy reindex first.</p>
     *
     * @param position the position
     * @return the id, or null if no ticket occupies the position
     */
    TicketId lookup(int position);

    /**
     * Reverse lookup by value.
     *
     * <p>Position-derived tickets are catalogued under their position ({@link Integer}).
     * Settles a pending lazy reindex first when position-derived tickets exist.</p>
     *
     * @param value the value (null allowed)
     * @return {@link CatalogMatch.Single} for one ticket, {@link CatalogMatch.Many} for several
     *         (insertion order), or null when no ticket carries the value
     */
    CatalogMatch browse(Object value);

    /**
     * Registers a ticket with every field defaulted.
     *
     * @return the new ticket
     */
    default Ticket<V> register() {
        return register(Registration.empty());
    }

    /**
     * Registers a ticket.
     *
     * <p><strong>Defaults:</strong></p>
     * <ul>
     *   <li>id omitted: generated by the configured {@link TicketIdGenerator}</li>
     *   <li>position omitted: appended at the current size</li>
     *   <li>value omitted: derived from the position ({@code valueIsPosition = true})</li>
     * </ul>
     *
     * <p>An id that is already present is rejected non-fatally: a WARN diagnostic is logged and
     * the existing ticket is returned unchanged. Emits {@link EventKind#TICKET_REGISTERED} on success.</p>
     *
     * @param registration the partial ticket
     * @return the new ticket, or the existing ticket for a duplicate id
     * @throws IllegalArgumentException if registration is null
     */
    Ticket<V> register(Registration<V> registration);

    /**
     * Creates or updates a ticket.
     *
     * <p>For a missing id this behaves exactly like {@code register(patch.toRegistration(id))}.
     * For an existing id only the value may change; id and position are immutable here.
     * Emits {@link EventKind#TICKET_UPDATED} for an update.</p>
     *
     * @param id the ticket id
     * @param patch the value change
     * @return the created or updated ticket
     * @throws IllegalArgumentException if id or patch is null
     */
    Ticket<V> upsert(TicketId id, TicketPatch<V> patch);

    default Ticket<V> upsert(TicketId id) {
        return upsert(id, TicketPatch.keep());
    }

    default Ticket<V> upsert(String id, TicketPatch<V> patch) {
        return upsert(TicketId.of(id), patch);
    }

    /**
     * Removes a ticket. No-op if the id is absent.
     *
     * <p>Emits {@link EventKind#TICKET_UNREGISTERED} with the removed snapshot.</p>
     *
     * @param id the ticket id
     * @throws IllegalArgumentException if id is null
     */
    void unregister(TicketId id);

    default void unregister(String id) {
        unregister(TicketId.of(id));
    }

    /**
     * Registers several tickets inside one batch.
     *
     * @param registrations partial tickets, in order
     * @return the resulting tickets in input order (existing tickets for duplicate ids)
     * @throws IllegalArgumentException if registrations is null
     */
    List<Ticket<V>> onboard(List<Registration<V>> registrations);

    /**
     * Removes several tickets in one pass, leaving the reindex lazy.
     *
     * <p>Absent ids are skipped. Emits one {@link EventKind#TICKET_UNREGISTERED} per removed ticket.</p>
     *
     * @param ids ids to remove
     * @throws IllegalArgumentException if ids is null
     */
    void offboard(Collection<TicketId> ids);

    /**
     * Returns the first or last ticket.
     *
     * @param direction scan direction
     * @return the ticket, or null for an empty registry
     */
    default Ticket<V> seek(SeekDirection direction) {
        return seek(direction, null, null);
    }

    /**
     * Linear scan over the ordered view.
     *
     * <p>Starts at {@code from} clamped into {@code [0, size-1]} (default: the natural start for the
     * direction) and walks forward ({@link SeekDirection#FIRST}) or backward ({@link SeekDirection#LAST})
     * until {@code predicate} accepts a ticket.</p>
     *
     * @param direction scan direction
     * @param from start position, or null for the natural start
     * @param predicate acceptance test, or null to accept the first visited ticket
     * @return the matching ticket, or null when empty or nothing matches
     * @throws IllegalArgumentException if direction is null
     */
    Ticket<V> seek(SeekDirection direction, Integer from, Predicate<Ticket<V>> predicate);

    /**
     * Eagerly renumbers every ticket to {@code 0..size-1} in store order and rebuilds the
     * position directory and value catalog. Emits {@link EventKind#REGISTRY_REINDEXED}.
     */
    void reindex();

    /**
     * Removes every ticket and resets reindex state. Emits {@link EventKind#REGISTRY_CLEARED}.
     */
    void clear();

    /**
     * Removes every listener, then clears the registry. Intended for teardown.
     */
    void dispose();

    /**
     * Runs a function with cache invalidation and event emission deferred.
     *
     * <p>On completion the cache is invalidated once and queued events are flushed in
     * original order. Nested calls run inline. If the function throws, queued events are
     * discarded and the exception propagates.</p>
     *
     * @param work the function
     * @param <T> result type
     * @return the function's result
     * @throws IllegalArgumentException if work is null
     */
    <T> T batch(Supplier<T> work);

    /**
     * Void form of {@link #batch(Supplier)}.
     *
     * @param work the function
     * @throws IllegalArgumentException if work is null
     */
    void batch(Runnable work);

    /**
     * Subscribes to a structural event.
     *
     * @param kind event kind
     * @param listener the listener
     * @throws IllegalArgumentException if kind or listener is null
     */
    void on(EventKind kind, RegistryListener<V> listener);

    /**
     * Subscribes to an event by name (structural or custom).
     *
     * @param event event name
     * @param listener the listener
     * @throws IllegalArgumentException if event or listener is null
     */
    void on(String event, RegistryListener<V> listener);

    void off(EventKind kind, RegistryListener<V> listener);

    /**
     * Unsubscribes a listener. No-op if it was never subscribed.
     *
     * @param event event name
     * @param listener the listener
     */
    void off(String event, RegistryListener<V> listener);

    /**
     * Publishes an application-defined event to the subscribers of {@code event}.
     *
     * @param event event name
     * @param data payload (null allowed)
     * @throws IllegalArgumentException if event is null
     */
    void emit(String event, Object data);

    /**
     * Live ticket count, O(1), independent of pending reindex state.
     *
     * @return number of registered tickets
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
