package com.ryuqq.registry.adapter.inmemory.registry;

import com.ryuqq.registry.adapter.inmemory.batch.BatchCoordinator;
import com.ryuqq.registry.adapter.inmemory.cache.DerivedViewCache;
import com.ryuqq.registry.adapter.inmemory.event.EventChannel;
import com.ryuqq.registry.adapter.inmemory.index.PositionDirectory;
import com.ryuqq.registry.adapter.inmemory.index.ValueCatalog;
import com.ryuqq.registry.adapter.inmemory.reindex.LazyReindexer;
import com.ryuqq.registry.adapter.inmemory.store.TicketArena;
import com.ryuqq.registry.core.config.RegistryConfig;
import com.ryuqq.registry.core.event.CustomEvent;
import com.ryuqq.registry.core.event.EventKind;
import com.ryuqq.registry.core.event.RegistryCleared;
import com.ryuqq.registry.core.event.RegistryEvent;
import com.ryuqq.registry.core.event.RegistryListener;
import com.ryuqq.registry.core.event.RegistryReindexed;
import com.ryuqq.registry.core.event.TicketRegistered;
import com.ryuqq.registry.core.event.TicketUnregistered;
import com.ryuqq.registry.core.event.TicketUpdated;
import com.ryuqq.registry.core.model.CatalogMatch;
import com.ryuqq.registry.core.model.Registration;
import com.ryuqq.registry.core.model.SeekDirection;
import com.ryuqq.registry.core.model.Ticket;
import com.ryuqq.registry.core.model.TicketId;
import com.ryuqq.registry.core.model.TicketPatch;
import com.ryuqq.registry.core.spi.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link Registry}.
 *
 * <p>Composes the primary store, the two auxiliary indices, the derived-view cache, the event
 * channel, the batch coordinator and the lazy reindexer into the public operations.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>arena:</strong> {@link TicketArena} - id → ticket in store order (O(1) access)</li>
 *   <li><strong>directory:</strong> {@link PositionDirectory} - position → id (O(1) access)</li>
 *   <li><strong>catalog:</strong> {@link ValueCatalog} - resolved value → id(s) (O(1) access)</li>
 *   <li><strong>views:</strong> {@link DerivedViewCache} - memoized keys/values/entries</li>
 * </ul>
 *
 * <p><strong>Mutation Order:</strong></p>
 * <ol>
 *   <li>primary store</li>
 *   <li>position directory and value catalog</li>
 *   <li>cache invalidation (suppressed while a batch is open)</li>
 *   <li>event emission (queued while a batch is open)</li>
 * </ol>
 *
 * <p>Emission always comes last, so a listener never observes half-applied bookkeeping.
 * A listener exception propagates to the caller after the mutation is fully applied.</p>
 *
 * <p><strong>Reindex Policy:</strong></p>
 * <ul>
 *   <li><strong>unregister:</strong> immediate when position-derived tickets exist and no batch is open,
 *       otherwise deferred</li>
 *   <li><strong>offboard:</strong> always deferred</li>
 *   <li><strong>lookup / seek:</strong> settle any pending reindex</li>
 *   <li><strong>browse:</strong> settles only when position-derived tickets exist</li>
 *   <li><strong>batch close:</strong> settles when position-derived tickets exist</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Not thread-safe; see {@link SynchronizedRegistry}</li>
 *   <li>Listeners calling back into the registry are not supported</li>
 * </ul>
 *
 * @param <V> value type
 * @author Registry Team
 * @since 1.0.0
 */
public class InMemoryRegistry<V> implements Registry<V> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRegistry.class);

    private final RegistryConfig config;
    private final Logger logger;

    private final TicketArena<V> arena;
    private final PositionDirectory directory;
    private final ValueCatalog catalog;
    private final DerivedViewCache<V> views;
    private final EventChannel<V> channel;
    private final LazyReindexer<V> reindexer;
    private final BatchCoordinator<V> batches;

    /**
     * Number of tickets whose value is derived from their position.
     */
    private int positionDerived;

    /**
     * Creates a registry with {@link RegistryConfig#defaults()} (events disabled).
     */
    public InMemoryRegistry() {
        this(RegistryConfig.defaults());
    }

    public InMemoryRegistry(RegistryConfig config) {
        this(config, log);
    }

    InMemoryRegistry(RegistryConfig config, Logger logger) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (logger == null) {
            throw new IllegalArgumentException("logger cannot be null");
        }
        this.config = config;
        this.logger = logger;
        this.arena = new TicketArena<>();
        this.directory = new PositionDirectory();
        this.catalog = new ValueCatalog();
        this.views = new DerivedViewCache<>(arena);
        this.channel = new EventChannel<>(config.eventsEnabled(), logger);
        this.reindexer = new LazyReindexer<>(arena, directory, catalog);
        this.batches = new BatchCoordinator<>(this::closeBatch, channel::dispatch);
    }

    @Override
    public boolean has(TicketId id) {
        return arena.contains(id);
    }

    @Override
    public Ticket<V> get(TicketId id) {
        return arena.get(id);
    }

    @Override
    public List<TicketId> keys() {
        return views.keys();
    }

    @Override
    public List<Ticket<V>> values() {
        return views.values();
    }

    @Override
    public List<Map.Entry<TicketId, Ticket<V>>> entries() {
        return views.entries();
    }

    @Override
    public TicketId lookup(int position) {
        settle();
        return position < 0 ? null : directory.get(position);
    }

    @Override
    public CatalogMatch browse(Object value) {
        if (positionDerived > 0) {
            settle();
        }
        return catalog.browse(value);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>A seeded position other than the current size is honored until the next reindex,
     *       which renumbers from position 0</li>
     *   <li>A seeded position that is already occupied leaves the directory entry to its owner
     *       and marks the reindexer dirty there</li>
     * </ul>
     */
    @Override
    public Ticket<V> register(Registration<V> registration) {
        if (registration == null) {
            throw new IllegalArgumentException("registration cannot be null");
        }
        TicketId id = registration.getIdOrNull();
        if (id == null) {
            id = config.idGenerator().next();
        }

        Ticket<V> existing = arena.get(id);
        if (existing != null) {
            logger.warn("Ticket with id {} already exists in the registry. Skipping registration.", id.getValue());
            return existing;
        }

        int size = arena.size();
        Integer seeded = registration.getPositionOrNull();
        int position = seeded == null ? size : seeded;
        Ticket<V> ticket = registration.hasValue()
            ? Ticket.valued(id, position, registration.getValue())
            : Ticket.positional(id, position);

        arena.append(ticket);
        if (position != size) {
            reindexer.markIrregular();
        }
        if (directory.isOccupied(position)) {
            reindexer.markDirty(position);
        } else {
            directory.put(position, id);
        }
        catalog.assign(ticket.resolvedValue(), id);
        if (ticket.valueIsPosition()) {
            positionDerived++;
        }

        invalidateViews();
        publish(new TicketRegistered<>(ticket));
        return ticket;
    }

    @Override
    public Ticket<V> upsert(TicketId id, TicketPatch<V> patch) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }

        Ticket<V> existing = arena.get(id);
        if (existing == null) {
            return register(patch.toRegistration(id));
        }

        Ticket<V> updated;
        switch (patch.getChange()) {
            case RESET:
                updated = Ticket.positional(id, existing.position());
                break;
            case SET:
                updated = Ticket.valued(id, existing.position(), patch.getValue());
                break;
            case KEEP:
            default:
                updated = existing;
                break;
        }

        if (updated != existing) {
            if (!Objects.equals(existing.resolvedValue(), updated.resolvedValue())) {
                catalog.unassign(existing.resolvedValue(), id);
                catalog.assign(updated.resolvedValue(), id);
            }
            if (existing.valueIsPosition() != updated.valueIsPosition()) {
                positionDerived += updated.valueIsPosition() ? 1 : -1;
            }
            arena.replace(updated);
            invalidateViews();
        }

        publish(new TicketUpdated<>(updated));
        return updated;
    }

    @Override
    public void unregister(TicketId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        Ticket<V> removed = detach(id);
        if (removed == null) {
            return;
        }
        if (!batches.isOpen() && positionDerived > 0) {
            reindexer.settle();
        }
        invalidateViews();
        publish(new TicketUnregistered<>(removed));
    }

    @Override
    public List<Ticket<V>> onboard(List<Registration<V>> registrations) {
        if (registrations == null) {
            throw new IllegalArgumentException("registrations cannot be null");
        }
        return batch(() -> {
            List<Ticket<V>> tickets = new ArrayList<>(registrations.size());
            for (Registration<V> registration : registrations) {
                tickets.add(register(registration));
            }
            return tickets;
        });
    }

    /**
     * {@inheritDoc}
     *
     * <p>Every id is validated before anything is removed, so a null element leaves the registry untouched.</p>
     */
    @Override
    public void offboard(Collection<TicketId> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        for (TicketId id : ids) {
            if (id == null) {
                throw new IllegalArgumentException("ids cannot contain null");
            }
        }

        List<Ticket<V>> removed = new ArrayList<>();
        for (TicketId id : ids) {
            Ticket<V> ticket = detach(id);
            if (ticket != null) {
                removed.add(ticket);
            }
        }
        if (removed.isEmpty()) {
            return;
        }

        invalidateViews();
        for (Ticket<V> ticket : removed) {
            publish(new TicketUnregistered<>(ticket));
        }
    }

    @Override
    public Ticket<V> seek(SeekDirection direction, Integer from, Predicate<Ticket<V>> predicate) {
        if (direction == null) {
            throw new IllegalArgumentException("direction cannot be null");
        }
        settle();

        // the cached view is stale inside a batch
        List<Ticket<V>> ordered = batches.isOpen() ? arena.toList() : views.values();
        int size = ordered.size();
        if (size == 0) {
            return null;
        }

        boolean forward = direction == SeekDirection.FIRST;
        int start = from == null ? (forward ? 0 : size - 1) : Math.max(0, Math.min(from, size - 1));
        int step = forward ? 1 : -1;

        for (int i = start; i >= 0 && i < size; i += step) {
            Ticket<V> ticket = ordered.get(i);
            if (predicate == null || predicate.test(ticket)) {
                return ticket;
            }
        }
        return null;
    }

    @Override
    public void reindex() {
        reindexer.reindexAll();
        invalidateViews();
        publish(new RegistryReindexed<>(arena.size()));
    }

    @Override
    public void clear() {
        arena.clear();
        directory.clear();
        catalog.clear();
        reindexer.reset();
        positionDerived = 0;
        invalidateViews();
        publish(new RegistryCleared<>());
    }

    /**
     * {@inheritDoc}
     *
     * <p>Listeners are removed first, so the final clear is not observed.</p>
     */
    @Override
    public void dispose() {
        channel.clear();
        clear();
    }

    @Override
    public <T> T batch(Supplier<T> work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        return batches.run(work);
    }

    @Override
    public void batch(Runnable work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        batches.run(() -> {
            work.run();
            return null;
        });
    }

    @Override
    public void on(EventKind kind, RegistryListener<V> listener) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        channel.on(kind.eventName(), listener);
    }

    @Override
    public void on(String event, RegistryListener<V> listener) {
        channel.on(event, listener);
    }

    @Override
    public void off(EventKind kind, RegistryListener<V> listener) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        channel.off(kind.eventName(), listener);
    }

    @Override
    public void off(String event, RegistryListener<V> listener) {
        channel.off(event, listener);
    }

    @Override
    public void emit(String event, Object data) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        publish(new CustomEvent<>(event, data));
    }

    @Override
    public int size() {
        return arena.size();
    }

    /**
     * Removes a ticket from the store and both indices and records the dirty position.
     *
     * <p>Removing the last ticket of a clean, regularly numbered registry leaves it clean.</p>
     *
     * @return the removed ticket, or null if absent
     */
    private Ticket<V> detach(TicketId id) {
        Ticket<V> removed = arena.remove(id);
        if (removed == null) {
            return null;
        }
        directory.remove(removed.position(), id);
        catalog.unassign(removed.resolvedValue(), id);
        if (removed.valueIsPosition()) {
            positionDerived--;
        }

        boolean cleanTail = !reindexer.isDirty()
            && !reindexer.isFullPassRequired()
            && removed.position() == arena.size();
        if (!cleanTail) {
            reindexer.markDirty(removed.position());
        }
        return removed;
    }

    private void settle() {
        if (reindexer.settle()) {
            invalidateViews();
        }
    }

    private void closeBatch() {
        if (positionDerived > 0) {
            reindexer.settle();
        }
        views.invalidate();
    }

    private void invalidateViews() {
        if (!batches.isOpen()) {
            views.invalidate();
        }
    }

    private void publish(RegistryEvent<V> event) {
        if (!channel.isEnabled()) {
            return;
        }
        if (batches.isOpen()) {
            batches.enqueue(event);
        } else {
            channel.dispatch(event);
        }
    }
}
