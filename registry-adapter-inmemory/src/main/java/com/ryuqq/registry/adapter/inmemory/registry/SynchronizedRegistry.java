package com.ryuqq.registry.adapter.inmemory.registry;

import com.ryuqq.registry.core.event.EventKind;
import com.ryuqq.registry.core.event.RegistryListener;
import com.ryuqq.registry.core.model.CatalogMatch;
import com.ryuqq.registry.core.model.Registration;
import com.ryuqq.registry.core.model.SeekDirection;
import com.ryuqq.registry.core.model.Ticket;
import com.ryuqq.registry.core.model.TicketId;
import com.ryuqq.registry.core.model.TicketPatch;
import com.ryuqq.registry.core.spi.Registry;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Decorator serializing every call to a {@link Registry} on one monitor.
 *
 * <p>The wrapped registry is single-writer; this decorator makes it safe to share across threads
 * at the cost of all concurrency. Listeners run while the monitor is held, and
 * {@link #batch(Supplier)} holds it for the whole function, so a batch is atomic with respect to
 * other threads.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Registry&lt;String&gt; shared = new SynchronizedRegistry&lt;&gt;(new InMemoryRegistry&lt;&gt;());
 * </pre>
 *
 * @param <V> value type
 * @author Registry Team
 * @since 1.0.0
 */
public final class SynchronizedRegistry<V> implements Registry<V> {

    private final Registry<V> delegate;
    private final Object lock = new Object();

    public SynchronizedRegistry(Registry<V> delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    @Override
    public boolean has(TicketId id) {
        synchronized (lock) {
            return delegate.has(id);
        }
    }

    @Override
    public Ticket<V> get(TicketId id) {
        synchronized (lock) {
            return delegate.get(id);
        }
    }

    @Override
    public List<TicketId> keys() {
        synchronized (lock) {
            return delegate.keys();
        }
    }

    @Override
    public List<Ticket<V>> values() {
        synchronized (lock) {
            return delegate.values();
        }
    }

    @Override
    public List<Map.Entry<TicketId, Ticket<V>>> entries() {
        synchronized (lock) {
            return delegate.entries();
        }
    }

    @Override
    public TicketId lookup(int position) {
        synchronized (lock) {
            return delegate.lookup(position);
        }
    }

    @Override
    public CatalogMatch browse(Object value) {
        synchronized (lock) {
            return delegate.browse(value);
        }
    }

    @Override
    public Ticket<V> register(Registration<V> registration) {
        synchronized (lock) {
            return delegate.register(registration);
        }
    }

    @Override
    public Ticket<V> upsert(TicketId id, TicketPatch<V> patch) {
        synchronized (lock) {
            return delegate.upsert(id, patch);
        }
    }

    @Override
    public void unregister(TicketId id) {
        synchronized (lock) {
            delegate.unregister(id);
        }
    }

    @Override
    public List<Ticket<V>> onboard(List<Registration<V>> registrations) {
        synchronized (lock) {
            return delegate.onboard(registrations);
        }
    }

    @Override
    public void offboard(Collection<TicketId> ids) {
        synchronized (lock) {
            delegate.offboard(ids);
        }
    }

    @Override
    public Ticket<V> seek(SeekDirection direction, Integer from, Predicate<Ticket<V>> predicate) {
        synchronized (lock) {
            return delegate.seek(direction, from, predicate);
        }
    }

    @Override
    public void reindex() {
        synchronized (lock) {
            delegate.reindex();
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            delegate.clear();
        }
    }

    @Override
    public void dispose() {
        synchronized (lock) {
            delegate.dispose();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Calls made by {@code work} go through this decorator and re-enter the monitor.</p>
     */
    @Override
    public <T> T batch(Supplier<T> work) {
        synchronized (lock) {
            return delegate.batch(work);
        }
    }

    @Override
    public void batch(Runnable work) {
        synchronized (lock) {
            delegate.batch(work);
        }
    }

    @Override
    public void on(EventKind kind, RegistryListener<V> listener) {
        synchronized (lock) {
            delegate.on(kind, listener);
        }
    }

    @Override
    public void on(String event, RegistryListener<V> listener) {
        synchronized (lock) {
            delegate.on(event, listener);
        }
    }

    @Override
    public void off(EventKind kind, RegistryListener<V> listener) {
        synchronized (lock) {
            delegate.off(kind, listener);
        }
    }

    @Override
    public void off(String event, RegistryListener<V> listener) {
        synchronized (lock) {
            delegate.off(event, listener);
        }
    }

    @Override
    public void emit(String event, Object data) {
        synchronized (lock) {
            delegate.emit(event, data);
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return delegate.size();
        }
    }
}
