package com.ryuqq.registry.adapter.inmemory.batch;

import com.ryuqq.registry.core.event.RegistryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Defers cache invalidation and event emission across a sequence of mutations.
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * run(work)
 *   ├─ nested (already open)  → work.get() inline, no new scope
 *   └─ outermost
 *        1. open scope          (mutators check {@link #isOpen()} and {@link #enqueue})
 *        2. work.get()
 *        3. close scope
 *        4. onClose.run()       (settle pending reindex, invalidate cache once)
 *        5. flush queued events in original order
 * </pre>
 *
 * <p>If {@code work} throws, the scope is closed, {@code onClose} still runs, queued events are
 * discarded and the exception propagates unchanged.</p>
 *
 * @param <V> registry value type
 * @author Registry Team
 * @since 1.0.0
 */
public final class BatchCoordinator<V> {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final Runnable onClose;
    private final Consumer<RegistryEvent<V>> sink;
    private final List<RegistryEvent<V>> queued = new ArrayList<>();
    private boolean open;

    /**
     * @param onClose runs once when the outermost scope closes, before the flush
     * @param sink receives queued events on flush
     */
    public BatchCoordinator(Runnable onClose, Consumer<RegistryEvent<V>> sink) {
        if (onClose == null) {
            throw new IllegalArgumentException("onClose cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        this.onClose = onClose;
        this.sink = sink;
    }

    public boolean isOpen() {
        return open;
    }

    /**
     * Queues an event for the flush at the end of the open scope.
     *
     * @param event the event
     * @throws IllegalStateException if no scope is open
     */
    public void enqueue(RegistryEvent<V> event) {
        if (!open) {
            throw new IllegalStateException("No batch is open");
        }
        queued.add(event);
    }

    /**
     * @return number of events waiting for the flush
     */
    public int pending() {
        return queued.size();
    }

    public <T> T run(Supplier<T> work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (open) {
            return work.get();
        }

        open = true;
        T result;
        try {
            result = work.get();
        } catch (RuntimeException | Error e) {
            int discarded = queued.size();
            queued.clear();
            open = false;
            onClose.run();
            log.debug("Batch aborted, {} queued events discarded", discarded);
            throw e;
        }
        open = false;
        onClose.run();
        flush();
        return result;
    }

    private void flush() {
        if (queued.isEmpty()) {
            return;
        }
        List<RegistryEvent<V>> drained = new ArrayList<>(queued);
        queued.clear();
        log.debug("Batch closed, flushing {} events", drained.size());
        for (RegistryEvent<V> event : drained) {
            sink.accept(event);
        }
    }
}
