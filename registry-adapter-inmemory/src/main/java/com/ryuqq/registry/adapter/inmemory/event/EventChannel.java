package com.ryuqq.registry.adapter.inmemory.event;

import com.ryuqq.registry.core.event.RegistryEvent;
import com.ryuqq.registry.core.event.RegistryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Synchronous publish/subscribe channel keyed by event name.
 *
 * <p>Listeners of one name run in subscription order on the publishing thread. The listener
 * table is only allocated when the channel is enabled; on a disabled channel {@link #on} and
 * {@link #off} log a WARN diagnostic and do nothing, and {@link #dispatch} is a silent no-op.</p>
 *
 * <p><strong>Failure policy:</strong> a listener exception propagates to the publisher and
 * skips the remaining listeners of that dispatch.</p>
 *
 * @param <V> registry value type
 * @author Registry Team
 * @since 1.0.0
 */
public final class EventChannel<V> {

    private static final Logger log = LoggerFactory.getLogger(EventChannel.class);

    private final boolean enabled;
    private final Logger logger;
    private final Map<String, Set<RegistryListener<V>>> listeners;

    public EventChannel(boolean enabled) {
        this(enabled, log);
    }

    /**
     * @param enabled whether listeners may subscribe
     * @param logger diagnostics sink
     */
    public EventChannel(boolean enabled, Logger logger) {
        if (logger == null) {
            throw new IllegalArgumentException("logger cannot be null");
        }
        this.enabled = enabled;
        this.logger = logger;
        this.listeners = enabled ? new LinkedHashMap<>() : Collections.emptyMap();
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Subscribes a listener. Subscribing the same listener twice to one name is a no-op.
     *
     * @param event event name
     * @param listener the listener
     */
    public void on(String event, RegistryListener<V> listener) {
        requireArguments(event, listener);
        if (!enabled) {
            logger.warn("Events are disabled: ignoring listener registration for \"{}\"", event);
            return;
        }
        listeners.computeIfAbsent(event, ignored -> new LinkedHashSet<>()).add(listener);
    }

    /**
     * Unsubscribes a listener. Unknown listeners are ignored.
     *
     * @param event event name
     * @param listener the listener
     */
    public void off(String event, RegistryListener<V> listener) {
        requireArguments(event, listener);
        if (!enabled) {
            logger.warn("Events are disabled: ignoring listener removal for \"{}\"", event);
            return;
        }
        Set<RegistryListener<V>> subscribed = listeners.get(event);
        if (subscribed != null && subscribed.remove(listener) && subscribed.isEmpty()) {
            listeners.remove(event);
        }
    }

    /**
     * Delivers an event to the current subscribers of its name.
     *
     * <p>The subscriber set is copied first, so listeners may subscribe or unsubscribe while
     * being notified; changes apply from the next dispatch.</p>
     *
     * @param event the event
     */
    public void dispatch(RegistryEvent<V> event) {
        if (!enabled || event == null) {
            return;
        }
        Set<RegistryListener<V>> subscribed = listeners.get(event.name());
        if (subscribed == null) {
            return;
        }
        List<RegistryListener<V>> snapshot = new ArrayList<>(subscribed);
        for (RegistryListener<V> listener : snapshot) {
            listener.onEvent(event);
        }
    }

    /**
     * @param event event name
     * @return number of listeners subscribed to the name
     */
    public int listenerCount(String event) {
        Set<RegistryListener<V>> subscribed = listeners.get(event);
        return subscribed == null ? 0 : subscribed.size();
    }

    /**
     * Removes every listener.
     */
    public void clear() {
        if (enabled) {
            listeners.clear();
        }
    }

    private static void requireArguments(String event, Object listener) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
    }
}
