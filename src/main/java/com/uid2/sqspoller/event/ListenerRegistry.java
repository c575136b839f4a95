package com.uid2.sqspoller.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listeners grouped by event type. Used for both the poller-wide and the per-message scope.
 */
public class ListenerRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(ListenerRegistry.class);

    private final Map<PollerEventType, List<PollerEventListener>> listeners = new EnumMap<>(PollerEventType.class);

    /**
     * Registers a listener and returns a handle that removes it again.
     */
    public synchronized Subscription on(PollerEventType type, PollerEventListener listener) {
        List<PollerEventListener> forType = listeners.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>());
        forType.add(listener);
        return () -> forType.remove(listener);
    }

    /**
     * Registers a listener that removes itself after its first invocation.
     */
    public Subscription once(PollerEventType type, PollerEventListener listener) {
        Subscription[] holder = new Subscription[1];
        boolean[] fired = new boolean[1];
        holder[0] = on(type, event -> {
            if (fired[0]) {
                return;
            }
            fired[0] = true;
            holder[0].cancel();
            listener.onEvent(event);
        });
        return holder[0];
    }

    public void dispatch(PollerEvent event) {
        List<PollerEventListener> forType;
        synchronized (this) {
            forType = listeners.get(event.type());
        }
        if (forType == null) {
            return;
        }
        for (PollerEventListener listener : forType) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOGGER.error("listener failed handling event {}", event.type(), e);
            }
        }
    }

    public synchronized int listenerCount(PollerEventType type) {
        List<PollerEventListener> forType = listeners.get(type);
        return forType == null ? 0 : forType.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void cancel();
    }
}
