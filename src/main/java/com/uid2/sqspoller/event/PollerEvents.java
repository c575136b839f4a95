package com.uid2.sqspoller.event;

/**
 * Event bus of one poller. Each occurrence is published once; it reaches the poller-wide listeners first and
 * then, for message events, the listeners registered on that message.
 */
public class PollerEvents {
    private final ListenerRegistry global = new ListenerRegistry();

    public ListenerRegistry.Subscription on(PollerEventType type, PollerEventListener listener) {
        return global.on(type, listener);
    }

    public ListenerRegistry.Subscription once(PollerEventType type, PollerEventListener listener) {
        return global.once(type, listener);
    }

    public void publish(PollerEvent event) {
        global.dispatch(event);
        if (event.message() != null) {
            event.message().listeners().dispatch(event);
        }
    }

    public int listenerCount(PollerEventType type) {
        return global.listenerCount(type);
    }
}
