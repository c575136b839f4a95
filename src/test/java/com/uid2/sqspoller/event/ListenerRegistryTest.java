package com.uid2.sqspoller.event;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ListenerRegistryTest {

    @Test
    void testDispatchOnlyToMatchingType() {
        ListenerRegistry registry = new ListenerRegistry();
        List<PollerEvent> drained = new ArrayList<>();
        List<PollerEvent> empty = new ArrayList<>();
        registry.on(PollerEventType.DRAINED, drained::add);
        registry.on(PollerEventType.QUEUE_EMPTY, empty::add);

        registry.dispatch(PollerEvent.of(PollerEventType.DRAINED));

        assertEquals(1, drained.size());
        assertTrue(empty.isEmpty());
    }

    @Test
    void testCancelledSubscriptionNotCalled() {
        ListenerRegistry registry = new ListenerRegistry();
        List<PollerEvent> seen = new ArrayList<>();
        ListenerRegistry.Subscription subscription = registry.on(PollerEventType.ERROR, seen::add);

        subscription.cancel();
        registry.dispatch(PollerEvent.failure(PollerEventType.ERROR, null, new RuntimeException("boom")));

        assertTrue(seen.isEmpty());
        assertEquals(0, registry.listenerCount(PollerEventType.ERROR));
    }

    @Test
    void testOnceFiresOnlyOnce() {
        ListenerRegistry registry = new ListenerRegistry();
        List<PollerEvent> seen = new ArrayList<>();
        registry.once(PollerEventType.DRAINED, seen::add);

        registry.dispatch(PollerEvent.of(PollerEventType.DRAINED));
        registry.dispatch(PollerEvent.of(PollerEventType.DRAINED));

        assertEquals(1, seen.size());
        assertEquals(0, registry.listenerCount(PollerEventType.DRAINED));
    }

    @Test
    void testFailingListenerDoesNotStopOthers() {
        ListenerRegistry registry = new ListenerRegistry();
        List<PollerEvent> seen = new ArrayList<>();
        registry.on(PollerEventType.QUEUE_EMPTY, e -> {
            throw new IllegalStateException("listener bug");
        });
        registry.on(PollerEventType.QUEUE_EMPTY, seen::add);

        assertDoesNotThrow(() -> registry.dispatch(PollerEvent.of(PollerEventType.QUEUE_EMPTY)));
        assertEquals(1, seen.size());
    }

    @Test
    void testPollerEventsPublishesGlobalEventsWithoutMessage() {
        PollerEvents events = new PollerEvents();
        List<PollerEvent> seen = new ArrayList<>();
        events.on(PollerEventType.GOT_MESSAGES, seen::add);

        events.publish(PollerEvent.withDetail(PollerEventType.GOT_MESSAGES, null, 3));

        assertEquals(1, seen.size());
        assertEquals(3, seen.get(0).detail());
        assertNull(seen.get(0).message());
        assertEquals(1, events.listenerCount(PollerEventType.GOT_MESSAGES));
    }
}
