package com.uid2.sqspoller.sqs;

import com.uid2.sqspoller.event.PollerEvent;
import com.uid2.sqspoller.event.PollerEventType;
import com.uid2.sqspoller.event.PollerEvents;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PollerMetricsTest {

    @Test
    void testCountersFollowEvents() {
        PollerEvents events = new PollerEvents();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        PollerMetrics metrics = new PollerMetrics(events, "orders", registry);

        events.publish(PollerEvent.of(PollerEventType.MESSAGE));
        events.publish(PollerEvent.of(PollerEventType.MESSAGE));
        events.publish(PollerEvent.withDetail(PollerEventType.DELETED, null, "m-1"));
        events.publish(PollerEvent.failure(PollerEventType.ERROR, null, new RuntimeException("boom")));
        events.publish(PollerEvent.of(PollerEventType.QUEUE_EMPTY));

        assertEquals(2.0, metrics.getMessagesReceived());
        assertEquals(1.0, metrics.getMessagesDeleted());
        assertEquals(0.0, metrics.getDeleteErrors());
        assertEquals(1.0, metrics.getErrors());
        assertEquals(2.0, registry.get("uid2_sqs_poller_messages_received_total").tag("queue", "orders").counter().count());
    }
}
