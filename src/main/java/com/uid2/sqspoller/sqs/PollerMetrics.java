package com.uid2.sqspoller.sqs;

import com.uid2.sqspoller.event.PollerEventType;
import com.uid2.sqspoller.event.PollerEvents;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;

/**
 * Poller counters, fed from the poller's event bus.
 *
 * Tracks:
 * - messages received and handed out
 * - deletes confirmed and rejected
 * - receive and transport errors
 * - visibility extensions
 */
public class PollerMetrics {

    private final Counter messagesReceived;
    private final Counter messagesDeleted;
    private final Counter deleteErrors;
    private final Counter errors;
    private final Counter timeoutsExtended;
    private final Counter blobUploads;

    public PollerMetrics(PollerEvents events, String queue) {
        this(events, queue, Metrics.globalRegistry);
    }

    PollerMetrics(PollerEvents events, String queue, MeterRegistry registry) {
        this.messagesReceived = Counter
            .builder("uid2_sqs_poller_messages_received_total")
            .description("counter for how many messages were received and decoded")
            .tag("queue", queue)
            .register(registry);

        this.messagesDeleted = Counter
            .builder("uid2_sqs_poller_messages_deleted_total")
            .description("counter for how many message deletes were confirmed")
            .tag("queue", queue)
            .register(registry);

        this.deleteErrors = Counter
            .builder("uid2_sqs_poller_delete_errors_total")
            .description("counter for how many message deletes were rejected")
            .tag("queue", queue)
            .register(registry);

        this.errors = Counter
            .builder("uid2_sqs_poller_errors_total")
            .description("counter for receive, decode and transport errors")
            .tag("queue", queue)
            .register(registry);

        this.timeoutsExtended = Counter
            .builder("uid2_sqs_poller_timeouts_extended_total")
            .description("counter for how many visibility extensions succeeded")
            .tag("queue", queue)
            .register(registry);

        this.blobUploads = Counter
            .builder("uid2_sqs_poller_blob_uploads_total")
            .description("counter for how many outgoing bodies were offloaded to the blob store")
            .tag("queue", queue)
            .register(registry);

        events.on(PollerEventType.MESSAGE, e -> messagesReceived.increment());
        events.on(PollerEventType.DELETED, e -> messagesDeleted.increment());
        events.on(PollerEventType.DELETE_ERROR, e -> deleteErrors.increment());
        events.on(PollerEventType.ERROR, e -> errors.increment());
        events.on(PollerEventType.TIMEOUT_EXTENDED, e -> timeoutsExtended.increment());
        events.on(PollerEventType.BLOB_UPLOAD, e -> blobUploads.increment());
    }

    public double getMessagesReceived() {
        return messagesReceived.count();
    }

    public double getMessagesDeleted() {
        return messagesDeleted.count();
    }

    public double getDeleteErrors() {
        return deleteErrors.count();
    }

    public double getErrors() {
        return errors.count();
    }
}
