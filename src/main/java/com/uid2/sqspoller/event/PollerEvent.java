package com.uid2.sqspoller.event;

import com.uid2.sqspoller.sqs.QueueMessage;

/**
 * One occurrence in the poller's lifecycle.
 *
 * @param type what happened
 * @param message affected message, or null for poller-wide events
 * @param error failure cause for ERROR, ABORTED, DELETE_ERROR and AUTO_EXTEND_* events
 * @param detail type specific payload (record count, entry id, error entry, blob pointer)
 */
public record PollerEvent(PollerEventType type, QueueMessage message, Throwable error, Object detail) {

    public static PollerEvent of(PollerEventType type) {
        return new PollerEvent(type, null, null, null);
    }

    public static PollerEvent of(PollerEventType type, QueueMessage message) {
        return new PollerEvent(type, message, null, null);
    }

    public static PollerEvent withDetail(PollerEventType type, QueueMessage message, Object detail) {
        return new PollerEvent(type, message, null, detail);
    }

    public static PollerEvent failure(PollerEventType type, QueueMessage message, Throwable error) {
        return new PollerEvent(type, message, error, null);
    }
}
