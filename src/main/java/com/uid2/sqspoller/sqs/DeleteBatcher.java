package com.uid2.sqspoller.sqs;

import com.uid2.sqspoller.event.PollerEvent;
import com.uid2.sqspoller.event.PollerEventType;
import com.uid2.sqspoller.event.PollerEvents;
import com.uid2.sqspoller.util.ContextExecutor;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.model.BatchResultErrorEntry;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchResultEntry;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Collects deletes into DeleteMessageBatch calls. A full batch is flushed immediately; a partial batch waits
 * for the debounce delay counted from its first entry. Confined to the poller context.
 */
class DeleteBatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(DeleteBatcher.class);

    record DeleteQueueItem(QueueMessage message, String id, String receiptHandle, Promise<Void> promise) {
    }

    private final ContextExecutor executor;
    private final QueueClient queueClient;
    private final Supplier<Future<String>> queueUrl;
    private final PollerEvents events;
    private final int batchSize;
    private final LinkedHashMap<String, DeleteQueueItem> pending = new LinkedHashMap<>();
    private final DebounceTimer timer;

    DeleteBatcher(ContextExecutor executor, QueueClient queueClient, Supplier<Future<String>> queueUrl,
                  PollerEvents events, int batchSize, int waitMs) {
        this.executor = executor;
        this.queueClient = queueClient;
        this.queueUrl = queueUrl;
        this.events = events;
        this.batchSize = batchSize;
        this.timer = new DebounceTimer(executor, waitMs, this::flushAll);
    }

    /**
     * Adds the message keyed by its id. A repeated id replaces the queued receipt handle and keeps its
     * position; both callers are completed by the one delete.
     */
    Future<Void> add(QueueMessage message) {
        Promise<Void> promise = Promise.promise();
        DeleteQueueItem item = new DeleteQueueItem(message, message.getMessageId(), message.getReceiptHandle(), promise);
        DeleteQueueItem previous = pending.put(item.id(), item);
        if (previous != null) {
            promise.future().onComplete(previous.promise());
        }
        events.publish(PollerEvent.of(PollerEventType.DELETE_QUEUED, message));
        return promise.future();
    }

    /**
     * Sends a full batch right away, else makes sure the debounce timer is running.
     */
    void scheduleFlush() {
        if (pending.size() >= batchSize) {
            timer.disarm();
            flush(take(batchSize));
        } else if (!pending.isEmpty()) {
            timer.arm();
        }
    }

    int size() {
        return pending.size();
    }

    DebounceTimer.State timerState() {
        return timer.state();
    }

    /**
     * Drops everything queued and fails the pending futures.
     */
    void clear(Throwable cause) {
        timer.disarm();
        List<DeleteQueueItem> dropped = take(pending.size());
        dropped.forEach(item -> item.promise().tryFail(cause));
        if (!dropped.isEmpty()) {
            LOGGER.warn("dropped {} queued deletes: {}", dropped.size(), cause.getMessage());
        }
    }

    private void flushAll() {
        if (!pending.isEmpty()) {
            flush(take(pending.size()));
        }
    }

    private List<DeleteQueueItem> take(int count) {
        List<DeleteQueueItem> batch = new ArrayList<>(count);
        Iterator<DeleteQueueItem> it = pending.values().iterator();
        while (it.hasNext() && batch.size() < count) {
            batch.add(it.next());
            it.remove();
        }
        return batch;
    }

    private void flush(List<DeleteQueueItem> batch) {
        Map<String, DeleteQueueItem> itemsById = new LinkedHashMap<>();
        List<DeleteMessageBatchRequestEntry> entries = new ArrayList<>(batch.size());
        for (DeleteQueueItem item : batch) {
            itemsById.put(item.id(), item);
            entries.add(DeleteMessageBatchRequestEntry.builder()
                .id(item.id())
                .receiptHandle(item.receiptHandle())
                .build());
        }

        LOGGER.debug("flushing delete batch of {} messages", entries.size());
        executor.adopt(queueUrl.get().compose(url -> queueClient.deleteMessageBatch(url, entries)))
            .onSuccess(response -> handleResponse(response, itemsById))
            .onFailure(e -> {
                events.publish(PollerEvent.failure(PollerEventType.ERROR, null, e));
                batch.forEach(item -> item.promise().tryFail(e));
            });
    }

    private void handleResponse(DeleteMessageBatchResponse response, Map<String, DeleteQueueItem> itemsById) {
        for (BatchResultErrorEntry failure : response.failed()) {
            DeleteQueueItem item = itemsById.remove(failure.id());
            if (item == null) {
                LOGGER.warn("sqs_error: delete failure for unknown entry id {}", failure.id());
                continue;
            }
            DeleteFailedException error = new DeleteFailedException(failure);
            LOGGER.warn("sqs_error: {}", error.getMessage());
            events.publish(new PollerEvent(PollerEventType.DELETE_ERROR, item.message(), error, failure));
            item.promise().tryFail(error);
        }
        for (DeleteMessageBatchResultEntry success : response.successful()) {
            DeleteQueueItem item = itemsById.remove(success.id());
            if (item == null) {
                continue;
            }
            events.publish(PollerEvent.withDetail(PollerEventType.DELETED, item.message(), success.id()));
            item.promise().tryComplete();
        }
        // entries the service did not report on
        itemsById.values().forEach(item -> item.promise().tryFail(new IllegalStateException("no delete result for entry " + item.id())));
    }
}
