package com.uid2.sqspoller.sqs;

import com.uid2.sqspoller.blob.BlobPointer;
import com.uid2.sqspoller.blob.BlobStore;
import com.uid2.sqspoller.codec.DecodedPayload;
import com.uid2.sqspoller.codec.OutgoingMessage;
import com.uid2.sqspoller.codec.PayloadCodec;
import com.uid2.sqspoller.config.PollerConfig;
import com.uid2.sqspoller.event.ListenerRegistry;
import com.uid2.sqspoller.event.PollerEvent;
import com.uid2.sqspoller.event.PollerEventType;
import com.uid2.sqspoller.event.PollerEvents;
import com.uid2.sqspoller.util.ContextExecutor;
import io.vertx.core.AsyncResult;
import io.vertx.core.CompositeFuture;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Consumes from and produces to one queue.
 *
 * <p>Keeps a single receive call outstanding while running, asks for no more records than the free in-flight
 * slots allow, and pauses when the slots are used up until handled messages free some. Every state change
 * happens on the Vert.x context the poller was created on; public methods may be called from any thread.</p>
 *
 * <p>Subscribe to {@link #events()} for {@link PollerEventType#MESSAGE} to get work, then call
 * {@link QueueMessage#del()}, {@link QueueMessage#keep()} or {@link QueueMessage#release()} once per
 * message.</p>
 */
public class SqsPoller {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqsPoller.class);

    private final PollerConfig config;
    private final QueueClient queueClient;
    private final BlobStore blobStore;
    private final ContextExecutor executor;
    private final PollerEvents events = new PollerEvents();
    private final PayloadCodec codec;
    private final DeleteBatcher deleteBatcher;
    private final SendBatcher sendBatcher;
    private final PollerMetrics metrics;

    private volatile boolean running = false;
    private boolean paused = true;
    private volatile int inFlight = 0;
    // messages whose slot is still held, inFlight is its size
    private final Set<QueueMessage> outstanding = Collections.newSetFromMap(new IdentityHashMap<>());
    private AbortSignal activeReceive;
    private long receiveTimerId = -1;
    private String queueUrl;
    private Integer queueVisibilityTimeout;
    private Integer queueMaximumMessageSize;
    private TimeoutExtender timeoutExtender;
    private ListenerRegistry.Subscription timeoutReachedSubscription;

    /**
     * @param blobStore required when s3 fallback is enabled, else may be null
     */
    public SqsPoller(Vertx vertx, PollerConfig config, QueueClient queueClient, BlobStore blobStore) {
        this.config = config;
        this.queueClient = queueClient;
        this.blobStore = blobStore;
        this.executor = new ContextExecutor(vertx);
        this.queueUrl = config.getQueueUrl();
        this.codec = new PayloadCodec(config, blobStore, this::getQueueMaximumMessageSize);
        this.deleteBatcher = new DeleteBatcher(executor, queueClient, this::getQueueUrl, events,
            config.getDeleteBatchSize(), config.getDeleteWaitMs());
        this.sendBatcher = new SendBatcher(queueClient, this::getQueueUrl);
        this.metrics = new PollerMetrics(events, config.getQueueName() != null ? config.getQueueName() : config.getQueueUrl());
        LOGGER.info("created poller: {}", config);
    }

    public PollerEvents events() {
        return events;
    }

    public int inFlight() {
        return inFlight;
    }

    public boolean isRunning() {
        return running;
    }

    public PollerConfig getConfig() {
        return config;
    }

    public PollerMetrics getMetrics() {
        return metrics;
    }

    // ==================== lifecycle ====================

    /**
     * Resolves the queue url, installs the timeout extender when enabled, then starts receiving.
     * Calling it while running does nothing.
     */
    public Future<Void> start() {
        return onContext(() -> {
            if (running) {
                return Future.succeededFuture();
            }
            running = true;
            return initTimeoutExtender()
                .compose(v -> getQueueUrl())
                .<Void>map(url -> {
                    LOGGER.info("poller started: {}", url);
                    paused = false;
                    receiveNext();
                    return null;
                })
                .onFailure(e -> {
                    running = false;
                    LOGGER.error("sqs_error: failed to start poller", e);
                    events.publish(PollerEvent.failure(PollerEventType.ERROR, null, e));
                });
        });
    }

    /**
     * Stops receiving. A hard stop also aborts the outstanding receive call.
     *
     * @param timeoutMs how long to wait for in-flight messages to drain, 0 to wait indefinitely
     * @return true once drained, false if the timeout elapsed first
     */
    public Future<Boolean> stop(boolean soft, long timeoutMs) {
        return onContext(() -> {
            if (!soft && activeReceive != null) {
                activeReceive.abort();
            }
            running = false;
            paused = false;
            if (receiveTimerId != -1) {
                executor.cancelTimer(receiveTimerId);
                receiveTimerId = -1;
            }
            LOGGER.info("poller stopping: soft={}, inFlight={}", soft, inFlight);
            if (inFlight == 0) {
                closeTimeoutExtender();
                return Future.succeededFuture(true);
            }

            Promise<Boolean> drained = Promise.promise();
            long[] timer = {-1};
            ListenerRegistry.Subscription subscription = events.once(PollerEventType.DRAINED, e -> {
                if (timer[0] != -1) {
                    executor.cancelTimer(timer[0]);
                }
                if (!running) {
                    closeTimeoutExtender();
                }
                drained.tryComplete(true);
            });
            if (timeoutMs > 0) {
                timer[0] = executor.setTimer(timeoutMs, () -> {
                    subscription.cancel();
                    if (drained.tryComplete(false)) {
                        LOGGER.warn("poller stop timed out after {} ms with {} messages in flight", timeoutMs, inFlight);
                    }
                });
            }
            return drained.future();
        });
    }

    public Future<Boolean> stop() {
        return stop(false, 0);
    }

    private Future<Void> initTimeoutExtender() {
        if (!config.isAutoExtendTimeout() || timeoutExtender != null) {
            return Future.succeededFuture();
        }
        Future<Integer> visibility = config.getVisibilityTimeoutSecs() != null
            ? Future.succeededFuture(config.getVisibilityTimeoutSecs())
            : getQueueVisibilityTimeout();
        return visibility.map(visibilityTimeoutSecs -> {
            timeoutExtender = new TimeoutExtender(executor, events, this::changeMessageVisibility,
                visibilityTimeoutSecs, config.getNoExtensionsAfterSecs(), config.getAdvancedCallMs());
            timeoutReachedSubscription = events.on(PollerEventType.TIMEOUT_REACHED, e -> freeSlot(e.message()));
            LOGGER.info("auto extending visibility: visibilityTimeout={}s, noExtensionsAfter={}s, advancedCall={}ms",
                visibilityTimeoutSecs, config.getNoExtensionsAfterSecs(), config.getAdvancedCallMs());
            return null;
        });
    }

    private void closeTimeoutExtender() {
        if (timeoutExtender == null) {
            return;
        }
        timeoutExtender.close();
        timeoutReachedSubscription.cancel();
        timeoutExtender = null;
        timeoutReachedSubscription = null;
        LOGGER.info("stopped extending visibility");
    }

    // ==================== receive loop ====================

    private boolean slotsAvailable() {
        return config.getMaxInFlight() == 0 || inFlight < config.getMaxInFlight();
    }

    private void scheduleReceive(long delayMs) {
        if (delayMs <= 0) {
            receiveNext();
            return;
        }
        receiveTimerId = executor.setTimer(delayMs, () -> {
            receiveTimerId = -1;
            receiveNext();
        });
    }

    private void receiveNext() {
        if (activeReceive != null || receiveTimerId != -1 || !running) {
            return;
        }
        int maxToGet = config.getMaxInFlight() == 0
            ? config.getReceiveBatchSize()
            : Math.min(config.getMaxInFlight() - inFlight, config.getReceiveBatchSize());
        if (maxToGet < config.getMinReceiveBatchSize()) {
            paused = true;
            return;
        }

        ReceiveMessageRequest.Builder request = ReceiveMessageRequest.builder()
            .queueUrl(queueUrl)
            .maxNumberOfMessages(maxToGet)
            .waitTimeSeconds(config.getReceiveWaitTimeSecs())
            .messageAttributeNames(config.getReceiveAttributes())
            .attributeNamesWithStrings(config.getReceiveSqsAttributes());
        if (config.getVisibilityTimeoutSecs() != null) {
            request.visibilityTimeout(config.getVisibilityTimeoutSecs());
        }

        AbortSignal signal = new AbortSignal();
        activeReceive = signal;
        executor.adopt(queueClient.receiveMessages(request.build(), signal)).onComplete(ar -> {
            if (activeReceive == signal) {
                activeReceive = null;
            }
            if (ar.failed()) {
                if (ar.cause() instanceof ReceiveAbortedException) {
                    LOGGER.info("receive aborted");
                    events.publish(PollerEvent.failure(PollerEventType.ABORTED, null, ar.cause()));
                } else {
                    LOGGER.warn("sqs_error: receive failed, retrying in {} ms", config.getPollRetryMs(), ar.cause());
                    scheduleReceive(config.getPollRetryMs());
                    events.publish(PollerEvent.failure(PollerEventType.ERROR, null, ar.cause()));
                }
                return;
            }

            List<Message> records = ar.result();
            boolean gotMessages = records != null && !records.isEmpty();
            if (gotMessages) {
                events.publish(PollerEvent.withDetail(PollerEventType.GOT_MESSAGES, null, records.size()));
                emitMessages(records);
            } else {
                events.publish(PollerEvent.of(PollerEventType.QUEUE_EMPTY));
            }

            if (slotsAvailable()) {
                scheduleReceive(gotMessages ? config.getActivePollIntervalMs() : config.getIdlePollIntervalMs());
            } else {
                paused = true;
                events.publish(PollerEvent.of(PollerEventType.MAX_IN_FLIGHT));
            }
        });
    }

    /**
     * Decodes concurrently but hands messages out in the order the service returned them.
     */
    private void emitMessages(List<Message> records) {
        List<QueueMessage> messages = new ArrayList<>(records.size());
        for (Message raw : records) {
            messages.add(new QueueMessage(this, raw));
        }
        outstanding.addAll(messages);
        inFlight = outstanding.size();

        Future<Void> ordered = Future.succeededFuture();
        for (QueueMessage message : messages) {
            Future<DecodedPayload> decoded = executor.adopt(codec.decode(message.getRaw()));
            ordered = ordered.compose(v -> decoded.transform(ar -> {
                deliver(message, ar);
                return Future.<Void>succeededFuture();
            }));
        }
    }

    private void deliver(QueueMessage message, AsyncResult<DecodedPayload> decoded) {
        if (decoded.failed()) {
            LOGGER.error("failed to decode message {}, leaving it on the queue", message.getMessageId(), decoded.cause());
            events.publish(PollerEvent.failure(PollerEventType.ERROR, message, decoded.cause()));
            message.markHandled();
            freeSlot(message);
            return;
        }
        message.setDecoded(decoded.result());
        if (message.isBlobBacked()) {
            events.publish(PollerEvent.withDetail(PollerEventType.BLOB_DOWNLOAD, message, message.getBlobPointer()));
        }
        events.publish(PollerEvent.of(PollerEventType.MESSAGE, message));
    }

    // ==================== message handling ====================

    /**
     * Frees the message's in-flight slot without touching the queue. The message can still be deleted,
     * kept or released afterwards.
     */
    public Future<Void> handledMessage(QueueMessage message) {
        return onContext(() -> {
            freeSlot(message);
            return Future.succeededFuture();
        });
    }

    private void freeSlot(QueueMessage message) {
        if (!message.freeSlot()) {
            return;
        }
        outstanding.remove(message);
        inFlight = outstanding.size();
        resumeIfPaused();
        events.publish(PollerEvent.of(PollerEventType.HANDLED, message));
        if (inFlight == 0) {
            events.publish(PollerEvent.of(PollerEventType.DRAINED));
        }
    }

    private void resumeIfPaused() {
        if (paused && running && slotsAvailable()) {
            paused = false;
            receiveNext();
        }
    }

    /**
     * Queues a delete. The returned future completes once the service confirms it.
     */
    public Future<Void> deleteMessage(QueueMessage message) {
        return onContext(() -> {
            if (!message.markHandled()) {
                return Future.succeededFuture();
            }
            Future<Void> deleted = deleteBatcher.add(message);
            freeSlot(message);
            deleteBatcher.scheduleFlush();
            if (message.isBlobBacked() && !config.isS3Retain()) {
                deleted.onSuccess(v -> deleteBlob(message));
            }
            return deleted;
        });
    }

    private void deleteBlob(QueueMessage message) {
        BlobPointer pointer = message.getBlobPointer();
        executor.adopt(blobStore.delete(pointer))
            .onSuccess(v -> events.publish(PollerEvent.withDetail(PollerEventType.BLOB_DELETE, message, pointer)))
            .onFailure(e -> events.publish(PollerEvent.failure(PollerEventType.ERROR, message, e)));
    }

    public Future<Void> keepMessage(QueueMessage message) {
        return onContext(() -> {
            if (!message.markHandled()) {
                return Future.succeededFuture();
            }
            freeSlot(message);
            events.publish(PollerEvent.of(PollerEventType.KEEP, message));
            return Future.succeededFuture();
        });
    }

    /**
     * Frees the slot, then sets the message's visibility timeout to zero.
     */
    public Future<Void> releaseMessage(QueueMessage message) {
        return onContext(() -> {
            if (!message.markHandled()) {
                return Future.succeededFuture();
            }
            freeSlot(message);
            return changeMessageVisibility(message, 0)
                .onSuccess(v -> events.publish(PollerEvent.of(PollerEventType.RELEASED, message)));
        });
    }

    public Future<Void> changeMessageVisibility(QueueMessage message, int visibilityTimeoutSecs) {
        return changeMessageVisibility(message.getReceiptHandle(), visibilityTimeoutSecs);
    }

    public Future<Void> changeMessageVisibility(String receiptHandle, int visibilityTimeoutSecs) {
        return onContext(() -> getQueueUrl()
            .compose(url -> executor.adopt(queueClient.changeMessageVisibility(url, receiptHandle, visibilityTimeoutSecs))));
    }

    // ==================== producing ====================

    /**
     * @param body String bodies are sent as-is, anything else as JSON
     * @param delaySeconds null for the queue default
     * @param attributes may be null
     */
    public Future<SendMessageResponse> sendMessage(Object body, Integer delaySeconds, Map<String, ?> attributes) {
        return onContext(() -> encode(body, delaySeconds, attributes)
            .compose(message -> getQueueUrl()
                .compose(url -> executor.adopt(queueClient.sendMessage(message.toRequest(url))))));
    }

    /**
     * Sends many messages in as few batch calls as the service limits allow. The same attributes apply to
     * every message.
     */
    public Future<SendMessageBatchResponse> sendMessages(List<?> bodies, Integer delaySeconds, Map<String, ?> attributes) {
        List<Map<String, ?>> perMessage = new ArrayList<>(bodies.size());
        for (int i = 0; i < bodies.size(); i++) {
            perMessage.add(attributes);
        }
        return sendMessagesWithAttributes(bodies, delaySeconds, perMessage);
    }

    /**
     * @param attributesList attributes for the message at the same position, may be shorter than bodies
     */
    public Future<SendMessageBatchResponse> sendMessagesWithAttributes(List<?> bodies, Integer delaySeconds,
                                                                       List<? extends Map<String, ?>> attributesList) {
        return onContext(() -> {
            List<Future<OutgoingMessage>> encoded = new ArrayList<>(bodies.size());
            for (int i = 0; i < bodies.size(); i++) {
                Map<String, ?> attributes = attributesList != null && i < attributesList.size() ? attributesList.get(i) : null;
                encoded.add(encode(bodies.get(i), delaySeconds, attributes));
            }
            return CompositeFuture.all(new ArrayList<>(encoded))
                .compose(all -> getQueueMaximumMessageSize().compose(maxSize -> {
                    List<OutgoingMessage> messages = new ArrayList<>(encoded.size());
                    encoded.forEach(f -> messages.add(f.result()));
                    return executor.adopt(sendBatcher.send(messages, maxSize))
                        .onFailure(e -> {
                            LOGGER.error("sqs_error: failed to send batch of {} messages", messages.size(), e);
                            events.publish(PollerEvent.failure(PollerEventType.ERROR, null, e));
                        });
                }));
        });
    }

    private Future<OutgoingMessage> encode(Object body, Integer delaySeconds, Map<String, ?> attributes) {
        return executor.adopt(codec.encode(body, delaySeconds, attributes))
            .onSuccess(message -> {
                if (message.isBlobBacked()) {
                    events.publish(PollerEvent.withDetail(PollerEventType.BLOB_UPLOAD, null, message.blobPointer()));
                }
            });
    }

    // ==================== queue operations ====================

    /**
     * The configured queue url, else looked up by name once and cached.
     */
    public Future<String> getQueueUrl() {
        return onContext(() -> {
            if (queueUrl != null) {
                return Future.succeededFuture(queueUrl);
            }
            return executor.adopt(queueClient.getQueueUrl(config.getQueueName(), config.getAccountNumber()))
                .map(url -> {
                    queueUrl = config.isCorrectQueueUrl() ? correctQueueUrl(url, config.getEndpoint()) : url;
                    return queueUrl;
                });
        });
    }

    /**
     * Keeps the queue path but takes scheme, host and port from the endpoint, for local queue emulators that
     * report urls with their public host name.
     */
    static String correctQueueUrl(String queueUrl, String endpoint) {
        try {
            URI target = new URI(endpoint);
            URI original = new URI(queueUrl);
            return new URI(target.getScheme(), target.getUserInfo(), target.getHost(), target.getPort(),
                original.getPath(), null, null).toString();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("cannot correct queue url " + queueUrl + " to endpoint " + endpoint, e);
        }
    }

    /**
     * Creates the configured queue by name and remembers its url.
     */
    public Future<String> createQueue() {
        return onContext(() -> {
            if (config.getQueueName() == null) {
                return Future.failedFuture(new IllegalStateException("poller was not configured with a queue name"));
            }
            Map<QueueAttributeName, String> attributes = new EnumMap<>(QueueAttributeName.class);
            attributes.put(QueueAttributeName.RECEIVE_MESSAGE_WAIT_TIME_SECONDS, String.valueOf(config.getReceiveWaitTimeSecs()));
            attributes.put(QueueAttributeName.DELAY_SECONDS, String.valueOf(config.getDelaySecs()));
            attributes.put(QueueAttributeName.MAXIMUM_MESSAGE_SIZE, String.valueOf(config.getMaxMessageBytes()));
            attributes.put(QueueAttributeName.MESSAGE_RETENTION_PERIOD, String.valueOf(config.getMessageRetentionSecs()));
            if (config.getVisibilityTimeoutSecs() != null) {
                attributes.put(QueueAttributeName.VISIBILITY_TIMEOUT, String.valueOf(config.getVisibilityTimeoutSecs()));
            }
            if (config.getQueuePolicy() != null) {
                attributes.put(QueueAttributeName.POLICY, config.getQueuePolicy());
            }
            return executor.adopt(queueClient.createQueue(config.getQueueName(), attributes))
                .map(url -> {
                    queueUrl = url;
                    return url;
                });
        });
    }

    public Future<Void> deleteQueue() {
        return onContext(() -> getQueueUrl().compose(url -> executor.adopt(queueClient.deleteQueue(url))));
    }

    /**
     * Purges the queue and forgets local state: queued deletes, whose futures fail, and every held slot. Messages
     * received before the purge no longer count against the in-flight limit when handled later.
     */
    public Future<Void> purgeQueue() {
        return onContext(() -> getQueueUrl()
            .compose(url -> executor.adopt(queueClient.purgeQueue(url)))
            .onSuccess(v -> {
                LOGGER.info("queue purged, dropping {} in flight and {} queued deletes", inFlight, deleteBatcher.size());
                deleteBatcher.clear(new IllegalStateException("queue was purged"));
                List<QueueMessage> dropped = new ArrayList<>(outstanding);
                outstanding.clear();
                inFlight = 0;
                for (QueueMessage message : dropped) {
                    message.freeSlot();
                    events.publish(PollerEvent.of(PollerEventType.HANDLED, message));
                }
                if (!dropped.isEmpty()) {
                    events.publish(PollerEvent.of(PollerEventType.DRAINED));
                }
                resumeIfPaused();
            }));
    }

    public Future<Integer> getQueueVisibilityTimeout() {
        return onContext(() -> {
            if (queueVisibilityTimeout != null) {
                return Future.succeededFuture(queueVisibilityTimeout);
            }
            return getIntAttribute(QueueAttributeName.VISIBILITY_TIMEOUT).map(value -> {
                queueVisibilityTimeout = value;
                return value;
            });
        });
    }

    public Future<Integer> getQueueMaximumMessageSize() {
        return onContext(() -> {
            if (queueMaximumMessageSize != null) {
                return Future.succeededFuture(queueMaximumMessageSize);
            }
            return getIntAttribute(QueueAttributeName.MAXIMUM_MESSAGE_SIZE).map(value -> {
                queueMaximumMessageSize = value;
                return value;
            });
        });
    }

    private Future<Integer> getIntAttribute(QueueAttributeName name) {
        return getQueueUrl()
            .compose(url -> executor.adopt(queueClient.getQueueAttributes(url, List.of(name))))
            .map(attributes -> {
                String value = attributes == null ? null : attributes.get(name);
                if (value == null) {
                    throw new IllegalStateException("GetQueueAttributes response did not contain " + name + ": " + attributes);
                }
                return Integer.parseInt(value);
            });
    }

    // ==================== internals ====================

    private <T> Future<T> onContext(Supplier<Future<T>> action) {
        if (executor.isOnContext()) {
            return invoke(action);
        }
        Promise<T> promise = Promise.promise();
        executor.execute(() -> invoke(action).onComplete(promise));
        return promise.future();
    }

    private static <T> Future<T> invoke(Supplier<Future<T>> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    boolean isPaused() {
        return paused;
    }

    TimeoutExtender getTimeoutExtender() {
        return timeoutExtender;
    }
}
