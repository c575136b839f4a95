package com.uid2.sqspoller.sqs;

import com.uid2.sqspoller.blob.BlobPointer;
import com.uid2.sqspoller.codec.DecodedPayload;
import com.uid2.sqspoller.codec.MessageAttribute;
import com.uid2.sqspoller.event.ListenerRegistry;
import com.uid2.sqspoller.event.PollerEventListener;
import com.uid2.sqspoller.event.PollerEventType;
import io.vertx.core.Future;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageSystemAttributeName;

import java.util.Map;

/**
 * A received record and its lifecycle: received, decoded, handed out, then handled exactly once through
 * {@link #del()}, {@link #keep()} or {@link #release()}.
 */
public class QueueMessage {
    private final SqsPoller poller;
    private final Message raw;
    private final ListenerRegistry listeners = new ListenerRegistry();
    private final long receivedAtMs;

    private volatile DecodedPayload decoded;
    private volatile boolean handled = false;
    // in-flight slot accounting, separate from the caller facing handled flag
    private boolean slotFreed = false;

    QueueMessage(SqsPoller poller, Message raw) {
        this.poller = poller;
        this.raw = raw;
        this.receivedAtMs = System.currentTimeMillis();
    }

    public String getMessageId() {
        return raw.messageId();
    }

    public String getReceiptHandle() {
        return raw.receiptHandle();
    }

    public Message getRaw() {
        return raw;
    }

    public long getReceivedAtMs() {
        return receivedAtMs;
    }

    public boolean isDecoded() {
        return decoded != null;
    }

    /**
     * @throws IllegalStateException if decoding has not completed
     */
    public Object getBody() {
        return requireDecoded().body();
    }

    /**
     * Convenience cast for callers that know the body type, e.g. {@code JsonObject} for JSON bodies.
     */
    public <T> T getBodyAs(Class<T> type) {
        return type.cast(getBody());
    }

    public Map<String, MessageAttribute> getAttributes() {
        return requireDecoded().attributes();
    }

    public Map<MessageSystemAttributeName, String> getSqsAttributes() {
        return raw.attributes();
    }

    public int getReceiveCount() {
        String count = raw.attributes().get(MessageSystemAttributeName.APPROXIMATE_RECEIVE_COUNT);
        if (count == null) {
            return 0;
        }
        try {
            return Integer.parseInt(count);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public String getTopicArn() {
        return requireDecoded().topicArn();
    }

    public String getTopicName() {
        return requireDecoded().topicName();
    }

    public String getSubject() {
        return requireDecoded().subject();
    }

    public BlobPointer getBlobPointer() {
        return requireDecoded().blobPointer();
    }

    public boolean isBlobBacked() {
        return decoded != null && decoded.blobPointer() != null;
    }

    public boolean isHandled() {
        return handled;
    }

    /**
     * Queues the message for deletion. Completes once the delete is confirmed.
     */
    public Future<Void> del() {
        return poller.deleteMessage(this);
    }

    /**
     * Leaves the message on the queue and frees its in-flight slot.
     */
    public Future<Void> keep() {
        return poller.keepMessage(this);
    }

    /**
     * Frees the slot and makes the message visible to receivers again.
     */
    public Future<Void> release() {
        return poller.releaseMessage(this);
    }

    public Future<Void> changeVisibility(int visibilityTimeoutSecs) {
        return poller.changeMessageVisibility(this, visibilityTimeoutSecs);
    }

    public ListenerRegistry.Subscription on(PollerEventType type, PollerEventListener listener) {
        return listeners.on(type, listener);
    }

    public ListenerRegistry.Subscription once(PollerEventType type, PollerEventListener listener) {
        return listeners.once(type, listener);
    }

    public ListenerRegistry listeners() {
        return listeners;
    }

    void setDecoded(DecodedPayload payload) {
        this.decoded = payload;
    }

    /**
     * @return false if the message was already handled
     */
    boolean markHandled() {
        if (handled) {
            return false;
        }
        handled = true;
        return true;
    }

    /**
     * @return false if the slot was already freed
     */
    boolean freeSlot() {
        if (slotFreed) {
            return false;
        }
        slotFreed = true;
        return true;
    }

    private DecodedPayload requireDecoded() {
        DecodedPayload payload = decoded;
        if (payload == null) {
            throw new IllegalStateException("message " + getMessageId() + " has not been decoded");
        }
        return payload;
    }

    @Override
    public String toString() {
        return "QueueMessage{id=" + getMessageId() + ", handled=" + handled + "}";
    }
}
