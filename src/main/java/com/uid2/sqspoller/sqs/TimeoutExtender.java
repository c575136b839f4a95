package com.uid2.sqspoller.sqs;

import com.uid2.sqspoller.event.ListenerRegistry;
import com.uid2.sqspoller.event.PollerEvent;
import com.uid2.sqspoller.event.PollerEventType;
import com.uid2.sqspoller.event.PollerEvents;
import com.uid2.sqspoller.util.ContextExecutor;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Keeps handed out messages invisible while the caller works on them.
 *
 * <p>Each tracked message is renewed {@code advancedCallMs} before its visibility runs out, by the queue's
 * visibility timeout or by whatever is left of the extension allowance, whichever is shorter. Once the
 * allowance counted from receipt is used up the message is reported as TIMEOUT_REACHED and dropped.</p>
 */
public class TimeoutExtender {
    private static final Logger LOGGER = LoggerFactory.getLogger(TimeoutExtender.class);
    static final String MESSAGE_GONE_ERROR = "Message does not exist or is not available";

    private static class Tracked {
        final QueueMessage message;
        long expiresAtMs;
        long timerId = -1;

        Tracked(QueueMessage message, long expiresAtMs) {
            this.message = message;
            this.expiresAtMs = expiresAtMs;
        }
    }

    private final ContextExecutor executor;
    private final PollerEvents events;
    private final BiFunction<QueueMessage, Integer, Future<Void>> changeVisibility;
    private final long visibilityTimeoutMs;
    private final long noExtensionsAfterMs;
    private final long advancedCallMs;
    private final Map<String, Tracked> tracked = new HashMap<>();
    private final List<ListenerRegistry.Subscription> subscriptions;

    /**
     * Must be created on the executor's context; starts tracking on the next MESSAGE event.
     */
    public TimeoutExtender(ContextExecutor executor, PollerEvents events,
                           BiFunction<QueueMessage, Integer, Future<Void>> changeVisibility,
                           int visibilityTimeoutSecs, int noExtensionsAfterSecs, int advancedCallMs) {
        this.executor = executor;
        this.events = events;
        this.changeVisibility = changeVisibility;
        this.visibilityTimeoutMs = visibilityTimeoutSecs * 1000L;
        this.noExtensionsAfterMs = noExtensionsAfterSecs * 1000L;
        this.advancedCallMs = advancedCallMs;
        this.subscriptions = List.of(
            events.on(PollerEventType.MESSAGE, e -> track(e.message())),
            events.on(PollerEventType.HANDLED, e -> untrack(e.message())));
    }

    public int trackedCount() {
        return tracked.size();
    }

    /**
     * Cancels every pending renewal and stops listening for new messages.
     */
    public void close() {
        subscriptions.forEach(ListenerRegistry.Subscription::cancel);
        tracked.values().forEach(t -> executor.cancelTimer(t.timerId));
        tracked.clear();
    }

    private void track(QueueMessage message) {
        if (message.isHandled() || tracked.containsKey(message.getMessageId())) {
            return;
        }
        Tracked t = new Tracked(message, message.getReceivedAtMs() + visibilityTimeoutMs);
        tracked.put(message.getMessageId(), t);
        schedule(t, System.currentTimeMillis());
    }

    private void untrack(QueueMessage message) {
        Tracked t = tracked.get(message.getMessageId());
        if (t != null && t.message == message) {
            tracked.remove(message.getMessageId());
            executor.cancelTimer(t.timerId);
        }
    }

    private void schedule(Tracked t, long nowMs) {
        long allowanceEndsAt = t.message.getReceivedAtMs() + noExtensionsAfterMs;
        long renewAt;
        if (t.expiresAtMs >= allowanceEndsAt) {
            // the current lease already covers the allowance, next wake up only reports it as reached
            renewAt = allowanceEndsAt;
        } else {
            renewAt = t.expiresAtMs - advancedCallMs;
            if (renewAt <= nowMs) {
                renewAt = nowMs + Math.max(0, (t.expiresAtMs - nowMs) / 2);
            }
        }
        t.timerId = executor.setTimer(Math.max(0, renewAt - nowMs), () -> renew(t));
    }

    private boolean isTracked(Tracked t) {
        return tracked.get(t.message.getMessageId()) == t;
    }

    private void renew(Tracked t) {
        if (!isTracked(t)) {
            return;
        }
        long now = System.currentTimeMillis();
        long remainingMs = t.message.getReceivedAtMs() + noExtensionsAfterMs - now;
        int extendBySecs = (int) (Math.min(visibilityTimeoutMs, remainingMs) / 1000);
        if (extendBySecs <= 0) {
            tracked.remove(t.message.getMessageId());
            LOGGER.info("message {} reached its extension limit of {} ms", t.message.getMessageId(), noExtensionsAfterMs);
            events.publish(PollerEvent.of(PollerEventType.TIMEOUT_REACHED, t.message));
            return;
        }

        events.publish(PollerEvent.withDetail(PollerEventType.EXTENDING_TIMEOUT, t.message, extendBySecs));
        changeVisibility.apply(t.message, extendBySecs).onComplete(ar -> {
            if (!isTracked(t)) {
                return;
            }
            long completedAt = System.currentTimeMillis();
            if (ar.succeeded()) {
                t.expiresAtMs = now + extendBySecs * 1000L;
                events.publish(PollerEvent.withDetail(PollerEventType.TIMEOUT_EXTENDED, t.message, extendBySecs));
                schedule(t, completedAt);
            } else if (isMessageGone(ar.cause())) {
                tracked.remove(t.message.getMessageId());
                LOGGER.warn("sqs_error: message {} is gone, no longer extending its visibility", t.message.getMessageId());
                events.publish(PollerEvent.failure(PollerEventType.AUTO_EXTEND_FAIL, t.message, ar.cause()));
            } else {
                LOGGER.warn("sqs_error: failed to extend visibility of message {}", t.message.getMessageId(), ar.cause());
                events.publish(PollerEvent.failure(PollerEventType.AUTO_EXTEND_ERROR, t.message, ar.cause()));
                // retry while still inside the advance window
                t.timerId = executor.setTimer(Math.max(advancedCallMs / 2, 100), () -> renew(t));
            }
        });
    }

    private static boolean isMessageGone(Throwable error) {
        return error != null && error.getMessage() != null && error.getMessage().contains(MESSAGE_GONE_ERROR);
    }
}
