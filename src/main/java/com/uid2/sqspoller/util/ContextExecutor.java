package com.uid2.sqspoller.util;

import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;

/**
 * Runs work on one Vert.x context so that state touched only from here needs no locking.
 *
 * <p>The context is captured at construction: the caller's context when built on a Vert.x thread, else a new
 * event loop context.</p>
 */
public class ContextExecutor {
    private final Vertx vertx;
    private final Context context;

    public ContextExecutor(Vertx vertx) {
        this.vertx = vertx;
        this.context = vertx.getOrCreateContext();
    }

    public Vertx vertx() {
        return vertx;
    }

    public boolean isOnContext() {
        return Vertx.currentContext() == context;
    }

    /**
     * Runs inline when already on the context, else schedules it there.
     */
    public void execute(Runnable task) {
        if (isOnContext()) {
            task.run();
        } else {
            context.runOnContext(v -> task.run());
        }
    }

    /**
     * Re-completes a future produced elsewhere (SDK threads, another context) on this context.
     */
    public <T> Future<T> adopt(Future<T> future) {
        Promise<T> promise = Promise.promise();
        future.onComplete(ar -> execute(() -> promise.handle(ar)));
        return promise.future();
    }

    /**
     * Schedules a one shot timer whose handler runs on this context. Must be called on the context.
     */
    public long setTimer(long delayMs, Runnable task) {
        if (!isOnContext()) {
            throw new IllegalStateException("timers must be scheduled from the owning context");
        }
        return vertx.setTimer(Math.max(1, delayMs), id -> task.run());
    }

    public boolean cancelTimer(long timerId) {
        return vertx.cancelTimer(timerId);
    }
}
