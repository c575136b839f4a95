package com.uid2.sqspoller.sqs;

import java.util.ArrayList;
import java.util.List;

/**
 * Cancellation handle for one receive call.
 */
public class AbortSignal {
    private final List<Runnable> handlers = new ArrayList<>();
    private boolean aborted = false;

    public void abort() {
        List<Runnable> toRun;
        synchronized (this) {
            if (aborted) {
                return;
            }
            aborted = true;
            toRun = new ArrayList<>(handlers);
            handlers.clear();
        }
        toRun.forEach(Runnable::run);
    }

    public synchronized boolean isAborted() {
        return aborted;
    }

    /**
     * Registers a handler; runs it immediately if the signal already fired.
     */
    public void onAbort(Runnable handler) {
        synchronized (this) {
            if (!aborted) {
                handlers.add(handler);
                return;
            }
        }
        handler.run();
    }
}
