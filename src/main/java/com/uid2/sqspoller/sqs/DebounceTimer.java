package com.uid2.sqspoller.sqs;

import com.uid2.sqspoller.util.ContextExecutor;

/**
 * Single pending timer: IDLE, then ARMED once, then FIRED while the action runs, then IDLE again.
 * Arming an armed timer does not push its deadline back.
 */
class DebounceTimer {
    enum State {
        IDLE,
        ARMED,
        FIRED
    }

    private final ContextExecutor executor;
    private final long delayMs;
    private final Runnable action;

    private State state = State.IDLE;
    private long timerId = -1;

    DebounceTimer(ContextExecutor executor, long delayMs, Runnable action) {
        this.executor = executor;
        this.delayMs = delayMs;
        this.action = action;
    }

    /**
     * @return true if this call armed the timer
     */
    boolean arm() {
        if (state != State.IDLE) {
            return false;
        }
        state = State.ARMED;
        timerId = executor.setTimer(delayMs, this::fire);
        return true;
    }

    void disarm() {
        if (state == State.ARMED) {
            executor.cancelTimer(timerId);
        }
        timerId = -1;
        state = State.IDLE;
    }

    State state() {
        return state;
    }

    private void fire() {
        if (state != State.ARMED) {
            return;
        }
        state = State.FIRED;
        timerId = -1;
        try {
            action.run();
        } finally {
            state = State.IDLE;
        }
    }
}
