package com.uid2.sqspoller.event;

@FunctionalInterface
public interface PollerEventListener {
    void onEvent(PollerEvent event);
}
