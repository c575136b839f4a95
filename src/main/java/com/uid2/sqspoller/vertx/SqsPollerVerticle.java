package com.uid2.sqspoller.vertx;

import com.uid2.sqspoller.blob.BlobStore;
import com.uid2.sqspoller.config.PollerConfig;
import com.uid2.sqspoller.event.PollerEventListener;
import com.uid2.sqspoller.event.PollerEventType;
import com.uid2.sqspoller.sqs.QueueClient;
import com.uid2.sqspoller.sqs.SqsPoller;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a poller for the lifetime of a verticle deployment: receiving starts on deploy, and undeploy
 * soft-stops it, waiting up to the configured stop timeout for in-flight messages to drain.
 */
public class SqsPollerVerticle extends AbstractVerticle {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqsPollerVerticle.class);

    private final PollerConfig config;
    private final QueueClient queueClient;
    private final BlobStore blobStore;
    private final PollerEventListener messageHandler;
    private SqsPoller poller;

    /**
     * @param messageHandler receives every MESSAGE event; it must del, keep or release each message
     */
    public SqsPollerVerticle(PollerConfig config, QueueClient queueClient, BlobStore blobStore, PollerEventListener messageHandler) {
        this.config = config;
        this.queueClient = queueClient;
        this.blobStore = blobStore;
        this.messageHandler = messageHandler;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        LOGGER.info("starting sqs poller verticle");
        try {
            this.poller = new SqsPoller(vertx, config, queueClient, blobStore);
            this.poller.events().on(PollerEventType.MESSAGE, messageHandler);
        } catch (Exception e) {
            LOGGER.error("failed to create sqs poller", e);
            startPromise.fail(e);
            return;
        }

        this.poller.start().onComplete(ar -> {
            if (ar.succeeded()) {
                LOGGER.info("sqs poller verticle started");
                startPromise.complete();
            } else {
                LOGGER.error("failed to start sqs poller", ar.cause());
                startPromise.fail(ar.cause());
            }
        });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (this.poller == null) {
            stopPromise.complete();
            return;
        }
        LOGGER.info("stopping sqs poller, waiting up to {} ms for {} in flight messages", config.getStopTimeoutMs(), poller.inFlight());
        this.poller.stop(true, config.getStopTimeoutMs()).onComplete(ar -> {
            if (ar.succeeded() && ar.result()) {
                LOGGER.info("sqs poller stopped, all messages handled");
            } else if (ar.succeeded()) {
                LOGGER.warn("sqs poller stopped with {} messages still in flight", poller.inFlight());
            } else {
                LOGGER.error("error stopping sqs poller", ar.cause());
            }
            stopPromise.complete();
        });
    }

    public SqsPoller getPoller() {
        return poller;
    }
}
