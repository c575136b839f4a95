package com.uid2.sqspoller.sqs;

import com.uid2.sqspoller.Const;
import com.uid2.sqspoller.codec.OutgoingMessage;
import io.vertx.core.CompositeFuture;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.model.BatchResultErrorEntry;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResultEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Splits encoded messages into SendMessageBatch calls that respect the per-call entry count and the queue's
 * maximum payload size, sends them concurrently and merges the results.
 */
class SendBatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(SendBatcher.class);

    private final QueueClient queueClient;
    private final Supplier<Future<String>> queueUrl;

    SendBatcher(QueueClient queueClient, Supplier<Future<String>> queueUrl) {
        this.queueClient = queueClient;
        this.queueUrl = queueUrl;
    }

    /**
     * Entry ids are the messages' positions in {@code messages}.
     */
    Future<SendMessageBatchResponse> send(List<OutgoingMessage> messages, int maxBatchBytes) {
        if (messages.isEmpty()) {
            return Future.succeededFuture(SendMessageBatchResponse.builder()
                .successful(List.of())
                .failed(List.of())
                .build());
        }
        List<List<SendMessageBatchRequestEntry>> batches = split(messages, maxBatchBytes);
        LOGGER.debug("sending {} messages in {} batches", messages.size(), batches.size());

        return queueUrl.get().compose(url -> {
            List<Future<SendMessageBatchResponse>> sends = new ArrayList<>(batches.size());
            for (List<SendMessageBatchRequestEntry> batch : batches) {
                sends.add(queueClient.sendMessageBatch(url, batch));
            }
            return CompositeFuture.all(new ArrayList<>(sends)).map(SendBatcher::merge);
        });
    }

    static List<List<SendMessageBatchRequestEntry>> split(List<OutgoingMessage> messages, int maxBatchBytes) {
        List<List<SendMessageBatchRequestEntry>> batches = new ArrayList<>();
        List<SendMessageBatchRequestEntry> current = null;
        int currentBytes = 0;
        for (int i = 0; i < messages.size(); i++) {
            OutgoingMessage message = messages.get(i);
            int size = message.size();
            if (current == null || current.size() % Const.Sqs.MaxSendBatchSize == 0 || currentBytes + size >= maxBatchBytes) {
                current = new ArrayList<>();
                batches.add(current);
                currentBytes = 0;
            }
            currentBytes += size;
            current.add(message.toBatchEntry(String.valueOf(i)));
        }
        return batches;
    }

    private static SendMessageBatchResponse merge(CompositeFuture results) {
        List<SendMessageBatchResultEntry> successful = new ArrayList<>();
        List<BatchResultErrorEntry> failed = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            SendMessageBatchResponse response = results.resultAt(i);
            successful.addAll(response.successful());
            failed.addAll(response.failed());
        }
        if (!failed.isEmpty()) {
            LOGGER.warn("sqs_error: {} of {} messages failed to send", failed.size(), successful.size() + failed.size());
        }
        return SendMessageBatchResponse.builder()
            .successful(successful)
            .failed(failed)
            .build();
    }
}
