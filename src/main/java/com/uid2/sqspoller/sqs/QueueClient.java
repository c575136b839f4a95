package com.uid2.sqspoller.sqs;

import io.vertx.core.Future;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;
import software.amazon.awssdk.services.sqs.model.SendMessageResponse;

import java.util.List;
import java.util.Map;

/**
 * Queue service operations used by the poller. Futures may complete on any thread.
 */
public interface QueueClient {
    /**
     * @param accountNumber owner account, or null for the caller's own account
     */
    Future<String> getQueueUrl(String queueName, String accountNumber);

    Future<String> createQueue(String queueName, Map<QueueAttributeName, String> attributes);

    Future<Void> deleteQueue(String queueUrl);

    Future<Void> purgeQueue(String queueUrl);

    Future<Map<QueueAttributeName, String>> getQueueAttributes(String queueUrl, List<QueueAttributeName> names);

    /**
     * Long polls for records. Fails with {@link ReceiveAbortedException} once the signal is aborted.
     */
    Future<List<Message>> receiveMessages(ReceiveMessageRequest request, AbortSignal signal);

    Future<DeleteMessageBatchResponse> deleteMessageBatch(String queueUrl, List<DeleteMessageBatchRequestEntry> entries);

    Future<SendMessageBatchResponse> sendMessageBatch(String queueUrl, List<SendMessageBatchRequestEntry> entries);

    Future<SendMessageResponse> sendMessage(SendMessageRequest request);

    Future<Void> changeMessageVisibility(String queueUrl, String receiptHandle, int visibilityTimeoutSecs);
}
