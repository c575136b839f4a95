package com.uid2.sqspoller.sqs;

import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link QueueClient} over the AWS SDK async SQS client.
 */
public class SqsQueueClient implements QueueClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqsQueueClient.class);

    private final SqsAsyncClient sqsClient;

    public SqsQueueClient(SqsAsyncClient sqsClient) {
        this.sqsClient = sqsClient;
    }

    @Override
    public Future<String> getQueueUrl(String queueName, String accountNumber) {
        GetQueueUrlRequest request = GetQueueUrlRequest.builder()
            .queueName(queueName)
            .queueOwnerAWSAccountId(accountNumber)
            .build();

        return Future.fromCompletionStage(sqsClient.getQueueUrl(request))
            .map(GetQueueUrlResponse::queueUrl)
            .onFailure(e -> LOGGER.error("sqs_error: failed to get queue url: queueName={}", queueName, e));
    }

    @Override
    public Future<String> createQueue(String queueName, Map<QueueAttributeName, String> attributes) {
        CreateQueueRequest request = CreateQueueRequest.builder()
            .queueName(queueName)
            .attributes(attributes)
            .build();

        return Future.fromCompletionStage(sqsClient.createQueue(request))
            .map(CreateQueueResponse::queueUrl)
            .onSuccess(url -> LOGGER.info("created queue: {}", url))
            .onFailure(e -> LOGGER.error("sqs_error: failed to create queue: queueName={}", queueName, e));
    }

    @Override
    public Future<Void> deleteQueue(String queueUrl) {
        DeleteQueueRequest request = DeleteQueueRequest.builder().queueUrl(queueUrl).build();

        return Future.fromCompletionStage(sqsClient.deleteQueue(request))
            .<Void>mapEmpty()
            .onFailure(e -> LOGGER.error("sqs_error: failed to delete queue: {}", queueUrl, e));
    }

    @Override
    public Future<Void> purgeQueue(String queueUrl) {
        PurgeQueueRequest request = PurgeQueueRequest.builder().queueUrl(queueUrl).build();

        return Future.fromCompletionStage(sqsClient.purgeQueue(request))
            .<Void>mapEmpty()
            .onFailure(e -> LOGGER.error("sqs_error: failed to purge queue: {}", queueUrl, e));
    }

    @Override
    public Future<Map<QueueAttributeName, String>> getQueueAttributes(String queueUrl, List<QueueAttributeName> names) {
        GetQueueAttributesRequest request = GetQueueAttributesRequest.builder()
            .queueUrl(queueUrl)
            .attributeNames(names)
            .build();

        return Future.fromCompletionStage(sqsClient.getQueueAttributes(request))
            .map(GetQueueAttributesResponse::attributes)
            .onFailure(e -> LOGGER.error("sqs_error: error getting queue attributes: {}", queueUrl, e));
    }

    @Override
    public Future<List<Message>> receiveMessages(ReceiveMessageRequest request, AbortSignal signal) {
        CompletableFuture<ReceiveMessageResponse> response = sqsClient.receiveMessage(request);
        signal.onAbort(() -> response.cancel(true));

        return Future.fromCompletionStage(response)
            .recover(e -> {
                if (signal.isAborted()) {
                    return Future.failedFuture(new ReceiveAbortedException(e));
                }
                LOGGER.error("sqs_error: failed to receive messages", e);
                return Future.failedFuture(e);
            })
            .map(ReceiveMessageResponse::messages);
    }

    @Override
    public Future<DeleteMessageBatchResponse> deleteMessageBatch(String queueUrl, List<DeleteMessageBatchRequestEntry> entries) {
        DeleteMessageBatchRequest request = DeleteMessageBatchRequest.builder()
            .queueUrl(queueUrl)
            .entries(entries)
            .build();

        return Future.fromCompletionStage(sqsClient.deleteMessageBatch(request))
            .onSuccess(r -> LOGGER.debug("deleted {} messages, {} failed", r.successful().size(), r.failed().size()))
            .onFailure(e -> LOGGER.error("sqs_error: error deleting {} messages", entries.size(), e));
    }

    @Override
    public Future<SendMessageBatchResponse> sendMessageBatch(String queueUrl, List<SendMessageBatchRequestEntry> entries) {
        SendMessageBatchRequest request = SendMessageBatchRequest.builder()
            .queueUrl(queueUrl)
            .entries(entries)
            .build();

        return Future.fromCompletionStage(sqsClient.sendMessageBatch(request))
            .onFailure(e -> LOGGER.error("sqs_error: error sending batch of {} messages", entries.size(), e));
    }

    @Override
    public Future<SendMessageResponse> sendMessage(SendMessageRequest request) {
        return Future.fromCompletionStage(sqsClient.sendMessage(request))
            .onFailure(e -> LOGGER.error("sqs_error: error sending message", e));
    }

    @Override
    public Future<Void> changeMessageVisibility(String queueUrl, String receiptHandle, int visibilityTimeoutSecs) {
        ChangeMessageVisibilityRequest request = ChangeMessageVisibilityRequest.builder()
            .queueUrl(queueUrl)
            .receiptHandle(receiptHandle)
            .visibilityTimeout(visibilityTimeoutSecs)
            .build();

        return Future.fromCompletionStage(sqsClient.changeMessageVisibility(request))
            .<Void>mapEmpty()
            .onFailure(e -> LOGGER.warn("sqs_error: failed to change visibility: timeout={}", visibilityTimeoutSecs, e));
    }
}
