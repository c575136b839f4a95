package com.uid2.sqspoller.sqs;

import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.services.sqs.model.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class SqsQueueClientTest {

    private static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/123456789/test-queue";

    private SqsAsyncClient sqsClient;
    private SqsQueueClient client;

    @BeforeEach
    void setUp() {
        sqsClient = mock(SqsAsyncClient.class);
        client = new SqsQueueClient(sqsClient);
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    // ==================== receive ====================

    @Test
    void testReceiveReturnsMessages() throws Exception {
        Message message = Message.builder().messageId("m-1").receiptHandle("rh-1").body("hi").build();
        when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(ReceiveMessageResponse.builder().messages(message).build()));

        List<Message> messages = await(client.receiveMessages(
            ReceiveMessageRequest.builder().queueUrl(QUEUE_URL).maxNumberOfMessages(10).build(), new AbortSignal()));

        assertEquals(List.of(message), messages);
    }

    @Test
    void testAbortCancelsReceive() throws Exception {
        CompletableFuture<ReceiveMessageResponse> pending = new CompletableFuture<>();
        when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class))).thenReturn(pending);
        AbortSignal signal = new AbortSignal();

        Future<List<Message>> received = client.receiveMessages(ReceiveMessageRequest.builder().queueUrl(QUEUE_URL).build(), signal);
        signal.abort();

        ExecutionException e = assertThrows(ExecutionException.class, () -> await(received));
        assertInstanceOf(ReceiveAbortedException.class, e.getCause());
        assertTrue(pending.isCancelled());
    }

    @Test
    void testReceiveErrorNotReportedAsAbort() {
        when(sqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
            .thenReturn(CompletableFuture.failedFuture(SqsException.builder().message("throttled").build()));

        ExecutionException e = assertThrows(ExecutionException.class, () -> await(client.receiveMessages(
            ReceiveMessageRequest.builder().queueUrl(QUEUE_URL).build(), new AbortSignal())));

        assertInstanceOf(SqsException.class, e.getCause());
    }

    // ==================== queue operations ====================

    @Test
    void testGetQueueUrlPassesAccount() throws Exception {
        when(sqsClient.getQueueUrl(any(GetQueueUrlRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(GetQueueUrlResponse.builder().queueUrl(QUEUE_URL).build()));

        assertEquals(QUEUE_URL, await(client.getQueueUrl("test-queue", "123456789")));

        ArgumentCaptor<GetQueueUrlRequest> captor = ArgumentCaptor.forClass(GetQueueUrlRequest.class);
        verify(sqsClient).getQueueUrl(captor.capture());
        assertEquals("test-queue", captor.getValue().queueName());
        assertEquals("123456789", captor.getValue().queueOwnerAWSAccountId());
    }

    @Test
    void testGetQueueAttributes() throws Exception {
        when(sqsClient.getQueueAttributes(any(GetQueueAttributesRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(GetQueueAttributesResponse.builder()
                .attributes(Map.of(QueueAttributeName.VISIBILITY_TIMEOUT, "30"))
                .build()));

        Map<QueueAttributeName, String> attributes = await(client.getQueueAttributes(QUEUE_URL, List.of(QueueAttributeName.VISIBILITY_TIMEOUT)));

        assertEquals("30", attributes.get(QueueAttributeName.VISIBILITY_TIMEOUT));
    }

    @Test
    void testDeleteBatchRequest() throws Exception {
        when(sqsClient.deleteMessageBatch(any(DeleteMessageBatchRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(DeleteMessageBatchResponse.builder()
                .successful(DeleteMessageBatchResultEntry.builder().id("m-1").build())
                .build()));
        List<DeleteMessageBatchRequestEntry> entries = List.of(
            DeleteMessageBatchRequestEntry.builder().id("m-1").receiptHandle("rh-1").build());

        DeleteMessageBatchResponse response = await(client.deleteMessageBatch(QUEUE_URL, entries));

        assertEquals(1, response.successful().size());
        ArgumentCaptor<DeleteMessageBatchRequest> captor = ArgumentCaptor.forClass(DeleteMessageBatchRequest.class);
        verify(sqsClient).deleteMessageBatch(captor.capture());
        assertEquals(QUEUE_URL, captor.getValue().queueUrl());
        assertEquals(entries, captor.getValue().entries());
    }

    @Test
    void testChangeVisibilityRequest() throws Exception {
        when(sqsClient.changeMessageVisibility(any(ChangeMessageVisibilityRequest.class)))
            .thenReturn(CompletableFuture.completedFuture(ChangeMessageVisibilityResponse.builder().build()));

        await(client.changeMessageVisibility(QUEUE_URL, "rh-1", 0));

        ArgumentCaptor<ChangeMessageVisibilityRequest> captor = ArgumentCaptor.forClass(ChangeMessageVisibilityRequest.class);
        verify(sqsClient).changeMessageVisibility(captor.capture());
        assertEquals("rh-1", captor.getValue().receiptHandle());
        assertEquals(0, captor.getValue().visibilityTimeout());
    }

    @Test
    void testPurgeFailurePropagates() {
        when(sqsClient.purgeQueue(any(PurgeQueueRequest.class)))
            .thenReturn(CompletableFuture.failedFuture(SqsException.builder().message("PurgeQueueInProgress").build()));

        assertThrows(ExecutionException.class, () -> await(client.purgeQueue(QUEUE_URL)));
    }
}
