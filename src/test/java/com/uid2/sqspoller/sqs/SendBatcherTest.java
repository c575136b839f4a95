package com.uid2.sqspoller.sqs;

import com.uid2.sqspoller.codec.OutgoingMessage;
import io.vertx.core.Future;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SendBatcherTest {

    private static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/123456789/test-queue";

    private static List<OutgoingMessage> messages(int count, int bodyLength) {
        List<OutgoingMessage> messages = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            messages.add(new OutgoingMessage("x".repeat(bodyLength), null, Map.of(), null, null, null));
        }
        return messages;
    }

    @Test
    void testSplitsAtTenEntries() {
        List<List<SendMessageBatchRequestEntry>> batches = SendBatcher.split(messages(25, 10), 262144);

        assertEquals(3, batches.size());
        assertEquals(10, batches.get(0).size());
        assertEquals(10, batches.get(1).size());
        assertEquals(5, batches.get(2).size());
    }

    @Test
    void testSplitsAtPayloadSize() {
        List<List<SendMessageBatchRequestEntry>> batches = SendBatcher.split(messages(5, 100), 250);

        assertEquals(3, batches.size());
        assertEquals(2, batches.get(0).size());
        assertEquals(2, batches.get(1).size());
        assertEquals(1, batches.get(2).size());
    }

    @Test
    void testEntryIdsAreInputPositions() {
        List<List<SendMessageBatchRequestEntry>> batches = SendBatcher.split(messages(12, 10), 262144);

        assertEquals("0", batches.get(0).get(0).id());
        assertEquals("9", batches.get(0).get(9).id());
        assertEquals("10", batches.get(1).get(0).id());
        assertEquals("11", batches.get(1).get(1).id());
    }

    @Test
    void testSendMergesBatchResults() {
        FakeQueueClient client = new FakeQueueClient();
        SendBatcher batcher = new SendBatcher(client, () -> Future.succeededFuture(QUEUE_URL));

        SendMessageBatchResponse response = batcher.send(messages(25, 10), 262144).result();

        assertEquals(3, client.sendBatches.size());
        assertEquals(25, response.successful().size());
        assertTrue(response.failed().isEmpty());
        assertEquals("24", response.successful().get(24).id());
    }

    @Test
    void testEmptySendMakesNoCalls() {
        FakeQueueClient client = new FakeQueueClient();
        SendBatcher batcher = new SendBatcher(client, () -> Future.succeededFuture(QUEUE_URL));

        SendMessageBatchResponse response = batcher.send(List.of(), 262144).result();

        assertTrue(response.successful().isEmpty());
        assertTrue(client.sendBatches.isEmpty());
    }

    @Test
    void testQueueUrlFailurePropagates() {
        FakeQueueClient client = new FakeQueueClient();
        SendBatcher batcher = new SendBatcher(client, () -> Future.failedFuture(new IllegalStateException("no url")));

        Future<SendMessageBatchResponse> response = batcher.send(messages(2, 10), 262144);

        assertTrue(response.failed());
        assertTrue(client.sendBatches.isEmpty());
    }
}
