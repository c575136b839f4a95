package com.uid2.sqspoller.sqs;

import com.uid2.sqspoller.event.PollerEvent;
import com.uid2.sqspoller.event.PollerEventType;
import com.uid2.sqspoller.event.PollerEvents;
import com.uid2.sqspoller.util.ContextExecutor;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import software.amazon.awssdk.services.sqs.model.BatchResultErrorEntry;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchResponse;
import software.amazon.awssdk.services.sqs.model.DeleteMessageBatchResultEntry;
import software.amazon.awssdk.services.sqs.model.Message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
public class DeleteBatcherTest {

    private static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/123456789/test-queue";

    private ContextExecutor executor;
    private FakeQueueClient client;
    private PollerEvents events;
    private List<PollerEvent> seen;

    @BeforeEach
    public void setup(Vertx vertx) {
        executor = new ContextExecutor(vertx);
        client = new FakeQueueClient();
        events = new PollerEvents();
        seen = Collections.synchronizedList(new ArrayList<>());
        for (PollerEventType type : List.of(PollerEventType.DELETE_QUEUED, PollerEventType.DELETED,
            PollerEventType.DELETE_ERROR, PollerEventType.ERROR)) {
            events.on(type, seen::add);
        }
    }

    private DeleteBatcher batcher(int batchSize, int waitMs) {
        return new DeleteBatcher(executor, client, () -> Future.succeededFuture(QUEUE_URL), events, batchSize, waitMs);
    }

    private <T> T call(Supplier<T> action) throws Exception {
        CompletableFuture<T> result = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                result.complete(action.get());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        return result.get(5, TimeUnit.SECONDS);
    }

    private static QueueMessage message(int i) {
        return new QueueMessage(null, FakeQueueClient.message(i));
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private long count(PollerEventType type) {
        synchronized (seen) {
            return seen.stream().filter(e -> e.type() == type).count();
        }
    }

    // ==================== flushing ====================

    @Test
    void testFullBatchFlushesImmediately() throws Exception {
        DeleteBatcher batcher = batcher(3, 60000);

        List<Future<Void>> deletes = call(() -> {
            List<Future<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                futures.add(batcher.add(message(i)));
                batcher.scheduleFlush();
            }
            return futures;
        });

        for (Future<Void> delete : deletes) {
            await(delete);
        }
        assertEquals(1, client.deleteBatches.size());
        assertEquals(3, client.deleteBatches.get(0).size());
        assertEquals(DebounceTimer.State.IDLE, call(batcher::timerState));
        assertEquals(3, count(PollerEventType.DELETE_QUEUED));
        assertEquals(3, count(PollerEventType.DELETED));
    }

    @Test
    void testPartialBatchFlushesAfterDelay() throws Exception {
        DeleteBatcher batcher = batcher(10, 100);

        List<Future<Void>> deletes = call(() -> {
            List<Future<Void>> futures = new ArrayList<>();
            futures.add(batcher.add(message(0)));
            batcher.scheduleFlush();
            futures.add(batcher.add(message(1)));
            batcher.scheduleFlush();
            return futures;
        });

        assertEquals(DebounceTimer.State.ARMED, call(batcher::timerState));
        for (Future<Void> delete : deletes) {
            await(delete);
        }
        assertEquals(1, client.deleteBatches.size());
        assertEquals("rh-0", client.deleteBatches.get(0).get(0).receiptHandle());
        assertEquals("rh-1", client.deleteBatches.get(0).get(1).receiptHandle());
        assertEquals(0, (int) call(batcher::size));
    }

    @Test
    void testOverflowLeavesRemainderForTimer() throws Exception {
        DeleteBatcher batcher = batcher(2, 100);

        List<Future<Void>> deletes = call(() -> {
            List<Future<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                futures.add(batcher.add(message(i)));
                batcher.scheduleFlush();
            }
            return futures;
        });

        for (Future<Void> delete : deletes) {
            await(delete);
        }
        assertEquals(2, client.deleteBatches.size());
        assertEquals(2, client.deleteBatches.get(0).size());
        assertEquals("m-2", client.deleteBatches.get(1).get(0).id());
    }

    @Test
    void testRepeatedIdUsesLatestReceiptHandle() throws Exception {
        DeleteBatcher batcher = batcher(10, 50);
        Message again = FakeQueueClient.message(0).toBuilder().receiptHandle("rh-0-again").build();

        List<Future<Void>> deletes = call(() -> {
            List<Future<Void>> futures = new ArrayList<>();
            futures.add(batcher.add(message(0)));
            futures.add(batcher.add(new QueueMessage(null, again)));
            batcher.scheduleFlush();
            return futures;
        });

        await(deletes.get(0));
        await(deletes.get(1));
        assertEquals(1, client.deleteBatches.size());
        assertEquals(1, client.deleteBatches.get(0).size());
        assertEquals("rh-0-again", client.deleteBatches.get(0).get(0).receiptHandle());
    }

    // ==================== failures ====================

    @Test
    void testRejectedEntryFailsOnlyThatDelete() throws Exception {
        client.deleteHandler = entries -> Future.succeededFuture(DeleteMessageBatchResponse.builder()
            .successful(DeleteMessageBatchResultEntry.builder().id("m-0").build())
            .failed(BatchResultErrorEntry.builder().id("m-1").code("ReceiptHandleIsInvalid").message("expired").senderFault(true).build())
            .build());
        DeleteBatcher batcher = batcher(2, 60000);

        List<Future<Void>> deletes = call(() -> {
            List<Future<Void>> futures = new ArrayList<>();
            futures.add(batcher.add(message(0)));
            futures.add(batcher.add(message(1)));
            batcher.scheduleFlush();
            return futures;
        });

        await(deletes.get(0));
        ExecutionException e = assertThrows(ExecutionException.class, () -> await(deletes.get(1)));
        DeleteFailedException failure = assertInstanceOf(DeleteFailedException.class, e.getCause());
        assertEquals("ReceiptHandleIsInvalid", failure.getErrorEntry().code());
        assertEquals(1, count(PollerEventType.DELETED));
        assertEquals(1, count(PollerEventType.DELETE_ERROR));
    }

    @Test
    void testEntryMissingFromResponseFails() throws Exception {
        client.deleteHandler = entries -> Future.succeededFuture(DeleteMessageBatchResponse.builder()
            .successful(DeleteMessageBatchResultEntry.builder().id("m-0").build())
            .build());
        DeleteBatcher batcher = batcher(2, 60000);

        List<Future<Void>> deletes = call(() -> {
            List<Future<Void>> futures = new ArrayList<>();
            futures.add(batcher.add(message(0)));
            futures.add(batcher.add(message(1)));
            batcher.scheduleFlush();
            return futures;
        });

        await(deletes.get(0));
        ExecutionException e = assertThrows(ExecutionException.class, () -> await(deletes.get(1)));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void testTransportFailureFailsWholeBatch() throws Exception {
        client.deleteHandler = entries -> Future.failedFuture(new RuntimeException("connection reset"));
        DeleteBatcher batcher = batcher(2, 60000);

        List<Future<Void>> deletes = call(() -> {
            List<Future<Void>> futures = new ArrayList<>();
            futures.add(batcher.add(message(0)));
            futures.add(batcher.add(message(1)));
            batcher.scheduleFlush();
            return futures;
        });

        for (Future<Void> delete : deletes) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> await(delete));
            assertEquals("connection reset", e.getCause().getMessage());
        }
        assertEquals(1, count(PollerEventType.ERROR));
        assertEquals(0, count(PollerEventType.DELETED));
    }

    @Test
    void testClearFailsQueuedDeletes() throws Exception {
        DeleteBatcher batcher = batcher(10, 60000);

        Future<Void> delete = call(() -> {
            Future<Void> f = batcher.add(message(0));
            batcher.scheduleFlush();
            batcher.clear(new IllegalStateException("queue was purged"));
            return f;
        });

        ExecutionException e = assertThrows(ExecutionException.class, () -> await(delete));
        assertEquals("queue was purged", e.getCause().getMessage());
        assertEquals(0, (int) call(batcher::size));
        assertEquals(DebounceTimer.State.IDLE, call(batcher::timerState));
        assertTrue(client.deleteBatches.isEmpty());
    }
}
