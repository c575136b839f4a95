package com.uid2.sqspoller.util;

import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.concurrent.Executors;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
public class ContextExecutorTest {

    @Test
    void testExecuteRunsOnContext(Vertx vertx, VertxTestContext testContext) {
        ContextExecutor executor = new ContextExecutor(vertx);

        assertFalse(executor.isOnContext());
        executor.execute(() -> testContext.verify(() -> {
            assertTrue(executor.isOnContext());
            testContext.completeNow();
        }));
    }

    @Test
    void testAdoptCompletesOnContext(Vertx vertx, VertxTestContext testContext) {
        ContextExecutor executor = new ContextExecutor(vertx);
        Promise<String> elsewhere = Promise.promise();
        ExecutorService pool = Executors.newSingleThreadExecutor();

        executor.adopt(elsewhere.future()).onComplete(testContext.succeeding(value -> testContext.verify(() -> {
            assertEquals("done", value);
            assertTrue(executor.isOnContext());
            pool.shutdown();
            testContext.completeNow();
        })));
        pool.submit(() -> elsewhere.complete("done"));
    }

    @Test
    void testTimerRequiresContext(Vertx vertx, VertxTestContext testContext) {
        ContextExecutor executor = new ContextExecutor(vertx);

        assertThrows(IllegalStateException.class, () -> executor.setTimer(10, () -> { }));
        executor.execute(() -> executor.setTimer(10, () -> testContext.verify(() -> {
            assertTrue(executor.isOnContext());
            testContext.completeNow();
        })));
    }

    @Test
    void testCancelledTimerDoesNotFire(Vertx vertx, VertxTestContext testContext) {
        ContextExecutor executor = new ContextExecutor(vertx);

        executor.execute(() -> {
            long id = executor.setTimer(50, () -> testContext.failNow("cancelled timer fired"));
            assertTrue(executor.cancelTimer(id));
            vertx.setTimer(200, x -> testContext.completeNow());
        });
    }
}
