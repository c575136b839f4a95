package com.uid2.sqspoller.blob;

import io.vertx.core.Future;

/**
 * Storage for message bodies too large to travel on the queue.
 */
public interface BlobStore {
    /**
     * Stores the body under a new key starting with {@code prefix}.
     */
    Future<BlobPointer> upload(String bucket, String prefix, String body);

    Future<String> download(BlobPointer pointer);

    Future<Void> delete(BlobPointer pointer);
}
