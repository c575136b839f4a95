package com.uid2.sqspoller.blob;

import io.vertx.core.json.JsonObject;

/**
 * Location of an offloaded message body, sent on the queue in place of the body itself.
 *
 * @param bucket bucket holding the body
 * @param key object key inside the bucket
 * @param uploadSize byte length of the uploaded body
 */
public record BlobPointer(String bucket, String key, long uploadSize) {

    public JsonObject toJson() {
        return new JsonObject()
            .put("uploadSize", uploadSize)
            .put("bucket", bucket)
            .put("key", key);
    }

    /**
     * @throws IllegalArgumentException if bucket or key is missing
     */
    public static BlobPointer fromJson(JsonObject json) {
        String bucket = json.getString("bucket");
        String key = json.getString("key");
        if (bucket == null || key == null) {
            throw new IllegalArgumentException("blob pointer requires bucket and key: " + json.encode());
        }
        Long size = json.getLong("uploadSize");
        return new BlobPointer(bucket, key, size == null ? 0 : size);
    }
}
