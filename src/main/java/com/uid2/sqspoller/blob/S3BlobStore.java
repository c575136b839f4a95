package com.uid2.sqspoller.blob;

import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * {@link BlobStore} backed by S3. Keys are the configured prefix followed by a random UUID.
 */
public class S3BlobStore implements BlobStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3BlobStore.class);

    private final S3AsyncClient s3Client;

    public S3BlobStore(S3AsyncClient s3Client) {
        this.s3Client = s3Client;
    }

    @Override
    public Future<BlobPointer> upload(String bucket, String prefix, String body) {
        String key = (prefix == null ? "" : prefix) + UUID.randomUUID();
        byte[] data = body.getBytes(StandardCharsets.UTF_8);
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .build();

        LOGGER.debug("uploading message body to s3: bucket={}, key={}, size={} bytes", bucket, key, data.length);
        return Future.fromCompletionStage(s3Client.putObject(request, AsyncRequestBody.fromBytes(data)))
            .map(response -> new BlobPointer(bucket, key, data.length))
            .onFailure(e -> LOGGER.error("s3_error: failed to upload message body: bucket={}, key={}", bucket, key, e));
    }

    @Override
    public Future<String> download(BlobPointer pointer) {
        GetObjectRequest request = GetObjectRequest.builder()
            .bucket(pointer.bucket())
            .key(pointer.key())
            .build();

        return Future.fromCompletionStage(s3Client.getObject(request, AsyncResponseTransformer.toBytes()))
            .map(bytes -> bytes.asUtf8String())
            .onFailure(e -> LOGGER.error("s3_error: failed to download message body: bucket={}, key={}", pointer.bucket(), pointer.key(), e));
    }

    @Override
    public Future<Void> delete(BlobPointer pointer) {
        DeleteObjectRequest request = DeleteObjectRequest.builder()
            .bucket(pointer.bucket())
            .key(pointer.key())
            .build();

        return Future.fromCompletionStage(s3Client.deleteObject(request))
            .<Void>mapEmpty()
            .onFailure(e -> LOGGER.error("s3_error: failed to delete message body: bucket={}, key={}", pointer.bucket(), pointer.key(), e));
    }
}
