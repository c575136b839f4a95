package com.uid2.sqspoller.codec;

import com.uid2.sqspoller.Const;
import com.uid2.sqspoller.blob.BlobPointer;
import com.uid2.sqspoller.blob.BlobStore;
import com.uid2.sqspoller.config.BodyFormat;
import com.uid2.sqspoller.config.PollerConfig;
import io.vertx.core.Future;
import io.vertx.core.json.Json;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Encodes outgoing messages and decodes received records.
 *
 * <p>Outgoing: serialize the body, check for reserved attribute names, lift the FIFO keys into protocol
 * fields, convert attributes, compress when enabled, then offload to the blob store when the message is still
 * too large. Incoming runs the inverse: download, decompress, strip the markers, unwrap SNS, then parse the
 * body in the configured format.</p>
 */
public class PayloadCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(PayloadCodec.class);

    private final PollerConfig config;
    private final BlobStore blobStore;
    private final Supplier<Future<Integer>> maxMessageSize;

    /**
     * @param blobStore may be null when blob offload is disabled
     * @param maxMessageSize queue MaximumMessageSize lookup, only called when no explicit offload size is set
     */
    public PayloadCodec(PollerConfig config, BlobStore blobStore, Supplier<Future<Integer>> maxMessageSize) {
        if (config.isS3Fallback() && blobStore == null) {
            throw new IllegalArgumentException("blob store is required when s3 fallback is enabled");
        }
        this.config = config;
        this.blobStore = blobStore;
        this.maxMessageSize = maxMessageSize;
    }

    /**
     * @param body String bodies are sent as-is; anything else is JSON encoded
     * @param delaySeconds null for the queue's default delay
     * @param attributes caller attributes, values are converted with {@link MessageAttribute#of(Object)}
     * @return failed with {@link ReservedAttributeException} when a codec marker name is used
     */
    public Future<OutgoingMessage> encode(Object body, Integer delaySeconds, Map<String, ?> attributes) {
        Map<String, Object> remaining = new LinkedHashMap<>();
        if (attributes != null) {
            for (Map.Entry<String, ?> entry : attributes.entrySet()) {
                if (Const.Attribute.GzipMarker.equals(entry.getKey()) || Const.Attribute.S3Marker.equals(entry.getKey())) {
                    return Future.failedFuture(new ReservedAttributeException(entry.getKey()));
                }
                remaining.put(entry.getKey(), entry.getValue());
            }
        }

        String text;
        try {
            text = body instanceof String ? (String) body : Json.encode(body);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        String groupId = liftProtocolField(remaining, Const.Attribute.FifoMessageGroupId);
        String dedupId = liftProtocolField(remaining, Const.Attribute.FifoMessageDeduplicationId);

        Map<String, MessageAttributeValue> wire = new LinkedHashMap<>();
        remaining.forEach((name, value) -> wire.put(name, MessageAttributeUtils.toWire(MessageAttribute.of(value))));

        if (config.isGzip() && (config.getMinGzipSize() == 0 || MessageSizeUtils.getMessageSize(text, wire) >= config.getMinGzipSize())) {
            try {
                text = BrotliCompression.compress(text);
            } catch (IOException e) {
                return Future.failedFuture(e);
            }
            wire.put(Const.Attribute.GzipMarker, MessageAttributeUtils.numberAttribute("1"));
        }

        OutgoingMessage encoded = new OutgoingMessage(text, delaySeconds, wire, groupId, dedupId, null);
        if (!config.isS3Fallback()) {
            return Future.succeededFuture(encoded);
        }
        return offloadThreshold().compose(threshold -> encoded.size() >= threshold
            ? offload(encoded)
            : Future.succeededFuture(encoded));
    }

    private Future<Integer> offloadThreshold() {
        if (config.getMinS3Size() != null) {
            return Future.succeededFuture(config.getMinS3Size());
        }
        return maxMessageSize.get();
    }

    private Future<OutgoingMessage> offload(OutgoingMessage encoded) {
        return blobStore.upload(config.getS3Bucket(), config.getS3Prefix(), encoded.body())
            .map(pointer -> {
                LOGGER.debug("offloaded message body: bucket={}, key={}, size={}", pointer.bucket(), pointer.key(), pointer.uploadSize());
                Map<String, MessageAttributeValue> wire = new LinkedHashMap<>(encoded.attributes());
                wire.put(Const.Attribute.S3Marker, MessageAttributeUtils.numberAttribute(String.valueOf(pointer.uploadSize())));
                return new OutgoingMessage(pointer.toJson().encode(), encoded.delaySeconds(), wire,
                    encoded.messageGroupId(), encoded.messageDeduplicationId(), pointer);
            });
    }

    private static String liftProtocolField(Map<String, Object> attributes, String name) {
        if (!attributes.containsKey(name)) {
            return null;
        }
        Object value = attributes.remove(name);
        return value == null ? null : String.valueOf(value);
    }

    /**
     * Fails when the blob cannot be fetched, the compressed body is corrupt, the SNS envelope is not JSON,
     * or a JSON body does not parse.
     */
    public Future<DecodedPayload> decode(Message raw) {
        Map<String, MessageAttributeValue> wire = raw.hasMessageAttributes() ? raw.messageAttributes() : Map.of();
        String body = raw.body() == null ? "" : raw.body();

        Future<String> fetched;
        BlobPointer pointer = null;
        if (wire.containsKey(Const.Attribute.S3Marker)) {
            if (blobStore == null) {
                return Future.failedFuture(new IllegalStateException("message " + raw.messageId() + " is blob backed but no blob store is configured"));
            }
            try {
                pointer = BlobPointer.fromJson(new JsonObject(body));
            } catch (RuntimeException e) {
                return Future.failedFuture(e);
            }
            fetched = blobStore.download(pointer);
        } else {
            fetched = Future.succeededFuture(body);
        }

        BlobPointer blobPointer = pointer;
        return fetched.compose(text -> {
            try {
                if (wire.containsKey(Const.Attribute.GzipMarker)) {
                    text = BrotliCompression.decompress(text);
                }
                Map<String, MessageAttribute> attributes = MessageAttributeUtils.fromWire(wire);
                attributes.remove(Const.Attribute.GzipMarker);
                attributes.remove(Const.Attribute.S3Marker);

                String topicArn = null;
                String topicName = null;
                String subject = null;
                if (config.isUnwrapSns()) {
                    JsonObject envelope = new JsonObject(text);
                    text = envelope.getString("Message");
                    topicArn = envelope.getString("TopicArn");
                    subject = envelope.getString("Subject");
                    if (topicArn != null) {
                        topicName = topicArn.substring(topicArn.lastIndexOf(':') + 1);
                    }
                }

                Object decodedBody = config.getBodyFormat() == BodyFormat.JSON ? Json.decodeValue(text) : text;
                return Future.succeededFuture(new DecodedPayload(decodedBody, attributes, blobPointer, topicArn, topicName, subject));
            } catch (IOException | RuntimeException e) {
                return Future.failedFuture(e);
            }
        });
    }
}
