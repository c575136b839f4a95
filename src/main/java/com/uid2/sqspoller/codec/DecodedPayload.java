package com.uid2.sqspoller.codec;

import com.uid2.sqspoller.blob.BlobPointer;

import java.util.Map;

/**
 * Result of decoding one received record.
 *
 * @param body String for plain bodies; JsonObject, JsonArray or a scalar for JSON bodies
 * @param attributes caller attributes with the codec markers removed
 * @param blobPointer where the body was downloaded from, or null
 * @param topicArn SNS topic of the envelope when unwrapping, else null
 * @param topicName last segment of the topic arn, else null
 * @param subject SNS subject when unwrapping, else null
 */
public record DecodedPayload(Object body,
                             Map<String, MessageAttribute> attributes,
                             BlobPointer blobPointer,
                             String topicArn,
                             String topicName,
                             String subject) {
}
