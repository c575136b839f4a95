package com.uid2.sqspoller.codec;

import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Message size as SQS counts it against MaximumMessageSize: body bytes plus, for every attribute, the bytes of
 * its name, its data type label and its value.
 *
 * <p>The same function decides the compression threshold, the blob offload threshold and send batch splits.</p>
 */
public class MessageSizeUtils {

    public static int getMessageSize(String body, Map<String, MessageAttributeValue> attributes) {
        int size = utf8Length(body);
        if (attributes != null) {
            for (Map.Entry<String, MessageAttributeValue> entry : attributes.entrySet()) {
                size += getAttributeSize(entry.getKey(), entry.getValue());
            }
        }
        return size;
    }

    static int getAttributeSize(String name, MessageAttributeValue value) {
        int valueSize = value.binaryValue() != null
            ? value.binaryValue().asByteArrayUnsafe().length
            : utf8Length(value.stringValue());
        return utf8Length(name) + utf8Length(value.dataType()) + valueSize;
    }

    static int utf8Length(String s) {
        return s == null ? 0 : s.getBytes(StandardCharsets.UTF_8).length;
    }
}
