package com.uid2.sqspoller.codec;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conversion between logical attributes and SQS wire attributes.
 */
public class MessageAttributeUtils {
    public static final String NUMBER_TYPE = "Number";
    public static final String STRING_TYPE = "String";
    public static final String BINARY_TYPE = "Binary";

    public static MessageAttributeValue toWire(MessageAttribute attribute) {
        switch (attribute.getKind()) {
            case NUMBER:
                return numberAttribute(attribute.asString());
            case BINARY:
                return MessageAttributeValue.builder()
                    .dataType(BINARY_TYPE)
                    .binaryValue(SdkBytes.fromByteArray(attribute.asBinary()))
                    .build();
            default:
                return MessageAttributeValue.builder()
                    .dataType(STRING_TYPE)
                    .stringValue(attribute.asString())
                    .build();
        }
    }

    public static Map<String, MessageAttributeValue> toWire(Map<String, MessageAttribute> attributes) {
        Map<String, MessageAttributeValue> wire = new LinkedHashMap<>();
        attributes.forEach((name, value) -> wire.put(name, toWire(value)));
        return wire;
    }

    /**
     * Reads a wire attribute back. Custom type suffixes ("Number.int") are honoured; text attributes with an
     * empty string value fall back to their binary value when one is present.
     */
    public static MessageAttribute fromWire(MessageAttributeValue value) {
        String type = value.dataType() == null ? "" : value.dataType();
        if (type.startsWith(NUMBER_TYPE)) {
            return MessageAttribute.number(value.stringValue());
        }
        if (type.startsWith(BINARY_TYPE)) {
            return binaryOf(value);
        }
        String text = value.stringValue();
        if ((text == null || text.isEmpty()) && value.binaryValue() != null) {
            return binaryOf(value);
        }
        return MessageAttribute.string(text);
    }

    public static Map<String, MessageAttribute> fromWire(Map<String, MessageAttributeValue> attributes) {
        Map<String, MessageAttribute> logical = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((name, value) -> logical.put(name, fromWire(value)));
        }
        return logical;
    }

    public static MessageAttributeValue numberAttribute(String decimalText) {
        return MessageAttributeValue.builder()
            .dataType(NUMBER_TYPE)
            .stringValue(decimalText)
            .build();
    }

    private static MessageAttribute binaryOf(MessageAttributeValue value) {
        return MessageAttribute.binary(value.binaryValue() == null ? new byte[0] : value.binaryValue().asByteArray());
    }
}
