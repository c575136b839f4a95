package com.uid2.sqspoller.codec;

import software.amazon.awssdk.core.SdkBytes;

import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

/**
 * A logical message attribute value: numeric, text or binary.
 */
public final class MessageAttribute {
    public enum Kind {
        NUMBER,
        STRING,
        BINARY
    }

    private final Kind kind;
    private final String stringValue;
    private final byte[] binaryValue;

    private MessageAttribute(Kind kind, String stringValue, byte[] binaryValue) {
        this.kind = kind;
        this.stringValue = stringValue;
        this.binaryValue = binaryValue;
    }

    public static MessageAttribute number(Number value) {
        Objects.requireNonNull(value, "value");
        String text = value instanceof BigDecimal ? ((BigDecimal) value).toPlainString() : value.toString();
        return new MessageAttribute(Kind.NUMBER, text, null);
    }

    /**
     * @throws NumberFormatException if the text is not a decimal number
     */
    public static MessageAttribute number(String decimalText) {
        new BigDecimal(decimalText);
        return new MessageAttribute(Kind.NUMBER, decimalText, null);
    }

    public static MessageAttribute string(String value) {
        return new MessageAttribute(Kind.STRING, value == null ? "" : value, null);
    }

    public static MessageAttribute binary(byte[] value) {
        Objects.requireNonNull(value, "value");
        return new MessageAttribute(Kind.BINARY, null, value.clone());
    }

    /**
     * Infers the kind from the runtime type: numbers first, then text, then binary payloads. Anything else is
     * sent as its text form; null becomes the empty string.
     */
    public static MessageAttribute of(Object value) {
        if (value instanceof MessageAttribute) {
            return (MessageAttribute) value;
        }
        if (value == null) {
            return string("");
        }
        if (value instanceof Number) {
            return number((Number) value);
        }
        if (value instanceof CharSequence) {
            return string(value.toString());
        }
        if (value instanceof byte[]) {
            return binary((byte[]) value);
        }
        if (value instanceof SdkBytes) {
            return binary(((SdkBytes) value).asByteArray());
        }
        if (value instanceof ByteBuffer) {
            ByteBuffer buffer = ((ByteBuffer) value).duplicate();
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return binary(bytes);
        }
        return string(String.valueOf(value));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean isBinary() {
        return kind == Kind.BINARY;
    }

    /**
     * @throws IllegalStateException if this is not a numeric attribute
     */
    public BigDecimal asNumber() {
        if (kind != Kind.NUMBER) {
            throw new IllegalStateException("attribute is " + kind + ", not NUMBER");
        }
        return new BigDecimal(stringValue);
    }

    /**
     * Text form for numeric and text attributes.
     *
     * @throws IllegalStateException for binary attributes
     */
    public String asString() {
        if (kind == Kind.BINARY) {
            throw new IllegalStateException("attribute is BINARY");
        }
        return stringValue;
    }

    /**
     * @throws IllegalStateException if this is not a binary attribute
     */
    public byte[] asBinary() {
        if (kind != Kind.BINARY) {
            throw new IllegalStateException("attribute is " + kind + ", not BINARY");
        }
        return binaryValue.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageAttribute)) return false;
        MessageAttribute that = (MessageAttribute) o;
        return kind == that.kind
            && Objects.equals(stringValue, that.stringValue)
            && Arrays.equals(binaryValue, that.binaryValue);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(kind, stringValue) + Arrays.hashCode(binaryValue);
    }

    @Override
    public String toString() {
        return kind == Kind.BINARY
            ? "MessageAttribute{BINARY, " + binaryValue.length + " bytes}"
            : "MessageAttribute{" + kind + ", " + stringValue + "}";
    }
}
