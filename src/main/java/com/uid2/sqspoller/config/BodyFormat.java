package com.uid2.sqspoller.config;

/**
 * How a received message body is presented after decoding.
 */
public enum BodyFormat {
    /** body is handed out as the received text */
    PLAIN,

    /** body is parsed as JSON into a JsonObject, JsonArray or scalar */
    JSON;

    public static BodyFormat fromString(String value) {
        if (value == null || value.isEmpty()) {
            return PLAIN;
        }
        return BodyFormat.valueOf(value.toUpperCase());
    }
}
