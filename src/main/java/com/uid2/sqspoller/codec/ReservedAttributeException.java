package com.uid2.sqspoller.codec;

public class ReservedAttributeException extends RuntimeException {
    private final String attributeName;

    public ReservedAttributeException(String attributeName) {
        super("Using of internal attribute " + attributeName + " is not allowed");
        this.attributeName = attributeName;
    }

    public String getAttributeName() {
        return attributeName;
    }
}
