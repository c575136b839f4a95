package com.uid2.sqspoller.sqs;

public class ReceiveAbortedException extends RuntimeException {
    public ReceiveAbortedException(Throwable cause) {
        super("receive request aborted", cause);
    }
}
