package com.uid2.sqspoller.sqs;

import software.amazon.awssdk.services.sqs.model.BatchResultErrorEntry;

/**
 * One entry of a delete batch was rejected by the queue.
 */
public class DeleteFailedException extends RuntimeException {
    private final BatchResultErrorEntry errorEntry;

    public DeleteFailedException(BatchResultErrorEntry errorEntry) {
        super(String.format("delete rejected: id=%s, code=%s, senderFault=%s, message=%s",
            errorEntry.id(), errorEntry.code(), errorEntry.senderFault(), errorEntry.message()));
        this.errorEntry = errorEntry;
    }

    public BatchResultErrorEntry getErrorEntry() {
        return errorEntry;
    }
}
