package com.uid2.sqspoller.codec;

import com.uid2.sqspoller.blob.BlobPointer;
import software.amazon.awssdk.services.sqs.model.MessageAttributeValue;
import software.amazon.awssdk.services.sqs.model.SendMessageBatchRequestEntry;
import software.amazon.awssdk.services.sqs.model.SendMessageRequest;

import java.util.Map;

/**
 * A fully encoded message ready to be sent.
 *
 * @param body wire body: plain, compressed, or a blob pointer
 * @param delaySeconds per message delay, null for the queue default
 * @param attributes wire attributes including the codec markers
 * @param messageGroupId FIFO group id, or null
 * @param messageDeduplicationId FIFO deduplication id, or null
 * @param blobPointer where the body was offloaded, or null
 */
public record OutgoingMessage(String body,
                              Integer delaySeconds,
                              Map<String, MessageAttributeValue> attributes,
                              String messageGroupId,
                              String messageDeduplicationId,
                              BlobPointer blobPointer) {

    public int size() {
        return MessageSizeUtils.getMessageSize(body, attributes);
    }

    public boolean isBlobBacked() {
        return blobPointer != null;
    }

    public SendMessageBatchRequestEntry toBatchEntry(String id) {
        return SendMessageBatchRequestEntry.builder()
            .id(id)
            .messageBody(body)
            .delaySeconds(delaySeconds)
            .messageAttributes(attributes)
            .messageGroupId(messageGroupId)
            .messageDeduplicationId(messageDeduplicationId)
            .build();
    }

    public SendMessageRequest toRequest(String queueUrl) {
        return SendMessageRequest.builder()
            .queueUrl(queueUrl)
            .messageBody(body)
            .delaySeconds(delaySeconds)
            .messageAttributes(attributes)
            .messageGroupId(messageGroupId)
            .messageDeduplicationId(messageDeduplicationId)
            .build();
    }
}
