package com.uid2.sqspoller.event;

/**
 * Lifecycle notifications published by the poller. Types marked "message" carry the affected message and are
 * delivered to that message's own listeners as well as to the poller-wide ones.
 */
public enum PollerEventType {
    /** message: decoded and handed to the caller */
    MESSAGE,
    /** a receive call returned records; detail is the record count */
    GOT_MESSAGES,
    /** a receive call returned no records */
    QUEUE_EMPTY,
    /** polling paused because the in-flight limit was reached */
    MAX_IN_FLIGHT,
    /** in-flight count dropped back to zero */
    DRAINED,
    /** message: in-flight slot freed */
    HANDLED,
    /** message: caller chose to keep the message on the queue */
    KEEP,
    /** message: visibility reset to zero */
    RELEASED,
    /** message: delete accepted into the delete batch */
    DELETE_QUEUED,
    /** message: delete confirmed; detail is the batch entry id */
    DELETED,
    /** message: delete rejected; detail is the BatchResultErrorEntry */
    DELETE_ERROR,
    /** transport or decode failure; message is set when the failure concerns one message */
    ERROR,
    /** the active receive call was aborted by a hard stop */
    ABORTED,
    /** message: no further visibility extensions allowed */
    TIMEOUT_REACHED,
    /** message: visibility extension call issued */
    EXTENDING_TIMEOUT,
    /** message: visibility extension confirmed */
    TIMEOUT_EXTENDED,
    /** message: extension failed because the message is gone; tracking stops */
    AUTO_EXTEND_FAIL,
    /** message: extension failed for another reason; tracking continues */
    AUTO_EXTEND_ERROR,
    /** payload offloaded to the blob store; detail is the BlobPointer */
    BLOB_UPLOAD,
    /** message: payload fetched from the blob store; detail is the BlobPointer */
    BLOB_DOWNLOAD,
    /** message: offloaded payload removed after delete; detail is the BlobPointer */
    BLOB_DELETE
}
