package com.uid2.sqspoller;

public class Const {
    public static class Config {
        public static final String QueueUrlProp = "sqs_queue_url";
        public static final String QueueNameProp = "sqs_queue_name";
        public static final String AccountNumberProp = "sqs_account_number";
        public static final String CorrectQueueUrlProp = "sqs_correct_queue_url";
        public static final String EndpointProp = "sqs_endpoint";
        public static final String ReceiveBatchSizeProp = "sqs_receive_batch_size";
        public static final String MinReceiveBatchSizeProp = "sqs_min_receive_batch_size";
        public static final String ReceiveAttributesProp = "sqs_receive_attributes";
        public static final String ReceiveSqsAttributesProp = "sqs_receive_sqs_attributes";
        public static final String ReceiveWaitTimeSecsProp = "sqs_receive_wait_time_secs";
        public static final String DeleteBatchSizeProp = "sqs_delete_batch_size";
        public static final String DeleteWaitMsProp = "sqs_delete_wait_ms";
        public static final String MaxInFlightProp = "sqs_max_in_flight";
        public static final String UnwrapSnsProp = "sqs_unwrap_sns";
        public static final String BodyFormatProp = "sqs_body_format";
        public static final String PollRetryMsProp = "sqs_poll_retry_ms";
        public static final String ActivePollIntervalMsProp = "sqs_active_poll_interval_ms";
        public static final String IdlePollIntervalMsProp = "sqs_idle_poll_interval_ms";
        public static final String DelaySecsProp = "sqs_delay_secs";
        public static final String GzipProp = "sqs_gzip";
        public static final String MinGzipSizeProp = "sqs_min_gzip_size";
        public static final String MaxMessageBytesProp = "sqs_max_message_bytes";
        public static final String MessageRetentionSecsProp = "sqs_message_retention_secs";
        public static final String AutoExtendTimeoutProp = "sqs_auto_extend_timeout";
        public static final String VisibilityTimeoutSecsProp = "sqs_visibility_timeout_secs";
        public static final String QueuePolicyProp = "sqs_queue_policy";
        public static final String NoExtensionsAfterSecsProp = "sqs_no_extensions_after_secs";
        public static final String AdvancedCallMsProp = "sqs_advanced_call_ms";
        public static final String S3FallbackProp = "sqs_s3_fallback";
        public static final String S3BucketProp = "sqs_s3_bucket";
        public static final String S3RetainProp = "sqs_s3_retain";
        public static final String S3PrefixProp = "sqs_s3_prefix";
        public static final String MinS3SizeProp = "sqs_min_s3_size";
        public static final String StopTimeoutMsProp = "sqs_stop_timeout_ms";
    }

    public static class Attribute {
        public static final String GzipMarker = "__SQS_GZIP__";
        public static final String S3Marker = "__SQS_S3__";
        public static final String FifoMessageGroupId = "FIFO_MessageGroupId";
        public static final String FifoMessageDeduplicationId = "FIFO_MessageDeduplicationId";
    }

    public static class Sqs {
        public static final int MaxSendBatchSize = 10;
        public static final int MaxDeleteBatchSize = 10;
        public static final int MaxReceiveBatchSize = 10;
    }
}
