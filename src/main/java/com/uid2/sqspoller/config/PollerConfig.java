package com.uid2.sqspoller.config;

import com.uid2.sqspoller.Const;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Fully resolved poller configuration.
 *
 * <p>Every option carries its effective value once {@link Builder#build()} returns; batch sizes are
 * clamped to the service limits there and nothing is adjusted afterwards.</p>
 */
public final class PollerConfig {
    public static final int DEFAULT_RECEIVE_BATCH_SIZE = 10;
    public static final int DEFAULT_MIN_RECEIVE_BATCH_SIZE = 1;
    public static final int DEFAULT_RECEIVE_WAIT_TIME_SECS = 20;
    public static final int DEFAULT_DELETE_BATCH_SIZE = 10;
    public static final int DEFAULT_DELETE_WAIT_MS = 2000;
    public static final int DEFAULT_MAX_IN_FLIGHT = 100;
    public static final int DEFAULT_POLL_RETRY_MS = 2000;
    public static final int DEFAULT_MAX_MESSAGE_BYTES = 262144;
    public static final int DEFAULT_MESSAGE_RETENTION_SECS = 345600;
    public static final int DEFAULT_NO_EXTENSIONS_AFTER_SECS = 43200;
    public static final int DEFAULT_ADVANCED_CALL_MS = 5000;
    public static final int DEFAULT_STOP_TIMEOUT_MS = 30000;

    public static class MalformedPollerConfigException extends Exception {
        public MalformedPollerConfigException(String message) {
            super(message);
        }
    }

    private final String queueUrl;
    private final String queueName;
    private final String accountNumber;
    private final boolean correctQueueUrl;
    private final String endpoint;
    private final int receiveBatchSize;
    private final int minReceiveBatchSize;
    private final List<String> receiveAttributes;
    private final List<String> receiveSqsAttributes;
    private final int receiveWaitTimeSecs;
    private final int deleteBatchSize;
    private final int deleteWaitMs;
    private final int maxInFlight;
    private final boolean unwrapSns;
    private final BodyFormat bodyFormat;
    private final int pollRetryMs;
    private final int activePollIntervalMs;
    private final int idlePollIntervalMs;
    private final int delaySecs;
    private final boolean gzip;
    private final int minGzipSize;
    private final int maxMessageBytes;
    private final int messageRetentionSecs;
    private final boolean autoExtendTimeout;
    private final Integer visibilityTimeoutSecs;
    private final String queuePolicy;
    private final int noExtensionsAfterSecs;
    private final int advancedCallMs;
    private final boolean s3Fallback;
    private final String s3Bucket;
    private final boolean s3Retain;
    private final String s3Prefix;
    private final Integer minS3Size;
    private final int stopTimeoutMs;

    private PollerConfig(Builder b) {
        this.queueUrl = b.queueUrl;
        this.queueName = b.queueName;
        this.accountNumber = b.accountNumber;
        this.correctQueueUrl = b.correctQueueUrl;
        this.endpoint = b.endpoint;
        this.maxInFlight = b.maxInFlight;
        this.receiveBatchSize = Math.min(Math.min(b.receiveBatchSize, b.maxInFlight > 0 ? b.maxInFlight : Const.Sqs.MaxReceiveBatchSize),
                Const.Sqs.MaxReceiveBatchSize);
        this.minReceiveBatchSize = Math.min(b.minReceiveBatchSize, this.receiveBatchSize);
        this.receiveAttributes = List.copyOf(b.receiveAttributes);
        this.receiveSqsAttributes = List.copyOf(b.receiveSqsAttributes);
        this.receiveWaitTimeSecs = b.receiveWaitTimeSecs;
        this.deleteBatchSize = Math.min(b.deleteBatchSize, Const.Sqs.MaxDeleteBatchSize);
        this.deleteWaitMs = b.deleteWaitMs;
        this.unwrapSns = b.unwrapSns;
        this.bodyFormat = b.bodyFormat;
        this.pollRetryMs = b.pollRetryMs;
        this.activePollIntervalMs = b.activePollIntervalMs;
        this.idlePollIntervalMs = b.idlePollIntervalMs;
        this.delaySecs = b.delaySecs;
        this.gzip = b.gzip;
        this.minGzipSize = b.minGzipSize;
        this.maxMessageBytes = b.maxMessageBytes;
        this.messageRetentionSecs = b.messageRetentionSecs;
        this.autoExtendTimeout = b.autoExtendTimeout;
        this.visibilityTimeoutSecs = b.visibilityTimeoutSecs;
        this.queuePolicy = b.queuePolicy;
        this.noExtensionsAfterSecs = b.noExtensionsAfterSecs;
        this.advancedCallMs = b.advancedCallMs;
        this.s3Fallback = b.s3Fallback;
        this.s3Bucket = b.s3Bucket;
        this.s3Retain = b.s3Retain;
        this.s3Prefix = b.s3Prefix == null ? "" : b.s3Prefix;
        this.minS3Size = b.minS3Size;
        this.stopTimeoutMs = b.stopTimeoutMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads poller options from a service config, falling back to defaults for absent keys.
     *
     * @param config json config keyed by {@link Const.Config} property names
     * @throws MalformedPollerConfigException if required options are missing or conflicting
     */
    public static PollerConfig fromJson(JsonObject config) throws MalformedPollerConfigException {
        Builder b = builder();
        try {
            b.queueUrl(config.getString(Const.Config.QueueUrlProp))
                .queueName(config.getString(Const.Config.QueueNameProp))
                .accountNumber(config.getValue(Const.Config.AccountNumberProp) == null ? null : String.valueOf(config.getValue(Const.Config.AccountNumberProp)))
                .correctQueueUrl(config.getBoolean(Const.Config.CorrectQueueUrlProp, false))
                .endpoint(config.getString(Const.Config.EndpointProp))
                .receiveBatchSize(config.getInteger(Const.Config.ReceiveBatchSizeProp, DEFAULT_RECEIVE_BATCH_SIZE))
                .minReceiveBatchSize(config.getInteger(Const.Config.MinReceiveBatchSizeProp, DEFAULT_MIN_RECEIVE_BATCH_SIZE))
                .receiveWaitTimeSecs(config.getInteger(Const.Config.ReceiveWaitTimeSecsProp, DEFAULT_RECEIVE_WAIT_TIME_SECS))
                .deleteBatchSize(config.getInteger(Const.Config.DeleteBatchSizeProp, DEFAULT_DELETE_BATCH_SIZE))
                .deleteWaitMs(config.getInteger(Const.Config.DeleteWaitMsProp, DEFAULT_DELETE_WAIT_MS))
                .maxInFlight(config.getInteger(Const.Config.MaxInFlightProp, DEFAULT_MAX_IN_FLIGHT))
                .unwrapSns(config.getBoolean(Const.Config.UnwrapSnsProp, false))
                .bodyFormat(BodyFormat.fromString(config.getString(Const.Config.BodyFormatProp)))
                .pollRetryMs(config.getInteger(Const.Config.PollRetryMsProp, DEFAULT_POLL_RETRY_MS))
                .activePollIntervalMs(config.getInteger(Const.Config.ActivePollIntervalMsProp, 0))
                .idlePollIntervalMs(config.getInteger(Const.Config.IdlePollIntervalMsProp, 0))
                .delaySecs(config.getInteger(Const.Config.DelaySecsProp, 0))
                .gzip(config.getBoolean(Const.Config.GzipProp, false))
                .minGzipSize(config.getInteger(Const.Config.MinGzipSizeProp, 0))
                .maxMessageBytes(config.getInteger(Const.Config.MaxMessageBytesProp, DEFAULT_MAX_MESSAGE_BYTES))
                .messageRetentionSecs(config.getInteger(Const.Config.MessageRetentionSecsProp, DEFAULT_MESSAGE_RETENTION_SECS))
                .autoExtendTimeout(config.getBoolean(Const.Config.AutoExtendTimeoutProp, false))
                .visibilityTimeoutSecs(config.getInteger(Const.Config.VisibilityTimeoutSecsProp))
                .queuePolicy(config.getString(Const.Config.QueuePolicyProp))
                .noExtensionsAfterSecs(config.getInteger(Const.Config.NoExtensionsAfterSecsProp, DEFAULT_NO_EXTENSIONS_AFTER_SECS))
                .advancedCallMs(config.getInteger(Const.Config.AdvancedCallMsProp, DEFAULT_ADVANCED_CALL_MS))
                .s3Fallback(config.getBoolean(Const.Config.S3FallbackProp, false))
                .s3Bucket(config.getString(Const.Config.S3BucketProp))
                .s3Retain(config.getBoolean(Const.Config.S3RetainProp, false))
                .s3Prefix(config.getString(Const.Config.S3PrefixProp, ""))
                .minS3Size(config.getInteger(Const.Config.MinS3SizeProp))
                .stopTimeoutMs(config.getInteger(Const.Config.StopTimeoutMsProp, DEFAULT_STOP_TIMEOUT_MS));

            JsonArray receiveAttributes = config.getJsonArray(Const.Config.ReceiveAttributesProp);
            if (receiveAttributes != null) {
                b.receiveAttributes(toStringList(receiveAttributes));
            }
            JsonArray receiveSqsAttributes = config.getJsonArray(Const.Config.ReceiveSqsAttributesProp);
            if (receiveSqsAttributes != null) {
                b.receiveSqsAttributes(toStringList(receiveSqsAttributes));
            }
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new MalformedPollerConfigException("invalid poller config: " + e.getMessage());
        }
        return b.build();
    }

    private static List<String> toStringList(JsonArray array) {
        return array.stream().map(String::valueOf).toList();
    }

    public String getQueueUrl() { return queueUrl; }
    public String getQueueName() { return queueName; }
    public String getAccountNumber() { return accountNumber; }
    public boolean isCorrectQueueUrl() { return correctQueueUrl; }
    public String getEndpoint() { return endpoint; }
    public int getReceiveBatchSize() { return receiveBatchSize; }
    public int getMinReceiveBatchSize() { return minReceiveBatchSize; }
    public List<String> getReceiveAttributes() { return receiveAttributes; }
    public List<String> getReceiveSqsAttributes() { return receiveSqsAttributes; }
    public int getReceiveWaitTimeSecs() { return receiveWaitTimeSecs; }
    public int getDeleteBatchSize() { return deleteBatchSize; }
    public int getDeleteWaitMs() { return deleteWaitMs; }
    /** 0 disables the in-flight limit */
    public int getMaxInFlight() { return maxInFlight; }
    public boolean isUnwrapSns() { return unwrapSns; }
    public BodyFormat getBodyFormat() { return bodyFormat; }
    public int getPollRetryMs() { return pollRetryMs; }
    public int getActivePollIntervalMs() { return activePollIntervalMs; }
    public int getIdlePollIntervalMs() { return idlePollIntervalMs; }
    public int getDelaySecs() { return delaySecs; }
    public boolean isGzip() { return gzip; }
    public int getMinGzipSize() { return minGzipSize; }
    public int getMaxMessageBytes() { return maxMessageBytes; }
    public int getMessageRetentionSecs() { return messageRetentionSecs; }
    public boolean isAutoExtendTimeout() { return autoExtendTimeout; }
    /** null means the queue's own visibility timeout applies */
    public Integer getVisibilityTimeoutSecs() { return visibilityTimeoutSecs; }
    public String getQueuePolicy() { return queuePolicy; }
    public int getNoExtensionsAfterSecs() { return noExtensionsAfterSecs; }
    public int getAdvancedCallMs() { return advancedCallMs; }
    public boolean isS3Fallback() { return s3Fallback; }
    public String getS3Bucket() { return s3Bucket; }
    public boolean isS3Retain() { return s3Retain; }
    public String getS3Prefix() { return s3Prefix; }
    /** null means the queue's maximum message size is the offload threshold */
    public Integer getMinS3Size() { return minS3Size; }
    public int getStopTimeoutMs() { return stopTimeoutMs; }

    @Override
    public String toString() {
        return String.format("PollerConfig{queueUrl=%s, queueName=%s, receiveBatchSize=%d, minReceiveBatchSize=%d, maxInFlight=%d, deleteBatchSize=%d, deleteWaitMs=%d, gzip=%s, s3Fallback=%s, autoExtendTimeout=%s}",
            queueUrl, queueName, receiveBatchSize, minReceiveBatchSize, maxInFlight, deleteBatchSize, deleteWaitMs, gzip, s3Fallback, autoExtendTimeout);
    }

    public static class Builder {
        private String queueUrl;
        private String queueName;
        private String accountNumber;
        private boolean correctQueueUrl = false;
        private String endpoint;
        private int receiveBatchSize = DEFAULT_RECEIVE_BATCH_SIZE;
        private int minReceiveBatchSize = DEFAULT_MIN_RECEIVE_BATCH_SIZE;
        private List<String> receiveAttributes = List.of("All");
        private List<String> receiveSqsAttributes = List.of("All");
        private int receiveWaitTimeSecs = DEFAULT_RECEIVE_WAIT_TIME_SECS;
        private int deleteBatchSize = DEFAULT_DELETE_BATCH_SIZE;
        private int deleteWaitMs = DEFAULT_DELETE_WAIT_MS;
        private int maxInFlight = DEFAULT_MAX_IN_FLIGHT;
        private boolean unwrapSns = false;
        private BodyFormat bodyFormat = BodyFormat.PLAIN;
        private int pollRetryMs = DEFAULT_POLL_RETRY_MS;
        private int activePollIntervalMs = 0;
        private int idlePollIntervalMs = 0;
        private int delaySecs = 0;
        private boolean gzip = false;
        private int minGzipSize = 0;
        private int maxMessageBytes = DEFAULT_MAX_MESSAGE_BYTES;
        private int messageRetentionSecs = DEFAULT_MESSAGE_RETENTION_SECS;
        private boolean autoExtendTimeout = false;
        private Integer visibilityTimeoutSecs;
        private String queuePolicy;
        private int noExtensionsAfterSecs = DEFAULT_NO_EXTENSIONS_AFTER_SECS;
        private int advancedCallMs = DEFAULT_ADVANCED_CALL_MS;
        private boolean s3Fallback = false;
        private String s3Bucket;
        private boolean s3Retain = false;
        private String s3Prefix = "";
        private Integer minS3Size;
        private int stopTimeoutMs = DEFAULT_STOP_TIMEOUT_MS;

        private Builder() {
        }

        public Builder queueUrl(String queueUrl) { this.queueUrl = queueUrl; return this; }
        public Builder queueName(String queueName) { this.queueName = queueName; return this; }
        public Builder accountNumber(String accountNumber) { this.accountNumber = accountNumber; return this; }
        public Builder correctQueueUrl(boolean correctQueueUrl) { this.correctQueueUrl = correctQueueUrl; return this; }
        public Builder endpoint(String endpoint) { this.endpoint = endpoint; return this; }
        public Builder receiveBatchSize(int receiveBatchSize) { this.receiveBatchSize = receiveBatchSize; return this; }
        public Builder minReceiveBatchSize(int minReceiveBatchSize) { this.minReceiveBatchSize = minReceiveBatchSize; return this; }
        public Builder receiveAttributes(List<String> receiveAttributes) { this.receiveAttributes = receiveAttributes; return this; }
        public Builder receiveSqsAttributes(List<String> receiveSqsAttributes) { this.receiveSqsAttributes = receiveSqsAttributes; return this; }
        public Builder receiveWaitTimeSecs(int receiveWaitTimeSecs) { this.receiveWaitTimeSecs = receiveWaitTimeSecs; return this; }
        public Builder deleteBatchSize(int deleteBatchSize) { this.deleteBatchSize = deleteBatchSize; return this; }
        public Builder deleteWaitMs(int deleteWaitMs) { this.deleteWaitMs = deleteWaitMs; return this; }
        public Builder maxInFlight(int maxInFlight) { this.maxInFlight = maxInFlight; return this; }
        public Builder unwrapSns(boolean unwrapSns) { this.unwrapSns = unwrapSns; return this; }
        public Builder bodyFormat(BodyFormat bodyFormat) { this.bodyFormat = bodyFormat; return this; }
        public Builder pollRetryMs(int pollRetryMs) { this.pollRetryMs = pollRetryMs; return this; }
        public Builder activePollIntervalMs(int activePollIntervalMs) { this.activePollIntervalMs = activePollIntervalMs; return this; }
        public Builder idlePollIntervalMs(int idlePollIntervalMs) { this.idlePollIntervalMs = idlePollIntervalMs; return this; }
        public Builder delaySecs(int delaySecs) { this.delaySecs = delaySecs; return this; }
        public Builder gzip(boolean gzip) { this.gzip = gzip; return this; }
        public Builder minGzipSize(int minGzipSize) { this.minGzipSize = minGzipSize; return this; }
        public Builder maxMessageBytes(int maxMessageBytes) { this.maxMessageBytes = maxMessageBytes; return this; }
        public Builder messageRetentionSecs(int messageRetentionSecs) { this.messageRetentionSecs = messageRetentionSecs; return this; }
        public Builder autoExtendTimeout(boolean autoExtendTimeout) { this.autoExtendTimeout = autoExtendTimeout; return this; }
        public Builder visibilityTimeoutSecs(Integer visibilityTimeoutSecs) { this.visibilityTimeoutSecs = visibilityTimeoutSecs; return this; }
        public Builder queuePolicy(String queuePolicy) { this.queuePolicy = queuePolicy; return this; }
        public Builder noExtensionsAfterSecs(int noExtensionsAfterSecs) { this.noExtensionsAfterSecs = noExtensionsAfterSecs; return this; }
        public Builder advancedCallMs(int advancedCallMs) { this.advancedCallMs = advancedCallMs; return this; }
        public Builder s3Fallback(boolean s3Fallback) { this.s3Fallback = s3Fallback; return this; }
        public Builder s3Bucket(String s3Bucket) { this.s3Bucket = s3Bucket; return this; }
        public Builder s3Retain(boolean s3Retain) { this.s3Retain = s3Retain; return this; }
        public Builder s3Prefix(String s3Prefix) { this.s3Prefix = s3Prefix; return this; }
        public Builder minS3Size(Integer minS3Size) { this.minS3Size = minS3Size; return this; }
        public Builder stopTimeoutMs(int stopTimeoutMs) { this.stopTimeoutMs = stopTimeoutMs; return this; }

        /**
         * @throws MalformedPollerConfigException if neither queue url nor queue name is set, if s3 fallback is
         *         enabled without a bucket, or if a size option is out of range
         */
        public PollerConfig build() throws MalformedPollerConfigException {
            if (isBlank(queueUrl) && isBlank(queueName)) {
                throw new MalformedPollerConfigException("either queue url or queue name must be configured");
            }
            if (s3Fallback && isBlank(s3Bucket)) {
                throw new MalformedPollerConfigException("s3 bucket must be configured when s3 fallback is enabled");
            }
            if (correctQueueUrl && isBlank(endpoint)) {
                throw new MalformedPollerConfigException("endpoint must be configured when queue url correction is enabled");
            }
            if (receiveBatchSize < 1 || minReceiveBatchSize < 1 || deleteBatchSize < 1) {
                throw new MalformedPollerConfigException(String.format("batch sizes must be positive: receiveBatchSize=%d, minReceiveBatchSize=%d, deleteBatchSize=%d",
                    receiveBatchSize, minReceiveBatchSize, deleteBatchSize));
            }
            if (maxInFlight < 0) {
                throw new MalformedPollerConfigException("maxInFlight must not be negative: " + maxInFlight);
            }
            if (receiveAttributes == null || receiveSqsAttributes == null || bodyFormat == null) {
                throw new MalformedPollerConfigException("receive attributes and body format must not be null");
            }
            return new PollerConfig(this);
        }

        private static boolean isBlank(String s) {
            return s == null || s.isBlank();
        }
    }
}
