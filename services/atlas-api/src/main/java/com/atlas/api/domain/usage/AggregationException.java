package com.atlas.api.domain.usage;

/**
 * A single stream message could not be turned into a usage increment.
 * <p>
 * Contained by the consumer loop: the message is logged, acknowledged and dropped.
 */
public class AggregationException extends RuntimeException {

    private final String messageId;

    public AggregationException(String messageId, String message) {
        super(message);
        this.messageId = messageId;
    }

    public AggregationException(String messageId, String message, Throwable cause) {
        super(message, cause);
        this.messageId = messageId;
    }

    public String messageId() {
        return messageId;
    }
}
