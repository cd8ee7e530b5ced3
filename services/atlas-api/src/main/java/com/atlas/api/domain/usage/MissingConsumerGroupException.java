package com.atlas.api.domain.usage;

/**
 * A read named a consumer group that does not exist on one of its streams, typically because the
 * group could not be created at startup or the stream was deleted.
 */
public class MissingConsumerGroupException extends RuntimeException {

    public MissingConsumerGroupException(String message, Throwable cause) {
        super(message, cause);
    }
}
