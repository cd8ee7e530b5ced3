package com.atlas.api.domain.usage;

/**
 * The stream broker could not be reached or dropped the connection.
 */
public class StreamConnectionException extends RuntimeException {

    public StreamConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
