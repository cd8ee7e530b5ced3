package com.atlas.api.infrastructure.web;

/**
 * A request parameter or body field failed a check made by this service. The message is shown to
 * the client as the problem detail.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
