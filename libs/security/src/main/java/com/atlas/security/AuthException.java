package com.atlas.security;

/**
 * Thrown when a credential cannot be resolved or an identity is not allowed to act.
 * <p>
 * Unchecked: callers in the request path never recover from it; the web layer translates the
 * carried {@link AuthFailure} into a 401 or 403 response.
 */
public class AuthException extends RuntimeException {

    private final AuthFailure failure;

    public AuthException(AuthFailure failure) {
        this(failure, failure.defaultMessage());
    }

    public AuthException(AuthFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public AuthException(AuthFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public AuthFailure failure() {
        return failure;
    }
}
