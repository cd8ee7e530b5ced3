package com.atlas.security;

/**
 * Every way authentication or authorization can fail.
 * <p>
 * Each case carries a stable {@link #reason()} code returned to clients, a generic message that
 * reveals nothing about secrets or keys, and whether it is a forbidden (403) rather than an
 * unauthorized (401) outcome.
 */
public enum AuthFailure {

    MISSING_CREDENTIAL("missing_credential", "Missing authorization header", false),
    MALFORMED_CREDENTIAL("malformed_credential", "Invalid authorization format", false),
    UNSUPPORTED_SCHEME("unsupported_scheme", "Unsupported authorization scheme", false),
    UNKNOWN_KEY("unknown_key", "Invalid API key", false),
    MALFORMED_TOKEN("malformed_token", "Invalid token format", false),
    BAD_SIGNATURE("bad_signature", "Invalid token signature", false),
    EXPIRED("expired", "Token expired", false),
    INSUFFICIENT_PERMISSIONS("insufficient_permissions", "Insufficient permissions", true);

    private final String reason;
    private final String defaultMessage;
    private final boolean forbidden;

    AuthFailure(String reason, String defaultMessage, boolean forbidden) {
        this.reason = reason;
        this.defaultMessage = defaultMessage;
        this.forbidden = forbidden;
    }

    /** Machine-readable reason code (e.g., "bad_signature"). */
    public String reason() {
        return reason;
    }

    /** Client-safe description. */
    public String defaultMessage() {
        return defaultMessage;
    }

    /** True when the caller is authenticated but lacks privileges. */
    public boolean forbidden() {
        return forbidden;
    }
}
