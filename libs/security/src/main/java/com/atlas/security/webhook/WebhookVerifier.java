package com.atlas.security.webhook;

/**
 * Authenticates an inbound webhook delivery against a shared secret.
 * <p>
 * Verification runs on the raw request body before anything is parsed.
 */
public interface WebhookVerifier {

    /** HTTP header carrying the signature or token. */
    String headerName();

    /**
     * True when a secret is configured. A disabled verifier accepts every delivery, which is only
     * meant for local development.
     */
    boolean enabled();

    /**
     * Verifies one delivery.
     *
     * @param body        raw request body bytes
     * @param headerValue value of {@link #headerName()} (may be null)
     * @throws WebhookSignatureException when the delivery is not authentic
     */
    void verify(byte[] body, String headerValue);
}
