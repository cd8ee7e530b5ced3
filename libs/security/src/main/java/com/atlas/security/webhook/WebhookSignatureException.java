package com.atlas.security.webhook;

/**
 * Raised when a webhook delivery fails signature or token verification.
 */
public class WebhookSignatureException extends RuntimeException {

    private final String platform;

    public WebhookSignatureException(String platform, String message) {
        super(message);
        this.platform = platform;
    }

    public String platform() {
        return platform;
    }
}
