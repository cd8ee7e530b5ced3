package com.atlas.security.webhook;

import com.atlas.security.Hmac;
import java.util.HexFormat;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies GitHub's {@code X-Hub-Signature-256} header: {@code "sha256=" + hex(HMAC-SHA256(secret, body))}.
 * <p>
 * The hex digest is compared lower-cased and in constant time. With an empty secret verification
 * is skipped and a warning is logged for every skipped delivery.
 */
public final class GitHubSignatureVerifier implements WebhookVerifier {

    public static final String HEADER = "X-Hub-Signature-256";
    static final String PREFIX = "sha256=";

    private static final Logger log = LoggerFactory.getLogger(GitHubSignatureVerifier.class);

    private final String secret;

    public GitHubSignatureVerifier(String secret) {
        this.secret = secret == null ? "" : secret;
    }

    @Override
    public String headerName() {
        return HEADER;
    }

    @Override
    public boolean enabled() {
        return !secret.isEmpty();
    }

    @Override
    public void verify(byte[] body, String headerValue) {
        if (!enabled()) {
            log.warn("GitHub webhook secret not configured, skipping signature verification");
            return;
        }
        if (headerValue == null || headerValue.isEmpty()) {
            throw new WebhookSignatureException("github", "Missing " + HEADER + " header");
        }
        if (!headerValue.startsWith(PREFIX)) {
            throw new WebhookSignatureException("github", "Unsupported signature format");
        }

        String expected = HexFormat.of().formatHex(Hmac.sha256(secret, body));
        String provided = headerValue.substring(PREFIX.length()).toLowerCase(Locale.ROOT);
        if (!Hmac.constantTimeEquals(expected, provided)) {
            throw new WebhookSignatureException("github", "Invalid webhook signature");
        }
    }
}
