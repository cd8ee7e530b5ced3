package com.atlas.security.webhook;

import com.atlas.security.Hmac;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies GitLab's {@code X-Gitlab-Token} header, which carries the shared secret verbatim.
 */
public final class GitLabTokenVerifier implements WebhookVerifier {

    public static final String HEADER = "X-Gitlab-Token";

    private static final Logger log = LoggerFactory.getLogger(GitLabTokenVerifier.class);

    private final String secret;

    public GitLabTokenVerifier(String secret) {
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
            log.warn("GitLab webhook secret not configured, skipping token verification");
            return;
        }
        if (headerValue == null || headerValue.isEmpty()) {
            throw new WebhookSignatureException("gitlab", "Missing " + HEADER + " header");
        }
        if (!Hmac.constantTimeEquals(secret, headerValue)) {
            throw new WebhookSignatureException("gitlab", "Invalid webhook token");
        }
    }
}
