package com.atlas.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Shared secrets for inbound webhooks, bound from {@code atlas.webhooks.*}. An empty secret
 * disables verification for that platform.
 */
@ConfigurationProperties(prefix = "atlas.webhooks")
public record WebhookProperties(String githubSecret, String gitlabSecret) {

    public WebhookProperties {
        githubSecret = githubSecret == null ? "" : githubSecret;
        gitlabSecret = gitlabSecret == null ? "" : gitlabSecret;
    }
}
