package com.atlas.api.config;

import com.atlas.api.domain.usage.StreamBroker;
import com.atlas.api.domain.webhook.WebhookEventStore;
import com.atlas.api.domain.webhook.WebhookIngestionService;
import com.atlas.eventmodel.WebhookPlatform;
import com.atlas.security.webhook.GitHubSignatureVerifier;
import com.atlas.security.webhook.GitLabTokenVerifier;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Webhook ingestion with one verifier per platform.
 */
@Configuration
public class WebhookConfig {

    private static final Logger log = LoggerFactory.getLogger(WebhookConfig.class);

    @Bean
    public WebhookIngestionService webhookIngestionService(WebhookProperties webhooks, WebhookEventStore store,
                                                           StreamBroker broker, UsageWorkerProperties worker,
                                                           Clock clock) {
        var github = new GitHubSignatureVerifier(webhooks.githubSecret());
        var gitlab = new GitLabTokenVerifier(webhooks.gitlabSecret());
        if (!github.enabled() || !gitlab.enabled()) {
            log.warn("Webhook verification is off for some platforms: github={} gitlab={}",
                    github.enabled() ? "on" : "off", gitlab.enabled() ? "on" : "off");
        }
        return new WebhookIngestionService(
                Map.of(WebhookPlatform.GITHUB, github, WebhookPlatform.GITLAB, gitlab),
                store, broker, worker.scanStream(), clock);
    }
}
