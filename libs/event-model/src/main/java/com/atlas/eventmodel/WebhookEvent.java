package com.atlas.eventmodel;

import java.time.Instant;

/**
 * A verified CI webhook delivery, as persisted in {@code webhook_events}.
 *
 * <p>Append-only: created once the signature check has passed and never mutated afterwards.
 * Fields the platform did not send are stored as empty strings, never null.
 *
 * @param id unique event id (UUID v4, generated on receipt)
 * @param platform the platform that delivered the webhook
 * @param eventType platform event name (e.g., "push", "pull_request", "merge_request")
 * @param repository full repository path (e.g., "acme/backend")
 * @param ref git ref the event refers to (e.g., "refs/heads/main")
 * @param sender login of the user that triggered the event
 * @param action sub-action for events that have one (e.g., "opened")
 * @param receivedAt when the control plane accepted the delivery
 */
public record WebhookEvent(
        String id,
        WebhookPlatform platform,
        String eventType,
        String repository,
        String ref,
        String sender,
        String action,
        Instant receivedAt) {

    public WebhookEvent {
        eventType = orEmpty(eventType);
        repository = orEmpty(repository);
        ref = orEmpty(ref);
        sender = orEmpty(sender);
        action = orEmpty(action);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
