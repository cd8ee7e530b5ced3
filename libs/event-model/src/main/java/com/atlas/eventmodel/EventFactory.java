package com.atlas.eventmodel;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Factory methods for building {@link WebhookEvent} instances from platform payloads and for
 * turning an accepted event into a scan-request stream entry.
 * <p>
 * Missing fields in the platform body become empty strings rather than failures: a push from a
 * repository with an unusual payload shape is still recorded.
 */
public final class EventFactory {

    private EventFactory() {
        // utility class
    }

    /**
     * Builds an event from a GitHub delivery.
     *
     * @param eventTypeHeader value of {@code X-GitHub-Event} (null becomes "unknown")
     * @param body parsed JSON body
     * @param receivedAt receipt time
     */
    public static WebhookEvent fromGitHub(String eventTypeHeader, JsonNode body, Instant receivedAt) {
        String eventType =
                eventTypeHeader == null || eventTypeHeader.isBlank() ? "unknown" : eventTypeHeader;
        return new WebhookEvent(
                UUID.randomUUID().toString(),
                WebhookPlatform.GITHUB,
                eventType,
                text(body.path("repository").path("full_name")),
                text(body.path("ref")),
                text(body.path("sender").path("login")),
                text(body.path("action")),
                receivedAt);
    }

    /**
     * Builds an event from a GitLab delivery. GitLab names the event inside the body
     * ({@code object_kind}) rather than in a header.
     */
    public static WebhookEvent fromGitLab(JsonNode body, Instant receivedAt) {
        String eventType = text(body.path("object_kind"));
        return new WebhookEvent(
                UUID.randomUUID().toString(),
                WebhookPlatform.GITLAB,
                eventType.isEmpty() ? "unknown" : eventType,
                text(body.path("project").path("path_with_namespace")),
                text(body.path("ref")),
                text(body.path("user_name")),
                text(body.path("object_attributes").path("action")),
                receivedAt);
    }

    /**
     * Builds the fields of the scan-request entry published for an accepted webhook.
     *
     * @param event the persisted event
     * @param tenantId tenant the scan is billed to, or null to let the worker apply its default
     * @return stream entry fields with the JSON document under {@link UsageStreams#PAYLOAD_FIELD}
     */
    public static Map<String, String> scanRequest(WebhookEvent event, String tenantId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_id", event.id());
        payload.put("platform", event.platform().value());
        payload.put("event_type", event.eventType());
        payload.put("repository", event.repository());
        payload.put("ref", event.ref());
        if (tenantId != null && !tenantId.isBlank()) {
            payload.put("tenant_id", tenantId);
        }
        payload.put("requested_at", event.receivedAt().toString());
        return Map.of(UsageStreams.PAYLOAD_FIELD, EventSerializer.toJson(payload));
    }

    private static String text(JsonNode node) {
        return node.isValueNode() ? node.asText("") : "";
    }
}
