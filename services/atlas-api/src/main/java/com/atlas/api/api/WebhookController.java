package com.atlas.api.api;

import com.atlas.api.domain.webhook.WebhookIngestionService;
import com.atlas.api.domain.webhook.WebhookIngestionService.Delivery;
import com.atlas.api.infrastructure.web.InvalidRequestException;
import com.atlas.api.infrastructure.web.RequiresRole;
import com.atlas.api.infrastructure.web.TenantHeader;
import com.atlas.eventmodel.WebhookEvent;
import com.atlas.eventmodel.WebhookPlatform;
import com.atlas.security.Role;
import com.atlas.security.webhook.GitHubSignatureVerifier;
import com.atlas.security.webhook.GitLabTokenVerifier;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * CI webhook receivers and the recent-event listing.
 *
 * <p>The receivers are unauthenticated; the platform signature or token is the credential. The
 * body is taken as raw bytes so the signature is checked over exactly what was sent.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    static final String GITHUB_EVENT_HEADER = "X-GitHub-Event";
    static final int MAX_LIMIT = 100;

    private final WebhookIngestionService ingestion;

    public WebhookController(WebhookIngestionService ingestion) {
        this.ingestion = ingestion;
    }

    public record WebhookResponse(String status, String message, @JsonProperty("event_id") String eventId) {

        static WebhookResponse accepted(String platformLabel, WebhookEvent event) {
            return new WebhookResponse("accepted",
                    "%s %s event received for %s".formatted(platformLabel, event.eventType(), event.repository()),
                    event.id());
        }
    }

    public record WebhookEventResponse(
            String id,
            String platform,
            @JsonProperty("event_type") String eventType,
            String repository,
            String ref,
            String sender,
            String action,
            @JsonProperty("received_at") Instant receivedAt) {

        static WebhookEventResponse from(WebhookEvent event) {
            return new WebhookEventResponse(event.id(), event.platform().value(), event.eventType(),
                    event.repository(), event.ref(), event.sender(), event.action(), event.receivedAt());
        }
    }

    @PostMapping("/github")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public WebhookResponse github(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(name = GitHubSignatureVerifier.HEADER, required = false) String signature,
            @RequestHeader(name = GITHUB_EVENT_HEADER, required = false) String eventType,
            @RequestHeader(name = TenantHeader.NAME, required = false) String tenantId) {
        WebhookEvent event = ingestion.ingest(
                new Delivery(WebhookPlatform.GITHUB, orEmpty(body), signature, eventType, tenantId));
        return WebhookResponse.accepted("GitHub", event);
    }

    @PostMapping("/gitlab")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public WebhookResponse gitlab(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(name = GitLabTokenVerifier.HEADER, required = false) String token,
            @RequestHeader(name = TenantHeader.NAME, required = false) String tenantId) {
        WebhookEvent event = ingestion.ingest(
                new Delivery(WebhookPlatform.GITLAB, orEmpty(body), token, null, tenantId));
        return WebhookResponse.accepted("GitLab", event);
    }

    @GetMapping("/events")
    @RequiresRole(Role.VIEWER)
    public List<WebhookEventResponse> events(@RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_LIMIT);
        }
        return ingestion.recent(limit).stream().map(WebhookEventResponse::from).toList();
    }

    private static byte[] orEmpty(byte[] body) {
        return body == null ? new byte[0] : body;
    }
}
