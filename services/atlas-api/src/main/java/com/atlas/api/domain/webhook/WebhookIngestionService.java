package com.atlas.api.domain.webhook;

import com.atlas.api.domain.usage.StreamBroker;
import com.atlas.eventmodel.EventFactory;
import com.atlas.eventmodel.EventSerializer;
import com.atlas.eventmodel.EventValidator;
import com.atlas.eventmodel.WebhookEvent;
import com.atlas.eventmodel.WebhookPlatform;
import com.atlas.security.webhook.WebhookVerifier;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts CI webhook deliveries: verify, record, and queue a scan request.
 * <p>
 * The signature check runs on the raw body before anything is parsed. The scan request is
 * published after the event is stored; a publish failure is logged and does not reject the
 * delivery, since the event is already recorded.
 */
public class WebhookIngestionService {

    private static final Logger log = LoggerFactory.getLogger(WebhookIngestionService.class);

    /** Everything taken from one HTTP delivery. */
    public record Delivery(
            WebhookPlatform platform,
            byte[] body,
            String signatureHeader,
            String eventTypeHeader,
            String tenantId
    ) {
    }

    private final Map<WebhookPlatform, WebhookVerifier> verifiers;
    private final WebhookEventStore store;
    private final StreamBroker broker;
    private final String scanStream;
    private final Clock clock;

    /**
     * @param scanStream stream that receives one scan request per accepted event
     */
    public WebhookIngestionService(Map<WebhookPlatform, WebhookVerifier> verifiers, WebhookEventStore store,
                                   StreamBroker broker, String scanStream, Clock clock) {
        this.verifiers = new EnumMap<>(verifiers);
        this.store = store;
        this.broker = broker;
        this.scanStream = scanStream;
        this.clock = clock;
    }

    /**
     * @return the stored event
     * @throws com.atlas.security.webhook.WebhookSignatureException if verification fails
     * @throws EventSerializer.EventSerializationException          if the verified body is not JSON
     * @throws com.atlas.eventmodel.InvalidEventException           if the event is incomplete
     */
    public WebhookEvent ingest(Delivery delivery) {
        WebhookVerifier verifier = verifiers.get(delivery.platform());
        if (verifier == null) {
            throw new IllegalStateException("No verifier configured for " + delivery.platform().value());
        }
        verifier.verify(delivery.body(), delivery.signatureHeader());

        JsonNode body = EventSerializer.readTree(delivery.body());
        WebhookEvent event = switch (delivery.platform()) {
            case GITHUB -> EventFactory.fromGitHub(delivery.eventTypeHeader(), body, clock.instant());
            case GITLAB -> EventFactory.fromGitLab(body, clock.instant());
        };

        store.save(EventValidator.requireValid(event));
        log.info("Accepted {} {} event {} for {}", event.platform().value(), event.eventType(), event.id(),
                event.repository());
        publishScanRequest(event, delivery.tenantId());
        return event;
    }

    public List<WebhookEvent> recent(int limit) {
        return store.recent(limit);
    }

    private void publishScanRequest(WebhookEvent event, String tenantId) {
        try {
            String entryId = broker.publish(scanStream, EventFactory.scanRequest(event, tenantId));
            log.debug("Queued scan request {} for event {}", entryId, event.id());
        } catch (RuntimeException e) {
            log.warn("Failed to queue scan request for event {}: {}", event.id(), e.getMessage());
        }
    }
}
