package com.atlas.api.domain.webhook;

import com.atlas.eventmodel.WebhookEvent;
import java.util.List;

/**
 * Append-only log of verified webhook deliveries.
 */
public interface WebhookEventStore {

    void save(WebhookEvent event);

    /** The {@code limit} most recently received events, newest first. */
    List<WebhookEvent> recent(int limit);
}
