package com.atlas.api.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.atlas.eventmodel.WebhookEvent;
import com.atlas.eventmodel.WebhookPlatform;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JdbcWebhookEventStore")
class JdbcWebhookEventStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private JdbcWebhookEventStore store;

    @BeforeEach
    void setUp() {
        store = new JdbcWebhookEventStore(H2Database.migrated().jdbc);
    }

    @Test
    @DisplayName("round-trips every column")
    void roundTrip() {
        var event = new WebhookEvent("evt-1", WebhookPlatform.GITHUB, "pull_request", "acme/backend",
                "refs/heads/main", "octocat", "opened", T0);

        store.save(event);

        assertThat(store.recent(10)).containsExactly(event);
    }

    @Test
    @DisplayName("recent returns newest first, limited")
    void newestFirst() {
        store.save(new WebhookEvent("old", WebhookPlatform.GITLAB, "push", "g/r", "", "", "", T0));
        store.save(new WebhookEvent("new", WebhookPlatform.GITHUB, "push", "g/r", "", "", "", T0.plusSeconds(60)));
        store.save(new WebhookEvent("mid", WebhookPlatform.GITHUB, "push", "g/r", "", "", "", T0.plusSeconds(30)));

        assertThat(store.recent(2)).extracting(WebhookEvent::id).containsExactly("new", "mid");
    }
}
