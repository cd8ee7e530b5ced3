package com.atlas.api.infrastructure.persistence;

import com.atlas.api.domain.webhook.WebhookEventStore;
import com.atlas.eventmodel.WebhookEvent;
import com.atlas.eventmodel.WebhookPlatform;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * {@link WebhookEventStore} over the {@code webhook_events} table.
 */
public class JdbcWebhookEventStore implements WebhookEventStore {

    private static final String INSERT =
            "INSERT INTO webhook_events (id, platform, event_type, repository, ref, sender, action, received_at)"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String SELECT_RECENT =
            "SELECT id, platform, event_type, repository, ref, sender, action, received_at"
                    + " FROM webhook_events ORDER BY received_at DESC, id LIMIT ?";

    private final JdbcTemplate jdbc;

    public JdbcWebhookEventStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(WebhookEvent event) {
        jdbc.update(INSERT,
                event.id(),
                event.platform().value(),
                event.eventType(),
                event.repository(),
                event.ref(),
                event.sender(),
                event.action(),
                event.receivedAt().atOffset(ZoneOffset.UTC));
    }

    @Override
    public List<WebhookEvent> recent(int limit) {
        return jdbc.query(SELECT_RECENT, JdbcWebhookEventStore::mapEvent, limit);
    }

    private static WebhookEvent mapEvent(ResultSet rs, int row) throws SQLException {
        String platformName = rs.getString("platform");
        WebhookPlatform platform = WebhookPlatform.fromString(platformName)
                .orElseThrow(() -> new SQLException("Unknown platform " + platformName));
        return new WebhookEvent(
                rs.getString("id"),
                platform,
                rs.getString("event_type"),
                rs.getString("repository"),
                rs.getString("ref"),
                rs.getString("sender"),
                rs.getString("action"),
                rs.getObject("received_at", OffsetDateTime.class).toInstant());
    }
}
