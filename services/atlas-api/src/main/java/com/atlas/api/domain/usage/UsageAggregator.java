package com.atlas.api.domain.usage;

import com.atlas.eventmodel.EventSerializer;
import com.atlas.eventmodel.StreamMessage;
import com.atlas.eventmodel.Tenant;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns one stream message into tenant upserts and a counter increment.
 * <p>
 * Messages from the usage stream add {@code tokens_used} (default 0) to the token count; messages
 * from the scan stream add one scan. The tenant and its usage row are created first if missing.
 */
public final class UsageAggregator {

    static final String TOKENS_FIELD = "tokens_used";

    private final TenantIdExtractor tenantIds;
    private final String usageStream;
    private final String scanStream;

    public UsageAggregator(TenantIdExtractor tenantIds, String usageStream, String scanStream) {
        this.tenantIds = tenantIds;
        this.usageStream = usageStream;
        this.scanStream = scanStream;
    }

    /**
     * Applies {@code message} to {@code batch}.
     *
     * @throws AggregationException if the payload is not a JSON object, the token count is not a
     *                              non-negative integer, or the stream is not a usage stream
     */
    public UsageDelta apply(UsageBatch batch, StreamMessage message) {
        JsonNode payload = parse(message);
        String tenantId = tenantIds.extract(payload);

        UsageDelta delta;
        if (usageStream.equals(message.stream())) {
            delta = new UsageDelta(tenantId, tokensOf(message, payload), 0);
        } else if (scanStream.equals(message.stream())) {
            delta = new UsageDelta(tenantId, 0, 1);
        } else {
            throw new AggregationException(message.id(), "Unexpected stream " + message.stream());
        }

        batch.ensureTenant(Tenant.lazy(tenantId));
        if (delta.tokens() > 0) {
            batch.addTokens(tenantId, delta.tokens());
        }
        if (delta.scans() > 0) {
            batch.addScans(tenantId, delta.scans());
        }
        return delta;
    }

    private static JsonNode parse(StreamMessage message) {
        JsonNode payload;
        try {
            payload = EventSerializer.readTree(message.payloadJson());
        } catch (EventSerializer.EventSerializationException e) {
            throw new AggregationException(message.id(), "Payload is not valid JSON", e);
        }
        if (!payload.isObject()) {
            throw new AggregationException(message.id(), "Payload is not a JSON object");
        }
        return payload;
    }

    private static long tokensOf(StreamMessage message, JsonNode payload) {
        JsonNode tokens = payload.path(TOKENS_FIELD);
        if (tokens.isMissingNode() || tokens.isNull()) {
            return 0;
        }
        if (!tokens.canConvertToLong() || !tokens.isIntegralNumber() || tokens.asLong() < 0) {
            throw new AggregationException(message.id(),
                    TOKENS_FIELD + " must be a non-negative integer, got " + tokens);
        }
        return tokens.asLong();
    }
}
