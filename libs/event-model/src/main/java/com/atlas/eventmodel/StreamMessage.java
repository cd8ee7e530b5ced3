package com.atlas.eventmodel;

import java.util.Map;

/**
 * One entry read from a stream through a consumer group.
 *
 * @param stream name of the stream the entry was read from
 * @param id broker-assigned entry id, used to acknowledge it
 * @param fields raw entry fields; usage producers put a JSON document under {@code payload}
 */
public record StreamMessage(String stream, String id, Map<String, String> fields) {

    public StreamMessage {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    /** Returns the JSON payload field, or an empty JSON object when the producer sent none. */
    public String payloadJson() {
        String payload = fields.get(UsageStreams.PAYLOAD_FIELD);
        return payload == null || payload.isBlank() ? "{}" : payload;
    }
}
