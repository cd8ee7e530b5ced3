package com.atlas.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StreamMessage")
class StreamMessageTest {

    @Test
    @DisplayName("returns the payload field verbatim")
    void returnsPayload() {
        var message = new StreamMessage(UsageStreams.USAGE, "1-0",
                Map.of("payload", "{\"tenant_id\":\"acme\"}"));

        assertThat(message.payloadJson()).isEqualTo("{\"tenant_id\":\"acme\"}");
    }

    @Test
    @DisplayName("missing payload reads as an empty object")
    void missingPayload() {
        var message = new StreamMessage(UsageStreams.SCAN_REQUESTS, "1-0", null);

        assertThat(message.payloadJson()).isEqualTo("{}");
        assertThat(EventSerializer.readTree(message.payloadJson()).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("malformed JSON raises a serialization exception")
    void malformedJson() {
        assertThatThrownBy(() -> EventSerializer.readTree("{not json"))
                .isInstanceOf(EventSerializer.EventSerializationException.class);
    }
}
