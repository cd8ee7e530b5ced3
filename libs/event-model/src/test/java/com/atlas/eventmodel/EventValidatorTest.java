package com.atlas.eventmodel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EventValidator")
class EventValidatorTest {

    @Test
    @DisplayName("accepts a complete event")
    void acceptsCompleteEvent() {
        var event =
                new WebhookEvent("id-1", WebhookPlatform.GITHUB, "push", "acme/app", "main",
                        "yoad", null, Instant.now());

        assertThat(EventValidator.problems(event)).isEmpty();
        assertThat(EventValidator.requireValid(event)).isSameAs(event);
    }

    @Test
    @DisplayName("reports every missing required field")
    void reportsAllErrors() {
        var event = new WebhookEvent(" ", null, "", null, null, null, null, null);

        assertThat(EventValidator.problems(event))
                .hasSize(4)
                .anyMatch(e -> e.startsWith("id"))
                .anyMatch(e -> e.startsWith("platform"))
                .anyMatch(e -> e.startsWith("eventType"))
                .anyMatch(e -> e.startsWith("receivedAt"));
    }

    @Test
    @DisplayName("requireValid throws with every problem in the message")
    void requireValidThrows() {
        var event = new WebhookEvent("id-1", WebhookPlatform.GITHUB, " ", null, null, null, null, null);

        assertThatThrownBy(() -> EventValidator.requireValid(event))
                .isInstanceOf(InvalidEventException.class)
                .hasMessageContaining("eventType")
                .hasMessageContaining("receivedAt")
                .satisfies(e -> assertThat(((InvalidEventException) e).problems()).hasSize(2));
    }

    @Test
    @DisplayName("optional text fields are normalised to empty strings")
    void normalisesOptionalFields() {
        var event = new WebhookEvent("id-1", WebhookPlatform.GITLAB, "push", null, null, null, null,
                Instant.now());

        assertThat(event.repository()).isEmpty();
        assertThat(event.ref()).isEmpty();
        assertThat(event.sender()).isEmpty();
        assertThat(event.action()).isEmpty();
    }
}
