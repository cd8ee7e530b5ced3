package com.atlas.eventmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks {@link WebhookEvent} instances before they are persisted.
 *
 * <p>Every problem is collected at once instead of failing on the first.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Lists the columns {@code webhook_events} declares NOT NULL that {@code event} leaves empty.
     *
     * @return one message per missing field, empty when the event can be stored
     */
    public static List<String> problems(WebhookEvent event) {
        List<String> problems = new ArrayList<>();

        if (isBlank(event.id())) {
            problems.add("id must not be null or blank");
        }
        if (event.platform() == null) {
            problems.add("platform must not be null");
        }
        if (isBlank(event.eventType())) {
            problems.add("eventType must not be null or blank");
        }
        if (event.receivedAt() == null) {
            problems.add("receivedAt must not be null");
        }
        return problems;
    }

    /**
     * @return {@code event}, unchanged
     * @throws InvalidEventException listing every missing field
     */
    public static WebhookEvent requireValid(WebhookEvent event) {
        List<String> problems = problems(event);
        if (!problems.isEmpty()) {
            throw new InvalidEventException(problems);
        }
        return event;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
