package com.atlas.eventmodel;

import java.util.Optional;

/**
 * CI platforms that can deliver webhooks to the control plane.
 *
 * <p>The {@code value} is the lowercase name stored in {@code webhook_events.platform}.
 */
public enum WebhookPlatform {
    GITHUB("github"),
    GITLAB("gitlab");

    private final String value;

    WebhookPlatform(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "github"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a platform by its canonical value, ignoring case.
     *
     * @param value the string to match
     * @return the matching platform, or empty if not found
     */
    public static Optional<WebhookPlatform> fromString(String value) {
        for (WebhookPlatform platform : values()) {
            if (platform.value.equalsIgnoreCase(value)) {
                return Optional.of(platform);
            }
        }
        return Optional.empty();
    }
}
