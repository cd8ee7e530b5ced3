package com.atlas.eventmodel;

/**
 * Names shared by the producers and the usage worker.
 */
public final class UsageStreams {

    /** AI usage events; each carries {@code tokens_used}. */
    public static final String USAGE = "atlas.ai.usage";

    /** Scan requests; each entry counts as one scan. */
    public static final String SCAN_REQUESTS = "atlas.scan.requests";

    /** Consumer group the control plane reads both streams with. */
    public static final String CONSUMER_GROUP = "atlas-api-usage";

    /** Default consumer name inside {@link #CONSUMER_GROUP}. */
    public static final String DEFAULT_CONSUMER = "atlas-api-1";

    /** Entry field that holds the JSON document. */
    public static final String PAYLOAD_FIELD = "payload";

    /** Tenant charged when an event names none. */
    public static final String DEFAULT_TENANT = "default";

    private UsageStreams() {
        // constants
    }
}
