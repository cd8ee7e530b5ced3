package com.atlas.api.config;

import com.atlas.eventmodel.UsageStreams;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Usage worker and stream broker settings, bound from {@code atlas.usage-worker.*}.
 *
 * @param enabled         start the consumer loop with the application
 * @param redisUrl        broker URL, e.g. {@code redis://localhost:6379}
 * @param group           consumer group
 * @param consumer        consumer name inside the group
 * @param usageStream     AI usage stream
 * @param scanStream      scan-request stream
 * @param batchSize       entries requested per stream per poll
 * @param block           longest wait of one poll
 * @param backoff         pause after a broker connection failure
 * @param shutdownTimeout how long shutdown waits for the in-flight batch
 */
@ConfigurationProperties(prefix = "atlas.usage-worker")
public record UsageWorkerProperties(
        boolean enabled,
        String redisUrl,
        String group,
        String consumer,
        String usageStream,
        String scanStream,
        int batchSize,
        Duration block,
        Duration backoff,
        Duration shutdownTimeout
) {

    public UsageWorkerProperties {
        redisUrl = blankTo(redisUrl, "redis://localhost:6379");
        group = blankTo(group, UsageStreams.CONSUMER_GROUP);
        consumer = blankTo(consumer, UsageStreams.DEFAULT_CONSUMER);
        usageStream = blankTo(usageStream, UsageStreams.USAGE);
        scanStream = blankTo(scanStream, UsageStreams.SCAN_REQUESTS);
        if (batchSize <= 0) {
            batchSize = 10;
        }
        if (block == null) {
            block = Duration.ofSeconds(5);
        }
        if (backoff == null) {
            backoff = Duration.ofSeconds(5);
        }
        if (shutdownTimeout == null) {
            shutdownTimeout = Duration.ofSeconds(15);
        }
    }

    private static String blankTo(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
