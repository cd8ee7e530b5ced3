package com.atlas.api.domain.usage;

import java.time.Duration;
import java.util.List;

/**
 * Tuning of the usage consumer loop.
 *
 * @param group       consumer group name
 * @param consumer    this process's consumer name inside the group
 * @param usageStream stream of AI usage events, counted as tokens
 * @param scanStream  stream of scan requests, counted as scans
 * @param batchSize   entries requested per stream per poll
 * @param block       longest time a poll waits for entries
 * @param backoff     pause after a connection failure
 */
public record UsageWorkerSettings(
        String group,
        String consumer,
        String usageStream,
        String scanStream,
        int batchSize,
        Duration block,
        Duration backoff
) {

    public UsageWorkerSettings {
        if (usageStream == null || usageStream.isBlank() || scanStream == null || scanStream.isBlank()) {
            throw new IllegalArgumentException("stream names must not be null or blank");
        }
        if (usageStream.equals(scanStream)) {
            throw new IllegalArgumentException("usage and scan streams must differ");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
    }

    /** Streams read on every poll, usage first. */
    public List<String> streams() {
        return List.of(usageStream, scanStream);
    }
}
