package com.atlas.api.domain.usage;

/**
 * Increment applied for one message.
 */
public record UsageDelta(String tenantId, long tokens, long scans) {
}
