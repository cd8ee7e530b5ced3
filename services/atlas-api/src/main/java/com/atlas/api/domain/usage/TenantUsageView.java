package com.atlas.api.domain.usage;

/**
 * A tenant joined with its counters, as shown by billing and admin reports.
 */
public record TenantUsageView(
        String tenantId,
        String name,
        String planTier,
        long scansCount,
        long tokenCount
) {
}
