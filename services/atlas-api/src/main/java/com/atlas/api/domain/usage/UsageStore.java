package com.atlas.api.domain.usage;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Persistence of tenants and their usage counters.
 */
public interface UsageStore {

    /**
     * Runs {@code work} in one transaction, committing when it returns normally.
     *
     * @throws RuntimeException if the work throws or the commit fails; nothing is committed then
     */
    void inTransaction(Consumer<UsageBatch> work);

    Optional<TenantUsageView> findUsage(String tenantId);

    /** Tenants ordered by scan count, highest first; tenants without counters last. */
    List<TenantUsageView> topByScans(int limit);
}
