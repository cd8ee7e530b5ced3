package com.atlas.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Probe for one dependency (database, stream broker).
 * <p>
 * Implementations should complete quickly; the registry bounds each probe with a timeout.
 */
@FunctionalInterface
public interface HealthCheck {

    CompletableFuture<ComponentHealth> check();
}
