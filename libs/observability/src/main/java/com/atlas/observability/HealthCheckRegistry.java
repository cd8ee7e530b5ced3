package com.atlas.observability;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every registered {@link HealthCheck} concurrently and folds the results into one
 * {@link HealthReport}.
 * <p>
 * A probe that throws, fails its future or exceeds the timeout counts as {@link HealthStatus#ERROR}.
 */
public final class HealthCheckRegistry {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final Map<String, HealthCheck> checks = new LinkedHashMap<>();
    private final Duration timeout;
    private final Clock clock;

    public HealthCheckRegistry() {
        this(DEFAULT_TIMEOUT, Clock.systemUTC());
    }

    public HealthCheckRegistry(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
        this.clock = clock;
    }

    public synchronized void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    public synchronized boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    public HealthReport checkAll() {
        Map<String, CompletableFuture<ComponentHealth>> running = new LinkedHashMap<>();
        synchronized (this) {
            checks.forEach((name, check) -> running.put(name, start(name, check)));
        }

        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.OK;
        for (Map.Entry<String, CompletableFuture<ComponentHealth>> entry : running.entrySet()) {
            ComponentHealth health = await(entry.getKey(), entry.getValue());
            results.put(entry.getKey(), health);
            overall = overall.worst(health.status());
        }
        return new HealthReport(overall, results, clock.instant());
    }

    public synchronized int size() {
        return checks.size();
    }

    private static CompletableFuture<ComponentHealth> start(String name, HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ComponentHealth.error(name, e.getMessage(), 0));
        }
    }

    private ComponentHealth await(String name, CompletableFuture<ComponentHealth> future) {
        try {
            return future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).join();
        } catch (CompletionException e) {
            String message = e.getCause() instanceof TimeoutException
                    ? "timed out after " + timeout.toMillis() + "ms"
                    : String.valueOf(e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return ComponentHealth.error(name, message, timeout.toMillis());
        }
    }
}
