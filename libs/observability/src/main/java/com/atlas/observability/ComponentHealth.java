package com.atlas.observability;

/**
 * Result of probing one component.
 *
 * @param name      component name, e.g. "database"
 * @param status    probe outcome
 * @param message   error detail, null when OK
 * @param latencyMs probe duration
 */
public record ComponentHealth(String name, HealthStatus status, String message, long latencyMs) {

    public static ComponentHealth ok(String name, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.OK, null, latencyMs);
    }

    public static ComponentHealth error(String name, String message, long latencyMs) {
        return new ComponentHealth(name, HealthStatus.ERROR, message, latencyMs);
    }

    public boolean isOk() {
        return status == HealthStatus.OK;
    }
}
