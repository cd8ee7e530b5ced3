package com.atlas.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.atlas.observability.testing.StubHealthCheck;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HealthCheckRegistry")
class HealthCheckRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private final HealthCheckRegistry registry =
            new HealthCheckRegistry(Duration.ofMillis(200), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    @DisplayName("no checks means OK")
    void empty() {
        HealthReport report = registry.checkAll();

        assertThat(report.isUp()).isTrue();
        assertThat(report.components()).isEmpty();
        assertThat(report.checkedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("one failing component makes the aggregate ERROR")
    void failing() {
        registry.register("database", new StubHealthCheck("database").failing("connection refused"));
        registry.register("redis", new StubHealthCheck("redis").ok());

        HealthReport report = registry.checkAll();

        assertThat(report.status()).isEqualTo(HealthStatus.ERROR);
        assertThat(report.statusOf("database")).isEqualTo(HealthStatus.ERROR);
        assertThat(report.statusOf("redis")).isEqualTo(HealthStatus.OK);
        assertThat(report.components().get("database").message()).isEqualTo("connection refused");
    }

    @Test
    @DisplayName("a hanging probe times out as ERROR")
    void timeout() {
        registry.register("database", new StubHealthCheck("database").hanging());

        HealthReport report = registry.checkAll();

        assertThat(report.statusOf("database")).isEqualTo(HealthStatus.ERROR);
        assertThat(report.components().get("database").message()).contains("timed out");
    }

    @Test
    @DisplayName("a probe that throws or fails its future is ERROR")
    void throwing() {
        registry.register("a", () -> {
            throw new IllegalStateException("boom");
        });
        registry.register("b", () -> CompletableFuture.failedFuture(new IllegalStateException("bang")));

        HealthReport report = registry.checkAll();

        assertThat(report.components().get("a").message()).isEqualTo("boom");
        assertThat(report.components().get("b").message()).isEqualTo("bang");
    }

    @Test
    @DisplayName("unregistered component reads as ERROR")
    void unknownComponent() {
        assertThat(registry.checkAll().statusOf("database")).isEqualTo(HealthStatus.ERROR);
    }

    @Test
    @DisplayName("worst() orders OK < DEGRADED < ERROR")
    void worst() {
        assertThat(HealthStatus.OK.worst(HealthStatus.DEGRADED)).isEqualTo(HealthStatus.DEGRADED);
        assertThat(HealthStatus.ERROR.worst(HealthStatus.OK)).isEqualTo(HealthStatus.ERROR);
    }
}
