package com.atlas.database;

import com.atlas.observability.ComponentHealth;
import com.atlas.observability.HealthCheck;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.CompletableFuture;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes the relational store with {@code SELECT 1}.
 * <p>
 * The probe runs on the caller's thread; failures are logged here and reported as a generic
 * message so connection strings never reach the health response.
 */
public final class DataSourceHealthCheck implements HealthCheck {

    public static final String COMPONENT = "database";

    private static final Logger log = LoggerFactory.getLogger(DataSourceHealthCheck.class);

    private final DataSource dataSource;

    public DataSourceHealthCheck(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public CompletableFuture<ComponentHealth> check() {
        long start = System.nanoTime();
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("SELECT 1");
            return CompletableFuture.completedFuture(ComponentHealth.ok(COMPONENT, elapsedMs(start)));
        } catch (SQLException e) {
            log.error("Database health check failed", e);
            return CompletableFuture.completedFuture(
                    ComponentHealth.error(COMPONENT, "database unreachable", elapsedMs(start)));
        }
    }

    private static long elapsedMs(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
