package com.atlas.database;

import java.util.Arrays;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationState;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the Atlas schema with Flyway outside a Spring context.
 * <p>
 * The service relies on Spring Boot's Flyway auto-configuration pointed at {@link #LOCATION};
 * this class is for tools and tests that hold a bare {@link DataSource}.
 */
public final class SchemaMigrator {

    /** Classpath location of the versioned migrations. */
    public static final String LOCATION = "classpath:db/migration/atlas";

    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    /**
     * Snapshot of the schema state after migrating.
     *
     * @param applied        migrations applied by this run
     * @param pending        migrations still pending
     * @param currentVersion schema version, null for an empty schema
     */
    public record MigrationStatus(int applied, int pending, String currentVersion) {}

    private final Flyway flyway;

    public SchemaMigrator(DataSource dataSource) {
        this.flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(LOCATION)
                .load();
    }

    public MigrationStatus migrate() {
        MigrateResult result = flyway.migrate();
        log.info("Applied {} migration(s), schema now at version {}",
                result.migrationsExecuted, result.targetSchemaVersion);
        return status(result.migrationsExecuted);
    }

    public MigrationStatus status() {
        return status(0);
    }

    private MigrationStatus status(int applied) {
        MigrationInfo[] all = flyway.info().all();
        int pending = (int) Arrays.stream(all)
                .filter(info -> info.getState() == MigrationState.PENDING)
                .count();
        MigrationInfo current = flyway.info().current();
        return new MigrationStatus(applied, pending,
                current == null || current.getVersion() == null ? null : current.getVersion().getVersion());
    }
}
