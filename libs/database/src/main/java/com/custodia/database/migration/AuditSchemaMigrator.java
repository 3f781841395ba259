package com.custodia.database.migration;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * Applies the audit schema migrations and reports their state.
 * <p>
 * Usable without an application context. {@code clean} is disabled for this schema.
 */
public class AuditSchemaMigrator {

    /** Flyway location of the audit schema migrations. */
    public static final String LOCATION = "classpath:db/migration/audit";

    private static final Logger log = LoggerFactory.getLogger(AuditSchemaMigrator.class);

    private final Flyway flyway;

    public AuditSchemaMigrator(DataSource dataSource) {
        this.flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations(LOCATION)
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }

    /**
     * Schema state of the audit database.
     *
     * @param appliedMigrations number of successfully applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion    current schema version (null if no migrations applied)
     */
    public record MigrationStatus(int appliedMigrations, int pendingMigrations, String currentVersion) {

        public boolean upToDate() {
            return pendingMigrations == 0 && currentVersion != null;
        }
    }

    /**
     * Applies all pending migrations.
     */
    public MigrationStatus migrate() {
        MigrateResult result = flyway.migrate();
        log.info("Audit schema migrated: {} migration(s) executed, now at version {}",
                result.migrationsExecuted, result.targetSchemaVersion);
        return status();
    }

    public MigrationStatus status() {
        MigrationInfoService info = flyway.info();
        MigrationInfo current = info.current();
        return new MigrationStatus(
                info.applied().length,
                info.pending().length,
                current == null || current.getVersion() == null ? null : current.getVersion().getVersion());
    }
}
