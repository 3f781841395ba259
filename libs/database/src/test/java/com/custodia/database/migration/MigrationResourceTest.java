package com.custodia.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Checks that the audit migrations are packaged where Flyway looks for them and carry the
 * database-level immutability rules.
 */
@DisplayName("Audit migration resources")
class MigrationResourceTest {

    private static final String V1 = "db/migration/audit/V1__audit_entry.sql";

    @Test
    @DisplayName("V1__audit_entry.sql is under the migrator's location")
    void onClasspath() throws IOException {
        assertThat(AuditSchemaMigrator.LOCATION).isEqualTo("classpath:db/migration/audit");
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(V1)) {
            assertThat(is).as("V1__audit_entry.sql must be on the classpath").isNotNull();
        }
    }

    @Test
    @DisplayName("creates the entry and counter tables")
    void createsTables() throws IOException {
        String sql = read(V1);

        assertThat(sql).containsIgnoringCase("CREATE TABLE audit_entry");
        assertThat(sql).containsIgnoringCase("CREATE TABLE audit_sequence_counter");
    }

    @Test
    @DisplayName("one successor per link is enforced by a unique constraint")
    void uniqueLink() throws IOException {
        assertThat(read(V1)).contains("UNIQUE (tenant_id, previous_hash)");
    }

    @Test
    @DisplayName("updates, deletes and truncates are guarded by triggers with a maintenance switch")
    void immutabilityTriggers() throws IOException {
        String sql = read(V1);

        assertThat(sql).contains("BEFORE UPDATE OR DELETE ON audit_entry");
        assertThat(sql).contains("BEFORE TRUNCATE ON audit_entry");
        assertThat(sql).contains("current_setting('custodia.maintenance_mode', true)");
    }

    private String read(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is == null) {
                throw new AssertionError("Resource not found: " + path);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
