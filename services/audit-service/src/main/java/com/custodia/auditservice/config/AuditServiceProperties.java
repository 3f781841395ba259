package com.custodia.auditservice.config;

import com.custodia.auditchain.AuditTrail;
import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Audit chain settings, bound from {@code custodia.audit.*}.
 *
 * <p>No property enables maintenance mode. A store that bypasses the
 * immutability guard can only be obtained in code.
 *
 * @param clockSkewTolerance how far in the future a caller-supplied timestamp may lie
 * @param lockTimeout how long an append waits for the tenant's chain lock
 * @param storage where entries live
 * @param escalationThreads size of the pool that delivers escalations
 * @param datasource connection settings, required when {@code storage} is {@code jdbc}
 */
@ConfigurationProperties(prefix = "custodia.audit")
@Validated
public record AuditServiceProperties(
        Duration clockSkewTolerance,
        Duration lockTimeout,
        Storage storage,
        int escalationThreads,
        Datasource datasource) {

    public enum Storage {
        MEMORY,
        JDBC
    }

    public record Datasource(String url, String username, String password) {}

    public AuditServiceProperties {
        if (clockSkewTolerance == null) {
            clockSkewTolerance = AuditTrail.DEFAULT_CLOCK_SKEW_TOLERANCE;
        }
        if (lockTimeout == null) {
            lockTimeout = AuditTrail.DEFAULT_LOCK_TIMEOUT;
        }
        if (storage == null) {
            storage = Storage.MEMORY;
        }
        if (escalationThreads <= 0) {
            escalationThreads = 2;
        }
        if (clockSkewTolerance.isNegative()) {
            throw new IllegalArgumentException("clockSkewTolerance must not be negative");
        }
        if (lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive");
        }
    }

    @AssertTrue(message = "custodia.audit.datasource.url is required when storage is jdbc")
    public boolean isDatasourceConfigured() {
        return storage != Storage.JDBC
                || (datasource != null && datasource.url() != null && !datasource.url().isBlank());
    }
}
