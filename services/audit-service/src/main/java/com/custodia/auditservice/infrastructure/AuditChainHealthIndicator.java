package com.custodia.auditservice.infrastructure;

import com.custodia.auditchain.AuditTrail;
import com.custodia.auditservice.config.AuditServiceProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * {@code auditChain} component of {@code /actuator/health}: checks the audit store with a tenant
 * listing. Chains are not verified here; that is a reviewer action.
 */
@Component("auditChain")
public class AuditChainHealthIndicator implements HealthIndicator {

    private final AuditTrail auditTrail;
    private final AuditServiceProperties properties;

    public AuditChainHealthIndicator(AuditTrail auditTrail, AuditServiceProperties properties) {
        this.auditTrail = auditTrail;
        this.properties = properties;
    }

    @Override
    public Health health() {
        long start = System.currentTimeMillis();
        try {
            int tenants = auditTrail.tenantIds().size();
            return Health.up()
                    .withDetail("storage", properties.storage().name().toLowerCase())
                    .withDetail("tenants", tenants)
                    .withDetail("latencyMs", System.currentTimeMillis() - start)
                    .build();
        } catch (RuntimeException e) {
            return Health.down(e)
                    .withDetail("storage", properties.storage().name().toLowerCase())
                    .withDetail("latencyMs", System.currentTimeMillis() - start)
                    .build();
        }
    }
}
