package com.custodia.auditchain;

import java.time.Duration;

/**
 * The tenant's append lock could not be acquired in time. The caller may retry.
 */
public class ChainBusyException extends AuditTrailException {

    private final String tenantId;
    private final Duration timeout;

    public ChainBusyException(String tenantId, Duration timeout) {
        super("Audit chain of tenant '%s' is busy; lock not acquired within %s".formatted(tenantId, timeout));
        this.tenantId = tenantId;
        this.timeout = timeout;
    }

    public ChainBusyException(String tenantId, Duration timeout, Throwable cause) {
        super("Interrupted while waiting for audit chain of tenant '%s'".formatted(tenantId), cause);
        this.tenantId = tenantId;
        this.timeout = timeout;
    }

    public String tenantId() {
        return tenantId;
    }

    public Duration timeout() {
        return timeout;
    }
}
