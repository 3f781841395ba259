package com.custodia.auditchain;

/**
 * Base class of every error the audit chain surfaces to its callers.
 */
public abstract class AuditTrailException extends RuntimeException {

    protected AuditTrailException(String message) {
        super(message);
    }

    protected AuditTrailException(String message, Throwable cause) {
        super(message, cause);
    }
}
