package com.custodia.auditchain;

/**
 * Issues human-readable references such as {@code CUSTODY_TRANSFER/000003}, counting per tenant
 * and event type.
 */
public interface SequenceReferenceGenerator {

    String next(String tenantId, AuditEventType eventType);

    static String format(AuditEventType eventType, long counter) {
        return "%s/%06d".formatted(eventType.name(), counter);
    }
}
