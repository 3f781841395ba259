package com.custodia.auditchain;

/**
 * The tenant's chain (or a single entry) changed between the caller's read and its write.
 * Not an integrity problem; the caller may retry.
 */
public class ChainConflictException extends AuditTrailException {

    private final String tenantId;

    public ChainConflictException(String tenantId, String message) {
        super(message);
        this.tenantId = tenantId;
    }

    public ChainConflictException(String tenantId, String message, Throwable cause) {
        super(message, cause);
        this.tenantId = tenantId;
    }

    /**
     * The entry was chained onto a head that is no longer the tenant's last entry.
     */
    public static ChainConflictException staleHead(String tenantId, String expectedHead, String actualHead) {
        return new ChainConflictException(tenantId,
                "Chain head of tenant '%s' moved: entry links to %s but head is %s"
                        .formatted(tenantId, expectedHead, actualHead));
    }

    /**
     * The stored entry differs from the copy the caller based its update on.
     */
    public static ChainConflictException staleEntry(String tenantId, long entryId) {
        return new ChainConflictException(tenantId,
                "Audit entry %d of tenant '%s' was modified concurrently".formatted(entryId, tenantId));
    }

    public String tenantId() {
        return tenantId;
    }
}
