package com.custodia.auditchain;

public class AuditEntryNotFoundException extends AuditTrailException {

    private final long entryId;

    public AuditEntryNotFoundException(long entryId) {
        super("Audit entry %d not found".formatted(entryId));
        this.entryId = entryId;
    }

    public long entryId() {
        return entryId;
    }
}
