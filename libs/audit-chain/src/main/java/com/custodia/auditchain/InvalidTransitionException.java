package com.custodia.auditchain;

/**
 * Thrown for a lifecycle transition the workflow does not allow, such as archiving a draft.
 */
public class InvalidTransitionException extends AuditTrailException {

    private final long entryId;
    private final LifecycleState from;
    private final LifecycleState to;

    public InvalidTransitionException(long entryId, LifecycleState from, LifecycleState to) {
        super("Audit entry %d cannot move from %s to %s".formatted(entryId, from.value(), to.value()));
        this.entryId = entryId;
        this.from = from;
        this.to = to;
    }

    public long entryId() {
        return entryId;
    }

    public LifecycleState from() {
        return from;
    }

    public LifecycleState to() {
        return to;
    }
}
