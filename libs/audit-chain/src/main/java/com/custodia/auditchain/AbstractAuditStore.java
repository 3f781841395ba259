package com.custodia.auditchain;

import java.util.Collection;
import java.util.Objects;

/**
 * Routes {@link #update} and {@link #delete} through the {@link ImmutabilityGuard} chosen at
 * construction before handing them to the storage-specific implementation.
 */
public abstract class AbstractAuditStore implements AuditStore {

    private final ImmutabilityGuard guard;

    protected AbstractAuditStore(ImmutabilityGuard guard) {
        this.guard = Objects.requireNonNull(guard, "guard must not be null");
    }

    @Override
    public final AuditEntry update(AuditEntry current, AuditEntry replacement) {
        if (current.id() == null) {
            throw new IllegalArgumentException("only persisted entries can be updated");
        }
        guard.checkUpdate(current, replacement);
        return doUpdate(current, replacement);
    }

    @Override
    public final int delete(Collection<Long> ids) {
        guard.checkDelete(ids);
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        return doDelete(ids);
    }

    @Override
    public boolean isMaintenanceMode() {
        return guard.isMaintenance();
    }

    protected ImmutabilityGuard guard() {
        return guard;
    }

    /**
     * Persists {@code replacement} if the stored entry still equals {@code current}.
     */
    protected abstract AuditEntry doUpdate(AuditEntry current, AuditEntry replacement);

    protected abstract int doDelete(Collection<Long> ids);
}
