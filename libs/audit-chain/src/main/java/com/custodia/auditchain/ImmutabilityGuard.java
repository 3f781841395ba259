package com.custodia.auditchain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Gate in front of every mutation of persisted audit entries.
 * <p>
 * An enforcing guard lets through only changes to lifecycle-tied fields (lifecycle state,
 * sequence reference, review fields) and rejects everything else, deletes included, with
 * {@link ImmutableRecordException}. A maintenance guard lets everything through; it is handed
 * out only by the {@code withMaintenanceMode()} factories of the stores, never by configuration.
 */
public final class ImmutabilityGuard {

    private static final Logger log = LoggerFactory.getLogger(ImmutabilityGuard.class);

    private static final ImmutabilityGuard ENFORCING = new ImmutabilityGuard(false);
    private static final ImmutabilityGuard MAINTENANCE = new ImmutabilityGuard(true);

    private final boolean maintenance;

    private ImmutabilityGuard(boolean maintenance) {
        this.maintenance = maintenance;
    }

    public static ImmutabilityGuard enforcing() {
        return ENFORCING;
    }

    public static ImmutabilityGuard maintenance() {
        return MAINTENANCE;
    }

    public boolean isMaintenance() {
        return maintenance;
    }

    /**
     * @throws ImmutableRecordException if {@code replacement} changes a frozen field and the guard
     *                                  is enforcing
     */
    public void checkUpdate(AuditEntry stored, AuditEntry replacement) {
        List<String> changed = frozenFieldChanges(stored, replacement);
        if (changed.isEmpty()) {
            return;
        }
        if (!maintenance) {
            throw ImmutableRecordException.forUpdate(stored.id(), changed);
        }
        log.warn("Maintenance bypass: audit entry {} of tenant {} rewritten, fields {}",
                stored.id(), stored.tenantId(), changed);
    }

    /**
     * An empty selection always passes.
     *
     * @throws ImmutableRecordException if the selection is non-empty and the guard is enforcing
     */
    public void checkDelete(Collection<Long> selection) {
        if (selection == null || selection.isEmpty()) {
            return;
        }
        if (!maintenance) {
            throw ImmutableRecordException.forDelete(selection);
        }
        log.warn("Maintenance bypass: deleting audit entries {}", selection);
    }

    /**
     * Names of the fields outside the lifecycle-tied set that differ between the two entries.
     */
    public static List<String> frozenFieldChanges(AuditEntry stored, AuditEntry replacement) {
        var changed = new ArrayList<String>();
        compare(changed, "id", stored.id(), replacement.id());
        compare(changed, "tenantId", stored.tenantId(), replacement.tenantId());
        compare(changed, "eventType", stored.eventType(), replacement.eventType());
        compare(changed, "severity", stored.severity(), replacement.severity());
        compare(changed, "actorId", stored.actorId(), replacement.actorId());
        compare(changed, "timestamp", stored.timestamp(), replacement.timestamp());
        compare(changed, "subjectRef", stored.subjectRef(), replacement.subjectRef());
        compare(changed, "description", stored.description(), replacement.description());
        compare(changed, "beforeState", stored.beforeState(), replacement.beforeState());
        compare(changed, "afterState", stored.afterState(), replacement.afterState());
        compare(changed, "metadata", stored.metadata(), replacement.metadata());
        compare(changed, "contentHash", stored.contentHash(), replacement.contentHash());
        compare(changed, "previousHash", stored.previousHash(), replacement.previousHash());
        return changed;
    }

    private static void compare(List<String> changed, String field, Object before, Object after) {
        if (!Objects.equals(before, after)) {
            changed.add(field);
        }
    }
}
