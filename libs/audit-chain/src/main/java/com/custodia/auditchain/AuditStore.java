package com.custodia.auditchain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Append-only, tenant-partitioned collection of audit entries.
 * <p>
 * Ids are assigned by the store, increase monotonically system-wide and are never reused.
 * {@link #update} and {@link #delete} are the only mutation paths and always pass through the
 * store's {@link ImmutabilityGuard}.
 */
public interface AuditStore {

    /**
     * Assigns an id and persists the entry atomically.
     *
     * @param entry an entry without id whose {@code previousHash} is the tenant's current head
     *              (or the genesis sentinel for an empty chain)
     * @return the stored entry, id assigned
     * @throws ChainConflictException if the tenant's head is no longer what the entry links to
     */
    AuditEntry append(AuditEntry entry);

    /**
     * The highest-id entry of the tenant, or empty for an empty chain.
     */
    Optional<AuditEntry> lastForTenant(String tenantId);

    Optional<AuditEntry> get(long id);

    /**
     * Entries of the tenant in ascending id order. Lazy and single use; the caller closes it.
     */
    Stream<AuditEntry> listForTenant(String tenantId);

    /**
     * Replaces a stored entry.
     *
     * @param current     the entry as the caller last read it
     * @param replacement the new content, same id
     * @throws ImmutableRecordException    if a frozen field changes outside maintenance mode
     * @throws ChainConflictException      if the stored entry no longer equals {@code current}
     * @throws AuditEntryNotFoundException if the entry does not exist
     */
    AuditEntry update(AuditEntry current, AuditEntry replacement);

    /**
     * Deletes the given entries. Deleting nothing succeeds and returns 0.
     *
     * @return number of entries removed
     * @throws ImmutableRecordException if the selection is non-empty outside maintenance mode
     */
    int delete(Collection<Long> ids);

    /**
     * Tenants that own at least one entry, sorted.
     */
    List<String> tenantIds();

    boolean isMaintenanceMode();
}
