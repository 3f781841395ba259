package com.custodia.auditchain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Stream;

/**
 * Heap-backed {@link AuditStore} for embedded use and tests.
 * <p>
 * Writes are serialised on the store; reads are lock-free over concurrent skip lists, so a
 * listing started before an append simply does not see it.
 */
public class InMemoryAuditStore extends AbstractAuditStore {

    private final ConcurrentSkipListMap<Long, AuditEntry> entries = new ConcurrentSkipListMap<>();
    private final Map<String, ConcurrentSkipListMap<Long, AuditEntry>> byTenant = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();
    private long lastId;

    public InMemoryAuditStore() {
        this(ImmutabilityGuard.enforcing());
    }

    private InMemoryAuditStore(ImmutabilityGuard guard) {
        super(guard);
    }

    /**
     * A store whose update and delete paths bypass immutability. For test harnesses and
     * operator-run repairs only.
     */
    public static InMemoryAuditStore withMaintenanceMode() {
        return new InMemoryAuditStore(ImmutabilityGuard.maintenance());
    }

    @Override
    public AuditEntry append(AuditEntry entry) {
        if (entry.id() != null) {
            throw new IllegalArgumentException("entry already has id " + entry.id());
        }
        synchronized (writeLock) {
            String head = lastForTenant(entry.tenantId())
                    .map(AuditEntry::contentHash)
                    .orElse(HashChainer.GENESIS);
            if (!head.equals(entry.previousHash())) {
                throw ChainConflictException.staleHead(entry.tenantId(), entry.previousHash(), head);
            }
            AuditEntry stored = entry.withId(++lastId);
            entries.put(stored.id(), stored);
            tenantEntries(stored.tenantId()).put(stored.id(), stored);
            return stored;
        }
    }

    @Override
    public Optional<AuditEntry> lastForTenant(String tenantId) {
        var chain = byTenant.get(tenantId);
        if (chain == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(chain.lastEntry()).map(Map.Entry::getValue);
    }

    @Override
    public Optional<AuditEntry> get(long id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public Stream<AuditEntry> listForTenant(String tenantId) {
        var chain = byTenant.get(tenantId);
        return chain == null ? Stream.empty() : chain.values().stream();
    }

    @Override
    public List<String> tenantIds() {
        var tenants = new ArrayList<String>();
        byTenant.forEach((tenant, chain) -> {
            if (!chain.isEmpty()) {
                tenants.add(tenant);
            }
        });
        tenants.sort(null);
        return tenants;
    }

    @Override
    protected AuditEntry doUpdate(AuditEntry current, AuditEntry replacement) {
        synchronized (writeLock) {
            AuditEntry stored = entries.get(current.id());
            if (stored == null) {
                throw new AuditEntryNotFoundException(current.id());
            }
            if (!stored.equals(current)) {
                throw ChainConflictException.staleEntry(stored.tenantId(), stored.id());
            }
            if (stored.id().equals(replacement.id()) && stored.tenantId().equals(replacement.tenantId())) {
                entries.put(stored.id(), replacement);
                byTenant.get(stored.tenantId()).put(stored.id(), replacement);
                return replacement;
            }
            // a maintenance rewrite moved the entry; readers may briefly see neither key
            entries.remove(stored.id());
            byTenant.get(stored.tenantId()).remove(stored.id());
            entries.put(replacement.id(), replacement);
            tenantEntries(replacement.tenantId()).put(replacement.id(), replacement);
            return replacement;
        }
    }

    @Override
    protected int doDelete(Collection<Long> ids) {
        synchronized (writeLock) {
            int removed = 0;
            for (Long id : ids) {
                AuditEntry entry = entries.remove(id);
                if (entry != null) {
                    byTenant.get(entry.tenantId()).remove(id);
                    removed++;
                }
            }
            return removed;
        }
    }

    private ConcurrentSkipListMap<Long, AuditEntry> tenantEntries(String tenantId) {
        return byTenant.computeIfAbsent(tenantId, t -> new ConcurrentSkipListMap<>());
    }
}
