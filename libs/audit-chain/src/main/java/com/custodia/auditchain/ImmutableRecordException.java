package com.custodia.auditchain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Thrown when persisted history is about to be edited or deleted outside maintenance mode.
 */
public class ImmutableRecordException extends AuditTrailException {

    private final List<Long> entryIds;
    private final List<String> fields;

    private ImmutableRecordException(String message, List<Long> entryIds, List<String> fields) {
        super(message);
        this.entryIds = entryIds;
        this.fields = fields;
    }

    /**
     * An update would change fields that are frozen once the entry is persisted.
     */
    public static ImmutableRecordException forUpdate(Long entryId, List<String> fields) {
        return new ImmutableRecordException(
                "Audit entry %s is immutable; attempted to change %s".formatted(entryId, fields),
                entryId == null ? List.of() : List.of(entryId),
                List.copyOf(fields));
    }

    public static ImmutableRecordException forDelete(Collection<Long> entryIds) {
        return new ImmutableRecordException(
                "Audit entries cannot be deleted: %s".formatted(entryIds),
                Collections.unmodifiableList(new ArrayList<>(entryIds)),
                List.of());
    }

    public List<Long> entryIds() {
        return entryIds;
    }

    /** Names of the frozen fields the rejected update touched; empty for deletes. */
    public List<String> fields() {
        return fields;
    }
}
