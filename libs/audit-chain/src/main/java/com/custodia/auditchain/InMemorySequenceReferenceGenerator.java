package com.custodia.auditchain;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemorySequenceReferenceGenerator implements SequenceReferenceGenerator {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public String next(String tenantId, AuditEventType eventType) {
        long value = counters
                .computeIfAbsent(tenantId + '|' + eventType.name(), k -> new AtomicLong())
                .incrementAndGet();
        return SequenceReferenceGenerator.format(eventType, value);
    }
}
