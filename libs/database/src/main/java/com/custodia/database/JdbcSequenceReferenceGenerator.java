package com.custodia.database;

import com.custodia.auditchain.AuditEventType;
import com.custodia.auditchain.SequenceReferenceGenerator;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Sequence references backed by {@code audit_sequence_counter}, so numbering survives restarts
 * and is shared by every service instance.
 */
public class JdbcSequenceReferenceGenerator implements SequenceReferenceGenerator {

    private static final String NEXT_VALUE = """
            INSERT INTO audit_sequence_counter (tenant_id, event_type, last_value)
            VALUES (?, ?, 1)
            ON CONFLICT (tenant_id, event_type)
            DO UPDATE SET last_value = audit_sequence_counter.last_value + 1
            RETURNING last_value""";

    private final JdbcTemplate jdbc;

    public JdbcSequenceReferenceGenerator(DataSource dataSource) {
        this.jdbc = new JdbcTemplate(dataSource);
    }

    @Override
    public String next(String tenantId, AuditEventType eventType) {
        Long value = jdbc.queryForObject(NEXT_VALUE, Long.class, tenantId, eventType.name());
        return SequenceReferenceGenerator.format(eventType, value);
    }
}
