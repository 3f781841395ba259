package com.custodia.database;

import com.custodia.auditchain.AbstractAuditStore;
import com.custodia.auditchain.AuditEntry;
import com.custodia.auditchain.AuditEntryNotFoundException;
import com.custodia.auditchain.AuditEventType;
import com.custodia.auditchain.ChainConflictException;
import com.custodia.auditchain.HashChainer;
import com.custodia.auditchain.ImmutabilityGuard;
import com.custodia.auditchain.LifecycleState;
import com.custodia.auditchain.Metadata;
import com.custodia.auditchain.Severity;
import com.custodia.auditchain.SubjectRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link com.custodia.auditchain.AuditStore} over the {@code audit_entry} table.
 * <p>
 * Appends check the tenant head inside a transaction and rely on the
 * {@code UNIQUE (tenant_id, previous_hash)} constraint to turn a concurrent append from another
 * process into a {@link ChainConflictException} instead of a forked chain.
 */
public class JdbcAuditStore extends AbstractAuditStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditStore.class);

    private static final String COLUMNS = """
            id, tenant_id, sequence_reference, event_type, severity, actor_id, event_timestamp,
            subject_type, subject_id, description, before_state, after_state, metadata,
            content_hash, previous_hash, lifecycle_state, reviewed_by, reviewed_at, review_notes""";

    private static final String INSERT = """
            INSERT INTO audit_entry (tenant_id, sequence_reference, event_type, severity, actor_id,
                event_timestamp, subject_type, subject_id, description, before_state, after_state,
                metadata, content_hash, previous_hash, lifecycle_state, reviewed_by, reviewed_at, review_notes)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id""";

    private static final String UPDATE = """
            UPDATE audit_entry SET id = ?, tenant_id = ?, sequence_reference = ?, event_type = ?,
                severity = ?, actor_id = ?, event_timestamp = ?, subject_type = ?, subject_id = ?,
                description = ?, before_state = ?, after_state = ?, metadata = ?, content_hash = ?,
                previous_hash = ?, lifecycle_state = ?, reviewed_by = ?, reviewed_at = ?, review_notes = ?
            WHERE id = ?""";

    private static final String SELECT_HEAD =
            "SELECT " + COLUMNS + " FROM audit_entry WHERE tenant_id = ? ORDER BY id DESC LIMIT 1";

    private static final String ENABLE_MAINTENANCE =
            "SELECT set_config('custodia.maintenance_mode', 'on', true)";

    private static final RowMapper<AuditEntry> ROW_MAPPER = JdbcAuditStore::mapRow;

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate namedJdbc;
    private final TransactionTemplate tx;

    public JdbcAuditStore(DataSource dataSource) {
        this(dataSource, ImmutabilityGuard.enforcing());
    }

    private JdbcAuditStore(DataSource dataSource, ImmutabilityGuard guard) {
        super(guard);
        this.jdbc = new JdbcTemplate(dataSource);
        this.namedJdbc = new NamedParameterJdbcTemplate(jdbc);
        this.tx = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    /**
     * A store whose updates and deletes bypass both the guard and the table trigger. For test
     * harnesses and operator-run repairs only.
     */
    public static JdbcAuditStore withMaintenanceMode(DataSource dataSource) {
        return new JdbcAuditStore(dataSource, ImmutabilityGuard.maintenance());
    }

    @Override
    public AuditEntry append(AuditEntry entry) {
        if (entry.id() != null) {
            throw new IllegalArgumentException("entry already has id " + entry.id());
        }
        try {
            Long id = tx.execute(status -> {
                String head = jdbc.query(SELECT_HEAD, ROW_MAPPER, entry.tenantId()).stream()
                        .findFirst()
                        .map(AuditEntry::contentHash)
                        .orElse(HashChainer.GENESIS);
                if (!head.equals(entry.previousHash())) {
                    throw ChainConflictException.staleHead(entry.tenantId(), entry.previousHash(), head);
                }
                return jdbc.queryForObject(INSERT, Long.class, insertArgs(entry));
            });
            return entry.withId(id);
        } catch (DuplicateKeyException e) {
            throw new ChainConflictException(entry.tenantId(),
                    "Concurrent append to audit chain of tenant '%s'".formatted(entry.tenantId()), e);
        }
    }

    @Override
    public Optional<AuditEntry> lastForTenant(String tenantId) {
        return jdbc.query(SELECT_HEAD, ROW_MAPPER, tenantId).stream().findFirst();
    }

    @Override
    public Optional<AuditEntry> get(long id) {
        return jdbc.query("SELECT " + COLUMNS + " FROM audit_entry WHERE id = ?", ROW_MAPPER, id)
                .stream()
                .findFirst();
    }

    @Override
    public Stream<AuditEntry> listForTenant(String tenantId) {
        return jdbc.queryForStream(
                "SELECT " + COLUMNS + " FROM audit_entry WHERE tenant_id = ? ORDER BY id", ROW_MAPPER, tenantId);
    }

    @Override
    public List<String> tenantIds() {
        return jdbc.queryForList("SELECT DISTINCT tenant_id FROM audit_entry ORDER BY tenant_id", String.class);
    }

    @Override
    protected AuditEntry doUpdate(AuditEntry current, AuditEntry replacement) {
        return tx.execute(status -> {
            AuditEntry stored = jdbc.query(
                            "SELECT " + COLUMNS + " FROM audit_entry WHERE id = ? FOR UPDATE", ROW_MAPPER, current.id())
                    .stream()
                    .findFirst()
                    .orElseThrow(() -> new AuditEntryNotFoundException(current.id()));
            if (!stored.equals(current)) {
                throw ChainConflictException.staleEntry(stored.tenantId(), stored.id());
            }
            enableMaintenanceIfAllowed();
            jdbc.update(UPDATE, updateArgs(replacement, current.id()));
            return replacement;
        });
    }

    @Override
    protected int doDelete(Collection<Long> ids) {
        Integer removed = tx.execute(status -> {
            enableMaintenanceIfAllowed();
            return namedJdbc.update("DELETE FROM audit_entry WHERE id IN (:ids)",
                    new MapSqlParameterSource("ids", ids));
        });
        log.warn("Deleted {} audit entries in maintenance mode", removed);
        return removed == null ? 0 : removed;
    }

    private void enableMaintenanceIfAllowed() {
        if (isMaintenanceMode()) {
            jdbc.queryForObject(ENABLE_MAINTENANCE, String.class);
        }
    }

    private static Object[] insertArgs(AuditEntry e) {
        return new Object[] {
                e.tenantId(), e.sequenceReference(), e.eventType().value(), e.severity().value(), e.actorId(),
                toOffset(e.timestamp()), subjectType(e), subjectId(e), e.description(), e.beforeState(),
                e.afterState(), e.metadata().toJson(), e.contentHash(), e.previousHash(),
                e.lifecycleState().value(), e.reviewedBy(), toOffset(e.reviewedAt()), e.reviewNotes()
        };
    }

    private static Object[] updateArgs(AuditEntry e, long whereId) {
        return new Object[] {
                e.id(), e.tenantId(), e.sequenceReference(), e.eventType().value(), e.severity().value(),
                e.actorId(), toOffset(e.timestamp()), subjectType(e), subjectId(e), e.description(),
                e.beforeState(), e.afterState(), e.metadata().toJson(), e.contentHash(), e.previousHash(),
                e.lifecycleState().value(), e.reviewedBy(), toOffset(e.reviewedAt()), e.reviewNotes(),
                whereId
        };
    }

    private static AuditEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
        String subjectType = rs.getString("subject_type");
        SubjectRef subject = subjectType == null ? null : new SubjectRef(subjectType, rs.getString("subject_id"));
        return new AuditEntry(
                rs.getLong("id"),
                rs.getString("tenant_id"),
                rs.getString("sequence_reference"),
                AuditEventType.fromString(rs.getString("event_type"))
                        .orElseThrow(() -> new SQLException("unknown event_type in row " + rowNum)),
                Severity.fromString(rs.getString("severity"))
                        .orElseThrow(() -> new SQLException("unknown severity in row " + rowNum)),
                rs.getString("actor_id"),
                toInstant(rs.getObject("event_timestamp", OffsetDateTime.class)),
                subject,
                rs.getString("description"),
                rs.getString("before_state"),
                rs.getString("after_state"),
                Metadata.fromJson(rs.getString("metadata")),
                rs.getString("content_hash"),
                rs.getString("previous_hash"),
                LifecycleState.fromString(rs.getString("lifecycle_state"))
                        .orElseThrow(() -> new SQLException("unknown lifecycle_state in row " + rowNum)),
                rs.getString("reviewed_by"),
                toInstant(rs.getObject("reviewed_at", OffsetDateTime.class)),
                rs.getString("review_notes"));
    }

    private static String subjectType(AuditEntry e) {
        return e.subjectRef() == null ? null : e.subjectRef().type();
    }

    private static String subjectId(AuditEntry e) {
        return e.subjectRef() == null ? null : e.subjectRef().id();
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
