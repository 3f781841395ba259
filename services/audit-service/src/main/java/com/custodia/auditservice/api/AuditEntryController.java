package com.custodia.auditservice.api;

import com.custodia.auditchain.AuditEntry;
import com.custodia.auditchain.AuditEntryNotFoundException;
import com.custodia.auditchain.AuditEventType;
import com.custodia.auditchain.AuditTrail;
import com.custodia.auditchain.AuditValidationException;
import com.custodia.auditchain.LogOptions;
import com.custodia.auditchain.Metadata;
import com.custodia.auditchain.Severity;
import com.custodia.auditchain.SubjectRef;
import com.custodia.auditservice.api.dto.ArchiveSweepResponse;
import com.custodia.auditservice.api.dto.AuditEntryResponse;
import com.custodia.auditservice.api.dto.EntryVerificationResponse;
import com.custodia.auditservice.api.dto.FlagRequest;
import com.custodia.auditservice.api.dto.LogEntryRequest;
import com.custodia.auditservice.api.dto.ReviewRequest;
import com.custodia.security.CustodiaSecurityContext;
import com.custodia.security.Role;
import com.custodia.security.RoleChecker;
import com.custodia.security.TenantIsolationEnforcer;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Records audit entries and drives their review lifecycle.
 *
 * <p>Every handler checks the caller's role and that the path tenant is the caller's tenant.
 * An entry id that belongs to another tenant is reported as not found.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/audit-entries")
public class AuditEntryController {

    private final AuditTrail auditTrail;

    public AuditEntryController(AuditTrail auditTrail) {
        this.auditTrail = auditTrail;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AuditEntryResponse log(
            @PathVariable String tenantId,
            @Valid @RequestBody LogEntryRequest request,
            CustodiaSecurityContext security) {
        authorize(security, tenantId, Role.RECORDS_CLERK);

        var options = LogOptions.builder()
                .actorId(security.actorId())
                .timestamp(request.timestamp())
                .beforeState(request.beforeState())
                .afterState(request.afterState())
                .metadata(request.metadata() == null ? Metadata.empty() : Metadata.of(request.metadata()));
        if (request.severity() != null) {
            options.severity(Severity.fromString(request.severity())
                    .orElseThrow(() -> new AuditValidationException("unknown severity '%s'".formatted(request.severity()))));
        }
        if (request.subjectType() != null || request.subjectId() != null) {
            options.subjectRef(new SubjectRef(request.subjectType(), request.subjectId()));
        }
        AuditEventType eventType = AuditEventType.fromString(request.eventType())
                .orElseThrow(() -> new AuditValidationException("unknown eventType '%s'".formatted(request.eventType())));

        return AuditEntryResponse.from(auditTrail.log(tenantId, eventType, request.description(), options.build()));
    }

    @GetMapping
    public List<AuditEntryResponse> list(
            @PathVariable String tenantId,
            @RequestParam(required = false) String state,
            CustodiaSecurityContext security) {
        authorize(security, tenantId, Role.RECORDS_CLERK);

        try (Stream<AuditEntry> entries = auditTrail.listForTenant(tenantId)) {
            return entries
                    .filter(e -> state == null || e.lifecycleState().value().equalsIgnoreCase(state))
                    .map(AuditEntryResponse::from)
                    .toList();
        }
    }

    @GetMapping("/{id}")
    public AuditEntryResponse get(
            @PathVariable String tenantId, @PathVariable long id, CustodiaSecurityContext security) {
        authorize(security, tenantId, Role.RECORDS_CLERK);
        return AuditEntryResponse.from(owned(tenantId, id));
    }

    @PostMapping("/{id}/validate")
    public AuditEntryResponse validate(
            @PathVariable String tenantId, @PathVariable long id, CustodiaSecurityContext security) {
        authorize(security, tenantId, Role.COMPLIANCE_REVIEWER);
        owned(tenantId, id);
        return AuditEntryResponse.from(auditTrail.validate(id));
    }

    @PostMapping("/{id}/flag")
    public AuditEntryResponse flag(
            @PathVariable String tenantId,
            @PathVariable long id,
            @Valid @RequestBody FlagRequest request,
            CustodiaSecurityContext security) {
        authorize(security, tenantId, Role.RECORDS_CLERK);
        owned(tenantId, id);
        return AuditEntryResponse.from(auditTrail.flagForReview(id, request.reason()));
    }

    @PostMapping("/{id}/review")
    public AuditEntryResponse review(
            @PathVariable String tenantId,
            @PathVariable long id,
            @RequestBody(required = false) ReviewRequest request,
            CustodiaSecurityContext security) {
        authorize(security, tenantId, Role.COMPLIANCE_REVIEWER);
        owned(tenantId, id);
        return AuditEntryResponse.from(
                auditTrail.resolveReview(id, security.actorId(), request == null ? null : request.notes()));
    }

    @PostMapping("/{id}/archive")
    public AuditEntryResponse archive(
            @PathVariable String tenantId, @PathVariable long id, CustodiaSecurityContext security) {
        authorize(security, tenantId, Role.RECORDS_ADMIN);
        owned(tenantId, id);
        return AuditEntryResponse.from(auditTrail.archive(id));
    }

    /**
     * Retention sweep over the tenant's chain. Archives, never deletes.
     */
    @PostMapping("/archive-sweep")
    public ArchiveSweepResponse archiveSweep(
            @PathVariable String tenantId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant before,
            CustodiaSecurityContext security) {
        authorize(security, tenantId, Role.RECORDS_ADMIN);
        return new ArchiveSweepResponse(tenantId, before, auditTrail.archiveOlderThan(tenantId, before));
    }

    @GetMapping("/{id}/verification")
    public EntryVerificationResponse verify(
            @PathVariable String tenantId, @PathVariable long id, CustodiaSecurityContext security) {
        authorize(security, tenantId, Role.COMPLIANCE_REVIEWER);
        owned(tenantId, id);
        return EntryVerificationResponse.from(id, tenantId, auditTrail.verifyEntry(id));
    }

    private static void authorize(CustodiaSecurityContext security, String tenantId, Role role) {
        TenantIsolationEnforcer.enforce(security, tenantId);
        RoleChecker.require(security, role);
    }

    private AuditEntry owned(String tenantId, long id) {
        AuditEntry entry = auditTrail.get(id);
        if (!entry.tenantId().equals(tenantId)) {
            throw new AuditEntryNotFoundException(id);
        }
        return entry;
    }
}
