package com.custodia.auditservice.api;

import com.custodia.auditchain.AuditTrail;
import com.custodia.auditservice.api.dto.SummaryResponse;
import com.custodia.auditservice.api.dto.VerificationResponse;
import com.custodia.security.CustodiaSecurityContext;
import com.custodia.security.Role;
import com.custodia.security.RoleChecker;
import com.custodia.security.TenantIsolationEnforcer;
import java.time.Instant;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Whole-chain views for compliance reviewers: integrity verification and period summaries.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}")
public class AuditChainController {

    private final AuditTrail auditTrail;

    public AuditChainController(AuditTrail auditTrail) {
        this.auditTrail = auditTrail;
    }

    @GetMapping("/audit-chain/verification")
    public VerificationResponse verify(@PathVariable String tenantId, CustodiaSecurityContext security) {
        authorize(security, tenantId);
        return VerificationResponse.from(auditTrail.inspect(tenantId));
    }

    /**
     * Totals over {@code [from, to)}; either bound may be omitted.
     */
    @GetMapping("/audit-summary")
    public SummaryResponse summary(
            @PathVariable String tenantId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            CustodiaSecurityContext security) {
        authorize(security, tenantId);
        return SummaryResponse.from(auditTrail.summarize(tenantId, from, to));
    }

    private static void authorize(CustodiaSecurityContext security, String tenantId) {
        TenantIsolationEnforcer.enforce(security, tenantId);
        RoleChecker.require(security, Role.COMPLIANCE_REVIEWER);
    }
}
