package com.custodia.auditservice.api.dto;

import com.custodia.auditchain.ChainVerificationReport;
import com.custodia.auditchain.ChainViolation;
import java.time.Instant;
import java.util.List;

/**
 * Result of {@code GET /audit-chain/verification}.
 */
public record VerificationResponse(
        String tenantId,
        boolean intact,
        long entriesChecked,
        String headHash,
        Instant verifiedAt,
        List<Violation> violations) {

    public record Violation(long entryId, String kind, String message) {

        static Violation from(ChainViolation violation) {
            return new Violation(violation.entryId(), violation.kind(), violation.message());
        }
    }

    public static VerificationResponse from(ChainVerificationReport report) {
        return new VerificationResponse(
                report.tenantId(),
                report.intact(),
                report.entriesChecked(),
                report.headHash(),
                report.verifiedAt(),
                report.violations().stream().map(Violation::from).toList());
    }
}
