package com.custodia.auditservice.infrastructure.web;

import com.custodia.auditchain.AuditEntryNotFoundException;
import com.custodia.auditchain.AuditValidationException;
import com.custodia.auditchain.ChainBusyException;
import com.custodia.auditchain.ChainConflictException;
import com.custodia.auditchain.ImmutableRecordException;
import com.custodia.auditchain.InvalidTransitionException;
import com.custodia.observability.CorrelationContextHolder;
import com.custodia.security.AccessDeniedException;
import com.custodia.security.SecurityContextException;
import com.custodia.security.TenantMismatchException;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://custodia.io/errors/immutable-record",
 *   "title": "Immutable Record",
 *   "status": 409,
 *   "detail": "Audit entry 17 is immutable; attempted to change [description]",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Every response carries the correlation ID so a caller can point support at the log lines of
 * the failed request.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String TYPE_PREFIX = "https://custodia.io/errors/";

    @ExceptionHandler(AuditValidationException.class)
    public ProblemDetail handleAuditValidation(AuditValidationException ex) {
        log.warn("Audit entry rejected: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation",
                String.join("; ", ex.errors()));
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        List<String> errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation",
                errors.isEmpty() ? "Validation failed" : String.join("; ", errors));
        problem.setProperty("errors", errors);
        return problem;
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(SecurityContextException.class)
    public ProblemDetail handleMissingIdentity(SecurityContextException ex) {
        log.warn("Rejected request without usable identity: {}", ex.errors());
        ProblemDetail problem = problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", ex.getMessage());
        problem.setProperty("errors", ex.errors());
        return problem;
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDenied(AccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", ex.getMessage());
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ProblemDetail handleTenantMismatch(TenantMismatchException ex) {
        log.warn("Cross-tenant access attempt: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "tenant-mismatch", ex.getMessage());
    }

    @ExceptionHandler(AuditEntryNotFoundException.class)
    public ProblemDetail handleNotFound(AuditEntryNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(ImmutableRecordException.class)
    public ProblemDetail handleImmutable(ImmutableRecordException ex) {
        log.warn("Blocked modification of audit entries {}: {}", ex.entryIds(), ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "Immutable Record", "immutable-record", ex.getMessage());
        problem.setProperty("entryIds", ex.entryIds());
        return problem;
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ProblemDetail handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Invalid lifecycle transition: {}", ex.getMessage());
        ProblemDetail problem =
                problem(HttpStatus.CONFLICT, "Invalid Transition", "invalid-transition", ex.getMessage());
        problem.setProperty("from", ex.from().value());
        problem.setProperty("to", ex.to().value());
        return problem;
    }

    @ExceptionHandler(ChainConflictException.class)
    public ProblemDetail handleConflict(ChainConflictException ex) {
        log.warn("Chain conflict for tenant {}: {}", ex.tenantId(), ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Chain Conflict", "chain-conflict", ex.getMessage());
    }

    @ExceptionHandler(ChainBusyException.class)
    public ProblemDetail handleBusy(ChainBusyException ex) {
        log.warn("Chain busy for tenant {}: {}", ex.tenantId(), ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Chain Busy", "chain-busy", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_PREFIX + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
