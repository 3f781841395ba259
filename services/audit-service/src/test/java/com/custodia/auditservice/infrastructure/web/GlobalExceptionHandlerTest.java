package com.custodia.auditservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.custodia.auditchain.AuditEntryNotFoundException;
import com.custodia.auditchain.AuditValidationException;
import com.custodia.auditchain.ChainBusyException;
import com.custodia.auditchain.ChainConflictException;
import com.custodia.auditchain.ImmutableRecordException;
import com.custodia.auditchain.InvalidTransitionException;
import com.custodia.auditchain.LifecycleState;
import com.custodia.observability.CorrelationContext;
import com.custodia.observability.CorrelationContextHolder;
import com.custodia.security.AccessDeniedException;
import com.custodia.security.Role;
import com.custodia.security.SecurityContextException;
import com.custodia.security.TenantMismatchException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ProblemDetail;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps audit validation errors to 400 with every error listed")
    void validation() {
        ProblemDetail result = handler.handleAuditValidation(
                new AuditValidationException(List.of(
                        "description must not be null or blank", "tenantId must not be null or blank")));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat((List<?>) result.getProperties().get("errors")).hasSize(2);
    }

    @Test
    @DisplayName("maps a missing identity to 401")
    void missingIdentity() {
        ProblemDetail result = handler.handleMissingIdentity(
                new SecurityContextException(List.of("roles must contain at least one role")));

        assertThat(result.getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("maps access denied and tenant mismatch to 403")
    void forbidden() {
        assertThat(handler.handleAccessDenied(new AccessDeniedException("clerk-1", Role.RECORDS_ADMIN)).getStatus())
                .isEqualTo(403);
        assertThat(handler.handleTenantMismatch(new TenantMismatchException("a", "b")).getStatus())
                .isEqualTo(403);
    }

    @Test
    @DisplayName("maps a missing entry to 404")
    void notFound() {
        assertThat(handler.handleNotFound(new AuditEntryNotFoundException(42)).getStatus()).isEqualTo(404);
    }

    @Test
    @DisplayName("maps immutability, transition and chain conflicts to 409")
    void conflicts() {
        ProblemDetail immutable = handler.handleImmutable(
                ImmutableRecordException.forUpdate(7L, List.of("description")));
        ProblemDetail transition = handler.handleInvalidTransition(
                new InvalidTransitionException(7, LifecycleState.ARCHIVED, LifecycleState.FLAGGED));
        ProblemDetail conflict = handler.handleConflict(
                ChainConflictException.staleEntry("company-1", 7));

        assertThat(immutable.getStatus()).isEqualTo(409);
        assertThat(immutable.getProperties()).containsEntry("entryIds", List.of(7L));
        assertThat(transition.getStatus()).isEqualTo(409);
        assertThat(transition.getProperties()).containsEntry("from", "archived").containsEntry("to", "flagged");
        assertThat(conflict.getStatus()).isEqualTo(409);
    }

    @Test
    @DisplayName("maps a busy chain to 503")
    void busy() {
        assertThat(handler.handleBusy(new ChainBusyException("company-1", Duration.ofSeconds(5))).getStatus())
                .isEqualTo(503);
    }

    @Test
    @DisplayName("maps anything else to 500 without leaking the message")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("connection string with password"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getDetail()).doesNotContain("password");
    }

    @Test
    @DisplayName("every response carries timestamp and correlation id")
    void correlation() {
        CorrelationContextHolder.set(new CorrelationContext("corr-9", null, null, null));

        ProblemDetail result = handler.handleNotFound(new AuditEntryNotFoundException(1));

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("correlationId", "corr-9");
    }
}
