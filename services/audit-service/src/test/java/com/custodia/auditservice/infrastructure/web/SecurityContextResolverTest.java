package com.custodia.auditservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.custodia.observability.CorrelationContext;
import com.custodia.observability.CorrelationContextHolder;
import com.custodia.security.CustodiaSecurityContext;
import com.custodia.security.Role;
import com.custodia.security.SecurityContextException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SecurityContextResolver")
class SecurityContextResolverTest {

    private final SecurityContextResolver resolver = new SecurityContextResolver();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("parses canonical and bare role names")
    void parsesRoles() {
        CustodiaSecurityContext ctx = resolver.resolve(
                "clerk-1", "company-1", "ROLE_RECORDS_CLERK, compliance_reviewer");

        assertThat(ctx.actorId()).isEqualTo("clerk-1");
        assertThat(ctx.tenantId()).isEqualTo("company-1");
        assertThat(ctx.roles()).containsExactly(Role.RECORDS_CLERK, Role.COMPLIANCE_REVIEWER);
    }

    @Test
    @DisplayName("binds tenant and actor into the correlation context")
    void bindsPrincipal() {
        CorrelationContextHolder.set(new CorrelationContext("corr-1", null, null, null));

        CustodiaSecurityContext ctx = resolver.resolve("clerk-1", "company-1", "RECORDS_CLERK");

        assertThat(ctx.correlationId()).isEqualTo("corr-1");
        assertThat(CorrelationContextHolder.currentActorId()).contains("clerk-1");
        assertThat(CorrelationContextHolder.get().orElseThrow().tenantId()).isEqualTo("company-1");
    }

    @Test
    @DisplayName("reports every missing header at once")
    void missingHeaders() {
        assertThatThrownBy(() -> resolver.resolve(null, " ", null))
                .isInstanceOfSatisfying(SecurityContextException.class,
                        e -> assertThat(e.errors()).hasSize(3));
    }

    @Test
    @DisplayName("rejects unknown roles")
    void unknownRole() {
        assertThatThrownBy(() -> resolver.resolve("clerk-1", "company-1", "RECORDS_CLERK,SUPERUSER"))
                .isInstanceOf(SecurityContextException.class)
                .hasMessageContaining("SUPERUSER");
    }
}
