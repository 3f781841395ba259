package com.custodia.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CorrelationContext")
class CorrelationContextTest {

    @Test
    @DisplayName("should allow nullable tenant, actor and request ids")
    void shouldAllowNullOptionalFields() {
        var ctx = new CorrelationContext("corr-001", null, null, null);

        assertThat(ctx.correlationId()).isEqualTo("corr-001");
        assertThat(ctx.tenantId()).isNull();
        assertThat(ctx.actorId()).isNull();
    }

    @Test
    @DisplayName("should reject null or blank correlationId")
    void shouldRejectMissingCorrelationId() {
        assertThatThrownBy(() -> new CorrelationContext(null, "company-1", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
        assertThatThrownBy(() -> new CorrelationContext("  ", "company-1", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("withPrincipal keeps correlation and request ids")
    void withPrincipalKeepsIds() {
        var ctx = new CorrelationContext("corr-001", null, null, "req-9");

        var bound = ctx.withPrincipal("company-1", "clerk-3");

        assertThat(bound.correlationId()).isEqualTo("corr-001");
        assertThat(bound.requestId()).isEqualTo("req-9");
        assertThat(bound.tenantId()).isEqualTo("company-1");
        assertThat(bound.actorId()).isEqualTo("clerk-3");
        assertThat(ctx.tenantId()).isNull();
    }
}
