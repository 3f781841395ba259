package com.custodia.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.custodia.security.testing.TestSecurityContextFactory;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TenantIsolationEnforcer")
class TenantIsolationEnforcerTest {

    @Test
    @DisplayName("passes when tenants match")
    void tenantsMatch() {
        var ctx = TestSecurityContextFactory.createForTenant("company-1");
        assertThatCode(() -> TenantIsolationEnforcer.enforce(ctx, "company-1"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("throws TenantMismatchException carrying both tenant ids")
    void tenantsMismatch() {
        var ctx = TestSecurityContextFactory.createForTenant("company-1");

        assertThatThrownBy(() -> TenantIsolationEnforcer.enforce(ctx, "company-2"))
                .isInstanceOfSatisfying(TenantMismatchException.class, e -> {
                    assertThat(e.expectedTenantId()).isEqualTo("company-1");
                    assertThat(e.actualTenantId()).isEqualTo("company-2");
                });
    }

    @Test
    @DisplayName("a context without tenant never matches")
    void missingTenant() {
        var ctx = new CustodiaSecurityContext(
                new AuthenticatedActor("a-1", null), null, List.of(Role.RECORDS_CLERK), "corr-1");

        assertThatThrownBy(() -> TenantIsolationEnforcer.enforce(ctx, "company-1"))
                .isInstanceOf(TenantMismatchException.class);
    }
}
