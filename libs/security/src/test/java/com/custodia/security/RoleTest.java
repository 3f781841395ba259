package com.custodia.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Role")
class RoleTest {

    @Nested
    @DisplayName("hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("RECORDS_ADMIN implies every other role")
        void adminImpliesAll() {
            assertThat(Role.RECORDS_ADMIN.impliedRoles())
                    .containsExactlyInAnyOrder(Role.COMPLIANCE_REVIEWER, Role.RECORDS_CLERK);
        }

        @Test
        @DisplayName("COMPLIANCE_REVIEWER implies RECORDS_CLERK only")
        void reviewerImpliesClerk() {
            assertThat(Role.COMPLIANCE_REVIEWER.implies(Role.RECORDS_CLERK)).isTrue();
            assertThat(Role.COMPLIANCE_REVIEWER.implies(Role.RECORDS_ADMIN)).isFalse();
        }

        @Test
        @DisplayName("RECORDS_CLERK implies nothing but itself")
        void clerkImpliesItself() {
            assertThat(Role.RECORDS_CLERK.impliedRoles()).isEmpty();
            assertThat(Role.RECORDS_CLERK.implies(Role.RECORDS_CLERK)).isTrue();
            assertThat(Role.RECORDS_CLERK.implies(Role.COMPLIANCE_REVIEWER)).isFalse();
        }
    }

    @Nested
    @DisplayName("fromString()")
    class FromString {

        @ParameterizedTest
        @ValueSource(strings = {"ROLE_RECORDS_ADMIN", "RECORDS_ADMIN", "records_admin", " role_records_admin "})
        @DisplayName("accepts canonical and bare names in any case")
        void acceptsVariants(String value) {
            assertThat(Role.fromString(value)).contains(Role.RECORDS_ADMIN);
        }

        @Test
        @DisplayName("returns empty for unknown or null values")
        void unknownValue() {
            assertThat(Role.fromString("AUDITOR")).isEmpty();
            assertThat(Role.fromString(null)).isEmpty();
        }
    }

    @Test
    @DisplayName("value() carries the ROLE_ prefix")
    void valueHasPrefix() {
        assertThat(Role.COMPLIANCE_REVIEWER.value()).isEqualTo("ROLE_COMPLIANCE_REVIEWER");
    }
}
