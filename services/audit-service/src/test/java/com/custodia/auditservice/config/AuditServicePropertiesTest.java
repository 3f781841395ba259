package com.custodia.auditservice.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.custodia.auditservice.config.AuditServiceProperties.Datasource;
import com.custodia.auditservice.config.AuditServiceProperties.Storage;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Service configuration properties")
class AuditServicePropertiesTest {

    @Nested
    @DisplayName("AuditServiceProperties")
    class Audit {

        @Test
        @DisplayName("applies defaults for missing values")
        void defaults() {
            var props = new AuditServiceProperties(null, null, null, 0, null);

            assertThat(props.clockSkewTolerance()).isEqualTo(Duration.ofMinutes(5));
            assertThat(props.lockTimeout()).isEqualTo(Duration.ofSeconds(5));
            assertThat(props.storage()).isEqualTo(Storage.MEMORY);
            assertThat(props.escalationThreads()).isEqualTo(2);
            assertThat(props.isDatasourceConfigured()).isTrue();
        }

        @Test
        @DisplayName("keeps explicit values")
        void explicitValues() {
            var props = new AuditServiceProperties(
                    Duration.ofSeconds(30), Duration.ofMillis(250), Storage.JDBC, 4,
                    new Datasource("jdbc:postgresql://db/custodia", "u", "p"));

            assertThat(props.clockSkewTolerance()).isEqualTo(Duration.ofSeconds(30));
            assertThat(props.lockTimeout()).isEqualTo(Duration.ofMillis(250));
            assertThat(props.escalationThreads()).isEqualTo(4);
            assertThat(props.isDatasourceConfigured()).isTrue();
        }

        @Test
        @DisplayName("jdbc storage without a url is not configured")
        void jdbcNeedsUrl() {
            var props = new AuditServiceProperties(null, null, Storage.JDBC, 1, new Datasource(" ", null, null));

            assertThat(props.isDatasourceConfigured()).isFalse();
        }

        @Test
        @DisplayName("rejects non-positive lock timeout and negative tolerance")
        void rejectsBadDurations() {
            assertThatThrownBy(() -> new AuditServiceProperties(null, Duration.ZERO, null, 1, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("lockTimeout");
            assertThatThrownBy(() -> new AuditServiceProperties(Duration.ofSeconds(-1), null, null, 1, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("clockSkewTolerance");
        }
    }

    @Nested
    @DisplayName("ServiceProperties")
    class Service {

        @Test
        @DisplayName("defaults environment to 'development' when blank")
        void defaultsEnvironment() {
            assertThat(new ServiceProperties("audit-service", null, null).environment()).isEqualTo("development");
            assertThat(new ServiceProperties("audit-service", " ", null).environment()).isEqualTo("development");
        }

        @Test
        @DisplayName("keeps an explicit environment")
        void keepsEnvironment() {
            var props = new ServiceProperties("audit-service", "production", "Audit trail");

            assertThat(props.environment()).isEqualTo("production");
            assertThat(props.description()).isEqualTo("Audit trail");
        }
    }
}
