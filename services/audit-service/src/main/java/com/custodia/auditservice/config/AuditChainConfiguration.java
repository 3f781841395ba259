package com.custodia.auditservice.config;

import com.custodia.auditchain.AsyncEscalationNotifier;
import com.custodia.auditchain.AuditStore;
import com.custodia.auditchain.AuditTrail;
import com.custodia.auditchain.EscalationNotifier;
import com.custodia.auditchain.InMemoryAuditStore;
import com.custodia.auditchain.InMemorySequenceReferenceGenerator;
import com.custodia.auditchain.LoggingEscalationNotifier;
import com.custodia.auditchain.SequenceReferenceGenerator;
import com.custodia.database.JdbcAuditStore;
import com.custodia.database.JdbcSequenceReferenceGenerator;
import com.custodia.database.migration.AuditSchemaMigrator;
import com.custodia.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Wires the {@link AuditTrail} and its collaborators from {@link AuditServiceProperties}.
 *
 * <p>The store is selected by {@code custodia.audit.storage}; both variants enforce
 * immutability.
 */
@Configuration(proxyBeanMethods = false)
public class AuditChainConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AuditChainConfiguration.class);

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService escalationExecutor(AuditServiceProperties properties) {
        return Executors.newFixedThreadPool(
                properties.escalationThreads(), new CustomizableThreadFactory("audit-escalation-"));
    }

    @Bean
    public EscalationNotifier escalationNotifier(ExecutorService escalationExecutor) {
        return new AsyncEscalationNotifier(new LoggingEscalationNotifier(), escalationExecutor);
    }

    @Bean
    public AuditTrail auditTrail(
            AuditStore store,
            SequenceReferenceGenerator sequenceReferences,
            EscalationNotifier escalationNotifier,
            MetricFactory metricFactory,
            AuditServiceProperties properties) {
        log.info("Audit trail on {} storage (clock skew tolerance {}, lock timeout {})",
                properties.storage(), properties.clockSkewTolerance(), properties.lockTimeout());
        return AuditTrail.builder(store)
                .clockSkewTolerance(properties.clockSkewTolerance())
                .lockTimeout(properties.lockTimeout())
                .sequenceReferences(sequenceReferences)
                .escalationNotifier(escalationNotifier)
                .metrics(metricFactory)
                .build();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "custodia.audit", name = "storage", havingValue = "memory", matchIfMissing = true)
    static class MemoryStorage {

        @Bean
        public AuditStore auditStore() {
            log.warn("Audit entries are held in memory and are lost on restart");
            return new InMemoryAuditStore();
        }

        @Bean
        public SequenceReferenceGenerator sequenceReferenceGenerator() {
            return new InMemorySequenceReferenceGenerator();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "custodia.audit", name = "storage", havingValue = "jdbc")
    static class JdbcStorage {

        @Bean
        public DataSource auditDataSource(AuditServiceProperties properties) {
            var datasource = properties.datasource();
            return DataSourceBuilder.create()
                    .url(datasource.url())
                    .username(datasource.username())
                    .password(datasource.password())
                    .build();
        }

        @Bean
        public AuditSchemaMigrator auditSchemaMigrator(DataSource auditDataSource) {
            var migrator = new AuditSchemaMigrator(auditDataSource);
            migrator.migrate();
            return migrator;
        }

        @Bean
        public AuditStore auditStore(DataSource auditDataSource, AuditSchemaMigrator auditSchemaMigrator) {
            return new JdbcAuditStore(auditDataSource);
        }

        @Bean
        public SequenceReferenceGenerator sequenceReferenceGenerator(
                DataSource auditDataSource, AuditSchemaMigrator auditSchemaMigrator) {
            return new JdbcSequenceReferenceGenerator(auditDataSource);
        }
    }
}
