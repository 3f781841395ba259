package com.custodia.auditservice;

import com.custodia.auditservice.config.AuditServiceProperties;
import com.custodia.auditservice.config.ServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Audit service: exposes tenant audit chains over HTTP.
 *
 * <p>The audit store's DataSource and schema are owned by {@link
 * com.custodia.auditservice.config.AuditChainConfiguration}, so Boot's own DataSource and Flyway
 * auto-configuration stay off. With {@code custodia.audit.storage=memory} (the default) no
 * database is needed at all.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@EnableConfigurationProperties({ServiceProperties.class, AuditServiceProperties.class})
public class AuditServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuditServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuditServiceApplication.class, args);
        log.info("Custodia audit service started");
    }
}
