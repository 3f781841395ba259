package com.custodia.auditservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service, bound from {@code custodia.service.*}.
 *
 * <pre>
 * custodia:
 *   service:
 *     name: audit-service
 *     environment: production
 *     description: Tamper-evident audit trail
 * </pre>
 *
 * @param name service name, used as the {@code service} tag on every meter. Required.
 * @param environment deployment environment (development, staging, production).
 * @param description human-readable description.
 */
@ConfigurationProperties(prefix = "custodia.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
