package com.custodia.auditservice.config;

import com.custodia.auditservice.infrastructure.web.SecurityContextResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: lets controllers declare a
 * {@link com.custodia.security.CustodiaSecurityContext} parameter.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final SecurityContextResolver securityContextResolver;

    public WebConfig(SecurityContextResolver securityContextResolver) {
        this.securityContextResolver = securityContextResolver;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(securityContextResolver);
    }
}
