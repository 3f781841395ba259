package com.custodia.auditservice.infrastructure.web;

import com.custodia.observability.CorrelationContext;
import com.custodia.observability.CorrelationContextHolder;
import com.custodia.security.AuthenticatedActor;
import com.custodia.security.CustodiaSecurityContext;
import com.custodia.security.Role;
import com.custodia.security.SecurityContextException;
import com.custodia.security.SecurityContextValidator;
import com.custodia.security.TenantContext;
import java.util.ArrayList;
import java.util.List;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds a {@link CustodiaSecurityContext} for controller parameters of that type from the
 * identity headers set by the gateway.
 *
 * <ul>
 *   <li>{@code X-Actor-ID}: acting principal
 *   <li>{@code X-Tenant-ID}: tenant of the caller
 *   <li>{@code X-Roles}: comma-separated roles, canonical ({@code ROLE_RECORDS_CLERK}) or bare
 *       ({@code records_clerk})
 * </ul>
 *
 * <p>A missing or unusable identity fails with {@link SecurityContextException}. On success the
 * tenant and actor are bound into the current {@link CorrelationContext}.
 */
@Component
public class SecurityContextResolver implements HandlerMethodArgumentResolver {

    public static final String ACTOR_HEADER = "X-Actor-ID";
    public static final String TENANT_HEADER = "X-Tenant-ID";
    public static final String ROLES_HEADER = "X-Roles";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CustodiaSecurityContext.class.equals(parameter.getParameterType());
    }

    @Override
    public CustodiaSecurityContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        return resolve(
                webRequest.getHeader(ACTOR_HEADER),
                webRequest.getHeader(TENANT_HEADER),
                webRequest.getHeader(ROLES_HEADER));
    }

    CustodiaSecurityContext resolve(String actorId, String tenantId, String rolesHeader) {
        var roles = new ArrayList<Role>();
        var unknown = new ArrayList<String>();
        if (rolesHeader != null) {
            for (String token : rolesHeader.split(",")) {
                if (token.isBlank()) {
                    continue;
                }
                Role.fromString(token).ifPresentOrElse(roles::add, () -> unknown.add(token.trim()));
            }
        }
        if (!unknown.isEmpty()) {
            throw new SecurityContextException(List.of("unknown roles: " + String.join(", ", unknown)));
        }

        String correlationId = CorrelationContextHolder.get()
                .map(CorrelationContext::correlationId)
                .orElse(null);
        var context = SecurityContextValidator.requireValid(new CustodiaSecurityContext(
                actorId == null ? null : new AuthenticatedActor(actorId.trim(), null),
                tenantId == null ? null : new TenantContext(tenantId.trim(), null),
                roles,
                correlationId));

        CorrelationContextHolder.get().ifPresent(current ->
                CorrelationContextHolder.set(current.withPrincipal(context.tenantId(), context.actorId())));
        return context;
    }
}
