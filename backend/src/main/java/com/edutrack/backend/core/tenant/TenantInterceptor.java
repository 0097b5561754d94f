package com.edutrack.backend.core.tenant;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
@RequiredArgsConstructor
public class TenantInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(TenantInterceptor.class);
    public static final String MDC_TENANT_KEY = "tenant";

    private final TenantResolver tenantResolver;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String tenantId;
        try {
            tenantId = tenantResolver.resolve(
                    request.getHeader(TenantResolver.TENANT_HEADER),
                    request.getParameter(TenantResolver.TENANT_QUERY_PARAM));
        } catch (RuntimeException e) {
            logger.warn("Rejected {} {}: no tenant supplied", request.getMethod(), request.getRequestURI());
            throw e;
        }

        TenantContext.setTenant(tenantId);
        MDC.put(MDC_TENANT_KEY, tenantId);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        // Tomcat reuses threads; the tenant must not leak into the next request
        TenantContext.clear();
        MDC.remove(MDC_TENANT_KEY);
    }
}
