package com.edutrack.backend.config;

import com.edutrack.backend.core.tenant.TenantInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    // Every route that reads or writes school data; "/", "/test" and "/waitlist" stay open
    static final String[] TENANT_SCOPED_PATHS = {
        "/students/**",
        "/teachers/**",
        "/classes/**",
        "/parents/**",
        "/enrollments/**",
        "/progress/**",
        "/announcements/**",
        "/invoices/**",
        "/payments/**"
    };

    private final TenantInterceptor tenantInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(tenantInterceptor)
                .addPathPatterns(TENANT_SCOPED_PATHS);
    }
}
