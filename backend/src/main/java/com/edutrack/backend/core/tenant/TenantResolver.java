package com.edutrack.backend.core.tenant;

import com.edutrack.backend.exception.MissingTenantException;
import org.springframework.stereotype.Component;

/**
 * Picks the tenant identifier for a request out of the {@value #TENANT_HEADER} header or the
 * {@value #TENANT_QUERY_PARAM} query parameter. The header wins when both are present.
 *
 * <p>The value is trusted as-is. Verifying that the caller belongs to the tenant is the job of an
 * identity layer placed in front of this one.
 */
@Component
public class TenantResolver {

    public static final String TENANT_HEADER = "x-tenant-id";
    public static final String TENANT_QUERY_PARAM = "tenant_id";

    public String resolve(String headerValue, String queryValue) {
        if (hasText(headerValue)) {
            return headerValue.trim();
        }
        if (hasText(queryValue)) {
            return queryValue.trim();
        }
        throw new MissingTenantException();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
