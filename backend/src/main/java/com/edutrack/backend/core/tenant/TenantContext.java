package com.edutrack.backend.core.tenant;

import com.edutrack.backend.exception.MissingTenantException;

/**
 * ThreadLocal holder for the tenant of the current request.
 * Pattern: setTenant() + getCurrentTenant() + clear()
 */
public final class TenantContext {

    private static final ThreadLocal<String> currentTenant = new ThreadLocal<>();

    /**
     * Sets the tenant for the current thread (called by {@link TenantInterceptor}).
     */
    public static void setTenant(String tenantId) {
        currentTenant.set(tenantId);
    }

    /**
     * Returns the tenant of the current thread, or null when none was resolved.
     */
    public static String getCurrentTenant() {
        return currentTenant.get();
    }

    /**
     * Returns the tenant of the current thread, failing closed when none was resolved.
     */
    public static String requireCurrentTenant() {
        String tenantId = currentTenant.get();
        if (tenantId == null) {
            throw new MissingTenantException();
        }
        return tenantId;
    }

    /**
     * Clears the tenant of the current thread. Must run after every request.
     */
    public static void clear() {
        currentTenant.remove();
    }

    private TenantContext() {
        throw new UnsupportedOperationException("Utility class");
    }
}
