package com.edutrack.backend.exception;

public class MissingTenantException extends ValidationException {

    public MissingTenantException() {
        super("Missing tenant id: send the x-tenant-id header or the tenant_id query parameter");
    }
}
