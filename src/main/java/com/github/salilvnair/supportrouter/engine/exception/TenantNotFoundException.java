package com.github.salilvnair.supportrouter.engine.exception;

import lombok.Getter;

@Getter
public class TenantNotFoundException extends SupportRouterException {

    private final String tenantId;

    public TenantNotFoundException(String tenantId) {
        super(SupportRouterErrorCode.TENANT_NOT_FOUND, "Unknown tenant: " + tenantId);
        this.tenantId = tenantId;
    }

    /** The tenant exists in its source but its configuration cannot be compiled. */
    public TenantNotFoundException(String tenantId, TenantConfigurationException cause) {
        super(SupportRouterErrorCode.TENANT_NOT_FOUND,
                "Tenant has no usable configuration: " + tenantId + " (" + cause.getErrorCode() + ")", cause);
        this.tenantId = tenantId;
    }
}
