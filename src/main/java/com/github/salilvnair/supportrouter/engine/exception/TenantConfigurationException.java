package com.github.salilvnair.supportrouter.engine.exception;

/**
 * Raised while loading a tenant when its configuration fails validation.
 */
public class TenantConfigurationException extends SupportRouterException {

    public TenantConfigurationException(SupportRouterErrorCode code) {
        super(code);
    }

    public TenantConfigurationException(SupportRouterErrorCode code, String message) {
        super(code, message);
    }

    public TenantConfigurationException(SupportRouterErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
