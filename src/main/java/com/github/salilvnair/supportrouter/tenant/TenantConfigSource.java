package com.github.salilvnair.supportrouter.tenant;

import com.github.salilvnair.supportrouter.tenant.config.TenantConfig;

import java.util.Optional;

/**
 * Loads raw tenant configuration from wherever it is kept.
 */
public interface TenantConfigSource {

    /**
     * @return empty when the tenant is unknown
     * @throws com.github.salilvnair.supportrouter.engine.exception.TenantConfigurationException
     *         when the tenant exists but its configuration cannot be read
     */
    Optional<TenantConfig> load(String tenantId);
}
