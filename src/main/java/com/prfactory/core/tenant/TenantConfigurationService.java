package com.prfactory.core.tenant;

import com.prfactory.core.model.TenantConfiguration;

/**
 * Resolves the settings that apply to a tenant.
 */
public interface TenantConfigurationService {

    /**
     * @param tenantId tenant carried by the workflow's messages, may be {@code null}
     * @return the tenant's settings, or the defaults for an unknown or missing tenant
     */
    TenantConfiguration getConfiguration(String tenantId);
}
