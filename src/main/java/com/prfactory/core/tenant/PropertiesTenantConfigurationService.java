package com.prfactory.core.tenant;

import com.prfactory.core.model.TenantConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link TenantConfigurationService} backed by {@link TenantProperties}.
 * <p>
 * Holds no per-ticket state. The tenant id travels with the workflow's completion
 * events and graph checkpoints, so lookups give the same answer after a restart.
 */
@Service
public class PropertiesTenantConfigurationService implements TenantConfigurationService {

    private static final Logger log = LoggerFactory.getLogger(PropertiesTenantConfigurationService.class);

    private final TenantProperties properties;

    public PropertiesTenantConfigurationService(TenantProperties properties) {
        this.properties = properties;
    }

    @Override
    public TenantConfiguration getConfiguration(String tenantId) {
        if (tenantId != null && !tenantId.isBlank()) {
            TenantProperties.Settings override = properties.getOverrides().get(tenantId);
            if (override != null) {
                return override.toConfiguration();
            }
        }
        log.debug("Using default tenant settings for tenant {}", tenantId);
        return properties.getDefaults().toConfiguration();
    }
}
