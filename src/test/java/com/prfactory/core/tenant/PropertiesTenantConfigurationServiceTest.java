package com.prfactory.core.tenant;

import com.prfactory.core.model.TenantConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PropertiesTenantConfigurationServiceTest {

    private TenantProperties properties;
    private PropertiesTenantConfigurationService service;

    @BeforeEach
    void setUp() {
        properties = new TenantProperties();
        var acme = new TenantProperties.Settings();
        acme.setAutoImplementAfterPlanApproval(true);
        acme.setEnableAutoCodeReview(true);
        acme.setMaxCodeReviewIterations(5);
        properties.getOverrides().put("acme", acme);
        service = new PropertiesTenantConfigurationService(properties);
    }

    @Test
    @DisplayName("unknown tenants get the defaults")
    void defaultsForUnknownTenant() {
        assertEquals(TenantConfiguration.defaults(), service.getConfiguration("initech"));
    }

    @Test
    @DisplayName("a missing tenant id gets the defaults")
    void defaultsForMissingTenant() {
        assertEquals(TenantConfiguration.defaults(), service.getConfiguration(null));
        assertEquals(TenantConfiguration.defaults(), service.getConfiguration(" "));
    }

    @Test
    @DisplayName("a tenant with overrides gets its own settings")
    void overrideForTenant() {
        TenantConfiguration config = service.getConfiguration("acme");

        assertTrue(config.autoImplementAfterPlanApproval());
        assertTrue(config.enableAutoCodeReview());
        assertEquals(5, config.maxCodeReviewIterations());
        assertFalse(config.autoApproveIfNoIssues());
    }

    @Test
    @DisplayName("tenants without overrides get the configured defaults")
    void tenantWithoutOverride() {
        properties.getDefaults().setMaxCodeReviewIterations(7);

        assertEquals(7, service.getConfiguration("globex").maxCodeReviewIterations());
    }

    @Test
    @DisplayName("a fresh service resolves the same settings")
    void noPerTicketState() {
        var restarted = new PropertiesTenantConfigurationService(properties);

        assertEquals(service.getConfiguration("acme"), restarted.getConfiguration("acme"));
    }
}
