package com.prfactory.core.tenant;

import com.prfactory.core.model.TenantConfiguration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Tenant settings: defaults plus per-tenant overrides keyed by tenant id.
 */
@Component
@ConfigurationProperties(prefix = "prfactory.tenant")
public class TenantProperties {

    private Settings defaults = new Settings();

    private Map<String, Settings> overrides = new HashMap<>();

    public Settings getDefaults() { return defaults; }
    public void setDefaults(Settings defaults) { this.defaults = defaults; }

    public Map<String, Settings> getOverrides() { return overrides; }
    public void setOverrides(Map<String, Settings> overrides) { this.overrides = overrides; }

    public static class Settings {
        private boolean autoImplementAfterPlanApproval = false;
        private boolean enableAutoCodeReview = false;
        private int maxCodeReviewIterations = 3;
        private boolean autoApproveIfNoIssues = false;

        public boolean isAutoImplementAfterPlanApproval() { return autoImplementAfterPlanApproval; }
        public void setAutoImplementAfterPlanApproval(boolean v) { this.autoImplementAfterPlanApproval = v; }

        public boolean isEnableAutoCodeReview() { return enableAutoCodeReview; }
        public void setEnableAutoCodeReview(boolean v) { this.enableAutoCodeReview = v; }

        public int getMaxCodeReviewIterations() { return maxCodeReviewIterations; }
        public void setMaxCodeReviewIterations(int v) { this.maxCodeReviewIterations = v; }

        public boolean isAutoApproveIfNoIssues() { return autoApproveIfNoIssues; }
        public void setAutoApproveIfNoIssues(boolean v) { this.autoApproveIfNoIssues = v; }

        public TenantConfiguration toConfiguration() {
            return new TenantConfiguration(autoImplementAfterPlanApproval, enableAutoCodeReview,
                    maxCodeReviewIterations, autoApproveIfNoIssues);
        }
    }
}
