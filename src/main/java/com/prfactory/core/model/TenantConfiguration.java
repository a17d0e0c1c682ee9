package com.prfactory.core.model;

/**
 * Per-tenant switches that shape the implementation phase.
 *
 * @param autoImplementAfterPlanApproval run implementation once a plan is approved
 * @param enableAutoCodeReview           review the opened pull request automatically
 * @param maxCodeReviewIterations        fix iterations before completing with warnings
 * @param autoApproveIfNoIssues          post an approval comment on a clean review
 */
public record TenantConfiguration(
        boolean autoImplementAfterPlanApproval,
        boolean enableAutoCodeReview,
        int maxCodeReviewIterations,
        boolean autoApproveIfNoIssues
) {

    public static TenantConfiguration defaults() {
        return new TenantConfiguration(false, false, 3, false);
    }
}
