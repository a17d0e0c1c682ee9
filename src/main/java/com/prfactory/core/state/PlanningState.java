package com.prfactory.core.state;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checkpoint state of the planning graph.
 */
public class PlanningState extends GraphState {

    public static final String PLAN_ARTIFACTS = "plan_artifacts";
    public static final String PLAN_ID = "plan_id";
    public static final String PLAN_VERSION = "plan_version";
    public static final String BRANCH_NAME = "branch_name";
    public static final String GIT_COMMIT_SHA = "git_commit_sha";
    public static final String ISSUE_TRACKER_POSTED = "issue_tracker_posted";
    public static final String PLAN_RETRY_COUNT = "plan_retry_count";
    public static final String REVISION_FEEDBACK = "revision_feedback";
    public static final String REFINEMENT_INSTRUCTIONS = "refinement_instructions";
    public static final String REGENERATE_COMPLETELY = "regenerate_completely";
    public static final String AFFECTED_ARTIFACTS = "affected_artifacts";
    public static final String APPROVED_BY = "approved_by";
    public static final String APPROVED_AT = "approved_at";

    public PlanningState(Map<String, Object> initData) {
        super(initData);
    }

    public int planRetryCount() {
        return count(PLAN_RETRY_COUNT);
    }

    @SuppressWarnings("unchecked")
    public Map<String, String> planArtifacts() {
        return this.<Object>value(PLAN_ARTIFACTS)
                .map(v -> v instanceof Map<?, ?> m ? new LinkedHashMap<>((Map<String, String>) m) : new LinkedHashMap<String, String>())
                .orElseGet(LinkedHashMap::new);
    }

    public Optional<String> gitCommitSha() {
        return this.value(GIT_COMMIT_SHA);
    }

    public boolean issueTrackerPosted() {
        return flag(ISSUE_TRACKER_POSTED);
    }

    public Optional<String> revisionFeedback() {
        return this.value(REVISION_FEEDBACK);
    }

    public List<String> affectedArtifacts() {
        return strings(AFFECTED_ARTIFACTS);
    }

    public Optional<String> approvedBy() {
        return this.value(APPROVED_BY);
    }

    @Override
    public int retryCount() {
        return planRetryCount();
    }
}
