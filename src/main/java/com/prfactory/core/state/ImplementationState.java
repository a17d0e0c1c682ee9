package com.prfactory.core.state;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checkpoint state of the implementation graph.
 */
public class ImplementationState extends GraphState {

    public static final String SKIPPED = "skipped";
    public static final String SKIP_REASON = "skip_reason";
    public static final String COMMIT_SHA = "commit_sha";
    public static final String BRANCH_NAME = "branch_name";
    public static final String PR_NUMBER = "pr_number";
    public static final String PR_URL = "pr_url";
    public static final String ISSUE_TRACKER_POSTED = "issue_tracker_posted";
    public static final String REVIEW_FIX_COUNT = "review_fix_count";
    public static final String BLOCKING_ISSUES = "blocking_issues";
    public static final String REVIEW_OUTCOME = "review_outcome";

    public ImplementationState(Map<String, Object> initData) {
        super(initData);
    }

    public boolean skipped() {
        return flag(SKIPPED);
    }

    public int pullRequestNumber() {
        return count(PR_NUMBER);
    }

    public Optional<String> pullRequestUrl() {
        return this.value(PR_URL);
    }

    public int reviewFixCount() {
        return count(REVIEW_FIX_COUNT);
    }

    public List<String> blockingIssues() {
        return strings(BLOCKING_ISSUES);
    }

    @Override
    public int retryCount() {
        return reviewFixCount();
    }
}
