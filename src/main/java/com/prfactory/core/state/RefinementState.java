package com.prfactory.core.state;

import java.util.Map;
import java.util.Optional;

/**
 * Checkpoint state of the refinement graph.
 */
public class RefinementState extends GraphState {

    public static final String TICKET_KEY = "ticket_key";
    public static final String REPOSITORY_ID = "repository_id";
    public static final String ANALYSIS_RETRY_COUNT = "analysis_retry_count";
    public static final String LAST_ANALYSIS_ERROR = "last_analysis_error";
    public static final String QUESTION_COUNT = "question_count";
    public static final String ANSWER_COUNT = "answer_count";
    public static final String TICKET_UPDATE_ID = "ticket_update_id";
    public static final String TICKET_UPDATE_VERSION = "ticket_update_version";
    public static final String TICKET_UPDATE_REJECTIONS = "ticket_update_retry_count";
    public static final String LAST_REJECTION_REASON = "last_rejection_reason";
    public static final String APPROVED_BY = "approved_by";

    public RefinementState(Map<String, Object> initData) {
        super(initData);
    }

    public String ticketKey() {
        return text(TICKET_KEY);
    }

    public int analysisRetryCount() {
        return count(ANALYSIS_RETRY_COUNT);
    }

    public Optional<String> lastAnalysisError() {
        return this.value(LAST_ANALYSIS_ERROR);
    }

    public int ticketUpdateRejections() {
        return count(TICKET_UPDATE_REJECTIONS);
    }

    public Optional<String> lastRejectionReason() {
        return this.value(LAST_REJECTION_REASON);
    }

    @Override
    public int retryCount() {
        return ticketUpdateRejections() > 0 ? ticketUpdateRejections() : analysisRetryCount();
    }
}
