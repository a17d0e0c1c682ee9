package com.prfactory.core.agents;

/**
 * Single-purpose steps an {@link AgentExecutor} can run.
 * <p>
 * The step name is used for checkpoint and failure-state naming, e.g. a failing
 * {@link #USER_STORIES} step leaves its graph in {@code user_stories_failed}.
 */
public enum AgentType {
    // Refinement
    TRIGGER("trigger"),
    REPOSITORY_CLONE("repository_clone"),
    ANALYSIS("analysis"),
    QUESTION_GENERATION("question_generation"),
    QUESTION_POST("questions_post"),
    ANSWER_PROCESSING("answer_processing"),
    TICKET_UPDATE_GENERATION("ticket_update_generation"),
    TICKET_UPDATE_POST("ticket_update_post"),

    // Planning
    USER_STORIES("user_stories"),
    API_DESIGN("api_design"),
    DATA_SCHEMA("data_schema"),
    TEST_CASES("test_cases"),
    IMPLEMENTATION_NOTES("implementation_notes"),
    PLAN_STORAGE("plan_storage"),
    PLAN_COMMIT("plan_commit"),
    PLAN_POST("plan_post"),
    FEEDBACK_ANALYSIS("feedback_analysis"),

    // Implementation
    IMPLEMENTATION("implementation"),
    CODE_COMMIT("code_commit"),
    PULL_REQUEST("pull_request"),
    IMPLEMENTATION_POST("implementation_post"),
    CODE_REVIEW("code_review"),
    REVIEW_COMMENT_POST("review_comment_post"),
    APPROVAL_COMMENT_POST("approval_comment_post");

    private final String stepName;

    AgentType(String stepName) {
        this.stepName = stepName;
    }

    public String stepName() {
        return stepName;
    }

    public String failedState() {
        return stepName + "_failed";
    }
}
