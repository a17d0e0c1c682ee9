package com.prfactory.core.model;

/**
 * Artifacts making up an implementation plan, in generation order.
 */
public enum PlanArtifact {
    USER_STORIES("user_stories"),
    API_DESIGN("api_design"),
    DATA_SCHEMA("data_schema"),
    TEST_CASES("test_cases"),
    IMPLEMENTATION_NOTES("implementation_notes");

    private final String key;

    PlanArtifact(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
