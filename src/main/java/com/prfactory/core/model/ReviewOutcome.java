package com.prfactory.core.model;

/**
 * How the automated review loop ended for a pull request.
 */
public enum ReviewOutcome {
    NOT_REVIEWED,
    PASSED,
    COMPLETED_WITH_WARNINGS
}
