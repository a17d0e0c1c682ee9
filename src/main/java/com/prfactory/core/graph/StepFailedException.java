package com.prfactory.core.graph;

/**
 * Aborts the current graph invocation; turned into a {@link GraphExecutionResult.Failure}
 * by {@link AbstractAgentGraph}.
 */
class StepFailedException extends RuntimeException {

    private final String failedState;

    StepFailedException(String failedState, String message, Throwable cause) {
        super(message, cause);
        this.failedState = failedState;
    }

    String failedState() {
        return failedState;
    }
}
