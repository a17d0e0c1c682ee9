package com.prfactory.core.graph;

import com.prfactory.core.messages.AgentMessage;

import java.time.Duration;

/**
 * Outcome of one {@link AgentGraph#execute} or {@link AgentGraph#resume} call.
 * <p>
 * {@link #state()} is always the checkpoint name the graph left itself in.
 */
public sealed interface GraphExecutionResult {

    String state();

    boolean isSuccess();

    /** The graph finished; the caller must act on {@code outputMessage}. */
    record Success(String state, AgentMessage outputMessage, Duration duration) implements GraphExecutionResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /** The graph is durably parked waiting for an external decision. */
    record Suspended(String state, AgentMessage outputMessage) implements GraphExecutionResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /** Terminal for this invocation. */
    record Failure(String state, String error, Throwable cause) implements GraphExecutionResult {

        public Failure(String state, String error) {
            this(state, error, null);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
