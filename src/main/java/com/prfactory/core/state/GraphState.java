package com.prfactory.core.state;

import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view over a graph's checkpoint state.
 * <p>
 * Checkpoints store a schema-free map; graph logic reads it through these
 * accessors (and the per-graph subclasses) instead of raw string keys.
 */
public class GraphState extends AgentState {

    public static final String NOT_STARTED = "not_started";

    public static final String TICKET_ID = "ticket_id";
    public static final String TENANT_ID = "tenant_id";
    public static final String CURRENT_STATE = "current_state";
    public static final String CURRENT_AGENT = "current_agent";
    public static final String LAST_CHECKPOINT = "last_checkpoint";
    public static final String IS_SUSPENDED = "is_suspended";
    public static final String IS_COMPLETED = "is_completed";
    public static final String IS_FAILED = "is_failed";
    public static final String WAITING_FOR = "waiting_for";
    public static final String ERROR = "error";

    public GraphState(Map<String, Object> initData) {
        super(initData);
    }

    public String ticketId() {
        return text(TICKET_ID);
    }

    public Optional<String> tenantId() {
        return this.value(TENANT_ID);
    }

    public String currentState() {
        return this.<String>value(CURRENT_STATE).orElse(NOT_STARTED);
    }

    public Optional<String> currentAgent() {
        return this.value(CURRENT_AGENT);
    }

    public Optional<String> lastCheckpoint() {
        return this.value(LAST_CHECKPOINT);
    }

    public boolean isSuspended() {
        return flag(IS_SUSPENDED);
    }

    public boolean isCompleted() {
        return flag(IS_COMPLETED);
    }

    public boolean isFailed() {
        return flag(IS_FAILED);
    }

    public boolean isRunning() {
        return !NOT_STARTED.equals(currentState()) && !isSuspended() && !isCompleted() && !isFailed();
    }

    public Optional<String> waitingFor() {
        return this.value(WAITING_FOR);
    }

    public Optional<String> error() {
        return this.value(ERROR);
    }

    /** The graph's retry or rejection counter; zero for graphs without one. */
    public int retryCount() {
        return 0;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    protected String text(String key) {
        return this.<Object>value(key).map(Object::toString).orElse("");
    }

    protected boolean flag(String key) {
        return this.<Object>value(key)
                .map(v -> v instanceof Boolean b ? b : Boolean.parseBoolean(v.toString()))
                .orElse(false);
    }

    /** Numbers may come back from JSON storage as any {@link Number} subtype. */
    protected int count(String key) {
        return this.<Object>value(key)
                .map(v -> v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString()))
                .orElse(0);
    }

    @SuppressWarnings("unchecked")
    protected List<String> strings(String key) {
        return this.<Object>value(key)
                .map(v -> v instanceof List<?> list ? (List<String>) list : List.<String>of())
                .orElse(List.of());
    }
}
