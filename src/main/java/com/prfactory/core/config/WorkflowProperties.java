package com.prfactory.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Retry, rejection and concurrency limits for the workflow graphs.
 */
@Component
@ConfigurationProperties(prefix = "prfactory.workflow")
public class WorkflowProperties {

    /** Attempts for the codebase analysis step before the refinement graph fails. */
    private int analysisMaxAttempts = 3;

    /** Base delay between analysis attempts; doubled after each failure. */
    private Duration analysisRetryBackoff = Duration.ofSeconds(1);

    private int maxTicketUpdateRejections = 3;

    private int maxPlanRejections = 5;

    /** Threads available to parallel fan-out steps. */
    private int parallelism = 4;

    private AgentRetry agentRetry = new AgentRetry();

    /** Ended workflows whose audit entries the in-memory audit store keeps. */
    private int auditRetainedWorkflows = 500;

    public int getAnalysisMaxAttempts() { return analysisMaxAttempts; }
    public void setAnalysisMaxAttempts(int analysisMaxAttempts) { this.analysisMaxAttempts = analysisMaxAttempts; }

    public Duration getAnalysisRetryBackoff() { return analysisRetryBackoff; }
    public void setAnalysisRetryBackoff(Duration analysisRetryBackoff) { this.analysisRetryBackoff = analysisRetryBackoff; }

    public int getMaxTicketUpdateRejections() { return maxTicketUpdateRejections; }
    public void setMaxTicketUpdateRejections(int maxTicketUpdateRejections) { this.maxTicketUpdateRejections = maxTicketUpdateRejections; }

    public int getMaxPlanRejections() { return maxPlanRejections; }
    public void setMaxPlanRejections(int maxPlanRejections) { this.maxPlanRejections = maxPlanRejections; }

    public int getParallelism() { return parallelism; }
    public void setParallelism(int parallelism) { this.parallelism = parallelism; }

    public AgentRetry getAgentRetry() { return agentRetry; }
    public void setAgentRetry(AgentRetry agentRetry) { this.agentRetry = agentRetry; }

    public int getAuditRetainedWorkflows() { return auditRetainedWorkflows; }
    public void setAuditRetainedWorkflows(int auditRetainedWorkflows) { this.auditRetainedWorkflows = auditRetainedWorkflows; }

    /**
     * Retry policy applied by the agent executor to transient agent failures.
     */
    public static class AgentRetry {
        private int maxAttempts = 3;
        private Duration waitDuration = Duration.ofMillis(500);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getWaitDuration() { return waitDuration; }
        public void setWaitDuration(Duration waitDuration) { this.waitDuration = waitDuration; }
    }
}
