package com.prfactory.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for workflow orchestration.
 */
@Service
public class WorkflowMetrics {

    private final MeterRegistry registry;

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome "started", "completed", "failed" or "cancelled"
     */
    public void recordWorkflow(String outcome) {
        Counter.builder("prfactory.workflows." + outcome)
                .register(registry)
                .increment();
    }

    public void recordWorkflowDuration(Duration duration) {
        DistributionSummary.builder("prfactory.workflow.duration")
                .baseUnit("milliseconds")
                .register(registry)
                .record(duration.toMillis());
    }

    /**
     * @param outcome "success", "suspended" or "failure"
     */
    public void recordGraphResult(String graphId, String outcome) {
        Counter.builder("prfactory.graph.results")
                .tag("graph", graphId)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAgentExecution(String agent, long ms, boolean success) {
        Timer.builder("prfactory.agent.duration")
                .tag("agent", agent)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRejection(String graphId) {
        Counter.builder("prfactory.rejections")
                .description("Human rejections of generated ticket updates and plans")
                .tag("graph", graphId)
                .register(registry)
                .increment();
    }
}
