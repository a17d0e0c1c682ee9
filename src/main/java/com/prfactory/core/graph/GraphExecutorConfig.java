package com.prfactory.core.graph;

import com.prfactory.core.config.WorkflowProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool used by the graphs' parallel fan-out steps.
 */
@Configuration
public class GraphExecutorConfig {

    public static final String GRAPH_TASK_EXECUTOR = "graphTaskExecutor";

    @Bean(name = GRAPH_TASK_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService graphTaskExecutor(WorkflowProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "graph-fanout-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(2, properties.getParallelism()), threads);
    }
}
