package com.taskgraph.core.metrics;

import com.taskgraph.core.model.RunnerStatus;
import com.taskgraph.core.model.TaskStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Centralised Micrometer metrics for task graph execution.
 */
public class TaskSystemMetrics {

    private final MeterRegistry registry;

    public TaskSystemMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskCompletion(String taskId, TaskStatus status) {
        Counter.builder("taskgraph.task.completions")
                .description("Atomic task executions that returned Success or Failure")
                .tag("task", taskId)
                .tag("status", status.name().toLowerCase())
                .register(registry)
                .increment();
    }

    /**
     * @param reason one of "unknown_task", "parameter", "task_exception", "missing_node",
     *               "empty_composite", "composite_cycle"
     */
    public void recordDispatchError(String reason) {
        Counter.builder("taskgraph.task.dispatch_errors")
                .description("Nodes failed by the executor before or during dispatch")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordAbort(String taskId) {
        Counter.builder("taskgraph.task.aborts")
                .description("Running tasks aborted by interruption")
                .tag("task", taskId)
                .register(registry)
                .increment();
    }

    public void recordGraphFinished(RunnerStatus status) {
        Counter.builder("taskgraph.graph.finished")
                .tag("status", status.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public Timer.Sample startTick() {
        return Timer.start(registry);
    }

    public void stopTick(Timer.Sample sample) {
        sample.stop(Timer.builder("taskgraph.tick.duration")
                .description("Wall time of a single runner tick")
                .register(registry));
    }
}
