package com.taskgraph.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskgraph.core.engine.TaskExecutor;
import com.taskgraph.core.engine.TaskSystem;
import com.taskgraph.core.events.ExecutionEventBus;
import com.taskgraph.core.graph.TaskGraphAssetManager;
import com.taskgraph.core.graph.TaskGraphLoader;
import com.taskgraph.core.metrics.TaskSystemMetrics;
import com.taskgraph.core.pathfinding.PathfindingService;
import com.taskgraph.core.tasks.AtomicTaskRegistry;
import com.taskgraph.core.tasks.BuiltinTasks;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the task system. Core classes are plain Java; this is the only place they meet Spring.
 */
@Configuration
public class TaskSystemConfig {

    private static final Logger log = LoggerFactory.getLogger(TaskSystemConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean(destroyMethod = "close")
    public PathfindingService pathfindingService(TaskSystemProperties properties) {
        return new PathfindingService(properties.getPathfinding().getWorkerThreads());
    }

    @Bean
    public AtomicTaskRegistry atomicTaskRegistry(PathfindingService pathfindingService,
                                                 TaskSystemProperties properties) {
        var registry = new AtomicTaskRegistry();
        BuiltinTasks.registerAll(registry, pathfindingService,
                properties.getMovement().getDefaultSpeed(),
                properties.getMovement().getAcceptanceRadius());
        log.info("Registered {} atomic task ids", registry.size());
        return registry;
    }

    @Bean
    public TaskSystemMetrics taskSystemMetrics(MeterRegistry meterRegistry) {
        return new TaskSystemMetrics(meterRegistry);
    }

    @Bean
    public ExecutionEventBus executionEventBus() {
        return new ExecutionEventBus();
    }

    @Bean
    public TaskExecutor taskExecutor(AtomicTaskRegistry registry, TaskSystemMetrics metrics,
                                     ExecutionEventBus eventBus, TaskSystemProperties properties) {
        return new TaskExecutor(registry, metrics, properties.isPublishSnapshots() ? eventBus : null);
    }

    @Bean
    public TaskGraphLoader taskGraphLoader(ObjectMapper objectMapper) {
        return new TaskGraphLoader(objectMapper);
    }

    @Bean
    public TaskGraphAssetManager taskGraphAssetManager(TaskGraphLoader loader) {
        return new TaskGraphAssetManager(loader);
    }

    @Bean
    public TaskSystem taskSystem(TaskGraphAssetManager assets, TaskExecutor executor) {
        return new TaskSystem(assets, executor);
    }
}
