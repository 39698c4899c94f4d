package com.taskgraph.core.engine;

import com.taskgraph.core.graph.TaskGraphAssetManager;
import com.taskgraph.core.graph.TaskGraphTemplate;
import com.taskgraph.core.model.RunnerStatus;
import com.taskgraph.core.runner.TaskRunner;
import com.taskgraph.core.tasks.PositionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the runners of all entities and advances each of them once per simulation tick,
 * in attach order.
 * <p>
 * Not thread-safe: attach, detach and tick are called from the simulation thread.
 */
public class TaskSystem {

    private static final Logger log = LoggerFactory.getLogger(TaskSystem.class);

    private final TaskGraphAssetManager assets;
    private final TaskExecutor executor;
    private final Map<Long, TaskRunner> runners = new LinkedHashMap<>();
    private final Map<Long, PositionSource> positionSources = new HashMap<>();

    public TaskSystem(TaskGraphAssetManager assets, TaskExecutor executor) {
        this.assets = assets;
        this.executor = executor;
    }

    /**
     * Creates a runner for the entity bound to the given template asset, replacing any
     * runner the entity already had.
     *
     * @throws IllegalArgumentException if the asset id does not resolve
     */
    public TaskRunner attach(long entityId, long assetId) {
        TaskGraphTemplate template = assets.get(assetId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task graph asset " + assetId));
        if (runners.containsKey(entityId)) {
            detach(entityId);
        }
        var runner = new TaskRunner(entityId, template, assetId);
        runners.put(entityId, runner);
        log.info("Entity {} attached to '{}' (asset {})", entityId, template.name(), assetId);
        return runner;
    }

    /**
     * Removes the entity's runner, aborting its in-flight task if any.
     *
     * @return true if the entity had a runner
     */
    public boolean detach(long entityId) {
        TaskRunner runner = runners.remove(entityId);
        positionSources.remove(entityId);
        if (runner == null) {
            return false;
        }
        if (runner.hasActiveTask()) {
            runner.interrupt();
            executor.tick(runner, 0f);
        }
        log.info("Entity {} detached", entityId);
        return true;
    }

    /**
     * Makes movement tasks of this entity drive the given position instead of the blackboard.
     */
    public void setPositionSource(long entityId, PositionSource source) {
        if (source == null) {
            positionSources.remove(entityId);
        } else {
            positionSources.put(entityId, source);
        }
    }

    public Optional<TaskRunner> runner(long entityId) {
        return Optional.ofNullable(runners.get(entityId));
    }

    public Collection<TaskRunner> runners() {
        return Collections.unmodifiableCollection(runners.values());
    }

    /**
     * Advances every runner once. Runners whose template asset was unloaded are skipped.
     *
     * @return the status each ticked entity reported, in attach order
     */
    public Map<Long, RunnerStatus> tick(float deltaTime) {
        Map<Long, RunnerStatus> results = new LinkedHashMap<>();
        for (TaskRunner runner : runners.values()) {
            if (assets.get(runner.assetId()).isEmpty()) {
                log.debug("Entity {} skipped: asset {} is not loaded", runner.entityId(), runner.assetId());
                continue;
            }
            results.put(runner.entityId(), executor.tick(runner, deltaTime, positionSources.get(runner.entityId())));
        }
        return results;
    }

    public boolean allFinished() {
        return runners.values().stream().allMatch(TaskRunner::isFinished);
    }

    public int size() {
        return runners.size();
    }
}
