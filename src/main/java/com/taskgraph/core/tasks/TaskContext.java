package com.taskgraph.core.tasks;

import com.taskgraph.core.blackboard.LocalBlackboard;

import java.util.Optional;

/**
 * Runtime data handed to {@link AtomicTask#execute} each tick.
 *
 * @param entityId       entity whose graph is executing
 * @param blackboard     the runner's blackboard (may be null in isolated task tests)
 * @param deltaTime      seconds elapsed this tick
 * @param stateTimer     seconds accumulated in the current node before this tick
 * @param positionSource world-owned position, or null when running headless
 */
public record TaskContext(
    long entityId,
    LocalBlackboard blackboard,
    float deltaTime,
    float stateTimer,
    PositionSource positionSource
) {

    public static TaskContext headless(long entityId, LocalBlackboard blackboard, float deltaTime, float stateTimer) {
        return new TaskContext(entityId, blackboard, deltaTime, stateTimer, null);
    }

    public Optional<PositionSource> position() {
        return Optional.ofNullable(positionSource);
    }
}
