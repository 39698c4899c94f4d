package com.taskgraph.core.events;

import com.taskgraph.core.model.RunnerStatus;
import com.taskgraph.core.model.TaskValue;

import java.time.Instant;
import java.util.Map;

/**
 * State of one runner published after a tick, for editors and debug views.
 *
 * @param entityId     entity that was ticked
 * @param templateName name of the bound template
 * @param activeNodeId node the cursor rests on after the tick, or -1 when finished
 * @param status       status reported by the tick
 * @param blackboard   read-only copy of the blackboard values
 * @param timestamp    when the tick completed
 */
public record ExecutionSnapshot(
    long entityId,
    String templateName,
    int activeNodeId,
    RunnerStatus status,
    Map<String, TaskValue> blackboard,
    Instant timestamp
) {}
