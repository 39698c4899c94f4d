package com.taskgraph.core.tasks.builtin;

import com.taskgraph.core.blackboard.BlackboardException;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.VariableType;
import com.taskgraph.core.model.Vector3;
import com.taskgraph.core.pathfinding.PathfindingService;
import com.taskgraph.core.tasks.AtomicTask;
import com.taskgraph.core.tasks.TaskContext;
import com.taskgraph.core.tasks.TaskParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Submits an asynchronous path request on first execution, then polls it.
 * <p>
 * The start point is the {@code Start} parameter, or the blackboard's {@code Position}
 * when absent. {@code Target} is required and {@code AsyncDelay} (seconds) is optional.
 * On completion the path string is written to the {@code Path} String variable and the
 * request is released. {@link #abort()} cancels an outstanding request without touching
 * the blackboard.
 */
public class RequestPathfindingTask implements AtomicTask {

    private static final Logger log = LoggerFactory.getLogger(RequestPathfindingTask.class);

    public static final String ID = "RequestPathfinding";
    public static final String PARAM_START = "Start";
    public static final String PARAM_TARGET = "Target";
    public static final String PARAM_ASYNC_DELAY = "AsyncDelay";
    public static final String BB_POSITION = "Position";
    public static final String BB_PATH = "Path";

    private final PathfindingService pathfinding;
    private long requestId = PathfindingService.INVALID_REQUEST_ID;

    public RequestPathfindingTask(PathfindingService pathfinding) {
        this.pathfinding = pathfinding;
    }

    @Override
    public TaskStatus execute(TaskContext context, Map<String, TaskValue> parameters) {
        if (requestId == PathfindingService.INVALID_REQUEST_ID) {
            return submit(context, parameters);
        }

        if (!pathfinding.isComplete(requestId)) {
            log.trace("Entity {} waiting for path request {}", context.entityId(), requestId);
            return TaskStatus.RUNNING;
        }

        String path = pathfinding.pathString(requestId);
        pathfinding.cancel(requestId);
        requestId = PathfindingService.INVALID_REQUEST_ID;

        try {
            context.blackboard().setValue(BB_PATH, TaskValue.ofString(path));
        } catch (BlackboardException e) {
            log.warn("Failed to write '{}': {}", BB_PATH, e.getMessage());
            return TaskStatus.FAILURE;
        }
        log.debug("Entity {} path ready: {}", context.entityId(), path);
        return TaskStatus.SUCCESS;
    }

    private TaskStatus submit(TaskContext context, Map<String, TaskValue> parameters) {
        var bb = context.blackboard();
        if (bb == null) {
            log.warn("No blackboard available for entity {}", context.entityId());
            return TaskStatus.FAILURE;
        }

        Vector3 start;
        var startParam = TaskParams.typed(parameters, PARAM_START, VariableType.VECTOR);
        if (startParam.isPresent()) {
            start = startParam.get().asVector();
        } else if (bb.declaredType(BB_POSITION) == VariableType.VECTOR) {
            start = bb.getValue(BB_POSITION).asVector();
        } else {
            log.warn("No '{}' parameter and no '{}' variable for entity {}", PARAM_START, BB_POSITION, context.entityId());
            return TaskStatus.FAILURE;
        }

        var targetParam = TaskParams.typed(parameters, PARAM_TARGET, VariableType.VECTOR);
        if (targetParam.isEmpty()) {
            log.warn("Missing or invalid '{}' parameter", PARAM_TARGET);
            return TaskStatus.FAILURE;
        }

        if (bb.declaredType(BB_PATH) != VariableType.STRING) {
            log.warn("'{}' String variable not declared for entity {}", BB_PATH, context.entityId());
            return TaskStatus.FAILURE;
        }

        float delay = Math.max(0f, TaskParams.floatOr(parameters, PARAM_ASYNC_DELAY, 0f));
        requestId = pathfinding.request(start, targetParam.get().asVector(), delay);
        log.debug("Entity {} submitted path request {}", context.entityId(), requestId);
        return TaskStatus.RUNNING;
    }

    @Override
    public void abort() {
        if (requestId != PathfindingService.INVALID_REQUEST_ID) {
            log.debug("Cancelling path request {}", requestId);
            pathfinding.cancel(requestId);
        }
        requestId = PathfindingService.INVALID_REQUEST_ID;
    }

    long pendingRequestId() {
        return requestId;
    }
}
