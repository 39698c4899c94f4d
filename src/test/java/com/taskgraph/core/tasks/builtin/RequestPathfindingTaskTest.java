package com.taskgraph.core.tasks.builtin;

import com.taskgraph.core.blackboard.LocalBlackboard;
import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.VariableDefinition;
import com.taskgraph.core.model.Vector3;
import com.taskgraph.core.pathfinding.PathfindingService;
import com.taskgraph.core.tasks.TaskContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyFloat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RequestPathfindingTaskTest {

    private PathfindingService pathfinding;
    private RequestPathfindingTask task;
    private LocalBlackboard blackboard;
    private TaskContext context;

    private static final Map<String, TaskValue> PARAMS = Map.of(
            RequestPathfindingTask.PARAM_TARGET, TaskValue.ofVector(4, 6, 0),
            RequestPathfindingTask.PARAM_ASYNC_DELAY, TaskValue.ofFloat(0.25f));

    @BeforeEach
    void setUp() {
        pathfinding = mock(PathfindingService.class);
        task = new RequestPathfindingTask(pathfinding);
        blackboard = new LocalBlackboard();
        blackboard.initialize(List.of(
                VariableDefinition.of("Position", TaskValue.ofVector(1, 2, 0)),
                VariableDefinition.of("Path", TaskValue.ofString(""))));
        context = TaskContext.headless(7L, blackboard, 0.016f, 0f);
    }

    @Test
    @DisplayName("submits from Position, polls, then writes the path and releases the request")
    void fullCycle() {
        when(pathfinding.request(any(), any(), anyFloat())).thenReturn(5L);
        when(pathfinding.isComplete(5L)).thenReturn(false, true);
        when(pathfinding.pathString(5L)).thenReturn("(1.0,2.0,0.0)->(4.0,6.0,0.0)");

        assertEquals(TaskStatus.RUNNING, task.execute(context, PARAMS));
        verify(pathfinding).request(new Vector3(1, 2, 0), new Vector3(4, 6, 0), 0.25f);
        assertEquals(TaskStatus.RUNNING, task.execute(context, PARAMS));
        assertEquals("", blackboard.getValue("Path").asString());

        assertEquals(TaskStatus.SUCCESS, task.execute(context, PARAMS));
        assertEquals("(1.0,2.0,0.0)->(4.0,6.0,0.0)", blackboard.getValue("Path").asString());
        verify(pathfinding).cancel(5L);
        assertEquals(PathfindingService.INVALID_REQUEST_ID, task.pendingRequestId());
    }

    @Test
    @DisplayName("a Start parameter takes precedence over Position")
    void explicitStart() {
        when(pathfinding.request(any(), any(), anyFloat())).thenReturn(1L);
        var params = Map.of(
                RequestPathfindingTask.PARAM_START, TaskValue.ofVector(9, 9, 9),
                RequestPathfindingTask.PARAM_TARGET, TaskValue.ofVector(0, 0, 0));

        task.execute(context, params);

        verify(pathfinding).request(new Vector3(9, 9, 9), Vector3.ZERO, 0f);
    }

    @Test
    @DisplayName("abort cancels the outstanding request without writing")
    void abortCancels() {
        when(pathfinding.request(any(), any(), anyFloat())).thenReturn(3L);
        task.execute(context, PARAMS);

        task.abort();

        verify(pathfinding).cancel(3L);
        verify(pathfinding, never()).pathString(anyLong());
        assertEquals("", blackboard.getValue("Path").asString());
    }

    @Test
    @DisplayName("abort before execute does nothing")
    void abortBeforeExecute() {
        task.abort();

        verify(pathfinding, never()).cancel(anyLong());
    }

    @Test
    @DisplayName("fails fast on missing Target, start or Path variable")
    void failures() {
        assertEquals(TaskStatus.FAILURE, task.execute(context, Map.of()));

        var noPath = new LocalBlackboard();
        noPath.initialize(List.of(VariableDefinition.of("Position", TaskValue.ofVector(Vector3.ZERO))));
        assertEquals(TaskStatus.FAILURE, task.execute(TaskContext.headless(1L, noPath, 0.016f, 0f), PARAMS));

        var noPosition = new LocalBlackboard();
        noPosition.initialize(List.of(VariableDefinition.of("Path", TaskValue.ofString(""))));
        assertEquals(TaskStatus.FAILURE, task.execute(TaskContext.headless(1L, noPosition, 0.016f, 0f), PARAMS));

        verify(pathfinding, never()).request(any(), any(), anyFloat());
    }

    @Test
    @DisplayName("works end to end with the real service")
    void realService() throws Exception {
        try (var service = new PathfindingService(1)) {
            var realTask = new RequestPathfindingTask(service);
            var params = Map.of(RequestPathfindingTask.PARAM_TARGET, TaskValue.ofVector(4, 6, 0));

            TaskStatus status = realTask.execute(context, params);
            long deadline = System.currentTimeMillis() + 5000;
            while (status == TaskStatus.RUNNING && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
                status = realTask.execute(context, params);
            }

            assertEquals(TaskStatus.SUCCESS, status);
            assertEquals("(1.0,2.0,0.0)->(4.0,6.0,0.0)", blackboard.getValue("Path").asString());
            assertEquals(0, service.pendingCount());
        }
    }
}
