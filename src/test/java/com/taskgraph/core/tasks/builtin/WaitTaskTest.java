package com.taskgraph.core.tasks.builtin;

import com.taskgraph.core.model.TaskStatus;
import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.tasks.TaskContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WaitTaskTest {

    private final WaitTask task = new WaitTask();

    private TaskStatus runAt(float elapsed, Map<String, TaskValue> params) {
        return task.execute(TaskContext.headless(1L, null, 0.016f, elapsed), params);
    }

    @Test
    @DisplayName("running until the node timer reaches the duration")
    void runsUntilDuration() {
        var params = Map.of(WaitTask.PARAM_DURATION, TaskValue.ofFloat(0.05f));

        assertEquals(TaskStatus.RUNNING, runAt(0f, params));
        assertEquals(TaskStatus.RUNNING, runAt(0.048f, params));
        assertEquals(TaskStatus.SUCCESS, runAt(0.05f, params));
        assertEquals(TaskStatus.SUCCESS, runAt(0.064f, params));
    }

    @Test
    @DisplayName("fails without a positive Float duration")
    void invalidDuration() {
        assertEquals(TaskStatus.FAILURE, runAt(1f, Map.of()));
        assertEquals(TaskStatus.FAILURE, runAt(1f, Map.of(WaitTask.PARAM_DURATION, TaskValue.ofInt(1))));
        assertEquals(TaskStatus.FAILURE, runAt(1f, Map.of(WaitTask.PARAM_DURATION, TaskValue.ofFloat(0f))));
        assertEquals(TaskStatus.FAILURE, runAt(1f, Map.of(WaitTask.PARAM_DURATION, TaskValue.ofFloat(-2f))));
    }

    @Test
    @DisplayName("abort before execute is harmless")
    void abortBeforeExecute() {
        assertDoesNotThrow(task::abort);
    }
}
