package com.taskgraph.core.tasks;

import com.taskgraph.core.model.TaskValue;
import com.taskgraph.core.model.VariableType;

import java.util.Map;
import java.util.Optional;

/**
 * Typed lookups over a task parameter map.
 */
public final class TaskParams {

    private TaskParams() {}

    /**
     * @return the parameter if present and of the given type, empty otherwise
     */
    public static Optional<TaskValue> typed(Map<String, TaskValue> params, String name, VariableType type) {
        TaskValue value = params.get(name);
        if (value == null || value.type() != type) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public static Optional<TaskValue> present(Map<String, TaskValue> params, String name) {
        TaskValue value = params.get(name);
        if (value == null || value.isNone()) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    public static float floatOr(Map<String, TaskValue> params, String name, float fallback) {
        return typed(params, name, VariableType.FLOAT).map(TaskValue::asFloat).orElse(fallback);
    }
}
