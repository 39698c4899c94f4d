package com.taskgraph.core.graph;

import com.taskgraph.core.model.NodeType;
import com.taskgraph.core.model.ParameterBinding;

import java.util.List;
import java.util.Map;

/**
 * One node of a task graph template.
 *
 * @param id            unique id within the template
 * @param name          human-readable label
 * @param type          node role
 * @param children      ordered child ids (composites; exactly one for decorators)
 * @param atomicTaskId  registry id of the task to run (atomic nodes only, null otherwise)
 * @param parameters    named parameter bindings passed to the task, or decorator settings
 * @param nextOnSuccess node the cursor moves to when this node succeeds, or {@link TaskGraphTemplate#NODE_NONE}
 * @param nextOnFailure node the cursor moves to when this node fails, or {@link TaskGraphTemplate#NODE_NONE}
 */
public record TaskNodeDefinition(
    int id,
    String name,
    NodeType type,
    List<Integer> children,
    String atomicTaskId,
    Map<String, ParameterBinding> parameters,
    int nextOnSuccess,
    int nextOnFailure
) {

    public TaskNodeDefinition {
        name = name != null ? name : "";
        children = children != null ? List.copyOf(children) : List.of();
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    public static TaskNodeDefinition atomic(int id, String name, String atomicTaskId,
                                            Map<String, ParameterBinding> parameters,
                                            int nextOnSuccess, int nextOnFailure) {
        return new TaskNodeDefinition(id, name, NodeType.ATOMIC_TASK, List.of(), atomicTaskId,
                parameters, nextOnSuccess, nextOnFailure);
    }

    public static TaskNodeDefinition composite(int id, String name, NodeType type, List<Integer> children,
                                               int nextOnSuccess, int nextOnFailure) {
        return new TaskNodeDefinition(id, name, type, children, null, Map.of(), nextOnSuccess, nextOnFailure);
    }

    public boolean isAtomic() {
        return type == NodeType.ATOMIC_TASK;
    }

    public String label() {
        return name.isEmpty() ? "#" + id : name + "#" + id;
    }
}
