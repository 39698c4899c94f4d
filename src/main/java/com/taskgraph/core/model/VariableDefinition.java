package com.taskgraph.core.model;

import java.util.Objects;

/**
 * Declaration of a blackboard variable in a graph template.
 *
 * @param name         unique name within the template
 * @param type         declared type; every stored value must carry this tag
 * @param defaultValue initial value, restored by a blackboard reset
 */
public record VariableDefinition(String name, VariableType type, TaskValue defaultValue) {

    public VariableDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (defaultValue == null) {
            defaultValue = TaskValue.defaultFor(type);
        }
    }

    public static VariableDefinition of(String name, TaskValue defaultValue) {
        return new VariableDefinition(name, defaultValue.type(), defaultValue);
    }
}
