package com.taskgraph.core.model;

import java.util.Objects;

/**
 * A task parameter: either a literal value embedded in the template or a reference
 * to a blackboard variable read when the task is dispatched.
 *
 * @param type         literal or local-variable binding
 * @param literal      value used for literal bindings ({@link TaskValue#none()} otherwise)
 * @param variableName blackboard variable for local-variable bindings (null otherwise)
 */
public record ParameterBinding(BindingType type, TaskValue literal, String variableName) {

    public ParameterBinding {
        Objects.requireNonNull(type, "type");
        if (literal == null) {
            literal = TaskValue.none();
        }
    }

    public static ParameterBinding literal(TaskValue value) {
        return new ParameterBinding(BindingType.LITERAL, value, null);
    }

    public static ParameterBinding variable(String variableName) {
        return new ParameterBinding(BindingType.LOCAL_VARIABLE, TaskValue.none(), variableName);
    }

    public boolean isLiteral() {
        return type == BindingType.LITERAL;
    }
}
