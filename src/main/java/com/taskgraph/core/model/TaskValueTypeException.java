package com.taskgraph.core.model;

/**
 * Thrown when a {@link TaskValue} is read as a variant it does not hold.
 */
public class TaskValueTypeException extends RuntimeException {

    private final VariableType expected;
    private final VariableType actual;

    public TaskValueTypeException(VariableType expected, VariableType actual) {
        super("Type mismatch: expected " + expected.displayName() + " but value is " + actual.displayName());
        this.expected = expected;
        this.actual = actual;
    }

    public VariableType expected() {
        return expected;
    }

    public VariableType actual() {
        return actual;
    }
}
