package com.taskgraph.core.blackboard;

/**
 * Thrown on access to an undeclared blackboard variable or on a type-mismatched write.
 */
public class BlackboardException extends RuntimeException {

    public BlackboardException(String message) {
        super(message);
    }

    public BlackboardException(String message, Throwable cause) {
        super(message, cause);
    }

    public static BlackboardException unknownVariable(String name) {
        return new BlackboardException("Unknown variable: " + name);
    }
}
