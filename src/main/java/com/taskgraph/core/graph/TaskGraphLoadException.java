package com.taskgraph.core.graph;

/**
 * Thrown when a graph file cannot be read or parsed.
 */
public class TaskGraphLoadException extends RuntimeException {

    public TaskGraphLoadException(String message) {
        super(message);
    }

    public TaskGraphLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
