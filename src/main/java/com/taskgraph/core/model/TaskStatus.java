package com.taskgraph.core.model;

/**
 * Result of one {@code execute} call on an atomic task.
 */
public enum TaskStatus {
    SUCCESS,
    FAILURE,
    RUNNING  // call again next tick with the same instance
}
