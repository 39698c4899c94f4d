package com.taskgraph.core.model;

/**
 * Last completed status recorded on a runtime instance.
 */
public enum RunnerStatus {
    SUCCESS,
    FAILURE,
    RUNNING,
    ABORTED;

    public static RunnerStatus from(TaskStatus status) {
        return switch (status) {
            case SUCCESS -> SUCCESS;
            case FAILURE -> FAILURE;
            case RUNNING -> RUNNING;
        };
    }
}
