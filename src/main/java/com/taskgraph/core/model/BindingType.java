package com.taskgraph.core.model;

/**
 * How a task parameter is supplied.
 */
public enum BindingType {
    LITERAL,
    LOCAL_VARIABLE
}
