package com.taskgraph.core.model;

/**
 * Role of a node in a task graph.
 * <p>
 * Only {@link #ATOMIC_TASK} nodes do work at runtime; the composite kinds are
 * authoring structure that the executor enters through their first child.
 */
public enum NodeType {
    ATOMIC_TASK,
    SEQUENCE,
    SELECTOR,
    PARALLEL,
    DECORATOR,
    ROOT;

    public boolean isComposite() {
        return this != ATOMIC_TASK;
    }
}
