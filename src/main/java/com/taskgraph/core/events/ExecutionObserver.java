package com.taskgraph.core.events;

/**
 * Receives a snapshot after every executor tick.
 * Implementations must not block; they run on the ticking thread.
 */
@FunctionalInterface
public interface ExecutionObserver {

    void onTick(ExecutionSnapshot snapshot);
}
