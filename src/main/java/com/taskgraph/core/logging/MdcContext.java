package com.taskgraph.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing task-graph MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String ENTITY_ID = "entityId";
    public static final String NODE_ID = "nodeId";
    public static final String TASK_ID = "taskId";

    private MdcContext() {}

    public static void setEntity(long entityId) {
        MDC.put(ENTITY_ID, Long.toUnsignedString(entityId));
    }

    public static void setNode(int nodeId, String taskId) {
        MDC.put(NODE_ID, String.valueOf(nodeId));
        if (taskId != null) {
            MDC.put(TASK_ID, taskId);
        } else {
            MDC.remove(TASK_ID);
        }
    }

    public static void clear() {
        MDC.remove(ENTITY_ID);
        MDC.remove(NODE_ID);
        MDC.remove(TASK_ID);
    }
}
