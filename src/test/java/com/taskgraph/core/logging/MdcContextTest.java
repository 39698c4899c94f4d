package com.taskgraph.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setEntity puts entityId in MDC as an unsigned number")
    void setEntity() {
        MdcContext.setEntity(42L);
        assertEquals("42", MDC.get("entityId"));

        MdcContext.setEntity(-1L);
        assertEquals("18446744073709551615", MDC.get("entityId"));
    }

    @Test
    @DisplayName("setNode puts nodeId and taskId in MDC")
    void setNode() {
        MdcContext.setNode(3, "Wait");
        assertEquals("3", MDC.get("nodeId"));
        assertEquals("Wait", MDC.get("taskId"));
    }

    @Test
    @DisplayName("setNode without a task removes a stale taskId")
    void setNodeWithoutTask() {
        MdcContext.setNode(3, "Wait");
        MdcContext.setNode(4, null);
        assertEquals("4", MDC.get("nodeId"));
        assertNull(MDC.get("taskId"));
    }

    @Test
    @DisplayName("clear removes all task graph MDC keys")
    void clear() {
        MdcContext.setEntity(7L);
        MdcContext.setNode(1, "SetVariable");
        MdcContext.clear();
        assertNull(MDC.get("entityId"));
        assertNull(MDC.get("nodeId"));
        assertNull(MDC.get("taskId"));
    }
}
