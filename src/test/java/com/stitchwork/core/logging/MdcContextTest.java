package com.stitchwork.core.logging;

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
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("run-20260301-100000-001");
        assertEquals("run-20260301-100000-001", MDC.get("runId"));
    }

    @Test
    @DisplayName("setNode puts runId, nodeId, and attempt in MDC")
    void setNode() {
        MdcContext.setNode("run-1", "fn_parse", 2);
        assertEquals("run-1", MDC.get("runId"));
        assertEquals("fn_parse", MDC.get("nodeId"));
        assertEquals("2", MDC.get("attempt"));
    }

    @Test
    @DisplayName("clearNode keeps the run key")
    void clearNode() {
        MdcContext.setNode("run-1", "fn_parse", 1);
        MdcContext.clearNode();
        assertEquals("run-1", MDC.get("runId"));
        assertNull(MDC.get("nodeId"));
        assertNull(MDC.get("attempt"));
    }

    @Test
    @DisplayName("clear removes all stitchwork MDC keys")
    void clear() {
        MdcContext.setNode("run-1", "fn_parse", 1);
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("nodeId"));
        assertNull(MDC.get("attempt"));
    }
}
