package com.logtable.core.logging;

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
        MdcContext.setRun("a1b2c3d4");
        assertEquals("a1b2c3d4", MDC.get("runId"));
    }

    @Test
    @DisplayName("setBatch puts runId and batchIndex in MDC")
    void setBatch() {
        MdcContext.setBatch("a1b2c3d4", 7);
        assertEquals("a1b2c3d4", MDC.get("runId"));
        assertEquals("7", MDC.get("batchIndex"));
    }

    @Test
    @DisplayName("clear removes all logtable MDC keys")
    void clear() {
        MdcContext.setBatch("a1b2c3d4", 2);
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("batchIndex"));
    }
}
