package com.record.linkage.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forRun should set runId and operation in MDC")
    void forRunSetsMDC() {
        try (LogContext ctx = LogContext.forRun("run-1")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("match", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forPass should set runId, pass and operation in MDC")
    void forPassSetsMDC() {
        try (LogContext ctx = LogContext.forPass("run-1", "dup_ssn")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("dup_ssn", MDC.get("pass"));
            assertEquals("block", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forChunk should set pass, chunk and operation in MDC")
    void forChunkSetsMDC() {
        try (LogContext ctx = LogContext.forChunk("3", 7)) {
            assertEquals("3", MDC.get("pass"));
            assertEquals("7", MDC.get("chunk"));
            assertEquals("score", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("close should remove every key it added, including extra ones")
    void closeClearsMDC() {
        try (LogContext ctx = LogContext.forRun("run-1").with("matchName", "census_claims")) {
            assertEquals("census_claims", MDC.get("matchName"));
        }
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("matchName"));
    }

    @Test
    @DisplayName("generateRunId should produce unique values")
    void uniqueRunIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
