package com.trace.export.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("forUpload sets upload MDC entries")
    void forUpload() {
        try (LogContext ctx = LogContext.forUpload("batch-1", "orders")) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("orders", MDC.get("serviceName"));
            assertEquals("upload", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("close removes only the keys it added")
    void closeRemovesKeys() {
        MDC.put("requestId", "r-9");

        try (LogContext ctx = LogContext.forUpload("batch-2", "orders").with("attempt", "1")) {
            assertEquals("1", MDC.get("attempt"));
        }

        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("attempt"));
        assertEquals("r-9", MDC.get("requestId"));
    }

    @Test
    @DisplayName("Generated batch ids are unique")
    void batchIds() {
        assertNotEquals(LogContext.generateBatchId(), LogContext.generateBatchId());
    }
}
