package com.openapi.mockserver.logging;

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
    @DisplayName("forRequest should set correlationId, method, and path in MDC")
    void forRequestSetsMDC() {
        try (LogContext ctx = LogContext.forRequest("corr-123", "POST", "/pets/fido")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("POST", MDC.get("method"));
            assertEquals("/pets/fido", MDC.get("path"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forRequest("corr-123", "GET", "/pets");
        assertNotNull(MDC.get("correlationId"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("method"));
        assertNull(MDC.get("path"));
    }

    @Test
    @DisplayName("with() should add additional keys to MDC")
    void withAddsKeys() {
        try (LogContext ctx = LogContext.forRequest("corr-123", "GET", "/pets")
                .with("operationId", "listPets")) {
            assertEquals("listPets", MDC.get("operationId"));
        }
        assertNull(MDC.get("operationId"));
        assertNull(MDC.get("correlationId"));
    }

    @Test
    @DisplayName("close should leave unrelated MDC keys alone")
    void closeKeepsOtherKeys() {
        MDC.put("tenant", "acme");
        try (LogContext ctx = LogContext.forRequest("corr-1", "GET", "/pets")) {
            assertEquals("acme", MDC.get("tenant"));
        }
        assertEquals("acme", MDC.get("tenant"));
    }

    @Test
    @DisplayName("generateCorrelationId should return unique UUIDs")
    void generateCorrelationIdReturnsUniqueIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size(), "All generated IDs should be unique");
        assertTrue(ids.iterator().next()
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"));
    }
}
