package com.attribute.resolution.logging;

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
    @DisplayName("forResolution should set correlationId, attribute and operation in MDC")
    void forResolutionSetsMDC() {
        try (LogContext ctx = LogContext.forResolution("corr-123", "ROUTE", "entity")) {
            assertEquals("corr-123", MDC.get("correlationId"));
            assertEquals("ROUTE", MDC.get("attribute"));
            assertEquals("resolve-entity", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forResolution("corr-123", "SDESIGN", "group").with("studies", "3");
        assertEquals("3", MDC.get("studies"));

        ctx.close();

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("attribute"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("studies"));
    }

    @Test
    @DisplayName("Closing a nested context should restore the outer values")
    void nestedContextRestoresOuterValues() {
        try (LogContext outer = LogContext.forResolution("outer", "ROUTE", "entity")) {
            try (LogContext inner = LogContext.forResolution("inner", "SDESIGN", "group")) {
                assertEquals("inner", MDC.get("correlationId"));
            }
            assertEquals("outer", MDC.get("correlationId"));
            assertEquals("ROUTE", MDC.get("attribute"));
            assertEquals("resolve-entity", MDC.get("operation"));
        }
        assertNull(MDC.get("correlationId"));
    }

    @Test
    @DisplayName("generateCorrelationId should return unique values")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
