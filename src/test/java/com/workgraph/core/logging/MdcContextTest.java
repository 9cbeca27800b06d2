package com.workgraph.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("item scope puts itemId in MDC and removes it on close")
    void item() {
        try (var scope = MdcContext.item("feat-1a2b3c4d")) {
            assertEquals("feat-1a2b3c4d", MDC.get("itemId"));
        }
        assertNull(MDC.get("itemId"));
    }

    @Test
    @DisplayName("operation scope records both keys")
    void operationWithVersion() {
        try (var scope = MdcContext.operation("bottlenecks", 42)) {
            assertEquals("bottlenecks", MDC.get("operation"));
            assertEquals("42", MDC.get("indexVersion"));
        }
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("indexVersion"));
    }

    @Test
    @DisplayName("closing a scope leaves unrelated keys alone")
    void keepsUnrelatedKeys() {
        MDC.put("requestId", "r-1");
        MDC.put("itemId", "a");

        try (var scope = MdcContext.operation("rebuild", 7)) {
            assertEquals("a", MDC.get("itemId"));
        }

        assertEquals("r-1", MDC.get("requestId"));
        assertEquals("a", MDC.get("itemId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("nested scopes restore the outer values")
    void nested() {
        try (var outer = MdcContext.operation("apply", 3)) {
            try (var inner = MdcContext.operation("rebuild", 3)) {
                assertEquals("rebuild", MDC.get("operation"));
            }
            assertEquals("apply", MDC.get("operation"));
            assertEquals("3", MDC.get("indexVersion"));
        }
        assertNull(MDC.get("operation"));
    }
}
