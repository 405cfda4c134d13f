package io.surfworks.tileforge.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Unit tests for TraceException.
 */
@DisplayName("TraceException Unit Tests")
class TraceExceptionTest {

    @Test
    @DisplayName("Should create exception with message and error code")
    void testMessageErrorCodeConstructor() {
        TraceException ex = new TraceException("Already in kernel",
                TraceException.ErrorCode.NESTED_KERNEL);

        assertEquals("Already in kernel", ex.getMessage());
        assertEquals(TraceException.ErrorCode.NESTED_KERNEL, ex.errorCode());
        assertNull(ex.getCause());
    }

    @Test
    @DisplayName("Should create exception with message, error code and cause")
    void testFullConstructor() {
        Throwable cause = new IllegalStateException("frozen");
        TraceException ex = new TraceException("Cannot record", TraceException.ErrorCode.SCOPE_ERROR, cause);

        assertSame(cause, ex.getCause());
        assertEquals(TraceException.ErrorCode.SCOPE_ERROR, ex.errorCode());
    }

    @Test
    @DisplayName("Should create scope errors through the factory")
    void testScopeFactory() {
        TraceException ex = TraceException.scope("outside kernel");

        assertEquals("outside kernel", ex.getMessage());
        assertEquals(TraceException.ErrorCode.SCOPE_ERROR, ex.errorCode());
    }

    @Test
    @DisplayName("Should be unchecked")
    void testUnchecked() {
        assertInstanceOf(RuntimeException.class,
                new TraceException("x", TraceException.ErrorCode.LOOKUP_FAILURE));
    }

    @Test
    @DisplayName("Should define every trace error code")
    void testErrorCodes() {
        assertEquals(5, TraceException.ErrorCode.values().length);
        assertEquals(TraceException.ErrorCode.DUPLICATE_STEP_DEFINITION,
                TraceException.ErrorCode.valueOf("DUPLICATE_STEP_DEFINITION"));
    }
}
