package io.surfworks.tileforge.trace;

/**
 * Thrown when a traced program violates the graph-building discipline.
 *
 * <p>Every error code marks a bug in the traced program or its instrumentation,
 * never a transient failure. The trace that raised it should be abandoned.
 */
public class TraceException extends RuntimeException {

    private final ErrorCode errorCode;

    public TraceException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public TraceException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    static TraceException scope(String message) {
        return new TraceException(message, ErrorCode.SCOPE_ERROR);
    }

    /**
     * Trace error codes.
     */
    public enum ErrorCode {
        /** Closing a scope that is not open, or loop/step work outside a kernel */
        SCOPE_ERROR,

        /** Opening a kernel while another kernel is open */
        NESTED_KERNEL,

        /** The same node object registered twice */
        DUPLICATE_NODE,

        /** One step identity bound to two different step definitions */
        DUPLICATE_STEP_DEFINITION,

        /** A tag parameter name not declared by the step */
        LOOKUP_FAILURE
    }
}
