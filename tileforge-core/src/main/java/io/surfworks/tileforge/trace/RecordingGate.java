package io.surfworks.tileforge.trace;

import java.util.Objects;

/**
 * Thread-local switch between {@link Execute} and {@link Recording}.
 *
 * <p>Gates nest; closing one restores the mode that was current when it was opened:
 * <pre>{@code
 * try (RecordingGate outer = RecordingGate.recording()) {
 *     // recording
 *     try (RecordingGate inner = RecordingGate.execute()) {
 *         // a helper computation that must not appear in the graph
 *     }
 *     // recording again
 * }
 * // Execute (default)
 * }</pre>
 *
 * <p>Thread safety: each thread has its own gate. Opening a gate on one thread
 * does not affect other threads.
 *
 * <p><strong>Warning:</strong> failing to close a gate leaves the mode set for the
 * current thread. Always use try-with-resources.
 */
public final class RecordingGate implements AutoCloseable {

    private static final ThreadLocal<TraceMode> CURRENT = ThreadLocal.withInitial(() -> Execute.INSTANCE);

    private final TraceMode previous;
    private boolean closed;

    /**
     * Opens a gate, setting the current mode for this thread.
     *
     * @param mode the mode to set
     * @throws NullPointerException if mode is null
     */
    public RecordingGate(TraceMode mode) {
        Objects.requireNonNull(mode, "mode cannot be null");
        this.previous = CURRENT.get();
        this.closed = false;
        CURRENT.set(mode);
    }

    /**
     * Returns the current mode for this thread.
     */
    public static TraceMode current() {
        return CURRENT.get();
    }

    /**
     * Returns true if the current thread is recording.
     */
    public static boolean isRecording() {
        return CURRENT.get().isRecording();
    }

    public static RecordingGate recording() {
        return new RecordingGate(Recording.INSTANCE);
    }

    public static RecordingGate execute() {
        return new RecordingGate(Execute.INSTANCE);
    }

    /**
     * Restores the previous mode for this thread. Idempotent.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            CURRENT.set(previous);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        if (closed) {
            return "RecordingGate[CLOSED, previous=" + previous.modeName() + "]";
        }
        return String.format("RecordingGate[current=%s, previous=%s]",
                CURRENT.get().modeName(), previous.modeName());
    }
}
