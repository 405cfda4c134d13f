package io.surfworks.tileforge.trace;

/**
 * Sealed interface selecting how traced constructs behave.
 *
 * <ul>
 *   <li>{@link Execute} - kernels, loops and steps run directly; nothing is recorded</li>
 *   <li>{@link Recording} - each construct also builds graph nodes in the active {@link GraphContext}</li>
 * </ul>
 *
 * <p>Mode is managed via {@link RecordingGate}, which provides thread-local scoping:
 * <pre>{@code
 * // Default is Execute mode
 * assert !RecordingGate.isRecording();
 *
 * try (RecordingGate gate = RecordingGate.recording()) {
 *     assert RecordingGate.isRecording();
 * }
 * }</pre>
 */
public sealed interface TraceMode permits Execute, Recording {

    /**
     * Returns true if constructs should build graph nodes.
     *
     * @return true for Recording, false for Execute
     */
    boolean isRecording();

    /**
     * Returns a human-readable name for this mode.
     *
     * @return the mode name ("execute" or "recording")
     */
    String modeName();
}
