package io.surfworks.tileforge.trace;

/**
 * Plain execution: every entry point passes straight through to the computation.
 *
 * <p>Execute is the default when no {@link RecordingGate} is active.
 *
 * @see RecordingGate
 * @see Recording
 */
public record Execute() implements TraceMode {

    public static final Execute INSTANCE = new Execute();

    @Override
    public boolean isRecording() {
        return false;
    }

    @Override
    public String modeName() {
        return "execute";
    }
}
