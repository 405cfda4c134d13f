package io.surfworks.tileforge.trace;

/**
 * Recording mode: kernel launches, loop headers and step invocations build
 * Kernel/Loop/Step nodes in the active {@link GraphContext}.
 *
 * <p>Recording has no effect unless a context has been entered:
 * <pre>{@code
 * try (GraphContext ctx = new GraphContext().enter();
 *      RecordingGate gate = RecordingGate.recording()) {
 *     Tracer.launch("add_kernel", LaunchConfig.of1D(4, 128), grid -> { ... });
 * }
 * }</pre>
 *
 * @see RecordingGate
 * @see Execute
 */
public record Recording() implements TraceMode {

    public static final Recording INSTANCE = new Recording();

    @Override
    public boolean isRecording() {
        return true;
    }

    @Override
    public String modeName() {
        return "recording";
    }
}
