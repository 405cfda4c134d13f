package io.surfworks.tileforge.trace;

import io.surfworks.tileforge.graph.Handle;
import io.surfworks.tileforge.graph.KernelNode;
import io.surfworks.tileforge.graph.LaunchConfig;
import io.surfworks.tileforge.graph.LoopNode;
import io.surfworks.tileforge.graph.StepNode;
import io.surfworks.tileforge.graph.StepOrigin;
import io.surfworks.tileforge.symbolic.Coord;
import io.surfworks.tileforge.symbolic.SymbolicInt;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Entry points a traced program calls for kernel launches, loops and steps.
 *
 * <p>Each entry point has two behaviours, chosen on every call:
 * <ul>
 *   <li><b>Recording</b> (a {@link RecordingGate} is recording and a
 *       {@link GraphContext} is active): the construct is recorded in the current
 *       context and its body runs once with a symbolic index.</li>
 *   <li><b>Execute</b> (otherwise): the body runs concretely and nothing is recorded.</li>
 * </ul>
 */
public final class Tracer {

    private static final Logger LOG = Logger.getLogger(Tracer.class.getName());

    private Tracer() {}

    /**
     * Returns the context that entry points on this thread would record into.
     */
    public static Optional<GraphContext> recordingContext() {
        if (!RecordingGate.isRecording()) {
            return Optional.empty();
        }
        return GraphContext.current();
    }

    public static boolean isRecording() {
        return recordingContext().isPresent();
    }

    public static void launch(String name, LaunchConfig config, KernelBody body) {
        launch(name, config, Coord.unbound(), List.of(), List.of(), body);
    }

    public static void launch(String name, LaunchConfig config, List<Handle> inputs, List<Handle> outputs,
                              KernelBody body) {
        launch(name, config, Coord.unbound(), inputs, outputs, body);
    }

    /**
     * Launches a kernel.
     *
     * <p>Recording opens the kernel, runs {@code body} once with the grid induction
     * symbol and closes the kernel. Executing runs {@code body} once per block of
     * {@code config}, in linear block order.
     *
     * @param tagTemplate coordinate the grid loop's tag is bound from
     */
    public static void launch(String name, LaunchConfig config, Coord tagTemplate,
                              List<Handle> inputs, List<Handle> outputs, KernelBody body) {
        Optional<GraphContext> context = recordingContext();
        if (context.isPresent()) {
            GraphContext ctx = context.get();
            KernelNode kernel = ctx.openKernel(name, config, tagTemplate, inputs, outputs);
            body.run(kernel.gridLoop().induction());
            ctx.closeKernel();
            return;
        }
        long blocks = config.totalBlocks();
        LOG.fine("Executing kernel " + name + " over " + blocks + " block(s)");
        for (long block = 0; block < blocks; block++) {
            body.run(SymbolicInt.of(block));
        }
    }

    public static void range(long stop, LoopBody body) {
        range(0, stop, 1, body);
    }

    /**
     * Runs a loop from {@code start} (inclusive) to {@code stop} (exclusive).
     *
     * <p>Recording opens a loop under the current scope, runs {@code body} once with
     * the loop's induction symbol and closes it. Executing iterates concretely.
     *
     * @throws IllegalArgumentException if {@code step} is zero
     */
    public static void range(long start, long stop, long step, LoopBody body) {
        if (step == 0) {
            throw new IllegalArgumentException("range step cannot be zero");
        }
        Optional<GraphContext> context = recordingContext();
        if (context.isPresent()) {
            GraphContext ctx = context.get();
            LoopNode loop = ctx.openLoop();
            body.run(loop.induction());
            ctx.closeLoop();
            return;
        }
        long trips = tripCount(start, stop, step);
        long i = start;
        for (long n = 0; Long.compareUnsigned(n, trips) < 0; n++) {
            body.run(SymbolicInt.of(i));
            if (Long.compareUnsigned(n + 1, trips) < 0) {
                i += step;
            }
        }
    }

    // Iterations of range(start, stop, step) as an unsigned count; start and stop
    // may lie anywhere in the long range.
    static long tripCount(long start, long stop, long step) {
        if (step > 0) {
            if (stop <= start) {
                return 0;
            }
            long span = stop - start;
            return Long.divideUnsigned(span - 1, step) + 1;
        }
        if (stop >= start) {
            return 0;
        }
        long span = start - stop;
        // -Long.MIN_VALUE wraps to itself, which reads as 2^63 unsigned
        return Long.divideUnsigned(span - 1, -step) + 1;
    }

    /**
     * Records a step invocation when recording.
     *
     * @return the recorded node, or empty when executing
     */
    public static Optional<StepNode> step(StepOrigin origin, Coord tag, List<Handle> inputs, List<Handle> outputs) {
        Optional<GraphContext> context = recordingContext();
        if (context.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(context.get().recordStep(origin, tag, inputs, outputs));
    }
}
