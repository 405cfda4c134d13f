package io.surfworks.tileforge.lift;

import io.surfworks.tileforge.diagram.DiagramGraph;
import io.surfworks.tileforge.graph.KernelNode;
import io.surfworks.tileforge.trace.GraphContext;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of lifting a program.
 *
 * @param name      the lifted program's name
 * @param context   the context the program was traced into
 * @param kernels   recorded kernels in launch order
 * @param diagrams  one flattened diagram per kernel, in launch order
 * @param dump      {@link GraphContext#dumpAll()} of the context
 * @param artifacts files written, empty when graph generation is off
 */
public record LiftResult(
        String name,
        GraphContext context,
        List<KernelNode> kernels,
        List<DiagramGraph> diagrams,
        List<String> dump,
        List<Path> artifacts
) {

    public LiftResult {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(context, "context cannot be null");
        kernels = List.copyOf(kernels);
        diagrams = List.copyOf(diagrams);
        dump = List.copyOf(dump);
        artifacts = List.copyOf(artifacts);
    }

    /**
     * Returns the only kernel the program launched.
     *
     * @throws IllegalStateException if the program launched zero or several kernels
     */
    public KernelNode kernel() {
        if (kernels.size() != 1) {
            throw new IllegalStateException(name + " launched " + kernels.size() + " kernels, expected 1");
        }
        return kernels.get(0);
    }

    public boolean wroteArtifacts() {
        return !artifacts.isEmpty();
    }
}
