package io.surfworks.tileforge.lift;

import io.surfworks.tileforge.config.TraceOptions;
import io.surfworks.tileforge.diagram.DiagramFlattener;
import io.surfworks.tileforge.diagram.DiagramGraph;
import io.surfworks.tileforge.diagram.DiagramJson;
import io.surfworks.tileforge.diagram.DotWriter;
import io.surfworks.tileforge.graph.KernelNode;
import io.surfworks.tileforge.trace.GraphContext;
import io.surfworks.tileforge.trace.RecordingGate;
import io.surfworks.tileforge.trace.TraceException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Traces a program and optionally writes its graph artifacts.
 *
 * <p>The program runs once under a fresh {@link GraphContext} with recording on.
 * When {@link TraceOptions#generateGraph()} is set, the lifter writes into
 * {@link TraceOptions#dumpDir()}:
 * <ul>
 *   <li>{@code <name>.txt}: the text dump of every kernel</li>
 *   <li>{@code <name>.dot}, {@code <name>.json}: the diagram of each kernel; with
 *       more than one kernel the files are {@code <name>-<index>.dot} and so on, numbered in launch order</li>
 * </ul>
 */
public final class Lifter {

    private static final Logger LOG = Logger.getLogger(Lifter.class.getName());

    private final TraceOptions options;

    public Lifter() {
        this(TraceOptions.fromSystemProperties());
    }

    public Lifter(TraceOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    public TraceOptions options() {
        return options;
    }

    /**
     * Traces {@code program} and writes artifacts if enabled.
     *
     * @throws TraceException if the program breaks scope discipline or leaves a kernel open
     * @throws IOException    if an artifact cannot be written
     */
    public LiftResult lift(String name, TracedProgram program) throws IOException {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(program, "program cannot be null");

        GraphContext context = new GraphContext(options);
        try (GraphContext active = context.enter();
             RecordingGate gate = RecordingGate.recording()) {
            program.run();
            if (active.state() != GraphContext.State.IDLE) {
                throw new TraceException(name + " finished with kernel "
                        + active.currentKernel().map(KernelNode::name).orElse("?") + " still open",
                        TraceException.ErrorCode.SCOPE_ERROR);
            }
        }

        List<KernelNode> kernels = context.kernels();
        List<DiagramGraph> diagrams = new ArrayList<>(kernels.size());
        for (KernelNode kernel : kernels) {
            diagrams.add(DiagramFlattener.flatten(kernel));
        }
        List<String> dump = context.dumpAll();
        LOG.fine("Lifted " + name + ": " + kernels.size() + " kernel(s), " + context.nodeCount() + " node(s)");

        List<Path> artifacts = options.generateGraph()
                ? writeArtifacts(name, kernels, diagrams, dump)
                : List.of();
        return new LiftResult(name, context, kernels, diagrams, dump, artifacts);
    }

    private List<Path> writeArtifacts(String name, List<KernelNode> kernels, List<DiagramGraph> diagrams,
                                      List<String> dump) throws IOException {
        Path dir = options.dumpDir();
        Files.createDirectories(dir);
        List<Path> written = new ArrayList<>();

        Path text = dir.resolve(name + ".txt");
        Files.write(text, dump, StandardCharsets.UTF_8);
        written.add(text);

        for (int i = 0; i < diagrams.size(); i++) {
            String base = diagrams.size() == 1 ? name : name + "-" + i;
            Path dot = dir.resolve(base + ".dot");
            DotWriter.write(diagrams.get(i), kernels.get(i).name(), dot);
            written.add(dot);

            Path json = dir.resolve(base + ".json");
            DiagramJson.write(diagrams.get(i), json);
            written.add(json);
        }
        LOG.info("Wrote " + written.size() + " graph artifact(s) for " + name + " to " + dir.toAbsolutePath());
        return written;
    }
}
