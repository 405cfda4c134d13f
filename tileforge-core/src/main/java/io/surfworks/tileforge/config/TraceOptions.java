package io.surfworks.tileforge.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Options controlling how a trace is recorded and what artifacts it leaves behind.
 *
 * @param gridSymbolPrefix prefix for grid-loop induction symbols ({@code tile0}, {@code tile1}, ...)
 * @param loopSymbolPrefix prefix for nested-loop induction symbols ({@code coord0}, ...)
 * @param visualizeKernels whether kernel nodes are drawn in diagrams
 * @param visualizeLoops   whether loop nodes are drawn in diagrams
 * @param visualizeSteps   whether step nodes are drawn in diagrams
 * @param generateGraph    whether a lift writes diagram and dump artifacts
 * @param dumpDir          directory artifacts are written into
 * @param guardThread      whether a context rejects use from a thread other than its owner
 */
public record TraceOptions(
        String gridSymbolPrefix,
        String loopSymbolPrefix,
        boolean visualizeKernels,
        boolean visualizeLoops,
        boolean visualizeSteps,
        boolean generateGraph,
        Path dumpDir,
        boolean guardThread
) {

    public static final String PROP_GRID_PREFIX = "tileforge.gridPrefix";
    public static final String PROP_LOOP_PREFIX = "tileforge.loopPrefix";
    public static final String PROP_GEN_GRAPH = "tileforge.genGraph";
    public static final String PROP_DUMP_DIR = "tileforge.dumpDir";

    public static final String DEFAULT_GRID_PREFIX = "tile";
    public static final String DEFAULT_LOOP_PREFIX = "coord";

    public TraceOptions {
        Objects.requireNonNull(gridSymbolPrefix, "gridSymbolPrefix cannot be null");
        Objects.requireNonNull(loopSymbolPrefix, "loopSymbolPrefix cannot be null");
        Objects.requireNonNull(dumpDir, "dumpDir cannot be null");
        if (gridSymbolPrefix.isBlank() || loopSymbolPrefix.isBlank()) {
            throw new IllegalArgumentException("symbol prefixes cannot be blank");
        }
        if (gridSymbolPrefix.equals(loopSymbolPrefix)) {
            throw new IllegalArgumentException("grid and loop symbol prefixes must differ: " + gridSymbolPrefix);
        }
    }

    /**
     * Creates the default options: every node drawn, no artifacts written.
     */
    public static TraceOptions defaults() {
        return new TraceOptions(
                DEFAULT_GRID_PREFIX,
                DEFAULT_LOOP_PREFIX,
                true,   // draw kernels
                true,   // draw loops
                true,   // draw steps
                false,  // no artifacts
                Path.of("."),
                true    // single-thread guard
        );
    }

    /**
     * Returns the defaults overridden by any {@code tileforge.*} system properties.
     */
    public static TraceOptions fromSystemProperties() {
        return defaults().withSystemProperties();
    }

    /**
     * Returns a copy overridden by any {@code tileforge.*} system properties that are set.
     */
    public TraceOptions withSystemProperties() {
        Builder b = toBuilder();
        String grid = System.getProperty(PROP_GRID_PREFIX);
        if (grid != null && !grid.isBlank()) b.gridSymbolPrefix(grid.trim());
        String loop = System.getProperty(PROP_LOOP_PREFIX);
        if (loop != null && !loop.isBlank()) b.loopSymbolPrefix(loop.trim());
        String gen = System.getProperty(PROP_GEN_GRAPH);
        if (gen != null && !gen.isBlank()) b.generateGraph(Boolean.parseBoolean(gen.trim()));
        String dir = System.getProperty(PROP_DUMP_DIR);
        if (dir != null && !dir.isBlank()) {
            b.dumpDir(Path.of(dir.trim()));
            // Naming a dump directory implies wanting the artifacts.
            if (gen == null || gen.isBlank()) b.generateGraph(true);
        }
        return b.build();
    }

    /**
     * Returns a new options object with artifact generation into the given directory.
     */
    public TraceOptions withGraphOutput(Path dumpDir) {
        return toBuilder().generateGraph(true).dumpDir(dumpDir).build();
    }

    /**
     * Returns a new options object with the given symbol prefixes.
     */
    public TraceOptions withSymbolPrefixes(String gridPrefix, String loopPrefix) {
        return toBuilder().gridSymbolPrefix(gridPrefix).loopSymbolPrefix(loopPrefix).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .gridSymbolPrefix(gridSymbolPrefix)
                .loopSymbolPrefix(loopSymbolPrefix)
                .visualizeKernels(visualizeKernels)
                .visualizeLoops(visualizeLoops)
                .visualizeSteps(visualizeSteps)
                .generateGraph(generateGraph)
                .dumpDir(dumpDir)
                .guardThread(guardThread);
    }

    /**
     * Builder starting from {@link #defaults()}.
     */
    public static Builder builder() {
        return defaults().toBuilder();
    }

    public static class Builder {
        private String gridSymbolPrefix = DEFAULT_GRID_PREFIX;
        private String loopSymbolPrefix = DEFAULT_LOOP_PREFIX;
        private boolean visualizeKernels = true;
        private boolean visualizeLoops = true;
        private boolean visualizeSteps = true;
        private boolean generateGraph = false;
        private Path dumpDir = Path.of(".");
        private boolean guardThread = true;

        Builder() {
        }

        public Builder gridSymbolPrefix(String prefix) { this.gridSymbolPrefix = prefix; return this; }
        public Builder loopSymbolPrefix(String prefix) { this.loopSymbolPrefix = prefix; return this; }
        public Builder visualizeKernels(boolean draw) { this.visualizeKernels = draw; return this; }
        public Builder visualizeLoops(boolean draw) { this.visualizeLoops = draw; return this; }
        public Builder visualizeSteps(boolean draw) { this.visualizeSteps = draw; return this; }
        public Builder generateGraph(boolean generate) { this.generateGraph = generate; return this; }
        public Builder dumpDir(Path dir) { this.dumpDir = dir; return this; }
        public Builder guardThread(boolean guard) { this.guardThread = guard; return this; }

        public TraceOptions build() {
            return new TraceOptions(gridSymbolPrefix, loopSymbolPrefix, visualizeKernels,
                    visualizeLoops, visualizeSteps, generateGraph, dumpDir, guardThread);
        }
    }
}
