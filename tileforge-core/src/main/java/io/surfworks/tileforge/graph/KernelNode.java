package io.surfworks.tileforge.graph;

import io.surfworks.tileforge.symbolic.Coord;

import java.util.List;
import java.util.Objects;

/**
 * A traced kernel launch.
 *
 * <p>A kernel is created together with its grid loop and owns it for life.
 * Once closed, the kernel and every loop under it reject new children.
 */
public final class KernelNode extends Node {

    private final String name;
    private final LaunchConfig launchConfig;
    private final LoopNode gridLoop;
    private final List<Handle> inputs;
    private final List<Handle> outputs;
    private boolean closed;

    /**
     * @param name         kernel name
     * @param tagTemplate  coordinate the grid loop's tag is bound from
     * @param launchConfig grid and block dimensions
     * @param gridLoop     the kernel's grid loop, created for this kernel only
     * @param inputs       kernel arguments read
     * @param outputs      kernel arguments written
     */
    public KernelNode(String name, Coord tagTemplate, LaunchConfig launchConfig, LoopNode gridLoop,
                      List<Handle> inputs, List<Handle> outputs) {
        super(tagTemplate);
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.launchConfig = Objects.requireNonNull(launchConfig, "launchConfig cannot be null");
        this.gridLoop = Objects.requireNonNull(gridLoop, "gridLoop cannot be null");
        if (!gridLoop.isGridLoop()) {
            throw new IllegalArgumentException("Kernel requires a grid loop, got " + gridLoop);
        }
        if (gridLoop.kernel() != null) {
            throw new IllegalArgumentException("Grid loop already owned by " + gridLoop.kernel().name());
        }
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        gridLoop.ownedBy(this);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.KERNEL;
    }

    @Override
    public List<String> targets() {
        return List.of();
    }

    public String name() {
        return name;
    }

    public LaunchConfig launchConfig() {
        return launchConfig;
    }

    public LoopNode gridLoop() {
        return gridLoop;
    }

    public List<Handle> inputs() {
        return inputs;
    }

    public List<Handle> outputs() {
        return outputs;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Marks this kernel closed and freezes its loops.
     *
     * @throws IllegalStateException if already closed
     */
    public void close() {
        if (closed) {
            throw new IllegalStateException("Kernel " + name + " already closed");
        }
        closed = true;
        gridLoop.freeze();
    }

    @Override
    public String describe() {
        return "[Kernel] " + name + " id=" + id();
    }
}
