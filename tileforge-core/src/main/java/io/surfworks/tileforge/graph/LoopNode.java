package io.surfworks.tileforge.graph;

import io.surfworks.tileforge.symbolic.Coord;
import io.surfworks.tileforge.symbolic.SymbolicInt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A loop scope: an induction variable plus the ordered nodes executed in its body.
 *
 * <p>Every kernel owns exactly one grid loop, the outermost loop over the launch
 * grid. Grid loops have no parent; all other loops hang off an enclosing loop.
 */
public final class LoopNode extends Node {

    private final SymbolicInt.Symbol induction;
    private final boolean gridLoop;
    private final List<Node> children = new ArrayList<>();
    private KernelNode kernel;
    private boolean frozen;

    private LoopNode(Coord tag, SymbolicInt.Symbol induction, boolean gridLoop) {
        super(tag);
        this.induction = Objects.requireNonNull(induction, "induction cannot be null");
        this.gridLoop = gridLoop;
    }

    /**
     * Creates the grid loop for a kernel being launched.
     */
    public static LoopNode grid(Coord tag, SymbolicInt.Symbol induction) {
        return new LoopNode(tag, induction, true);
    }

    /**
     * Creates a nested loop; attach it with {@link #addChild(Node)}.
     */
    public static LoopNode nested(Coord tag, SymbolicInt.Symbol induction) {
        return new LoopNode(tag, induction, false);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOOP;
    }

    @Override
    public List<String> targets() {
        return List.of(induction.name());
    }

    public SymbolicInt.Symbol induction() {
        return induction;
    }

    public boolean isGridLoop() {
        return gridLoop;
    }

    /**
     * Returns the owning kernel for a grid loop, otherwise the kernel of the
     * enclosing grid loop, or null if not yet attached.
     */
    public KernelNode kernel() {
        if (gridLoop) {
            return kernel;
        }
        LoopNode p = parent();
        return p != null ? p.kernel() : null;
    }

    void ownedBy(KernelNode kernel) {
        this.kernel = kernel;
    }

    /**
     * Appends a child to this loop's body and sets its parent.
     *
     * @throws IllegalStateException if the child is a grid loop, already has a
     *         parent, or the enclosing kernel has been closed
     */
    public void addChild(Node child) {
        Objects.requireNonNull(child, "child cannot be null");
        if (frozen) {
            throw new IllegalStateException("Cannot add " + child + " to closed loop " + describe());
        }
        if (child instanceof KernelNode) {
            throw new IllegalStateException("Kernels cannot be nested in loops: " + child);
        }
        if (child instanceof LoopNode loop && loop.isGridLoop()) {
            throw new IllegalStateException("Grid loop cannot be a child: " + child);
        }
        child.attachTo(this);
        children.add(child);
    }

    /**
     * Returns the body nodes in execution order.
     */
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Nesting depth below the grid loop; the grid loop itself is 0.
     */
    public int depth() {
        int depth = 0;
        for (LoopNode p = parent(); p != null; p = p.parent()) {
            depth++;
        }
        return depth;
    }

    public boolean isFrozen() {
        return frozen;
    }

    void freeze() {
        frozen = true;
        for (Node child : children) {
            if (child instanceof LoopNode loop) {
                loop.freeze();
            }
        }
    }

    @Override
    public String describe() {
        String label = gridLoop ? "<GridLoop>" : "<Loop>";
        return label + " " + induction.name() + " [" + tag().toText() + "] id=" + id();
    }
}
