package io.surfworks.tileforge.graph;

import io.surfworks.tileforge.symbolic.Coord;

import java.util.List;
import java.util.Objects;

/**
 * A node of the traced Kernel/Loop/Step tree.
 *
 * <p>The hierarchy is closed: every node is a {@link KernelNode}, {@link LoopNode}
 * or {@link StepNode}, discriminated by {@link #kind()}. Nodes are created once,
 * when the construct they stand for starts executing, and are never removed.
 *
 * <p>Ids are assigned by the owning context on registration and are never reused.
 * The parent reference is a lookup-only back pointer; ownership runs from a loop
 * to its children.
 */
public abstract sealed class Node permits KernelNode, LoopNode, StepNode {

    /**
     * Id of a node not yet registered with a context.
     */
    public static final int UNASSIGNED = -1;

    private final Coord tag;
    private int id = UNASSIGNED;
    private LoopNode parent;
    private boolean visualize;

    protected Node(Coord tag) {
        this.tag = Objects.requireNonNull(tag, "tag cannot be null");
    }

    public abstract NodeKind kind();

    /**
     * Names this node declares as produced; used to label the next diagram edge.
     */
    public abstract List<String> targets();

    public Coord tag() {
        return tag;
    }

    public int id() {
        return id;
    }

    public boolean isRegistered() {
        return id != UNASSIGNED;
    }

    /**
     * Assigns the registration id. Called once by the owning context.
     *
     * @throws IllegalStateException if an id was already assigned
     */
    public void assignId(int id) {
        if (id < 0) {
            throw new IllegalArgumentException("id must be >= 0, got " + id);
        }
        if (this.id != UNASSIGNED) {
            throw new IllegalStateException("Node already has id " + this.id + ": " + this);
        }
        this.id = id;
    }

    /**
     * Returns the enclosing loop, or null for kernels and grid loops.
     */
    public LoopNode parent() {
        return parent;
    }

    void attachTo(LoopNode parent) {
        if (this.parent != null) {
            throw new IllegalStateException(this + " already has parent " + this.parent);
        }
        this.parent = parent;
    }

    /**
     * Returns true if diagram flattening should draw this node.
     */
    public boolean visualize() {
        return visualize;
    }

    public void setVisualize(boolean visualize) {
        this.visualize = visualize;
    }

    /**
     * Returns the first line of this node's dump, without indentation.
     */
    public abstract String describe();

    @Override
    public String toString() {
        return describe();
    }
}
