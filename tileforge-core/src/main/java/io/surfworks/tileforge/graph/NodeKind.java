package io.surfworks.tileforge.graph;

/**
 * Discriminator for the closed {@link Node} hierarchy.
 */
public enum NodeKind {
    KERNEL,
    LOOP,
    STEP
}
