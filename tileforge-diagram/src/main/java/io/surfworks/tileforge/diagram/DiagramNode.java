package io.surfworks.tileforge.diagram;

import io.surfworks.tileforge.graph.NodeKind;

import java.util.Objects;

/**
 * A drawn node.
 *
 * @param id    decimal id, allocated in visit order
 * @param label display text; may contain newlines
 * @param shape outline
 * @param kind  kind of the graph node this was drawn from
 */
public record DiagramNode(String id, String label, Shape shape, NodeKind kind) {

    public DiagramNode {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(label, "label cannot be null");
        Objects.requireNonNull(shape, "shape cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
    }
}
