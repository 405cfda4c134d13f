package io.surfworks.tileforge.diagram;

import java.util.Objects;

/**
 * A directed edge between two drawn nodes.
 *
 * @param from       source node id
 * @param to         target node id
 * @param label      edge text, or null
 * @param constraint false for loop back-edges, which must not affect layout
 */
public record DiagramEdge(String from, String to, String label, boolean constraint) {

    public DiagramEdge {
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(to, "to cannot be null");
    }

    public static DiagramEdge flow(String from, String to, String label) {
        return new DiagramEdge(from, to, label, true);
    }

    public static DiagramEdge backEdge(String from, String to) {
        return new DiagramEdge(from, to, null, false);
    }

    public boolean isBackEdge() {
        return !constraint;
    }
}
