package io.surfworks.tileforge.diagram;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Backend-neutral dataflow diagram produced by {@link DiagramFlattener}.
 *
 * @param nodes    drawn nodes in visit order
 * @param edges    flow edges and loop back-edges, in creation order
 * @param sameRank ids of nodes to align on one rank
 */
public record DiagramGraph(List<DiagramNode> nodes, List<DiagramEdge> edges, List<String> sameRank) {

    public DiagramGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        sameRank = List.copyOf(sameRank);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Optional<DiagramNode> node(String id) {
        for (DiagramNode node : nodes) {
            if (node.id().equals(id)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the edges entering {@code id}, back-edges included.
     */
    public List<DiagramEdge> edgesInto(String id) {
        List<DiagramEdge> result = new ArrayList<>();
        for (DiagramEdge edge : edges) {
            if (edge.to().equals(id)) {
                result.add(edge);
            }
        }
        return result;
    }

    public List<DiagramEdge> edgesFrom(String id) {
        List<DiagramEdge> result = new ArrayList<>();
        for (DiagramEdge edge : edges) {
            if (edge.from().equals(id)) {
                result.add(edge);
            }
        }
        return result;
    }
}
