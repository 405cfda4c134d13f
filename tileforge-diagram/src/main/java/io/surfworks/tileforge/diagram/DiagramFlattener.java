package io.surfworks.tileforge.diagram;

import io.surfworks.tileforge.graph.KernelNode;
import io.surfworks.tileforge.graph.LoopNode;
import io.surfworks.tileforge.graph.Node;
import io.surfworks.tileforge.graph.NodeKind;
import io.surfworks.tileforge.graph.StepNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flattens a Kernel/Loop/Step tree into a left-to-right dataflow chain.
 *
 * <p>The traversal is depth-first. Each drawn node is connected to the most
 * recently drawn node; nodes whose {@link Node#visualize()} flag is off are not
 * drawn, but their children are still visited so the chain stays connected.
 *
 * <p>Edge labels follow what produced the value flowing along the edge:
 * <ul>
 *   <li>the first edge inside a loop body is labeled with the loop's induction variable;</li>
 *   <li>every edge after a drawn step is labeled with that step's targets;</li>
 *   <li>leaving a loop keeps the label of the last step inside it, so the edge
 *       out of a nested loop names the value the loop produced.</li>
 * </ul>
 * A drawn loop with a drawn body also gets a back-edge from its last body node
 * to itself, marked as not affecting layout. A loop's body is spliced into the
 * surrounding chain: the node after the loop connects to the loop's last drawn
 * descendant, not to the loop.
 *
 * <pre>
 * K -&gt; tile0 -[tile0]-&gt; A -[a]-&gt; coord0 -[coord0]-&gt; B -[b]-&gt; C
 *                                 ^--------------------'
 * </pre>
 */
public final class DiagramFlattener {

    private final List<DiagramNode> nodes = new ArrayList<>();
    private final List<DiagramEdge> edges = new ArrayList<>();
    private final List<String> drawn = new ArrayList<>();

    private DiagramFlattener() {}

    /**
     * Flattens the subtree rooted at {@code root}.
     */
    public static DiagramGraph flatten(Node root) {
        Objects.requireNonNull(root, "root cannot be null");
        DiagramFlattener flattener = new DiagramFlattener();
        flattener.visit(root, null, null);
        return new DiagramGraph(flattener.nodes, flattener.edges, flattener.drawn);
    }

    // Result of visiting a subtree: the node the next sibling chains from, the
    // label of the next edge, and whether any step inside set that label.
    private record Visit(String last, String label, boolean labeled) {
    }

    private Visit visit(Node node, String predecessor, String label) {
        String id = node.visualize() ? draw(node, predecessor, label) : null;
        return switch (node.kind()) {
            case KERNEL -> visitKernel((KernelNode) node, id, predecessor, label);
            case LOOP -> visitLoop((LoopNode) node, id, predecessor, label);
            case STEP -> visitStep((StepNode) node, id, predecessor, label);
        };
    }

    private Visit visitKernel(KernelNode kernel, String id, String predecessor, String label) {
        return visit(kernel.gridLoop(), id != null ? id : predecessor, label);
    }

    private Visit visitLoop(LoopNode loop, String id, String predecessor, String label) {
        String chain = id != null ? id : predecessor;
        String bodyLabel = targetLabel(loop);
        String lastBody = null;
        boolean labeled = false;

        for (Node child : loop.children()) {
            Visit visit = visit(child, chain, bodyLabel);
            if (visit.last() != null && !visit.last().equals(chain)) {
                lastBody = visit.last();
                chain = visit.last();
            }
            bodyLabel = visit.label();
            labeled |= visit.labeled();
        }

        if (id != null && lastBody != null && !lastBody.equals(id)) {
            edges.add(DiagramEdge.backEdge(lastBody, id));
        }
        String last = lastBody != null ? lastBody : (id != null ? id : predecessor);
        return labeled ? new Visit(last, bodyLabel, true) : new Visit(last, label, false);
    }

    private Visit visitStep(StepNode step, String id, String predecessor, String label) {
        if (id == null) {
            return new Visit(predecessor, label, false);
        }
        return new Visit(id, targetLabel(step), true);
    }

    private String draw(Node node, String predecessor, String label) {
        String id = Integer.toString(nodes.size());
        nodes.add(new DiagramNode(id, labelOf(node), shapeOf(node), node.kind()));
        drawn.add(id);
        if (predecessor != null) {
            edges.add(DiagramEdge.flow(predecessor, id, label));
        }
        return id;
    }

    static String labelOf(Node node) {
        return switch (node.kind()) {
            case KERNEL -> ((KernelNode) node).name();
            case LOOP -> "for\ntag=" + node.tag().toText();
            case STEP -> ((StepNode) node).name() + "\ntag=" + node.tag().toText();
        };
    }

    static Shape shapeOf(Node node) {
        return node.kind() == NodeKind.LOOP ? Shape.DIAMOND : Shape.BOX;
    }

    // Comma-joined targets, or null when the node declares none.
    private static String targetLabel(Node node) {
        List<String> targets = node.targets();
        return targets.isEmpty() ? null : String.join(", ", targets);
    }
}
