package io.surfworks.tileforge.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic text listing of a node subtree.
 *
 * <p>Pre-order and depth-first: a kernel lists itself then its grid loop; a loop
 * lists itself then each child one level deeper; a step lists only itself.
 *
 * <pre>
 * [Kernel] add_kernel id=0
 *   &lt;GridLoop&gt; tile0 [(tile0, _)] id=1
 *     &lt;Loop&gt; coord0 [(tile0, coord0)] id=2
 *       &lt;Step&gt; load [(tile0, coord0)] id=3
 * </pre>
 */
public final class GraphDump {

    public static final String INDENT = "  ";

    private GraphDump() {}

    /**
     * Dumps a subtree, one node per line.
     */
    public static List<String> dump(Node root) {
        List<String> lines = new ArrayList<>();
        append(root, 0, lines);
        return Collections.unmodifiableList(lines);
    }

    /**
     * Dumps a subtree as a single newline-joined string.
     */
    public static String dumpToString(Node root) {
        return String.join("\n", dump(root));
    }

    private static void append(Node node, int level, List<String> lines) {
        lines.add(INDENT.repeat(level) + node.describe());
        switch (node.kind()) {
            case KERNEL -> append(((KernelNode) node).gridLoop(), level + 1, lines);
            case LOOP -> {
                for (Node child : ((LoopNode) node).children()) {
                    append(child, level + 1, lines);
                }
            }
            case STEP -> {
                // leaf
            }
        }
    }
}
