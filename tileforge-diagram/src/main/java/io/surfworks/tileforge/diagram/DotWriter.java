package io.surfworks.tileforge.diagram;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Renders a {@link DiagramGraph} as Graphviz DOT source.
 *
 * <p>The layout reads left to right with rounded, filled boxes. Loop back-edges
 * carry {@code constraint=false}, and every drawn node is placed in a single
 * {@code rank=same} group so the chain stays on one line. Turning the source
 * into an image is left to the {@code dot} tool.
 */
public final class DotWriter {

    private static final String FILL_COLOR = "#a5d8ff";

    private DotWriter() {}

    public static String render(DiagramGraph graph) {
        return render(graph, "tileforge");
    }

    /**
     * Renders {@code graph} as a digraph named {@code name}.
     */
    public static String render(DiagramGraph graph, String name) {
        Objects.requireNonNull(graph, "graph cannot be null");
        Objects.requireNonNull(name, "name cannot be null");

        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(quote(name)).append(" {\n");
        sb.append("  rankdir=LR;\n");
        sb.append("  splines=spline;\n");
        sb.append("  nodesep=0.8;\n");
        sb.append("  ranksep=0.8;\n");
        sb.append("  node [shape=box, style=\"rounded,filled\", fillcolor=\"").append(FILL_COLOR).append("\"];\n");
        sb.append("  edge [arrowsize=0.7];\n");

        for (DiagramNode node : graph.nodes()) {
            sb.append("  ").append(quote(node.id()))
              .append(" [label=").append(quote(node.label()))
              .append(", shape=").append(node.shape().dotName())
              .append(", fontsize=10];\n");
        }

        for (DiagramEdge edge : graph.edges()) {
            sb.append("  ").append(quote(edge.from())).append(" -> ").append(quote(edge.to()));
            if (edge.label() != null) {
                sb.append(" [label=").append(quote(edge.label())).append("]");
            } else if (edge.isBackEdge()) {
                sb.append(" [constraint=false]");
            }
            sb.append(";\n");
        }

        if (!graph.sameRank().isEmpty()) {
            sb.append("  { rank=same;");
            for (String id : graph.sameRank()) {
                sb.append(" ").append(quote(id)).append(";");
            }
            sb.append(" }\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Writes the DOT source for {@code graph} to {@code path}, creating parent directories.
     */
    public static void write(DiagramGraph graph, String name, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, render(graph, name), StandardCharsets.UTF_8);
    }

    // DOT double-quoted string; newlines become \n line breaks.
    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> { }
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
