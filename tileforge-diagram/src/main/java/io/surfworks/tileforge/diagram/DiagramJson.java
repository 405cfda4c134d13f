package io.surfworks.tileforge.diagram;

import io.surfworks.tileforge.symbolic.Coord;
import io.surfworks.tileforge.symbolic.Coords;
import io.surfworks.tileforge.symbolic.ExprTree;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON export of diagrams and coordinate expression trees.
 *
 * <p>A diagram is written as:
 * <pre>
 * {
 *   "nodes": [{"id": "0", "label": "add_kernel", "shape": "box", "kind": "KERNEL"}],
 *   "edges": [{"from": "0", "to": "1", "label": "tile0", "constraint": true}],
 *   "sameRank": ["0", "1"]
 * }
 * </pre>
 * Expression trees use a {@code "type"} discriminator: {@code Constant},
 * {@code Name}, {@code Tuple}, {@code BinOp} and {@code UnaryOp}.
 */
public final class DiagramJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();

    private DiagramJson() {}

    public static JsonObject toJson(DiagramGraph graph) {
        JsonArray nodes = new JsonArray();
        for (DiagramNode node : graph.nodes()) {
            JsonObject json = new JsonObject();
            json.addProperty("id", node.id());
            json.addProperty("label", node.label());
            json.addProperty("shape", node.shape().dotName());
            json.addProperty("kind", node.kind().name());
            nodes.add(json);
        }

        JsonArray edges = new JsonArray();
        for (DiagramEdge edge : graph.edges()) {
            JsonObject json = new JsonObject();
            json.addProperty("from", edge.from());
            json.addProperty("to", edge.to());
            json.addProperty("label", edge.label());
            json.addProperty("constraint", edge.constraint());
            edges.add(json);
        }

        JsonObject root = new JsonObject();
        root.add("nodes", nodes);
        root.add("edges", edges);
        root.add("sameRank", GSON.toJsonTree(graph.sameRank()));
        return root;
    }

    /**
     * Converts a coordinate's expression tree to JSON.
     */
    public static JsonElement toJson(Coord coord) {
        return toJson(Coords.toExprTree(coord));
    }

    public static JsonElement toJson(ExprTree tree) {
        JsonObject json = new JsonObject();
        if (tree instanceof ExprTree.Constant constant) {
            json.addProperty("type", "Constant");
            if (constant.value() == null) {
                json.add("value", JsonNull.INSTANCE);
            } else {
                json.addProperty("value", constant.value());
            }
        } else if (tree instanceof ExprTree.Name name) {
            json.addProperty("type", "Name");
            json.addProperty("id", name.id());
        } else if (tree instanceof ExprTree.Tuple tuple) {
            json.addProperty("type", "Tuple");
            JsonArray elements = new JsonArray();
            for (ExprTree element : tuple.elements()) {
                elements.add(toJson(element));
            }
            json.add("elements", elements);
        } else if (tree instanceof ExprTree.BinaryOp op) {
            json.addProperty("type", "BinOp");
            json.addProperty("op", op.op());
            json.add("left", toJson(op.left()));
            json.add("right", toJson(op.right()));
        } else {
            ExprTree.UnaryOp op = (ExprTree.UnaryOp) tree;
            json.addProperty("type", "UnaryOp");
            json.addProperty("op", op.op());
            json.add("operand", toJson(op.operand()));
        }
        return json;
    }

    public static String render(DiagramGraph graph) {
        return GSON.toJson(toJson(graph));
    }

    public static String render(JsonElement element) {
        return GSON.toJson(element);
    }

    /**
     * Writes the JSON form of {@code graph} to {@code path}, creating parent directories.
     */
    public static void write(DiagramGraph graph, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, render(graph), StandardCharsets.UTF_8);
    }
}
