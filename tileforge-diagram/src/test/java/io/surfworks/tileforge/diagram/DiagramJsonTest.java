package io.surfworks.tileforge.diagram;

import io.surfworks.tileforge.graph.NodeKind;
import io.surfworks.tileforge.symbolic.Coord;
import io.surfworks.tileforge.symbolic.SymbolicInt;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DiagramJson")
class DiagramJsonTest {

    private static final DiagramGraph GRAPH = new DiagramGraph(
            List.of(new DiagramNode("0", "K", Shape.BOX, NodeKind.KERNEL),
                    new DiagramNode("1", "for\ntag=tile0", Shape.DIAMOND, NodeKind.LOOP)),
            List.of(DiagramEdge.flow("0", "1", null), DiagramEdge.backEdge("1", "0")),
            List.of("0", "1"));

    @Test
    @DisplayName("diagram nodes, edges and rank group are exported")
    void diagram() {
        JsonObject json = DiagramJson.toJson(GRAPH);

        JsonObject loop = json.getAsJsonArray("nodes").get(1).getAsJsonObject();
        assertEquals("diamond", loop.get("shape").getAsString());
        assertEquals("LOOP", loop.get("kind").getAsString());
        assertEquals("for\ntag=tile0", loop.get("label").getAsString());

        JsonArray edges = json.getAsJsonArray("edges");
        assertTrue(edges.get(0).getAsJsonObject().get("label").isJsonNull());
        assertEquals(false, edges.get(1).getAsJsonObject().get("constraint").getAsBoolean());
        assertEquals(2, json.getAsJsonArray("sameRank").size());
    }

    @Test
    @DisplayName("coordinate expression trees use a type discriminator")
    void coordinate() {
        Coord tag = Coord.of(SymbolicInt.symbol("tile0").multiply(4), null);

        JsonObject tuple = DiagramJson.toJson(tag).getAsJsonObject();
        assertEquals("Tuple", tuple.get("type").getAsString());

        JsonObject product = tuple.getAsJsonArray("elements").get(0).getAsJsonObject();
        assertEquals("BinOp", product.get("type").getAsString());
        assertEquals("*", product.get("op").getAsString());
        assertEquals("tile0", product.getAsJsonObject("left").get("id").getAsString());
        assertEquals(4, product.getAsJsonObject("right").get("value").getAsLong());

        JsonObject hole = tuple.getAsJsonArray("elements").get(1).getAsJsonObject();
        assertEquals("Constant", hole.get("type").getAsString());
        assertTrue(hole.get("value").isJsonNull());
    }

    @Test
    @DisplayName("rendered text keeps null labels")
    void renderKeepsNulls() {
        assertTrue(DiagramJson.render(GRAPH).contains("\"label\": null"));
    }

    @Test
    @DisplayName("written file parses back to the same tree")
    void write(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("graph.json");
        DiagramJson.write(GRAPH, file);

        assertEquals(DiagramJson.toJson(GRAPH), JsonParser.parseString(Files.readString(file)));
    }
}
