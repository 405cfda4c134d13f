package io.surfworks.tileforge.diagram;

import io.surfworks.tileforge.config.TraceOptions;
import io.surfworks.tileforge.graph.KernelNode;
import io.surfworks.tileforge.graph.NodeKind;
import io.surfworks.tileforge.symbolic.Coord;
import io.surfworks.tileforge.trace.GraphContext;
import io.surfworks.tileforge.trace.StepDefinition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DiagramFlattener")
class DiagramFlattenerTest {

    private static StepDefinition step(String name, String output) {
        return StepDefinition.literal(name, Coord.of(0), args -> null).withOutputs(output);
    }

    // Kernel K: grid loop [StepA, loop {StepB}, StepC]
    private static KernelNode scenario(TraceOptions options) {
        GraphContext ctx = new GraphContext(options);
        KernelNode kernel = ctx.openKernel("K");
        ctx.recordStep(step("StepA", "a"), Coord.of(0));
        ctx.openLoop();
        ctx.recordStep(step("StepB", "b"), Coord.of(1));
        ctx.closeLoop();
        ctx.recordStep(step("StepC", "c"), Coord.of(2));
        return ctx.closeKernel();
    }

    @Nested
    @DisplayName("All nodes drawn")
    class AllDrawn {

        private final DiagramGraph graph = DiagramFlattener.flatten(scenario(TraceOptions.defaults()));

        @Test
        @DisplayName("nodes appear in visit order with kind-specific labels and shapes")
        void nodes() {
            assertEquals(6, graph.nodes().size());
            assertEquals(new DiagramNode("0", "K", Shape.BOX, NodeKind.KERNEL), graph.nodes().get(0));
            assertEquals(new DiagramNode("1", "for\ntag=tile0", Shape.DIAMOND, NodeKind.LOOP), graph.nodes().get(1));
            assertEquals(new DiagramNode("2", "StepA\ntag=(0)", Shape.BOX, NodeKind.STEP), graph.nodes().get(2));
            assertEquals("for\ntag=tile0", graph.nodes().get(3).label());
            assertEquals("StepB\ntag=(1)", graph.nodes().get(4).label());
            assertEquals("StepC\ntag=(2)", graph.nodes().get(5).label());
        }

        @Test
        @DisplayName("chain runs StepA, nested loop, StepB, StepC")
        void chain() {
            assertEquals(List.of(
                    DiagramEdge.flow("0", "1", null),
                    DiagramEdge.flow("1", "2", "tile0"),
                    DiagramEdge.flow("2", "3", "a"),
                    DiagramEdge.flow("3", "4", "coord0"),
                    DiagramEdge.backEdge("4", "3"),
                    DiagramEdge.flow("4", "5", "b"),
                    DiagramEdge.backEdge("5", "1")),
                    graph.edges());
        }

        @Test
        @DisplayName("edge into StepC is labeled by StepB's target")
        void labelAfterLoop() {
            List<DiagramEdge> into = graph.edgesInto("5");
            assertEquals(1, into.size());
            assertEquals("4", into.get(0).from());
            assertEquals("b", into.get(0).label());
        }

        @Test
        @DisplayName("back-edges do not constrain layout")
        void backEdges() {
            for (DiagramEdge edge : graph.edges()) {
                assertEquals(edge.isBackEdge(), !edge.constraint());
            }
            assertTrue(graph.edgesFrom("4").stream().anyMatch(DiagramEdge::isBackEdge));
        }

        @Test
        @DisplayName("every drawn node shares one rank")
        void sameRank() {
            assertEquals(List.of("0", "1", "2", "3", "4", "5"), graph.sameRank());
        }
    }

    @Nested
    @DisplayName("Hidden nodes")
    class Hidden {

        @Test
        @DisplayName("hidden loops are skipped while their bodies stay connected")
        void hiddenLoops() {
            DiagramGraph graph = DiagramFlattener.flatten(
                    scenario(TraceOptions.builder().visualizeLoops(false).build()));

            assertEquals(4, graph.nodes().size());
            assertEquals(List.of(
                    DiagramEdge.flow("0", "1", "tile0"),
                    DiagramEdge.flow("1", "2", "coord0"),
                    DiagramEdge.flow("2", "3", "b")),
                    graph.edges());
        }

        @Test
        @DisplayName("hidden steps keep the incoming label")
        void hiddenSteps() {
            DiagramGraph graph = DiagramFlattener.flatten(
                    scenario(TraceOptions.builder().visualizeSteps(false).build()));

            assertEquals(3, graph.nodes().size());
            assertEquals(List.of(
                    DiagramEdge.flow("0", "1", null),
                    DiagramEdge.flow("1", "2", "tile0"),
                    DiagramEdge.backEdge("2", "1")),
                    graph.edges());
        }

        @Test
        @DisplayName("nothing drawn yields an empty diagram")
        void nothingDrawn() {
            DiagramGraph graph = DiagramFlattener.flatten(scenario(TraceOptions.builder()
                    .visualizeKernels(false).visualizeLoops(false).visualizeSteps(false).build()));

            assertTrue(graph.isEmpty());
            assertTrue(graph.edges().isEmpty());
            assertFalse(graph.node("0").isPresent());
        }
    }

    @Test
    @DisplayName("a step without targets leaves the next edge unlabeled")
    void stepWithoutTargets() {
        GraphContext ctx = new GraphContext();
        ctx.openKernel("K");
        ctx.recordStep(StepDefinition.literal("sync", Coord.of(0), args -> null), Coord.of(0));
        ctx.recordStep(step("store", "out"), Coord.of(1));
        DiagramGraph graph = DiagramFlattener.flatten(ctx.closeKernel());

        assertEquals(DiagramEdge.flow("2", "3", null), graph.edgesInto("3").get(0));
    }
}
