package io.surfworks.tileforge.trace;

import io.surfworks.tileforge.graph.Handle;
import io.surfworks.tileforge.graph.StepNode;
import io.surfworks.tileforge.symbolic.Coord;
import io.surfworks.tileforge.symbolic.SymbolicInt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("StepDefinition")
class StepDefinitionTest {

    private static StepDefinition copy() {
        return new StepDefinition("copy", List.of("coord", "value"), TagSource.parameter("coord"),
                args -> args[1]).withOutputs("dst");
    }

    @Nested
    @DisplayName("Definition")
    class Definition {

        @Test
        @DisplayName("unknown tag parameter raises LOOKUP_FAILURE at definition time")
        void unknownParameter() {
            TraceException ex = assertThrows(TraceException.class, () -> new StepDefinition(
                    "load", List.of("src"), TagSource.parameter("coord"), args -> null));
            assertEquals(TraceException.ErrorCode.LOOKUP_FAILURE, ex.errorCode());
        }

        @Test
        @DisplayName("each constructor call has its own identity")
        void distinctIdentity() {
            assertNotSame(copy().identity(), copy().identity());
        }

        @Test
        @DisplayName("with* copies keep identity unless set explicitly")
        void copiesKeepIdentity() {
            StepDefinition base = copy();
            Object token = new Object();

            assertSame(base.identity(), base.withInputs("src").identity());
            assertSame(token, base.withIdentity(token).identity());
            assertEquals(List.of(Handle.of("src")), base.withInputs("src").inputs());
        }
    }

    @Nested
    @DisplayName("Invocation")
    class Invocation {

        @Test
        @DisplayName("executing runs the body and records nothing")
        void executeRunsBody() {
            try (GraphContext ctx = new GraphContext().enter()) {
                assertEquals("v", copy().invoke(Coord.of(0), "v"));
                assertEquals(0, ctx.nodeCount());
            }
        }

        @Test
        @DisplayName("recording records a step tagged from the parameter, then runs the body")
        void recordingRecords() {
            AtomicInteger calls = new AtomicInteger();
            StepDefinition store = new StepDefinition("store", List.of("c"), TagSource.parameter("c"),
                    args -> calls.incrementAndGet()).withOutputs("out");

            try (GraphContext ctx = new GraphContext().enter();
                 RecordingGate gate = RecordingGate.recording()) {
                ctx.openKernel("K");
                store.invoke(SymbolicInt.symbol("tile0"));
                store.invoke(7);

                List<StepInvocation> recorded = ctx.invocations(store);
                assertEquals(2, recorded.size());
                assertEquals(Coord.symbol("tile0"), recorded.get(0).tag());
                assertEquals(Coord.bound(7), recorded.get(1).tag());
                StepNode node = recorded.get(0).node();
                assertEquals(List.of("out"), node.targets());
            }
            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("literal tags ignore the arguments")
        void literalTag() {
            StepDefinition init = StepDefinition.literal("init", Coord.of(0, null), args -> null);

            try (GraphContext ctx = new GraphContext().enter();
                 RecordingGate gate = RecordingGate.recording()) {
                ctx.openKernel("K");
                init.invoke();
                assertEquals("(0, _)", ctx.invocations().get(0).tag().toText());
            }
        }

        @Test
        @DisplayName("wrong argument count is rejected")
        void wrongArity() {
            assertThrows(IllegalArgumentException.class, () -> copy().invoke(Coord.of(0)));
        }

        @Test
        @DisplayName("tag argument must be a coordinate, symbolic value or integer")
        void badTagArgument() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> copy().invoke("tile0", 1));
            assertTrue(ex.getMessage().contains("coord"));
        }
    }
}
