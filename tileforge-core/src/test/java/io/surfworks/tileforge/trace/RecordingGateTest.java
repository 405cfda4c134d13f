package io.surfworks.tileforge.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for RecordingGate thread-local mode switching.
 */
@DisplayName("RecordingGate")
class RecordingGateTest {

    @Nested
    @DisplayName("TraceMode")
    class TraceModeTests {

        @Test
        @DisplayName("Execute.INSTANCE does not record")
        void executeDoesNotRecord() {
            assertFalse(Execute.INSTANCE.isRecording());
            assertEquals("execute", Execute.INSTANCE.modeName());
        }

        @Test
        @DisplayName("Recording.INSTANCE records")
        void recordingRecords() {
            assertTrue(Recording.INSTANCE.isRecording());
            assertEquals("recording", Recording.INSTANCE.modeName());
        }
    }

    @Nested
    @DisplayName("Switching")
    class Switching {

        @Test
        @DisplayName("default mode is Execute")
        void defaultIsExecute() {
            assertSame(Execute.INSTANCE, RecordingGate.current());
            assertFalse(RecordingGate.isRecording());
        }

        @Test
        @DisplayName("recording gate switches and close restores")
        void switchAndRestore() {
            try (RecordingGate gate = RecordingGate.recording()) {
                assertTrue(RecordingGate.isRecording());
            }
            assertFalse(RecordingGate.isRecording());
        }

        @Test
        @DisplayName("nested gates restore in reverse order")
        void nested() {
            try (RecordingGate outer = RecordingGate.recording()) {
                try (RecordingGate inner = RecordingGate.execute()) {
                    assertFalse(RecordingGate.isRecording());
                }
                assertTrue(RecordingGate.isRecording());
            }
            assertFalse(RecordingGate.isRecording());
        }

        @Test
        @DisplayName("close is idempotent")
        void closeIdempotent() {
            RecordingGate outer = RecordingGate.recording();
            RecordingGate inner = RecordingGate.recording();
            inner.close();
            inner.close();

            assertTrue(inner.isClosed());
            assertTrue(RecordingGate.isRecording());
            outer.close();
            assertFalse(RecordingGate.isRecording());
        }

        @Test
        @DisplayName("null mode is rejected")
        void nullMode() {
            assertThrows(NullPointerException.class, () -> new RecordingGate(null));
        }

        @Test
        @DisplayName("toString reports closed state")
        void toStringClosed() {
            RecordingGate gate = RecordingGate.recording();
            assertEquals("RecordingGate[current=recording, previous=execute]", gate.toString());
            gate.close();
            assertEquals("RecordingGate[CLOSED, previous=execute]", gate.toString());
        }
    }

    @Nested
    @DisplayName("Thread Isolation")
    class ThreadIsolation {

        @Test
        @DisplayName("a gate on one thread does not affect another")
        void isolated() throws Exception {
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try (RecordingGate gate = RecordingGate.recording()) {
                Future<Boolean> other = executor.submit(RecordingGate::isRecording);
                assertFalse(other.get(5, TimeUnit.SECONDS));
                assertTrue(RecordingGate.isRecording());
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
