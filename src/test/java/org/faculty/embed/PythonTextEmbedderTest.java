package org.faculty.embed;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.faculty.exception.EmbeddingGenerationException;
import org.faculty.exception.ModelInitializationException;
import org.faculty.model.Vector;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonTextEmbedderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Answers "embed" with [length, comma count] per text so normalization is observable.
    // Every run appends its mode to <script>.calls.
    private static final String FAKE_EMBEDDER = """
            import json, sys
            with open(__file__ + ".calls", "a") as calls:
                calls.write(sys.argv[1] + "\\n")
            req = json.loads(sys.stdin.read())
            if req["model"] != "fake-model":
                sys.exit(4)
            if sys.argv[1] == "test":
                print(json.dumps({"ok": True}))
            else:
                print(json.dumps({"embeddings": [[float(len(t)), float(t.count(","))] for t in req["texts"]]}))
            """;

    private static PythonTextEmbedder embedder(String script, String model) {
        return new PythonTextEmbedder("python3", script, model, Duration.ofSeconds(20), MAPPER);
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    class ResponseParsingTests {

        private final PythonTextEmbedder embedder = embedder("classpath:embedder.py", "fake-model");

        @Test
        void parsesOneVectorPerText() {
            List<Vector> out = embedder.parseEmbeddings(utf8("{\"embeddings\": [[1, 2], [3, 4.5]]}"), 2);
            assertEquals(List.of(Vector.of(1, 2), Vector.of(3, 4.5)), out);
        }

        @Test
        void malformedResponses_throw() {
            assertThrows(EmbeddingGenerationException.class, () -> embedder.parseEmbeddings(utf8("not json"), 1));
            assertThrows(EmbeddingGenerationException.class, () -> embedder.parseEmbeddings(utf8("{\"ok\": true}"), 1));
            assertThrows(EmbeddingGenerationException.class,
                    () -> embedder.parseEmbeddings(utf8("{\"embeddings\": [[1, 2]]}"), 2));
            assertThrows(EmbeddingGenerationException.class,
                    () -> embedder.parseEmbeddings(utf8("{\"embeddings\": [[1, 2], [3]]}"), 2));
            assertThrows(EmbeddingGenerationException.class,
                    () -> embedder.parseEmbeddings(utf8("{\"embeddings\": [[]]}"), 1));
        }

        @Test
        void nonNumericComponents_throw() {
            assertThrows(EmbeddingGenerationException.class,
                    () -> embedder.parseEmbeddings(utf8("{\"embeddings\": [[\"x\", 1]]}"), 1));
            assertThrows(EmbeddingGenerationException.class,
                    () -> embedder.parseEmbeddings(utf8("{\"embeddings\": [[null]]}"), 1));
            assertThrows(EmbeddingGenerationException.class,
                    () -> embedder.parseEmbeddings(utf8("{\"embeddings\": [[true]]}"), 1));
            assertThrows(EmbeddingGenerationException.class,
                    () -> embedder.parseEmbeddings(utf8("{\"embeddings\": [[[1]]]}"), 1));
            EmbeddingGenerationException ex = assertThrows(EmbeddingGenerationException.class,
                    () -> embedder.parseEmbeddings(utf8("{\"embeddings\": [[1e400]]}"), 1));
            assertTrue(ex.getMessage().contains("non-numeric"));
        }
    }

    @Nested
    class LifecycleTests {

        @TempDir
        Path tempDir;

        @Test
        void missingClasspathScript_failsEmbedding() {
            PythonTextEmbedder embedder = embedder("classpath:no-such-script.py", "fake-model");
            EmbeddingGenerationException ex =
                    assertThrows(EmbeddingGenerationException.class, () -> embedder.embed(List.of("x")));
            assertTrue(ex.getMessage().contains("no-such-script.py"));
        }

        @Test
        void missingClasspathScript_failsInitialization() {
            PythonTextEmbedder embedder = embedder("classpath:no-such-script.py", "fake-model");
            ModelInitializationException ex = assertThrows(ModelInitializationException.class, embedder::initialize);
            assertTrue(ex.getMessage().contains("fake-model"));
        }

        @Test
        void blankModel_isRejected() {
            assertThrows(IllegalArgumentException.class, () -> embedder("classpath:embedder.py", " "));
        }

        @Test
        void embedsNormalizedTexts_whenPythonAvailable() throws IOException {
            Assumptions.assumeTrue(isPythonAvailable(), "Python is not available on PATH; skipping integration test.");
            Path script = tempDir.resolve("fake_embedder.py");
            Files.writeString(script, FAKE_EMBEDDER, StandardCharsets.UTF_8);

            try (PythonTextEmbedder embedder = embedder(script.toString(), "fake-model")) {
                embedder.initialize();
                List<Vector> out = embedder.embed(Arrays.asList("  a;b \n", null, "x"));

                assertEquals(List.of(Vector.of(3, 1), Vector.of(0, 0), Vector.of(1, 0)), out);
                assertTrue(embedder.embed(List.of()).isEmpty());
            }
            assertEquals(List.of("test", "embed"), Files.readAllLines(tempDir.resolve("fake_embedder.py.calls")));
        }

        @Test
        void embedWithoutInitialize_runsOnlyTheEmbedMode_whenPythonAvailable() throws IOException {
            Assumptions.assumeTrue(isPythonAvailable(), "Python is not available on PATH; skipping integration test.");
            Path script = tempDir.resolve("fake_embedder.py");
            Files.writeString(script, FAKE_EMBEDDER, StandardCharsets.UTF_8);

            try (PythonTextEmbedder embedder = embedder(script.toString(), "fake-model")) {
                assertEquals(List.of(Vector.of(2, 0)), embedder.embed(List.of("ab")));
            }
            assertEquals(List.of("embed"), Files.readAllLines(tempDir.resolve("fake_embedder.py.calls")));
        }

        @Test
        void failingSelfTest_failsInitialization_whenPythonAvailable() throws IOException {
            Assumptions.assumeTrue(isPythonAvailable(), "Python is not available on PATH; skipping integration test.");
            Path script = tempDir.resolve("fake_embedder.py");
            Files.writeString(script, FAKE_EMBEDDER, StandardCharsets.UTF_8);

            PythonTextEmbedder embedder = embedder(script.toString(), "other-model");

            ModelInitializationException ex = assertThrows(ModelInitializationException.class, embedder::initialize);
            assertTrue(ex.getMessage().contains("exit code=4"));
            assertThrows(EmbeddingGenerationException.class, () -> embedder.embed(List.of("x")));
        }

        private boolean isPythonAvailable() {
            try {
                Process p = new ProcessBuilder("python3", "--version")
                        .redirectErrorStream(true)
                        .start();
                return p.waitFor() == 0;
            } catch (IOException e) {
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
