package org.faculty.embed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.faculty.config.ConfigurationProvider;
import org.faculty.exception.EmbeddingGenerationException;
import org.faculty.exception.ModelInitializationException;
import org.faculty.io.json.PythonScriptRunner;
import org.faculty.model.Vector;
import org.faculty.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sentence-transformers embedder running in a Python child process.
 * <p>
 * Protocol with the script: {@code python embedder.py test|embed}, request
 * {@code {"model": ..., "texts": [...]}} on stdin, response {@code {"embeddings": [[...]]}}
 * on stdout. Texts are normalized with {@link TextNormalizer} before they are sent.
 * <p>
 * {@link #initialize()} runs the {@code test} mode once as a dependency check. {@link #embed(List)}
 * does not require it: the first call prepares the script itself, so the model is loaded
 * only by the {@code embed} run.
 */
public final class PythonTextEmbedder implements TextEmbedder {

    private static final Logger log = LoggerFactory.getLogger(PythonTextEmbedder.class);

    private final String pythonExecutable;
    private final String scriptLocation;
    private final String modelName;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private final TextNormalizer normalizer = new TextNormalizer();

    private PythonScriptRunner runner;
    private Path extractedScript;
    private boolean checked;

    /**
     * @param scriptLocation "classpath:embedder.py" or a filesystem path
     */
    public PythonTextEmbedder(String pythonExecutable,
                              String scriptLocation,
                              String modelName,
                              Duration timeout,
                              ObjectMapper mapper) {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be null/blank");
        }
        if (scriptLocation == null || scriptLocation.isBlank()) {
            throw new IllegalArgumentException("scriptLocation must not be null/blank");
        }
        this.pythonExecutable = pythonExecutable;
        this.scriptLocation = scriptLocation;
        this.modelName = modelName;
        this.timeout = timeout;
        this.mapper = mapper;
    }

    @Override
    public void initialize() {
        if (checked) {
            return;
        }
        try {
            runner().run(List.of("test"), request(List.of()), timeout);
            this.checked = true;
            log.info("Embedding model {} is ready", modelName);
        } catch (IOException | RuntimeException e) {
            close();
            throw new ModelInitializationException("Failed to initialize model " + modelName + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new ModelInitializationException("Interrupted while initializing model " + modelName, e);
        }
    }

    @Override
    public List<Vector> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        List<String> cleaned = new ArrayList<>(texts.size());
        for (String t : texts) {
            cleaned.add(normalizer.normalize(t));
        }

        byte[] stdout;
        try {
            stdout = runner().run(List.of("embed"), request(cleaned), timeout);
        } catch (IOException | IllegalArgumentException e) {
            throw new EmbeddingGenerationException("Failed to generate embeddings: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingGenerationException("Interrupted while generating embeddings", e);
        }
        return parseEmbeddings(stdout, texts.size());
    }

    List<Vector> parseEmbeddings(byte[] stdout, int expected) {
        JsonNode root;
        try {
            root = mapper.readTree(stdout);
        } catch (IOException e) {
            throw new EmbeddingGenerationException("Embedder returned invalid JSON", e);
        }
        JsonNode rows = root == null ? null : root.get("embeddings");
        if (rows == null || !rows.isArray()) {
            throw new EmbeddingGenerationException("Embedder response has no 'embeddings' array");
        }
        if (rows.size() != expected) {
            throw new EmbeddingGenerationException(
                    "Embedder returned " + rows.size() + " embeddings for " + expected + " texts"
            );
        }

        List<Vector> out = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            if (!row.isArray() || row.isEmpty()) {
                throw new EmbeddingGenerationException("Embedder returned an empty or malformed vector");
            }
            double[] values = new double[row.size()];
            for (int i = 0; i < values.length; i++) {
                JsonNode value = row.get(i);
                if (!value.isNumber() || !Double.isFinite(value.doubleValue())) {
                    throw new EmbeddingGenerationException("Embedder returned a non-numeric component: " + value);
                }
                values[i] = value.doubleValue();
            }
            if (!out.isEmpty() && out.get(0).dim() != values.length) {
                throw new EmbeddingGenerationException(
                        "Inconsistent embedding dimension: expected " + out.get(0).dim() + " but got " + values.length
                );
            }
            out.add(new Vector(values));
        }
        return out;
    }

    private PythonScriptRunner runner() throws IOException {
        if (runner == null) {
            runner = new PythonScriptRunner(pythonExecutable, resolveScript());
        }
        return runner;
    }

    private byte[] request(List<String> texts) throws IOException {
        ObjectNode req = mapper.createObjectNode();
        req.put("model", modelName);
        ArrayNode arr = req.putArray("texts");
        texts.forEach(arr::add);
        return mapper.writeValueAsBytes(req);
    }

    private Path resolveScript() throws IOException {
        if (!scriptLocation.startsWith(ConfigurationProvider.CLASSPATH_PREFIX)) {
            return Path.of(scriptLocation);
        }
        String resource = scriptLocation.substring(ConfigurationProvider.CLASSPATH_PREFIX.length());
        InputStream scriptStream = getClass().getClassLoader().getResourceAsStream(resource);
        if (scriptStream == null) {
            throw new FileNotFoundException("Missing Python resource: " + resource);
        }

        Path tempScript = Files.createTempFile("embedder-", ".py");
        try (InputStream in = scriptStream) {
            Files.copy(in, tempScript, StandardCopyOption.REPLACE_EXISTING);
        }
        this.extractedScript = tempScript;
        return tempScript;
    }

    @Override
    public String modelName() {
        return modelName;
    }

    @Override
    public void close() {
        runner = null;
        checked = false;
        if (extractedScript != null) {
            try {
                Files.deleteIfExists(extractedScript);
            } catch (IOException e) {
                log.warn("Could not delete extracted script {}", extractedScript, e);
            }
            extractedScript = null;
        }
    }
}
