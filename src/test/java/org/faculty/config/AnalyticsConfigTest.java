package org.faculty.config;

import org.faculty.exception.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticsConfigTest {

    @TempDir
    Path tempDir;

    private Path yaml(String content) throws IOException {
        Path file = tempDir.resolve("analytics.yaml");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void defaults_matchTheBundledConfiguration() {
        AnalyticsConfig defaults = AnalyticsConfig.defaults();
        AnalyticsConfig bundled = AnalyticsConfig.load(ConfigurationProvider.DEFAULT_LOCATION);

        assertEquals(defaults, bundled);
        assertEquals("all-MiniLM-L6-v2", bundled.embedderModel());
        assertEquals("classpath:embedder.py", bundled.embedderScript());
        assertEquals(Duration.ofSeconds(300), bundled.embedderTimeout());
        assertEquals("cosine", bundled.similarityMetric());
        assertEquals(10, bundled.defaultTopK());
        assertEquals(0.1, bundled.defaultThreshold(), 0.0);
        assertEquals(3, bundled.defaultMinClusterSize());
        assertEquals(50, bundled.maxComponents());
        assertEquals(0.5, bundled.dbscanEps(), 0.0);
        assertEquals(42L, bundled.randomSeed());
        assertEquals(10, bundled.defaultNumTopics());
    }

    @Test
    void fileOverrides_onlyTheKeysItSets() throws IOException {
        Path file = yaml("""
                embedder:
                  model: paraphrase-MiniLM-L3-v2
                  timeout-seconds: 30
                similarity:
                  metric: commons-math
                clustering:
                  dbscan:
                    eps: 1.25
                """);

        AnalyticsConfig config = AnalyticsConfig.load(file.toString());

        assertEquals("paraphrase-MiniLM-L3-v2", config.embedderModel());
        assertEquals(Duration.ofSeconds(30), config.embedderTimeout());
        assertEquals("commons-math", config.similarityMetric());
        assertEquals(1.25, config.dbscanEps(), 0.0);
        assertEquals("python3", config.pythonExecutable());
        assertEquals(300, config.kmeansMaxIterations());
    }

    @Test
    void missingClasspathResource_fallsBackToDefaults() {
        assertEquals(AnalyticsConfig.defaults(), AnalyticsConfig.load("classpath:does-not-exist.yaml"));
    }

    @Test
    void missingFile_throws() {
        ConfigException ex = assertThrows(ConfigException.class,
                () -> AnalyticsConfig.load(tempDir.resolve("absent.yaml").toString()));
        assertTrue(ex.getMessage().contains("does not exist"));
    }

    @Test
    void blankLocation_throws() {
        assertThrows(ConfigException.class, () -> new ConfigurationProvider(" "));
    }

    @Test
    void unknownMetric_throws() throws IOException {
        Path file = yaml("similarity:\n  metric: euclidean\n");
        ConfigException ex = assertThrows(ConfigException.class, () -> AnalyticsConfig.load(file.toString()));
        assertTrue(ex.getMessage().contains("similarity.metric"));
    }

    @Test
    void nonNumericValue_throws() throws IOException {
        Path file = yaml("similarity:\n  top-k: many\n");
        assertThrows(ConfigException.class, () -> AnalyticsConfig.load(file.toString()));
    }

    @Test
    void outOfRangeValues_throw() throws IOException {
        assertThrows(ConfigException.class,
                () -> AnalyticsConfig.load(yaml("clustering:\n  dbscan:\n    eps: 0\n").toString()));
        assertThrows(ConfigException.class,
                () -> AnalyticsConfig.load(yaml("clustering:\n  max-components: 0\n").toString()));
        assertThrows(ConfigException.class,
                () -> AnalyticsConfig.load(yaml("embedder:\n  timeout-seconds: 0\n").toString()));
    }
}
