package org.faculty.config;

import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;
import org.faculty.exception.ConfigException;
import org.faculty.metrics.SimilarityMetrics;

import java.time.Duration;

/**
 * Typed settings of the analytics pipeline, with defaults for every key.
 */
public record AnalyticsConfig(String pythonExecutable,
                              String embedderScript,
                              String embedderModel,
                              Duration embedderTimeout,
                              String similarityMetric,
                              int defaultTopK,
                              double defaultThreshold,
                              int defaultMinClusterSize,
                              int maxComponents,
                              double dbscanEps,
                              int kmeansMaxIterations,
                              int kmeansTrials,
                              long randomSeed,
                              int defaultNumTopics) {

    public AnalyticsConfig {
        requirePositive("clustering.max-components", maxComponents);
        requirePositive("clustering.kmeans.max-iterations", kmeansMaxIterations);
        requirePositive("clustering.kmeans.trials", kmeansTrials);
        requirePositive("clustering.min-cluster-size", defaultMinClusterSize);
        if (!(dbscanEps > 0.0)) {
            throw new ConfigException("clustering.dbscan.eps must be > 0 but was " + dbscanEps);
        }
        if (defaultTopK < 0 || defaultNumTopics < 0) {
            throw new ConfigException("similarity.top-k and topics.count must be >= 0");
        }
        if (embedderTimeout.isZero() || embedderTimeout.isNegative()) {
            throw new ConfigException("embedder.timeout-seconds must be > 0");
        }
        if (!SimilarityMetrics.names().contains(similarityMetric)) {
            throw new ConfigException(
                    "similarity.metric must be one of " + SimilarityMetrics.names() + " but was " + similarityMetric
            );
        }
    }

    public static AnalyticsConfig defaults() {
        return from(new BaseConfiguration());
    }

    public static AnalyticsConfig load(String location) {
        return from(new ConfigurationProvider(location).config());
    }

    public static AnalyticsConfig from(Configuration c) {
        try {
            return new AnalyticsConfig(
                    c.getString("embedder.python", "python3"),
                    c.getString("embedder.script", "classpath:embedder.py"),
                    c.getString("embedder.model", "all-MiniLM-L6-v2"),
                    Duration.ofSeconds(c.getLong("embedder.timeout-seconds", 300L)),
                    c.getString("similarity.metric", "cosine"),
                    c.getInt("similarity.top-k", 10),
                    c.getDouble("similarity.threshold", 0.1),
                    c.getInt("clustering.min-cluster-size", 3),
                    c.getInt("clustering.max-components", 50),
                    c.getDouble("clustering.dbscan.eps", 0.5),
                    c.getInt("clustering.kmeans.max-iterations", 300),
                    c.getInt("clustering.kmeans.trials", 10),
                    c.getLong("clustering.random-seed", 42L),
                    c.getInt("topics.count", 10)
            );
        } catch (ConversionException e) {
            throw new ConfigException("Invalid configuration value: " + e.getMessage(), e);
        }
    }

    private static void requirePositive(String key, int value) {
        if (value < 1) {
            throw new ConfigException(key + " must be >= 1 but was " + value);
        }
    }
}
