package org.faculty.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.faculty.cluster.ClusterEngine;
import org.faculty.cluster.ClusteringToolkit;
import org.faculty.config.AnalyticsConfig;
import org.faculty.embed.PythonTextEmbedder;
import org.faculty.embed.TextEmbedder;
import org.faculty.metrics.SimilarityMetrics;
import org.faculty.metrics.SimilarityRanker;
import org.faculty.topics.TopicExtractor;

import java.util.Objects;

/**
 * Everything one pipeline invocation needs, built once from configuration.
 * <p>
 * The embedder is the only component with a lifecycle: {@link #initialize()} checks that it
 * can start (idempotent) and {@link #close()} releases it. Nothing here is shared between contexts.
 */
public final class AnalyticsContext implements AutoCloseable {

    private final AnalyticsConfig config;
    private final TextEmbedder embedder;
    private final SimilarityRanker ranker;
    private final ClusterEngine clusterEngine;
    private final TopicExtractor topicExtractor;

    private boolean initialized;

    public AnalyticsContext(AnalyticsConfig config,
                            TextEmbedder embedder,
                            SimilarityRanker ranker,
                            ClusterEngine clusterEngine,
                            TopicExtractor topicExtractor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.embedder = Objects.requireNonNull(embedder, "embedder must not be null");
        this.ranker = Objects.requireNonNull(ranker, "ranker must not be null");
        this.clusterEngine = Objects.requireNonNull(clusterEngine, "clusterEngine must not be null");
        this.topicExtractor = Objects.requireNonNull(topicExtractor, "topicExtractor must not be null");
    }

    /**
     * Wires the default components: the Python embedder, the configured similarity metric
     * and the Commons Math clustering primitives.
     */
    public static AnalyticsContext fromConfig(AnalyticsConfig config, ObjectMapper mapper) {
        TextEmbedder embedder = new PythonTextEmbedder(
                config.pythonExecutable(),
                config.embedderScript(),
                config.embedderModel(),
                config.embedderTimeout(),
                mapper
        );
        ClusteringToolkit toolkit = ClusteringToolkit.commonsMath(
                config.dbscanEps(),
                config.kmeansMaxIterations(),
                config.kmeansTrials(),
                config.randomSeed()
        );
        return new AnalyticsContext(
                config,
                embedder,
                new SimilarityRanker(SimilarityMetrics.byName(config.similarityMetric())),
                new ClusterEngine(toolkit, config.maxComponents()),
                new TopicExtractor()
        );
    }

    /**
     * Runs the embedder's dependency check.
     *
     * @throws org.faculty.exception.ModelInitializationException if it cannot be started
     */
    public void initialize() {
        if (initialized) {
            return;
        }
        embedder.initialize();
        initialized = true;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public AnalyticsConfig config() {
        return config;
    }

    public TextEmbedder embedder() {
        return embedder;
    }

    public SimilarityRanker ranker() {
        return ranker;
    }

    public ClusterEngine clusterEngine() {
        return clusterEngine;
    }

    public TopicExtractor topicExtractor() {
        return topicExtractor;
    }

    @Override
    public void close() {
        initialized = false;
        embedder.close();
    }
}
