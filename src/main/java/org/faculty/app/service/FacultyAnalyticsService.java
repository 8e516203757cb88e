package org.faculty.app.service;

import org.faculty.app.api.FacultyAnalyticsUseCases;
import org.faculty.cluster.ClusteringReport;
import org.faculty.exception.AnalyticsException;
import org.faculty.exception.EmbeddingGenerationException;
import org.faculty.exception.InputValidationException;
import org.faculty.exception.TopicAnalysisException;
import org.faculty.metrics.SimilarityResult;
import org.faculty.model.FacultyRecord;
import org.faculty.model.Vector;
import org.faculty.topics.TopicsReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/** Default implementation of the use cases on top of an {@link AnalyticsContext}. */
public final class FacultyAnalyticsService implements FacultyAnalyticsUseCases {

    private static final Logger log = LoggerFactory.getLogger(FacultyAnalyticsService.class);

    private final AnalyticsContext context;

    public FacultyAnalyticsService(AnalyticsContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    @Override
    public String checkDependencies() {
        context.initialize();
        return "All dependencies loaded successfully (model: " + context.embedder().modelName() + ")";
    }

    @Override
    public List<Vector> generateEmbeddings(List<String> texts) {
        if (texts == null) {
            throw new InputValidationException("texts must not be null");
        }
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            List<Vector> vectors = context.embedder().embed(texts);
            log.debug("Generated {} embeddings", vectors.size());
            return vectors;
        } catch (AnalyticsException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingGenerationException("Failed to generate embeddings: " + e.getMessage(), e);
        }
    }

    @Override
    public List<SimilarityResult> findSimilar(Vector target,
                                              List<Vector> candidates,
                                              List<FacultyRecord> faculty,
                                              int topK,
                                              double threshold) {
        if (target == null) {
            throw new InputValidationException("target embedding must not be null");
        }
        if (candidates.size() != faculty.size()) {
            throw new InputValidationException(
                    "Expected one embedding per faculty record: " + candidates.size() + " embeddings vs "
                            + faculty.size() + " records"
            );
        }
        if (!candidates.isEmpty() && candidates.get(0).dim() != target.dim()) {
            throw new InputValidationException(
                    "Target embedding has dimension " + target.dim() + " but candidates have " + candidates.get(0).dim()
            );
        }
        if (topK < 0) {
            throw new InputValidationException("top_k must be >= 0 but was " + topK);
        }

        List<SimilarityResult> results = context.ranker().rank(target, candidates, faculty, topK, threshold);
        log.debug("Ranked {} candidates with {}, {} above threshold {}",
                candidates.size(), context.ranker().metric().name(), results.size(), threshold);
        return results;
    }

    @Override
    public ClusteringReport clusterFaculty(List<Vector> embeddings, List<FacultyRecord> faculty, int minClusterSize) {
        if (embeddings.size() != faculty.size()) {
            throw new InputValidationException(
                    "Expected one embedding per faculty record: " + embeddings.size() + " embeddings vs "
                            + faculty.size() + " records"
            );
        }
        ClusteringReport report = context.clusterEngine().cluster(embeddings, faculty, minClusterSize);
        log.info("Clustered {} faculty into {} clusters ({} outliers) using {}",
                faculty.size(), report.totalClusters(), report.outliers(), report.algorithm());
        return report;
    }

    @Override
    public TopicsReport analyzeTopics(List<FacultyRecord> faculty, int numTopics) {
        if (numTopics < 0) {
            throw new InputValidationException("num_topics must be >= 0 but was " + numTopics);
        }
        try {
            return context.topicExtractor().extract(faculty, numTopics);
        } catch (RuntimeException e) {
            throw new TopicAnalysisException("Topic analysis failed: " + e.getMessage(), e);
        }
    }
}
