package org.faculty.app.api;

import org.faculty.cluster.ClusteringReport;
import org.faculty.metrics.SimilarityResult;
import org.faculty.model.FacultyRecord;
import org.faculty.model.Vector;
import org.faculty.topics.TopicsReport;

import java.util.List;

/**
 * Application boundary consumed by the command line.
 * Keeps the entry point independent from the metrics/cluster/topics packages' internals.
 * <p>
 * Every operation either returns a complete result or throws an
 * {@link org.faculty.exception.AnalyticsException}; there is no partial success.
 */
public interface FacultyAnalyticsUseCases {

    /**
     * Loads the embedding model to prove that all dependencies are available.
     *
     * @return a human-readable confirmation
     */
    String checkDependencies();

    List<Vector> generateEmbeddings(List<String> texts);

    List<SimilarityResult> findSimilar(Vector target,
                                       List<Vector> candidates,
                                       List<FacultyRecord> faculty,
                                       int topK,
                                       double threshold);

    ClusteringReport clusterFaculty(List<Vector> embeddings, List<FacultyRecord> faculty, int minClusterSize);

    TopicsReport analyzeTopics(List<FacultyRecord> faculty, int numTopics);
}
