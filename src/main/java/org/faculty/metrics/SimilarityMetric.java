package org.faculty.metrics;

import org.faculty.model.Vector;

/**
 * Strategy interface for scoring how similar two vectors are.
 * Implementations define a score where "larger = closer".
 */
public interface SimilarityMetric {

    /**
     * Computes the similarity between two vectors.
     *
     * @param a first vector (non-null)
     * @param b second vector (non-null)
     * @return the similarity score
     * @throws IllegalArgumentException if vectors are null or dimensions mismatch
     */
    double similarity(Vector a, Vector b);

    /**
     * @return the configuration key of the metric (also used for logging).
     */
    String name();
}
