package org.faculty.cluster;

/**
 * Scores a labelling of points; higher means tighter, better separated clusters.
 */
@FunctionalInterface
public interface SilhouetteScorer {

    double score(double[][] points, int[] labels);
}
