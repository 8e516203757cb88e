package org.faculty.cluster;

import java.util.List;

/**
 * Result of a clustering run.
 *
 * @param clusters summaries sorted by descending size
 * @param outliers number of records labelled as noise
 * @param silhouetteScore quality of the labelling, {@link #UNDEFINED_SCORE} when it cannot be computed
 * @param algorithm strategy that produced the labels
 */
public record ClusteringReport(List<ClusterSummary> clusters,
                               int outliers,
                               double silhouetteScore,
                               ClusteringAlgorithm algorithm) {

    public static final double UNDEFINED_SCORE = -1.0;

    public ClusteringReport {
        clusters = List.copyOf(clusters);
        if (outliers < 0) {
            throw new IllegalArgumentException("outliers must be >= 0");
        }
    }

    public int totalClusters() {
        return clusters.size();
    }

    /** Sum of all cluster sizes plus outliers; always the input record count. */
    public int recordCount() {
        return clusters.stream().mapToInt(ClusterSummary::size).sum() + outliers;
    }
}
