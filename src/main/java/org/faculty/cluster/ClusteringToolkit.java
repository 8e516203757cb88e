package org.faculty.cluster;

import java.util.Objects;

/**
 * The numerical primitives a {@link ClusterEngine} delegates to.
 */
public record ClusteringToolkit(DimensionalityReducer reducer,
                                DensityClusterer densityClusterer,
                                PartitionClusterer partitionClusterer,
                                SilhouetteScorer silhouetteScorer) {

    public ClusteringToolkit {
        Objects.requireNonNull(reducer, "reducer must not be null");
        Objects.requireNonNull(densityClusterer, "densityClusterer must not be null");
        Objects.requireNonNull(partitionClusterer, "partitionClusterer must not be null");
        Objects.requireNonNull(silhouetteScorer, "silhouetteScorer must not be null");
    }

    /**
     * PCA, DBSCAN, k-means++ and silhouette, all backed by Commons Math.
     */
    public static ClusteringToolkit commonsMath(double dbscanEps, int kmeansMaxIterations, int kmeansTrials, long seed) {
        return new ClusteringToolkit(
                new PcaReducer(),
                new DbscanDensityClusterer(dbscanEps),
                new KMeansPartitionClusterer(kmeansMaxIterations, kmeansTrials, seed),
                new EuclideanSilhouetteScorer()
        );
    }
}
