package org.faculty.cluster;

import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.clustering.MultiKMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.Well19937c;

import java.util.List;

/**
 * k-means++ backed by Commons Math. Runs several seeded trials and keeps the one with the
 * lowest within-cluster variance, so results are reproducible for a given seed.
 */
public final class KMeansPartitionClusterer implements PartitionClusterer {

    private final int maxIterations;
    private final int trials;
    private final long seed;

    public KMeansPartitionClusterer(int maxIterations, int trials, long seed) {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        if (trials < 1) throw new IllegalArgumentException("trials must be >= 1");
        this.maxIterations = maxIterations;
        this.trials = trials;
        this.seed = seed;
    }

    @Override
    public int[] cluster(double[][] points, int k) {
        if (points == null) throw new IllegalArgumentException("points must not be null");
        if (k < 1) throw new IllegalArgumentException("k must be >= 1");
        if (points.length < k) {
            throw new IllegalArgumentException(
                    "Cannot partition " + points.length + " points into " + k + " clusters"
            );
        }

        KMeansPlusPlusClusterer<IndexedPoint> kmeans = new KMeansPlusPlusClusterer<>(
                k, maxIterations, new EuclideanDistance(), new Well19937c(seed)
        );
        MultiKMeansPlusPlusClusterer<IndexedPoint> best = new MultiKMeansPlusPlusClusterer<>(kmeans, trials);
        List<CentroidCluster<IndexedPoint>> clusters = best.cluster(IndexedPoint.wrap(points));

        // empty clusters are skipped so labels stay dense
        int[] labels = new int[points.length];
        int next = 0;
        for (CentroidCluster<IndexedPoint> cluster : clusters) {
            if (cluster.getPoints().isEmpty()) {
                continue;
            }
            for (IndexedPoint p : cluster.getPoints()) {
                labels[p.index()] = next;
            }
            next++;
        }
        return labels;
    }
}
