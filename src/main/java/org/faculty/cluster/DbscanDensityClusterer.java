package org.faculty.cluster;

import org.apache.commons.math3.ml.clustering.Cluster;
import org.apache.commons.math3.ml.clustering.DBSCANClusterer;
import org.apache.commons.math3.ml.distance.DistanceMeasure;
import org.apache.commons.math3.ml.distance.EuclideanDistance;

import java.util.Arrays;
import java.util.List;

/**
 * DBSCAN over Euclidean distance, backed by Commons Math.
 * <p>
 * A point is a core point when at least {@code minClusterSize} points, itself included,
 * lie within {@code eps}. Membership probability is 1.0 for core points, the share of the
 * required neighbourhood that is present for border points, and 0.0 for noise.
 */
public final class DbscanDensityClusterer implements DensityClusterer {

    private final double eps;
    private final DistanceMeasure distance = new EuclideanDistance();

    public DbscanDensityClusterer(double eps) {
        if (!(eps > 0.0)) {
            throw new IllegalArgumentException("eps must be > 0 but was " + eps);
        }
        this.eps = eps;
    }

    @Override
    public DensityClustering cluster(double[][] points, int minClusterSize) {
        if (points == null) throw new IllegalArgumentException("points must not be null");
        if (minClusterSize < 1) throw new IllegalArgumentException("minClusterSize must be >= 1");

        List<IndexedPoint> wrapped = IndexedPoint.wrap(points);

        // Commons Math counts neighbours excluding the point itself
        DBSCANClusterer<IndexedPoint> dbscan = new DBSCANClusterer<>(eps, minClusterSize - 1, distance);
        List<Cluster<IndexedPoint>> clusters = dbscan.cluster(wrapped);

        int[] labels = new int[points.length];
        Arrays.fill(labels, NOISE);
        for (int label = 0; label < clusters.size(); label++) {
            for (IndexedPoint p : clusters.get(label).getPoints()) {
                labels[p.index()] = label;
            }
        }

        double[] probabilities = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            if (labels[i] == NOISE) {
                continue;
            }
            int neighbourhood = neighbourhoodSize(points, i);
            probabilities[i] = Math.min(1.0, (double) neighbourhood / minClusterSize);
        }
        return new DensityClustering(labels, probabilities);
    }

    private int neighbourhoodSize(double[][] points, int i) {
        int count = 0;
        for (double[] other : points) {
            if (distance.compute(points[i], other) <= eps) {
                count++;
            }
        }
        return count;
    }

    public double eps() {
        return eps;
    }
}
