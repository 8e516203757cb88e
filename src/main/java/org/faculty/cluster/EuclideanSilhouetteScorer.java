package org.faculty.cluster;

import org.apache.commons.math3.ml.distance.DistanceMeasure;
import org.apache.commons.math3.ml.distance.EuclideanDistance;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Mean silhouette coefficient over all points, using Euclidean distance.
 * <p>
 * For point i with mean intra-group distance a and smallest mean distance to another group b,
 * s(i) = (b - a) / max(a, b); points alone in their group score 0. Every label, including -1,
 * is treated as a group of its own.
 */
public final class EuclideanSilhouetteScorer implements SilhouetteScorer {

    private final DistanceMeasure distance = new EuclideanDistance();

    /**
     * @throws IllegalArgumentException unless 2 <= number of distinct labels <= n - 1
     */
    @Override
    public double score(double[][] points, int[] labels) {
        if (points == null || labels == null) {
            throw new IllegalArgumentException("points and labels must not be null");
        }
        if (points.length != labels.length) {
            throw new IllegalArgumentException(
                    "Expected one label per point: " + points.length + " vs " + labels.length
            );
        }

        Map<Integer, Integer> groupIndex = new HashMap<>();
        for (int label : labels) {
            groupIndex.putIfAbsent(label, groupIndex.size());
        }
        int groups = groupIndex.size();
        int n = points.length;
        if (groups < 2 || groups > n - 1) {
            throw new IllegalArgumentException(
                    "Silhouette needs 2 <= labels <= n-1, got " + groups + " labels for " + n + " points"
            );
        }

        int[] group = new int[n];
        int[] groupSize = new int[groups];
        for (int i = 0; i < n; i++) {
            group[i] = groupIndex.get(labels[i]);
            groupSize[group[i]]++;
        }

        double total = 0.0;
        double[] distSums = new double[groups];
        for (int i = 0; i < n; i++) {
            if (groupSize[group[i]] == 1) {
                continue;
            }
            Arrays.fill(distSums, 0.0);
            for (int j = 0; j < n; j++) {
                if (i != j) {
                    distSums[group[j]] += distance.compute(points[i], points[j]);
                }
            }

            double a = distSums[group[i]] / (groupSize[group[i]] - 1);
            double b = Double.POSITIVE_INFINITY;
            for (int g = 0; g < groups; g++) {
                if (g != group[i]) {
                    b = Math.min(b, distSums[g] / groupSize[g]);
                }
            }
            double denom = Math.max(a, b);
            total += denom == 0.0 ? 0.0 : (b - a) / denom;
        }
        return total / n;
    }
}
