package org.faculty.cluster;

import java.util.Arrays;
import java.util.Optional;

/**
 * Output of a {@link DensityClusterer}: one label per point and, when the algorithm
 * provides them, one membership probability per point.
 */
public final class DensityClustering {

    private final int[] labels;
    private final double[] probabilities;

    public DensityClustering(int[] labels, double[] probabilities) {
        if (labels == null) {
            throw new IllegalArgumentException("labels must not be null");
        }
        if (probabilities != null && probabilities.length != labels.length) {
            throw new IllegalArgumentException(
                    "Expected one probability per label: " + labels.length + " vs " + probabilities.length
            );
        }
        this.labels = Arrays.copyOf(labels, labels.length);
        this.probabilities = probabilities == null ? null : Arrays.copyOf(probabilities, probabilities.length);
    }

    public static DensityClustering labelsOnly(int[] labels) {
        return new DensityClustering(labels, null);
    }

    public int[] labels() {
        return Arrays.copyOf(labels, labels.length);
    }

    public Optional<double[]> probabilities() {
        return probabilities == null
                ? Optional.empty()
                : Optional.of(Arrays.copyOf(probabilities, probabilities.length));
    }

    /**
     * @return number of distinct labels other than noise.
     */
    public int clusterCount() {
        return (int) Arrays.stream(labels).filter(l -> l != DensityClusterer.NOISE).distinct().count();
    }
}
