package org.faculty.cluster;

/**
 * Density-based clustering: every point gets a cluster label >= 0 or {@link #NOISE}.
 */
@FunctionalInterface
public interface DensityClusterer {

    int NOISE = -1;

    DensityClustering cluster(double[][] points, int minClusterSize);
}
