package org.faculty.cluster;

/**
 * Partition-based clustering into a fixed number of groups; every point is assigned.
 */
@FunctionalInterface
public interface PartitionClusterer {

    /**
     * @return one label in [0, k-1] per point
     */
    int[] cluster(double[][] points, int k);
}
