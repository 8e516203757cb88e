package org.faculty.cluster;

/**
 * Projects a row-major matrix (one row per point) onto fewer columns.
 */
@FunctionalInterface
public interface DimensionalityReducer {

    /**
     * @param matrix n x d input, not modified
     * @param targetDim requested number of output columns (>= 1)
     * @return n x t matrix with t <= targetDim
     */
    double[][] reduce(double[][] matrix, int targetDim);
}
