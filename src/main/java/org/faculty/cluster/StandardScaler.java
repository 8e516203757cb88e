package org.faculty.cluster;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

/**
 * Per-column standardization to zero mean and unit variance.
 * Uses the population standard deviation; constant columns become all zeros.
 */
public final class StandardScaler {

    public double[][] fitTransform(double[][] matrix) {
        if (matrix == null || matrix.length == 0) {
            throw new IllegalArgumentException("matrix must not be empty");
        }
        int rows = matrix.length;
        int cols = matrix[0].length;

        double[][] out = new double[rows][cols];
        double[] column = new double[rows];
        Mean mean = new Mean();
        StandardDeviation std = new StandardDeviation(false);

        for (int c = 0; c < cols; c++) {
            for (int r = 0; r < rows; r++) {
                if (matrix[r].length != cols) {
                    throw new IllegalArgumentException(
                            "Ragged matrix: row " + r + " has " + matrix[r].length + " columns, expected " + cols
                    );
                }
                column[r] = matrix[r][c];
            }
            double mu = mean.evaluate(column);
            double sigma = std.evaluate(column);
            double scale = sigma == 0.0 ? 1.0 : sigma;
            for (int r = 0; r < rows; r++) {
                out[r][c] = (column[r] - mu) / scale;
            }
        }
        return out;
    }
}
