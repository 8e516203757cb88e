package org.faculty.cluster;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.descriptive.moment.Mean;

/**
 * Principal component projection through a singular value decomposition of the
 * column-centred matrix.
 * <p>
 * Output columns are ordered by decreasing explained variance. Each component's sign is
 * fixed so that its largest-magnitude loading is positive, which makes the output
 * reproducible across runs.
 */
public final class PcaReducer implements DimensionalityReducer {

    @Override
    public double[][] reduce(double[][] matrix, int targetDim) {
        if (matrix == null || matrix.length == 0) {
            throw new IllegalArgumentException("matrix must not be empty");
        }
        if (targetDim < 1) {
            throw new IllegalArgumentException("targetDim must be >= 1 but was " + targetDim);
        }

        RealMatrix centred = centre(new Array2DRowRealMatrix(matrix, true));
        int rows = centred.getRowDimension();
        int cols = centred.getColumnDimension();
        int components = Math.min(targetDim, Math.min(rows, cols));

        SingularValueDecomposition svd = new SingularValueDecomposition(centred);
        RealMatrix basis = svd.getV().getSubMatrix(0, cols - 1, 0, components - 1);
        flipSigns(basis);

        return centred.multiply(basis).getData();
    }

    private static RealMatrix centre(RealMatrix m) {
        RealMatrix out = m.copy();
        Mean mean = new Mean();
        for (int c = 0; c < out.getColumnDimension(); c++) {
            double mu = mean.evaluate(out.getColumn(c));
            for (int r = 0; r < out.getRowDimension(); r++) {
                out.setEntry(r, c, out.getEntry(r, c) - mu);
            }
        }
        return out;
    }

    private static void flipSigns(RealMatrix basis) {
        for (int c = 0; c < basis.getColumnDimension(); c++) {
            int argMax = 0;
            for (int r = 1; r < basis.getRowDimension(); r++) {
                if (Math.abs(basis.getEntry(r, c)) > Math.abs(basis.getEntry(argMax, c))) {
                    argMax = r;
                }
            }
            if (basis.getEntry(argMax, c) < 0) {
                for (int r = 0; r < basis.getRowDimension(); r++) {
                    basis.setEntry(r, c, -basis.getEntry(r, c));
                }
            }
        }
    }
}
