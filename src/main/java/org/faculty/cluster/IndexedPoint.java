package org.faculty.cluster;

import org.apache.commons.math3.ml.clustering.Clusterable;

import java.util.ArrayList;
import java.util.List;

/**
 * Row of a matrix that remembers its row index.
 * Equality stays identity-based so duplicate embeddings remain distinct points.
 */
final class IndexedPoint implements Clusterable {

    private final int index;
    private final double[] point;

    IndexedPoint(int index, double[] point) {
        this.index = index;
        this.point = point;
    }

    static List<IndexedPoint> wrap(double[][] matrix) {
        List<IndexedPoint> out = new ArrayList<>(matrix.length);
        for (int i = 0; i < matrix.length; i++) {
            out.add(new IndexedPoint(i, matrix[i]));
        }
        return out;
    }

    int index() {
        return index;
    }

    @Override
    public double[] getPoint() {
        return point;
    }
}
