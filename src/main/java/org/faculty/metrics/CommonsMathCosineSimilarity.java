package org.faculty.metrics;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.faculty.model.Vector;

/**
 * Cosine similarity delegated to Commons Math {@link RealVector#cosine(RealVector)}.
 * <p>
 * Commons Math rejects zero-norm vectors, so those are scored 0 before delegating.
 * Inputs are divided by their L-infinity norm first so that the library's norms stay finite
 * and non-zero, which keeps the result identical to {@link CosineSimilarity}.
 */
public final class CommonsMathCosineSimilarity implements SimilarityMetric {

    public static final String NAME = "commons-math";

    @Override
    public double similarity(Vector a, Vector b) {
        if (a == null) throw new IllegalArgumentException("a must not be null");
        if (b == null) throw new IllegalArgumentException("b must not be null");
        if (a.dim() != b.dim()) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.dim() + " vs " + b.dim());
        }
        RealVector left = new ArrayRealVector(a.toArrayCopy(), false);
        RealVector right = new ArrayRealVector(b.toArrayCopy(), false);
        double maxLeft = left.getLInfNorm();
        double maxRight = right.getLInfNorm();
        if (maxLeft == 0.0 || maxRight == 0.0) {
            return 0.0;
        }
        return CosineSimilarity.clamp(left.mapDivide(maxLeft).cosine(right.mapDivide(maxRight)));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String toString() {
        return name();
    }
}
