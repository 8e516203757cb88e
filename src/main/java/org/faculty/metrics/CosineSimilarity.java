package org.faculty.metrics;

import org.faculty.model.Vector;

/**
 * Cosine similarity computed directly: (a · b) / (||a|| * ||b||).
 * <p>
 * Range is [-1, 1]. When either vector has zero magnitude the similarity is defined as 0.
 * Both vectors are first divided by their largest absolute component, so the norms neither
 * overflow for huge components nor underflow to 0 for tiny ones.
 */
public final class CosineSimilarity implements SimilarityMetric {

    public static final String NAME = "cosine";

    @Override
    public double similarity(Vector a, Vector b) {
        requireNonNull(a, "a");
        requireNonNull(b, "b");
        if (a.dim() != b.dim()) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.dim() + " vs " + b.dim());
        }

        double maxA = a.maxAbs();
        double maxB = b.maxAbs();
        if (maxA == 0.0 || maxB == 0.0) {
            return 0.0;
        }
        Vector unitA = a.scaledBy(maxA);
        Vector unitB = b.scaledBy(maxB);
        return clamp(unitA.dot(unitB) / (unitA.norm() * unitB.norm()));
    }

    @Override
    public String name() {
        return NAME;
    }

    // rounding can push |cos| a hair above 1; a non-finite value never leaves this method
    static double clamp(double cosine) {
        if (Double.isNaN(cosine)) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, cosine));
    }

    private static void requireNonNull(Object x, String paramName) {
        if (x == null) {
            throw new IllegalArgumentException(paramName + " must not be null");
        }
    }

    @Override
    public String toString() {
        return name();
    }
}
