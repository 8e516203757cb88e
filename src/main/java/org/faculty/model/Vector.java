package org.faculty.model;

import java.util.Arrays;
import java.util.List;

/**
 * An immutable embedding vector of doubles.
 */
public final class Vector {

    private final double[] data;

    /**
     * The input array is copied to keep immutability.
     *
     * @param values raw vector values (must be non-null and non-empty)
     */
    public Vector(double[] values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
        this.data = Arrays.copyOf(values, values.length);
    }

    public static Vector of(double... values) {
        return new Vector(values);
    }

    /**
     * @return the vector dimension (number of components).
     */
    public int dim() {
        return data.length;
    }

    /**
     * Returns a defensive copy of the internal data.
     */
    public double[] toArrayCopy() {
        return Arrays.copyOf(data, data.length);
    }

    /**
     * Computes the dot product between this vector and another vector.
     *
     * @throws IllegalArgumentException if dimensions do not match.
     */
    public double dot(Vector other) {
        requireSameDim(other);
        double sum = 0.0;
        for (int i = 0; i < data.length; i++) {
            sum += this.data[i] * other.data[i];
        }
        return sum;
    }

    /**
     * Computes the L2 norm (Euclidean length).
     */
    public double norm() {
        double sumSq = 0.0;
        for (double v : data) {
            sumSq += v * v;
        }
        return Math.sqrt(sumSq);
    }

    /**
     * @return the largest absolute component (the L-infinity norm); 0 only for the zero vector.
     */
    public double maxAbs() {
        double max = 0.0;
        for (double v : data) {
            max = Math.max(max, Math.abs(v));
        }
        return max;
    }

    /**
     * @return a copy of this vector divided component-wise by {@code divisor}.
     */
    public Vector scaledBy(double divisor) {
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = data[i] / divisor;
        }
        return new Vector(out);
    }

    /**
     * Returns the value at the given component index.
     *
     * @throws IndexOutOfBoundsException if the index is invalid
     */
    public double get(int index) {
        if (index < 0 || index >= data.length) {
            throw new IndexOutOfBoundsException("index=" + index + ", dim=" + data.length);
        }
        return data[index];
    }

    /**
     * Copies a batch of vectors into a row-major matrix.
     *
     * @throws IllegalArgumentException if the batch is empty or the vectors disagree on dimension
     */
    public static double[][] toMatrix(List<Vector> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new IllegalArgumentException("vectors must not be empty");
        }
        int dim = vectors.get(0).dim();
        double[][] out = new double[vectors.size()][];
        for (int i = 0; i < vectors.size(); i++) {
            Vector v = vectors.get(i);
            if (v.dim() != dim) {
                throw new IllegalArgumentException(
                        "Dimension mismatch at row " + i + ": expected " + dim + " but got " + v.dim()
                );
            }
            out[i] = v.toArrayCopy();
        }
        return out;
    }

    private void requireSameDim(Vector other) {
        if (other == null) {
            throw new IllegalArgumentException("other must not be null");
        }
        if (this.data.length != other.data.length) {
            throw new IllegalArgumentException(
                    "Dimension mismatch: " + this.data.length + " vs " + other.data.length
            );
        }
    }

    @Override
    public String toString() {
        // Short summary, embeddings are usually hundreds of components long
        return "Vector(dim=" + data.length + ")";
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (obj.getClass() != this.getClass()) return false;

        Vector other = (Vector) obj;
        return Arrays.equals(this.data, other.data);
    }
}
