package org.faculty.metrics;

import org.faculty.model.FacultyRecord;
import org.faculty.model.Vector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Ranks candidate faculty by similarity to a query vector and keeps the top-K
 * using a bounded min-heap.
 * <p>
 * Ordering: similarity descending, ties keep the candidates' input order.
 */
public final class SimilarityRanker {

    private final SimilarityMetric metric;

    /**
     * @param metric similarity strategy (non-null)
     */
    public SimilarityRanker(SimilarityMetric metric) {
        if (metric == null) throw new IllegalArgumentException("metric must not be null");
        this.metric = metric;
    }

    /**
     * Returns at most {@code topK} candidates whose similarity is {@code >= threshold}.
     *
     * @param query query vector
     * @param candidates candidate vectors, index-aligned with {@code records}
     * @param records candidate faculty records
     * @param topK maximum number of results (0 yields an empty list)
     * @param threshold inclusive lower bound on similarity
     * @return results sorted by non-increasing similarity
     *
     * Complexity:
     * - Time: O(N log K)
     * - Space: O(K)
     */
    public List<SimilarityResult> rank(Vector query,
                                       List<Vector> candidates,
                                       List<FacultyRecord> records,
                                       int topK,
                                       double threshold) {
        if (query == null) throw new IllegalArgumentException("query must not be null");
        if (candidates == null) throw new IllegalArgumentException("candidates must not be null");
        if (records == null) throw new IllegalArgumentException("records must not be null");
        if (candidates.size() != records.size()) {
            throw new IllegalArgumentException(
                    "candidates and records must have equal length: " + candidates.size() + " vs " + records.size()
            );
        }
        if (topK < 0) throw new IllegalArgumentException("topK must be >= 0");
        if (topK == 0 || candidates.isEmpty()) {
            return List.of();
        }

        // "Best first" order; the heap is reversed so the worst kept entry sits on top and is evicted first.
        Comparator<Scored> bestFirst = Comparator.comparingDouble(Scored::similarity).reversed()
                .thenComparingInt(Scored::index);
        PriorityQueue<Scored> heap = new PriorityQueue<>(bestFirst.reversed());

        for (int i = 0; i < candidates.size(); i++) {
            double s = metric.similarity(query, candidates.get(i));
            if (!(s >= threshold)) {
                continue;
            }

            Scored candidate = new Scored(i, s);
            if (heap.size() < topK) {
                heap.add(candidate);
            } else if (bestFirst.compare(candidate, heap.peek()) < 0) {
                heap.poll();
                heap.add(candidate);
            }
        }

        List<Scored> kept = new ArrayList<>(heap);
        kept.sort(bestFirst);

        List<SimilarityResult> result = new ArrayList<>(kept.size());
        for (Scored s : kept) {
            result.add(new SimilarityResult(records.get(s.index()), s.similarity()));
        }
        return result;
    }

    /**
     * Pairwise similarity of every vector with every other vector.
     *
     * @return a symmetric n x n matrix
     */
    public double[][] similarityMatrix(List<Vector> vectors) {
        if (vectors == null) throw new IllegalArgumentException("vectors must not be null");
        int n = vectors.size();
        double[][] out = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double s = metric.similarity(vectors.get(i), vectors.get(j));
                out[i][j] = s;
                out[j][i] = s;
            }
        }
        return out;
    }

    public SimilarityMetric metric() {
        return metric;
    }

    private record Scored(int index, double similarity) { }
}
