package org.faculty.cluster;

import org.faculty.exception.ClusteringException;
import org.faculty.model.FacultyRecord;
import org.faculty.model.Vector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Groups faculty into topical clusters.
 * <p>
 * Pipeline:
 * 1) standardize the embeddings and reduce them to at most {@code maxComponents} dimensions
 * 2) run density clustering
 * 3) if it finds fewer than two clusters, discard it and partition into
 *    {@code clamp(n / 10, 3, 15)} clusters instead (every point assigned, probability 1.0)
 * 4) score the final labels with the silhouette coefficient when there are two or more labels
 * 5) group the records by label; noise only increments the outlier count
 */
public final class ClusterEngine {

    private static final Logger log = LoggerFactory.getLogger(ClusterEngine.class);

    static final int MIN_DENSITY_CLUSTERS = 2;
    static final int MIN_PARTITIONS = 3;
    static final int MAX_PARTITIONS = 15;
    static final int RECORDS_PER_PARTITION = 10;

    private final ClusteringToolkit toolkit;
    private final StandardScaler scaler = new StandardScaler();
    private final int maxComponents;

    public ClusterEngine(ClusteringToolkit toolkit, int maxComponents) {
        if (toolkit == null) throw new IllegalArgumentException("toolkit must not be null");
        if (maxComponents < 1) throw new IllegalArgumentException("maxComponents must be >= 1");
        this.toolkit = toolkit;
        this.maxComponents = maxComponents;
    }

    /**
     * @param embeddings one vector per record, all of the same dimension
     * @param records faculty records, index-aligned with {@code embeddings}
     * @param minClusterSize smallest group the density clusterer may report (>= 1)
     * @throws ClusteringException if there are fewer records than {@code minClusterSize},
     *                             the input is malformed, or a numerical primitive fails
     */
    public ClusteringReport cluster(List<Vector> embeddings, List<FacultyRecord> records, int minClusterSize) {
        if (embeddings == null || records == null) {
            throw new ClusteringException("embeddings and records must not be null");
        }
        if (embeddings.size() != records.size()) {
            throw new ClusteringException(
                    "Expected one embedding per faculty record: " + embeddings.size() + " vs " + records.size()
            );
        }
        if (minClusterSize < 1) {
            throw new ClusteringException("min_cluster_size must be >= 1 but was " + minClusterSize);
        }
        int n = records.size();
        if (n < minClusterSize) {
            throw new ClusteringException(
                    "Not enough faculty to cluster: " + n + " records, min_cluster_size is " + minClusterSize
            );
        }

        try {
            double[][] reduced = reduce(Vector.toMatrix(embeddings));
            return clusterReduced(reduced, records, minClusterSize);
        } catch (ClusteringException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ClusteringException("Clustering failed: " + e.getMessage(), e);
        }
    }

    /**
     * Fallback cluster count for n records: n / 10 clamped to [3, 15].
     */
    public static int partitionCount(int n) {
        return Math.min(Math.max(n / RECORDS_PER_PARTITION, MIN_PARTITIONS), MAX_PARTITIONS);
    }

    private double[][] reduce(double[][] matrix) {
        int n = matrix.length;
        int targetDim = Math.min(maxComponents, n - 1);
        if (targetDim < 1) {
            throw new ClusteringException("At least two faculty records are needed to reduce dimensionality");
        }
        double[][] scaled = scaler.fitTransform(matrix);
        double[][] reduced = toolkit.reducer().reduce(scaled, targetDim);
        if (reduced == null || reduced.length != n) {
            throw new ClusteringException("Dimensionality reduction returned a malformed matrix");
        }
        log.debug("Reduced {} x {} embeddings to {} dimensions", n, matrix[0].length,
                reduced.length == 0 ? 0 : reduced[0].length);
        return reduced;
    }

    private ClusteringReport clusterReduced(double[][] reduced, List<FacultyRecord> records, int minClusterSize) {
        int n = records.size();

        DensityClustering density = toolkit.densityClusterer().cluster(reduced, minClusterSize);
        int[] labels = density.labels();
        requireLabelCount(labels, n, "Density clustering");
        int densityClusters = density.clusterCount();

        ClusteringAlgorithm algorithm;
        double[] probabilities;
        if (densityClusters < MIN_DENSITY_CLUSTERS) {
            int k = partitionCount(n);
            log.info("Density clustering found {} cluster(s); falling back to partition clustering with k={}",
                    densityClusters, k);
            labels = toolkit.partitionClusterer().cluster(reduced, k);
            requireLabelCount(labels, n, "Partition clustering");
            for (int label : labels) {
                if (label < 0) {
                    throw new ClusteringException("Partition clustering returned a negative label: " + label);
                }
            }
            probabilities = ones(n);
            algorithm = ClusteringAlgorithm.PARTITION;
        } else {
            log.info("Density clustering found {} clusters", densityClusters);
            probabilities = density.probabilities().orElseGet(() -> ones(n));
            algorithm = ClusteringAlgorithm.DENSITY;
        }

        labels = densify(labels);

        double score = ClusteringReport.UNDEFINED_SCORE;
        if (Arrays.stream(labels).distinct().count() >= 2) {
            score = toolkit.silhouetteScorer().score(reduced, labels);
        }

        return aggregate(records, labels, probabilities, score, algorithm);
    }

    private static ClusteringReport aggregate(List<FacultyRecord> records,
                                              int[] labels,
                                              double[] probabilities,
                                              double score,
                                              ClusteringAlgorithm algorithm) {
        // first-appearance order, so equal-sized clusters keep a stable order after sorting
        Map<Integer, List<ClusterAssignment>> byLabel = new LinkedHashMap<>();
        int outliers = 0;
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == DensityClusterer.NOISE) {
                outliers++;
                continue;
            }
            byLabel.computeIfAbsent(labels[i], l -> new ArrayList<>())
                    .add(new ClusterAssignment(records.get(i), labels[i], probabilities[i]));
        }

        List<ClusterSummary> summaries = new ArrayList<>(byLabel.size());
        byLabel.forEach((label, members) -> summaries.add(new ClusterSummary(label, members)));
        summaries.sort(Comparator.comparingInt(ClusterSummary::size).reversed());

        return new ClusteringReport(summaries, outliers, score, algorithm);
    }

    /**
     * Renumbers non-noise labels to 0..k-1 keeping their relative order; noise stays -1.
     */
    static int[] densify(int[] labels) {
        TreeSet<Integer> distinct = new TreeSet<>();
        for (int label : labels) {
            if (label < DensityClusterer.NOISE) {
                throw new ClusteringException("Invalid cluster label: " + label);
            }
            if (label != DensityClusterer.NOISE) {
                distinct.add(label);
            }
        }
        Map<Integer, Integer> mapping = new LinkedHashMap<>();
        for (int label : distinct) {
            mapping.put(label, mapping.size());
        }

        int[] out = new int[labels.length];
        for (int i = 0; i < labels.length; i++) {
            out[i] = labels[i] == DensityClusterer.NOISE ? DensityClusterer.NOISE : mapping.get(labels[i]);
        }
        return out;
    }

    private static void requireLabelCount(int[] labels, int n, String stage) {
        if (labels == null || labels.length != n) {
            throw new ClusteringException(stage + " returned " + (labels == null ? "no" : labels.length)
                    + " labels for " + n + " records");
        }
    }

    private static double[] ones(int n) {
        double[] out = new double[n];
        Arrays.fill(out, 1.0);
        return out;
    }

    public int maxComponents() {
        return maxComponents;
    }
}
