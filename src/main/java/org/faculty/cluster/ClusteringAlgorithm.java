package org.faculty.cluster;

/** Which strategy produced the final labelling of a clustering run. */
public enum ClusteringAlgorithm {
    DENSITY("density"),
    PARTITION("partition");

    private final String label;

    ClusteringAlgorithm(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
