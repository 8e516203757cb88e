package org.faculty.cluster;

import org.faculty.model.FacultyRecord;

import java.util.Objects;

/**
 * A faculty record placed in a cluster, with the confidence of that placement.
 */
public record ClusterAssignment(FacultyRecord faculty, int clusterId, double probability) {

    public ClusterAssignment {
        Objects.requireNonNull(faculty, "faculty must not be null");
        if (clusterId < DensityClusterer.NOISE) {
            throw new IllegalArgumentException("clusterId must be >= -1 but was " + clusterId);
        }
        if (!(probability >= 0.0 && probability <= 1.0)) {
            throw new IllegalArgumentException("probability must be in [0, 1] but was " + probability);
        }
    }
}
