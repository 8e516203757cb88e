package org.faculty.metrics;

import org.faculty.model.FacultyRecord;

/**
 * A candidate faculty record together with its similarity to the query.
 * Larger similarity means closer.
 */
public record SimilarityResult(FacultyRecord faculty, double similarity) {
}
