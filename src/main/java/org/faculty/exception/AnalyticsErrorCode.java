package org.faculty.exception;

/** Stable error categories reported by the analytics pipeline. */
public enum AnalyticsErrorCode {
    INPUT_VALIDATION,
    MODEL_INITIALIZATION,
    EMBEDDING_GENERATION,
    CLUSTERING,
    TOPIC_ANALYSIS,
    CONFIGURATION
}
