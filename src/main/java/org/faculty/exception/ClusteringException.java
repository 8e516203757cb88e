package org.faculty.exception;

/** Clustering could not produce a report (guard failure or a numerical primitive fault). */
public class ClusteringException extends AnalyticsException {

    public ClusteringException(String message) {
        super(AnalyticsErrorCode.CLUSTERING, message);
    }

    public ClusteringException(String message, Throwable cause) {
        super(AnalyticsErrorCode.CLUSTERING, message, cause);
    }
}
