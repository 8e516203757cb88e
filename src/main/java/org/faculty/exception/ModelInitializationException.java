package org.faculty.exception;

/** The text embedder could not be started. */
public class ModelInitializationException extends AnalyticsException {

    public ModelInitializationException(String message) {
        super(AnalyticsErrorCode.MODEL_INITIALIZATION, message);
    }

    public ModelInitializationException(String message, Throwable cause) {
        super(AnalyticsErrorCode.MODEL_INITIALIZATION, message, cause);
    }
}
