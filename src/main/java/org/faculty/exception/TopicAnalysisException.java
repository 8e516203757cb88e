package org.faculty.exception;

/** Keyword topic extraction failed. */
public class TopicAnalysisException extends AnalyticsException {

    public TopicAnalysisException(String message) {
        super(AnalyticsErrorCode.TOPIC_ANALYSIS, message);
    }

    public TopicAnalysisException(String message, Throwable cause) {
        super(AnalyticsErrorCode.TOPIC_ANALYSIS, message, cause);
    }
}
