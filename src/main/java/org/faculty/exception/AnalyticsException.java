package org.faculty.exception;

import java.util.Objects;

/**
 * Base runtime exception of the analytics pipeline.
 * The message is meant for the caller; the code is meant for logs and tests.
 */
public class AnalyticsException extends RuntimeException {

    private final AnalyticsErrorCode code;

    public AnalyticsException(AnalyticsErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public AnalyticsException(AnalyticsErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public AnalyticsErrorCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
