package org.faculty.exception;

/** Missing or malformed request data, including vector dimension mismatches. */
public class InputValidationException extends AnalyticsException {

    public InputValidationException(String message) {
        super(AnalyticsErrorCode.INPUT_VALIDATION, message);
    }

    public InputValidationException(String message, Throwable cause) {
        super(AnalyticsErrorCode.INPUT_VALIDATION, message, cause);
    }
}
