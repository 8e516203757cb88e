package org.faculty.exception;

/** Configuration could not be read or holds an invalid value. */
public class ConfigException extends AnalyticsException {

    public ConfigException(String message) {
        super(AnalyticsErrorCode.CONFIGURATION, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(AnalyticsErrorCode.CONFIGURATION, message, cause);
    }
}
