package com.roapid.common;

/**
 * Thrown for malformed or missing configuration (intervals, endpoint templates, secrets).
 */
public class ConfigurationException extends RoapidException {

    public ConfigurationException(String message) {
        super(SyncErrorKind.CONFIG, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(SyncErrorKind.CONFIG, message, cause);
    }
}
