package com.adforge.core.error;

/**
 * Thrown when required configuration or credentials are missing or invalid.
 * Fails the enclosing job immediately.
 */
public class ConfigException extends TaskCoreException {

    public ConfigException(String message) {
        super(ErrorKind.CONFIG, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorKind.CONFIG, message, cause);
    }
}
