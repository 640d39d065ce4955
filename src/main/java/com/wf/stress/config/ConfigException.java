package com.wf.stress.config;

/**
 * Thrown when the run configuration is invalid.
 * Raised before any container is provisioned or any document generated.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
