package org.normharvest.config;

/**
 * Invalid or contradictory configuration. Raised while the harvest is being set up, never mid-run.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
