package com.ververica.bundle_lift.flink.mining.shared.config;

/**
 * Invalid mining configuration. Fatal at startup, never clamped.
 */
public class ConfigurationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
