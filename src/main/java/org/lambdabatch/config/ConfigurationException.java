package org.lambdabatch.config;

/**
 * Raised when the run configuration cannot be used, e.g. the calibration geometry is missing.
 * Only thrown before any processing starts.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
