package com.questrail.acars.splitter.config;

/**
 * Thrown when a splitter configuration is missing, unreadable or invalid.
 *
 * <p>Always fatal: it is raised while loading, before any socket is bound.</p>
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
