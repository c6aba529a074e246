package com.questrail.acars.splitter.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code --log-level} option to the logging backend.
 */
final class LoggingConfigurator {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {}

    /**
     * Set the root logger level. Unknown names fall back to INFO.
     *
     * @return {@code false} if the SLF4J backend is not logback and the level was left alone
     */
    static boolean setRootLevel(String levelName) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.toLevel(levelName, Level.INFO));
            return true;
        }
        log.warn("Log level {} requested but backend {} does not support dynamic level updates",
            levelName, factory.getClass().getName());
        return false;
    }
}
