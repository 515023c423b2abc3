package com.pbsmon.exporter.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Applies the configured log level to the Logback root logger at startup.
 */
public final class LogLevelConfigurator {
    private static final org.slf4j.Logger log = LoggerFactory.getLogger(LogLevelConfigurator.class);

    private LogLevelConfigurator() {
    }

    /**
     * Sets the root level. Unknown level names fall back to INFO.
     *
     * @param levelName trace, debug, info, warn or error
     */
    public static void apply(String levelName) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.toLevel(levelName, Level.INFO));
            return;
        }
        log.warn("Log level '{}' requested but backend {} does not support dynamic level updates",
            levelName, factory.getClass().getName());
    }
}
