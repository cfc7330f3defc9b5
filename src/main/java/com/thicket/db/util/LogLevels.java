package com.thicket.db.util;

import ch.qos.logback.classic.Level;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adjusts the root log level at runtime when Logback is the SLF4J backend.
 */
@UtilityClass
public class LogLevels {

    public static void setRootLevel(Level level) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(level);
        }
    }
}
