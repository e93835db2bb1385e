package org.janelia.calibration.util;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Changes logback levels from code so that tests can see debug output of the classes they exercise.
 *
 * @author Eric Trautman
 */
public class LogbackTestTools {

    public static void setLogLevelToDebug(final Class<?> loggedClass) {
        setLogLevel(loggedClass.getName(), Level.DEBUG);
    }

    public static void setLogLevel(final String loggerName,
                                   final Level logLevel) {
        getLogger(loggerName).setLevel(logLevel);
    }

    public static Level getLogLevel(final String loggerName) {
        return getLogger(loggerName).getEffectiveLevel();
    }

    private static Logger getLogger(final String loggerName) {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        return loggerContext.getLogger(loggerName);
    }
}
