package com.mesosphere.master.offer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility methods around construction of loggers.
 */
public final class LoggingUtils {

    private LoggingUtils() {
        // do not instantiate
    }

    /**
     * Creates a logger which is tagged with the provided class.
     *
     * @param clazz the class using this logger
     */
    public static Logger getLogger(Class<?> clazz) {
        return LoggerFactory.getLogger(getClassName(clazz));
    }

    /**
     * Returns a class name suitable for using in logs.
     */
    private static String getClassName(Class<?> clazz) {
        return clazz.getSimpleName();
    }
}
