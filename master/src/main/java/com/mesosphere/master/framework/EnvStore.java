package com.mesosphere.master.framework;

import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * Utility class for grabbing values from a mapping of flag values (typically the process env).
 */
public class EnvStore {
    /**
     * Exception which is thrown when failing to retrieve or parse a given flag value.
     */
    public static class ConfigException extends RuntimeException {

        /**
         * A machine-accessible error type.
         */
        public enum Type {
            INVALID_VALUE
        }

        private static ConfigException invalidValue(String message) {
            return new ConfigException(Type.INVALID_VALUE, message);
        }

        private final Type type;

        ConfigException(Type type, String message) {
            super(message);
            this.type = type;
        }

        public Type getType() {
            return type;
        }

        @Override
        public String getMessage() {
            return String.format("%s (errtype: %s)", super.getMessage(), type);
        }
    }

    private final Map<String, String> envMap;

    public static EnvStore fromEnv() {
        return new EnvStore(System.getenv());
    }

    public static EnvStore fromMap(Map<String, String> envMap) {
        return new EnvStore(envMap);
    }

    EnvStore(Map<String, String> envMap) {
        this.envMap = new HashMap<>(envMap);
    }

    public int getOptionalInt(String envKey, int defaultValue) {
        return toInt(envKey, getOptional(envKey, String.valueOf(defaultValue)));
    }

    public double getOptionalDouble(String envKey, double defaultValue) {
        return toDouble(envKey, getOptional(envKey, String.valueOf(defaultValue)));
    }

    /**
     * Returns the requested value if set, or {@code defaultValue} if it's missing from the map entirely.
     */
    public String getOptional(String envKey, String defaultValue) {
        String value = envMap.get(envKey);
        return (value == null) ? defaultValue : value;
    }

    /**
     * Returns the requested value if set and non-empty, or {@code defaultValue} if it's missing from the map or is
     * empty or whitespace.
     */
    public String getOptionalNonEmpty(String envKey, String defaultValue) {
        String value = envMap.get(envKey);
        return (StringUtils.isBlank(value)) ? defaultValue : value;
    }

    public boolean isPresent(String envKey) {
        return envMap.containsKey(envKey);
    }

    private static int toInt(String envKey, String envVal) {
        try {
            return Integer.parseInt(envVal);
        } catch (NumberFormatException e) {
            throw ConfigException.invalidValue(String.format(
                    "Failed to parse configured environment variable '%s' as an integer: %s", envKey, envVal));
        }
    }

    private static double toDouble(String envKey, String envVal) {
        try {
            return Double.parseDouble(envVal);
        } catch (NumberFormatException e) {
            throw ConfigException.invalidValue(String.format(
                    "Failed to parse configured environment variable '%s' as a double: %s", envKey, envVal));
        }
    }
}
