package io.clusterautoscaler.util;

/**
 * Utility class for environment variable operations
 */
public final class EnvironmentUtils {

    private EnvironmentUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Get environment variable, treating blank values as unset
     *
     * @param name the environment variable name
     * @param defaultValue the value to return if the variable is unset or blank
     * @return the trimmed environment variable value or the default
     */
    public static String getEnv(String name, String defaultValue) {
        String value = System.getenv(name);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }
}
