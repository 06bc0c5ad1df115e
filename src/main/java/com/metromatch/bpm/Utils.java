package com.metromatch.bpm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for configuration lookups and number parsing shared by the pipeline.
 *
 * @author MetroMatch Team
 * @since 1.0
 */
public final class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Reads a setting from the environment, then from a system property of the same name.
     * @param key Setting name, e.g. {@code DB_URL}
     * @param defaultVal Value returned when neither source defines the key
     * @return Resolved value
     */
    public static String envOrProp(String key, String defaultVal) {
        try {
            String ev = System.getenv(key);
            if (ev != null) return ev;
        } catch (SecurityException e) {
            logger.debug("Environment lookup for {} denied: {}", key, e.getMessage());
        }
        String prop = System.getProperty(key);
        return prop != null ? prop : defaultVal;
    }

    public static boolean envOrPropBoolean(String key, boolean defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null || raw.isBlank()) return defaultVal;
        return Boolean.parseBoolean(raw.trim());
    }

    public static int envOrPropInt(String key, int defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null || raw.isBlank()) return defaultVal;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}; using {}", raw, key, defaultVal);
            return defaultVal;
        }
    }

    public static double envOrPropDouble(String key, double defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null || raw.isBlank()) return defaultVal;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric value '{}' for {}; using {}", raw, key, defaultVal);
            return defaultVal;
        }
    }

    /**
     * Parses a decimal number, returning null for null, blank or malformed input.
     */
    public static Double parseDoubleOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Double.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
