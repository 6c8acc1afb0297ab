package app.focustrack.util;

import java.time.Duration;

/**
 * Configuration lookups: environment variable first, then system property, then default.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Read a duration expressed in whole seconds.
     */
    public static Duration getSeconds(String key, Duration defaultValue) {
        long seconds = getLong(key, -1);
        return seconds >= 0 ? Duration.ofSeconds(seconds) : defaultValue;
    }

    private Env() {}
}
