package app.focustrack.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Decision provider implementations selectable by configuration.
 */
public enum ProviderType {
    FALLBACK,
    GEMINI;

    private static final Logger log = LoggerFactory.getLogger(ProviderType.class);

    /**
     * Parse a configured value; "mock" is accepted as an alias for the fallback.
     * Unknown providers resolve to the fallback.
     */
    public static ProviderType parse(String value) {
        if (value == null || value.isBlank()) {
            return FALLBACK;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("MOCK".equals(normalized)) {
            return FALLBACK;
        }
        for (ProviderType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        log.warn("[CONFIG] Unknown decision provider '{}', using the fallback heuristic", value);
        return FALLBACK;
    }
}
