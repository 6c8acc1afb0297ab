package app.focustrack.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Which idle transitions make the decision loop consult the provider.
 */
public enum DecisionTrigger {
    IDLE_ENTRY,
    RESUME,
    BOTH;

    private static final Logger log = LoggerFactory.getLogger(DecisionTrigger.class);

    public boolean onIdleEntry() {
        return this == IDLE_ENTRY || this == BOTH;
    }

    public boolean onResume() {
        return this == RESUME || this == BOTH;
    }

    /**
     * Parse a configured value, accepting "idle-entry" as well as "idle_entry".
     */
    public static DecisionTrigger parse(String value, DecisionTrigger defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (DecisionTrigger trigger : values()) {
            if (trigger.name().equals(normalized)) {
                return trigger;
            }
        }
        log.warn("[CONFIG] Unknown decision trigger '{}', using {}", value, defaultValue);
        return defaultValue;
    }
}
