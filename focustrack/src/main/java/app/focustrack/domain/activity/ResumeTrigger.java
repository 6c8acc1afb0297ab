package app.focustrack.domain.activity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Input source that ended an idle period. Supplied by producers; the idle
 * detector does not disambiguate devices itself.
 */
public enum ResumeTrigger {
    MOUSE,
    KEYBOARD,
    UNKNOWN;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ResumeTrigger fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
