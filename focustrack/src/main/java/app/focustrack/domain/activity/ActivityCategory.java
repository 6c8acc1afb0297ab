package app.focustrack.domain.activity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Categories of activity events. Wire values are snake case.
 */
public enum ActivityCategory {
    WINDOW_CHANGE("window_change"),
    IDLE("idle"),
    OTHER("other");

    private final String wireValue;

    ActivityCategory(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ActivityCategory fromWire(String value) {
        for (ActivityCategory category : values()) {
            if (category.wireValue.equals(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown activity category: " + value);
    }
}
