package app.focustrack.domain.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Notification categories. Cooldowns are enforced per category.
 */
public enum NotificationCategory {
    IDLE_WARNING,
    GOOD_JOB,
    FOCUS_REMINDER,
    DAILY_PLAN;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NotificationCategory fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
