package app.focustrack.domain.notification;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A notification the gate admitted, with the interaction reported for it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationRecord(
    @JsonProperty("id")
    String id,

    @JsonProperty("category")
    NotificationCategory category,

    @JsonProperty("message")
    String message,

    @JsonProperty("timestamp")
    long timestamp,

    @JsonProperty("metadata")
    Map<String, Object> metadata,   // decision context: idle duration, trigger reason, ...

    @JsonProperty("interaction")
    NotificationInteraction interaction
) {
    public NotificationRecord {
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Apply an interaction update; flags already set stay as they are.
     */
    public NotificationRecord withInteraction(NotificationInteraction update, long now) {
        NotificationInteraction current = interaction != null
            ? interaction
            : new NotificationInteraction(null, null, null);
        NotificationInteraction merged = current.merge(update, now);
        if (merged == current) {
            return this;
        }
        return new NotificationRecord(id, category, message, timestamp, metadata, merged);
    }

    public boolean wasClicked() {
        return interaction != null && interaction.wasClicked();
    }

    public boolean wasDismissed() {
        return interaction != null && interaction.wasDismissed();
    }
}
